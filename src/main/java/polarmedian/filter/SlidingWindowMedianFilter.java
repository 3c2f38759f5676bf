/*
 *     This file is part of PolarMedian.
 *
 *     PolarMedian is free software: you can redistribute it and/or modify
 *     it under the terms of the GNU General Public License as published by
 *     the Free Software Foundation, either version 3 of the License, or
 *     (at your option) any later version.
 *
 *     PolarMedian is distributed in the hope that it will be useful,
 *     but WITHOUT ANY WARRANTY; without even the implied warranty of
 *     MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *     GNU General Public License for more details.
 *
 *     You should have received a copy of the GNU General Public License
 *     along with PolarMedian.  If not, see <http://www.gnu.org/licenses/>.
 */

package polarmedian.filter;

import polarmedian.filter.window.MedianWindowTraversal;
import polarmedian.image.PixelType;
import polarmedian.util.PolarMedianEnvironment;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Median filter backed by a dual-heap median tracker and a frequency tree that are updated incrementally as the
 * window slides, so the cost per pixel is O(k log k) for the k values entering and leaving the window instead of a
 * sort of all k^2 values.
 * <p>
 * With more than one band the output rows are split into contiguous bands, each filtered by its own traversal on
 * the shared filter executor. Bands read the rows above and below them from the input, so the result does not
 * depend on the number of bands.
 */
public class SlidingWindowMedianFilter extends NeighbourhoodMedianFilter
{
	static final long serialVersionUID = 42L;

	private final boolean crossCheck;
	private final boolean excludeExtremes;
	private final int numBands;

	public SlidingWindowMedianFilter()
	{
		this(false, false, 1);
	}

	/**
	 * @param crossCheck verify the heap median against the frequency tree at every pixel
	 * @param excludeExtremes take the median over values strictly between 0 and the pixel maximum when the window
	 *                        holds any, ignoring pixels that salt-and-pepper noise forced to an extreme
	 * @param numBands number of row bands filtered in parallel
	 */
	public SlidingWindowMedianFilter(boolean crossCheck, boolean excludeExtremes, int numBands)
	{
		if(numBands < 1)
			throw new IllegalArgumentException("At least one band is required");

		this.crossCheck = crossCheck;
		this.excludeExtremes = excludeExtremes;
		this.numBands = numBands;
	}

	public static SlidingWindowMedianFilter withCrossCheck()
	{
		return new SlidingWindowMedianFilter(true, false, 1);
	}

	public boolean isCrossCheck()
	{
		return crossCheck;
	}

	public boolean isExcludeExtremes()
	{
		return excludeExtremes;
	}

	public int getNumBands()
	{
		return numBands;
	}

	@Override
	protected int[] filterValidated(int[] pixels, int width, int height, PixelType pixelType, int kernelSize, BoundaryPolicy boundary)
	{
		final int[] output = new int[pixels.length];
		final int bands = Math.min(numBands, height);

		if(bands == 1)
		{
			traversal(pixels, width, height, pixelType, kernelSize, boundary, 0, height).run(output);
			return output;
		}

		final ExecutorService executor = PolarMedianEnvironment.getFilterExecutor();
		final List<Future<?>> futures = new ArrayList<>(bands);

		for(int band = 0; band < bands; band++)
		{
			final int rowStart = (int) ((long) height * band / bands);
			final int rowEnd = (int) ((long) height * (band + 1) / bands);
			final MedianWindowTraversal traversal = traversal(pixels, width, height, pixelType, kernelSize, boundary, rowStart, rowEnd);

			futures.add(executor.submit(() -> traversal.run(output)));
		}

		for(Future<?> future : futures)
		{
			try
			{
				future.get();
			}
			catch (InterruptedException e)
			{
				futures.forEach(f -> f.cancel(true));
				Thread.currentThread().interrupt();
				throw new RuntimeException("Interrupted while filtering row bands", e);
			}
			catch (ExecutionException e)
			{
				futures.forEach(f -> f.cancel(true));
				if(e.getCause() instanceof RuntimeException)
					throw (RuntimeException) e.getCause();

				throw new RuntimeException(e.getCause());
			}
		}

		return output;
	}

	private MedianWindowTraversal traversal(int[] pixels, int width, int height, PixelType pixelType, int kernelSize,
											BoundaryPolicy boundary, int rowStart, int rowEnd)
	{
		return MedianWindowTraversal.builder(pixels, width, height, pixelType.numValues())
				.kernelSize(kernelSize)
				.boundary(boundary)
				.rows(rowStart, rowEnd)
				.crossCheck(crossCheck)
				.excludeExtremes(excludeExtremes)
				.build();
	}

	@Override
	public String getName()
	{
		return "Sliding window median";
	}

	@Override
	public String getDescription()
	{
		final StringBuilder description = new StringBuilder(getName());
		if(excludeExtremes)
			description.append(" [excluding extremes]");
		if(numBands > 1)
			description.append(" [").append(numBands).append(" bands]");

		return description.toString();
	}
}

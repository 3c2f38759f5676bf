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

package polarmedian.filter.histogram;

import org.apache.commons.pool2.BasePooledObjectFactory;
import org.apache.commons.pool2.PooledObject;
import org.apache.commons.pool2.impl.DefaultPooledObject;
import org.apache.commons.pool2.impl.GenericObjectPool;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import polarmedian.filter.BoundaryPolicy;
import polarmedian.filter.NeighbourhoodMedianFilter;
import polarmedian.image.PixelType;
import polarmedian.util.PolarMedianEnvironment;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.stream.IntStream;

/**
 * Bulk median backend: every output row gets its own window histogram, slid across the row, and rows are filtered
 * in parallel on the shared filter executor. Histograms are borrowed from a pool created for the call, so none
 * outlives it.
 */
public class HistogramMedianFilter extends NeighbourhoodMedianFilter
{
	static final long serialVersionUID = 42L;

	@Override
	protected int[] filterValidated(final int[] pixels, final int width, final int height, final PixelType pixelType,
									final int kernelSize, final BoundaryPolicy boundary)
	{
		final int radius = kernelSize / 2;
		final int[] output = new int[pixels.length];

		final ExecutorService threadPool = PolarMedianEnvironment.getFilterExecutor();
		final HistogramPool histogramPool = new HistogramPool(PolarMedianEnvironment.getNumThreads(), new Histogram(pixelType.numValues()));

		try {
			threadPool.submit(() ->
					IntStream.range(0, height)
							.parallel()
							.forEach(y -> {
								final Histogram histogram;
								try {
									histogram = histogramPool.borrowObject();
								} catch (Exception e) {
									throw new RuntimeException("Failed to borrow a histogram", e);
								}

								try {
									final PixelWindow pixelWindow = PixelWindow.get(pixels, width, height, radius, boundary, y, histogram);
									for (int x = 0; x < width; x++) {
										output[y * width + x] = pixelWindow.median();
										if (x + 1 < width)
											pixelWindow.moveWindow();
									}
								} finally {
									histogramPool.returnObject(histogram);
								}
							})
			).get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new RuntimeException(e);
		} catch (ExecutionException e) {
			if (e.getCause() instanceof RuntimeException)
				throw (RuntimeException) e.getCause();

			throw new RuntimeException(e.getCause());
		} finally {
			histogramPool.close();
		}

		return output;
	}

	private static class HistogramPool extends GenericObjectPool<Histogram> {

		HistogramPool(int size, Histogram prototype) {
			super(new BasePooledObjectFactory<Histogram>() {
				@Override
				public Histogram create() {
					return prototype.copy();
				}

				@Override
				public PooledObject<Histogram> wrap(Histogram histogram) {
					return new DefaultPooledObject<>(histogram);
				}

				@Override
				public void passivateObject(PooledObject<Histogram> pooled) {
					pooled.getObject().reset();
				}
			}, config(size));
		}

		static GenericObjectPoolConfig<Histogram> config(int size) {
			final GenericObjectPoolConfig<Histogram> config = new GenericObjectPoolConfig<>();
			config.setMaxIdle(size);
			config.setMaxTotal(size);

			return config;
		}
	}

	@Override
	public String getName()
	{
		return "Histogram median";
	}
}

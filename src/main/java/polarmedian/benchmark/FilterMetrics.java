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

package polarmedian.benchmark;

import polarmedian.image.FilterImage;

public class FilterMetrics
{
	/**
	 * Peak signal-to-noise ratio of {@code test} against {@code reference} in decibels. Identical inputs give
	 * positive infinity.
	 */
	public static double psnr(int[] reference, int[] test, double maxValue)
	{
		if(reference.length != test.length)
			throw new IllegalArgumentException("Cannot compare " + reference.length + " pixels with " + test.length);

		if(reference.length == 0)
			throw new IllegalArgumentException("Cannot compare empty images");

		double squaredError = 0;
		for(int i = 0; i < reference.length; i++)
		{
			final double difference = reference[i] - test[i];
			squaredError += difference * difference;
		}

		return psnrFromSquaredError(squaredError, reference.length, maxValue);
	}

	/** PSNR over every plane of two images of the same shape. */
	public static double psnr(FilterImage reference, FilterImage test)
	{
		if(reference.numPlanes() != test.numPlanes() || reference.width != test.width || reference.height != test.height)
			throw new IllegalArgumentException("Images differ in shape");

		double squaredError = 0;
		long count = 0;
		final int[][] referencePlanes = reference.getPlanes();
		final int[][] testPlanes = test.getPlanes();
		for(int p = 0; p < referencePlanes.length; p++)
			for(int i = 0; i < referencePlanes[p].length; i++)
			{
				final double difference = referencePlanes[p][i] - testPlanes[p][i];
				squaredError += difference * difference;
				count++;
			}

		return psnrFromSquaredError(squaredError, count, reference.pixelType.getMax());
	}

	private static double psnrFromSquaredError(double squaredError, long count, double maxValue)
	{
		final double mse = squaredError / count;
		if(mse == 0)
			return Double.POSITIVE_INFINITY;

		return 10 * Math.log10((maxValue * maxValue) / mse);
	}
}

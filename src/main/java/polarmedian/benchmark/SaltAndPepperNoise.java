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

import it.unimi.dsi.util.XorShift1024StarPhiRandom;
import polarmedian.image.FilterImage;
import polarmedian.image.PixelType;

import java.util.Arrays;
import java.util.Random;

/**
 * Corrupts a copy of an image by forcing a random fraction of its pixels to the extremes of the value domain.
 * A forced pixel is forced in every channel, so colour images receive white and black dots.
 */
public class SaltAndPepperNoise
{
	private final double amount;
	private final double saltVsPepper;
	private final Long seed;

	/**
	 * @param amount fraction of pixels to corrupt, in [0, 1]
	 * @param saltVsPepper fraction of corrupted pixels set to the maximum rather than zero, in [0, 1]
	 * @param seed seed for reproducible noise, or null for a fresh pattern on every call
	 */
	public SaltAndPepperNoise(double amount, double saltVsPepper, Long seed)
	{
		if(!(amount >= 0 && amount <= 1))
			throw new IllegalArgumentException("amount must lie in [0, 1], got " + amount);
		if(!(saltVsPepper >= 0 && saltVsPepper <= 1))
			throw new IllegalArgumentException("saltVsPepper must lie in [0, 1], got " + saltVsPepper);

		this.amount = amount;
		this.saltVsPepper = saltVsPepper;
		this.seed = seed;
	}

	public SaltAndPepperNoise(double amount, Long seed)
	{
		this(amount, 0.5, seed);
	}

	public double getAmount()
	{
		return amount;
	}

	public FilterImage apply(FilterImage image)
	{
		final int[][] planes = image.getPlanes();
		if(amount == 0)
			return image.withPlanes(image.title, planes);

		final Random random = seed == null ? new XorShift1024StarPhiRandom() : new XorShift1024StarPhiRandom(seed);
		final int pixelsPerPlane = image.width * image.height;
		final int max = image.pixelType.getMax();

		for(int slice = 0; slice < image.numSlices; slice++)
			for(int i = 0; i < pixelsPerPlane; i++)
			{
				final int forced = draw(random, max);
				if(forced < 0)
					continue;

				for(int c = 0; c < image.numChannels; c++)
					planes[slice * image.numChannels + c][i] = forced;
			}

		return image.withPlanes(image.title + " (noisy)", planes);
	}

	/** Noisy copy of a single gray plane. */
	public int[] apply(int[] pixels, PixelType pixelType)
	{
		final int[] noisy = Arrays.copyOf(pixels, pixels.length);
		if(amount == 0)
			return noisy;

		final Random random = seed == null ? new XorShift1024StarPhiRandom() : new XorShift1024StarPhiRandom(seed);
		final int max = pixelType.getMax();
		for(int i = 0; i < noisy.length; i++)
		{
			final int forced = draw(random, max);
			if(forced >= 0)
				noisy[i] = forced;
		}

		return noisy;
	}

	/** Value to force the next pixel to, or -1 to leave it alone. */
	private int draw(Random random, int max)
	{
		final double r = random.nextDouble();
		if(r < amount * saltVsPepper)
			return max;
		if(r < amount)
			return 0;

		return -1;
	}
}

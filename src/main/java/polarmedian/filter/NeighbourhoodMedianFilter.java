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

import polarmedian.image.PixelType;

import java.util.Arrays;

/**
 * Argument checking shared by every median filter. Everything that can be rejected is rejected here, before any
 * output is allocated, so a call either returns a complete image or throws.
 */
abstract public class NeighbourhoodMedianFilter implements MedianFilter
{
	static final long serialVersionUID = 42L;

	public static final long DEFAULT_MAX_PIXELS = 1L << 28;

	private long maxPixels = DEFAULT_MAX_PIXELS;

	public long getMaxPixels()
	{
		return maxPixels;
	}

	public void setMaxPixels(long maxPixels)
	{
		if(maxPixels < 1)
			throw new IllegalArgumentException("Pixel limit must be positive");

		this.maxPixels = maxPixels;
	}

	/**
	 * Filters pixels that are known to be valid for the pixel type, with an odd kernel larger than one.
	 */
	abstract protected int[] filterValidated(int[] pixels, int width, int height, PixelType pixelType, int kernelSize, BoundaryPolicy boundary);

	@Override
	public final int[] filter(int[] pixels, int width, int height, PixelType pixelType, int kernelSize, BoundaryPolicy boundary)
	{
		if(pixels == null || pixelType == null || boundary == null)
			throw new FilterConfigurationException("Pixels, pixel type and boundary policy are required");

		final int kernel = normaliseKernelSize(kernelSize);
		checkExtent(pixels, width, height, maxPixels);
		if((long) kernel * kernel > maxPixels)
			throw new ResourceExhaustionException("Kernel of " + kernel + "x" + kernel + " exceeds the limit of " + maxPixels + " pixels");

		pixelType.checkDomain(pixels);

		if(kernel == 1)
			return Arrays.copyOf(pixels, pixels.length);

		return filterValidated(pixels, width, height, pixelType, kernel, boundary);
	}

	/**
	 * Even kernel sizes are promoted to the next odd size so that every window has a centre pixel.
	 *
	 * @throws FilterConfigurationException if the kernel size is not positive
	 */
	public static int normaliseKernelSize(int kernelSize)
	{
		if(kernelSize < 1)
			throw new FilterConfigurationException("Kernel size must be positive, got " + kernelSize);

		if(kernelSize == Integer.MAX_VALUE)
			throw new FilterConfigurationException("Kernel size " + kernelSize + " cannot be promoted to an odd size");

		return kernelSize % 2 == 0 ? kernelSize + 1 : kernelSize;
	}

	static void checkExtent(int[] pixels, int width, int height, long maxPixels)
	{
		if(width < 1 || height < 1)
			throw new FilterConfigurationException("Image dimensions must be positive, got " + width + "x" + height);

		final long numPixels = (long) width * height;
		if(numPixels > maxPixels || numPixels > Integer.MAX_VALUE)
			throw new ResourceExhaustionException("Image of " + width + "x" + height + " pixels exceeds the limit of " +
					Math.min(maxPixels, Integer.MAX_VALUE) + " pixels");

		if(pixels.length != numPixels)
			throw new FilterConfigurationException("Number of pixels must be exactly width * height. Actual=" +
					pixels.length + " Required=" + numPixels);
	}

	@Override
	public String toString()
	{
		return getDescription();
	}
}

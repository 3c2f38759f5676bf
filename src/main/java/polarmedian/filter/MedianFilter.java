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

import java.io.Serializable;

/**
 * A median filter as a pure function of its arguments: each output pixel is the median of the square window of
 * side {@code kernelSize} centred on the matching input pixel, with border windows resolved by the boundary
 * policy. For windows holding an even number of values the lower of the two middle values is used.
 * <p>
 * Implementations never modify the input and always return an array of the same extent.
 */
public interface MedianFilter extends Serializable
{
	int[] filter(int[] pixels, int width, int height, PixelType pixelType, int kernelSize, BoundaryPolicy boundary);

	default int[] filter(int[] pixels, int width, int height, PixelType pixelType, int kernelSize)
	{
		return filter(pixels, width, height, pixelType, kernelSize, BoundaryPolicy.DEFAULT);
	}

	default byte[] filter(byte[] pixels, int width, int height, int kernelSize, BoundaryPolicy boundary)
	{
		final int[] values = new int[pixels.length];
		for(int i = 0; i < pixels.length; i++)
			values[i] = pixels[i] & 0xff;

		final int[] filtered = filter(values, width, height, PixelType.GRAY_8_BIT, kernelSize, boundary);

		final byte[] out = new byte[filtered.length];
		for(int i = 0; i < out.length; i++)
			out[i] = (byte) filtered[i];

		return out;
	}

	default short[] filter(short[] pixels, int width, int height, int kernelSize, BoundaryPolicy boundary)
	{
		final int[] values = new int[pixels.length];
		for(int i = 0; i < pixels.length; i++)
			values[i] = pixels[i] & 0xffff;

		final int[] filtered = filter(values, width, height, PixelType.GRAY_16_BIT, kernelSize, boundary);

		final short[] out = new short[filtered.length];
		for(int i = 0; i < out.length; i++)
			out[i] = (short) filtered[i];

		return out;
	}

	String getName();

	default String getDescription()
	{
		return getName();
	}
}

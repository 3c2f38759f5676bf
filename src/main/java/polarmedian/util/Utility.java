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

package polarmedian.util;

import ij.ImagePlus;
import ij.ImageStack;
import ij.process.ColorProcessor;
import polarmedian.filter.FilterConfigurationException;
import polarmedian.image.PixelType;

public class Utility
{
	/**
	 * True for RGB images whose red, green and blue values agree at every pixel of every slice, which are filtered
	 * as a single gray channel.
	 */
	public static boolean isGrayScale(ImagePlus imagePlus)
	{
		if(imagePlus.getType() != ImagePlus.COLOR_RGB)
			return imagePlus.getNChannels() == 1;

		final ImageStack stack = imagePlus.getStack();
		for(int slice = 1; slice <= stack.getSize(); slice++)
		{
			final int[] pixels = (int[]) stack.getProcessor(slice).getPixels();
			for(int pixel : pixels)
				if((pixel & 0xff) != (pixel & 0xff00) >> 8 || (pixel & 0xff) != (pixel & 0xff0000) >> 16)
					return false;
		}

		return true;
	}

	public static PixelType getPixelType(ImagePlus imagePlus)
	{
		switch (imagePlus.getType())
		{
			case ImagePlus.GRAY8:
			case ImagePlus.COLOR_RGB:
				return PixelType.GRAY_8_BIT;
			case ImagePlus.GRAY16:
				return PixelType.GRAY_16_BIT;
			default:
				throw new FilterConfigurationException("Unsupported image type: " + describeType(imagePlus.getType()) +
						". Only 8-bit, 16-bit and RGB images can be median filtered.");
		}
	}

	static String describeType(int type)
	{
		switch (type)
		{
			case ImagePlus.GRAY8:
				return "8-bit";
			case ImagePlus.GRAY16:
				return "16-bit";
			case ImagePlus.GRAY32:
				return "32-bit";
			case ImagePlus.COLOR_256:
				return "8-bit color";
			case ImagePlus.COLOR_RGB:
				return "RGB";
			default:
				return "unknown (" + type + ")";
		}
	}

	public static int[] unpackChannel(ColorProcessor processor, int channel)
	{
		final int shift = 16 - 8 * channel;
		final int[] rgb = (int[]) processor.getPixels();
		final int[] values = new int[rgb.length];
		for(int i = 0; i < rgb.length; i++)
			values[i] = (rgb[i] >> shift) & 0xff;

		return values;
	}

	public static int[] packChannels(int[] red, int[] green, int[] blue)
	{
		final int[] rgb = new int[red.length];
		for(int i = 0; i < rgb.length; i++)
			rgb[i] = 0xff000000 | (red[i] << 16) | (green[i] << 8) | blue[i];

		return rgb;
	}
}

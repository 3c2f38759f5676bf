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

package polarmedian.image;

import ij.ImagePlus;
import ij.ImageStack;
import ij.process.ByteProcessor;
import ij.process.ColorProcessor;
import ij.process.ImageProcessor;
import ij.process.ShortProcessor;
import org.jetbrains.annotations.NotNull;
import polarmedian.filter.BoundaryPolicy;
import polarmedian.filter.FilterConfigurationException;
import polarmedian.filter.MedianFilter;
import polarmedian.util.Utility;

import java.util.Arrays;

/**
 * Image as planes of unpacked pixel values, one plane per channel per slice. RGB images are held as three 8-bit
 * channels, unless all three agree everywhere, in which case a single gray channel is kept.
 */
public class FilterImage
{
	public final PixelType pixelType;
	public final String title;

	public final int width;
	public final int height;
	public final int numChannels;
	public final int numSlices;
	public final boolean rgb;

	private final int[][] planes;

	public FilterImage(ImagePlus imagePlus)
	{
		this(imagePlus.getTitle(),
				Utility.getPixelType(imagePlus),
				imagePlus.getWidth(),
				imagePlus.getHeight(),
				imagePlus.getType() == ImagePlus.COLOR_RGB && !Utility.isGrayScale(imagePlus) ? 3 : 1,
				imagePlus.getStackSize(),
				imagePlus.getType() == ImagePlus.COLOR_RGB,
				getImagePlusPlanes(imagePlus));
	}

	private FilterImage(String title, PixelType pixelType, int width, int height, int numChannels, int numSlices, boolean rgb, int[][] planes)
	{
		if(width < 1 || height < 1 || numChannels < 1 || numSlices < 1)
			throw new FilterConfigurationException("Image dimensions must be positive values");

		if(planes.length != numChannels * numSlices)
			throw new FilterConfigurationException("Expected " + (numChannels * numSlices) + " planes, got " + planes.length);

		for(int[] plane : planes)
		{
			if(plane.length != width * height)
				throw new FilterConfigurationException("Number of pixels must be exactly width * height. Actual=" +
						plane.length + " Required=" + (width * height));

			pixelType.checkDomain(plane);
		}

		this.title = title;
		this.pixelType = pixelType;
		this.width = width;
		this.height = height;
		this.numChannels = numChannels;
		this.numSlices = numSlices;
		this.rgb = rgb;
		this.planes = planes;
	}

	@NotNull
	public static FilterImage gray(String title, PixelType pixelType, int width, int height, int[] pixels)
	{
		return new FilterImage(title, pixelType, width, height, 1, 1, false, new int[][] {Arrays.copyOf(pixels, pixels.length)});
	}

	/**
	 * Same extent and type as this image with new planes, indexed {@code slice * numChannels + channel}.
	 */
	@NotNull
	public FilterImage withPlanes(String title, int[][] planes)
	{
		return new FilterImage(title, pixelType, width, height, numChannels, numSlices, rgb, planes);
	}

	public int numPlanes()
	{
		return planes.length;
	}

	/** Copy of the plane for the given zero-based slice and channel. */
	public int[] getPixels(int slice, int channel)
	{
		final int[] plane = planes[planeIndex(slice, channel)];
		return Arrays.copyOf(plane, plane.length);
	}

	/** Copy of every plane, indexed {@code slice * numChannels + channel}. */
	public int[][] getPlanes()
	{
		return Arrays.stream(planes).map(p -> Arrays.copyOf(p, p.length)).toArray(int[][]::new);
	}

	/**
	 * Filters every channel of every slice independently.
	 */
	@NotNull
	public FilterImage filter(MedianFilter filter, int kernelSize, BoundaryPolicy boundary)
	{
		final int[][] filtered = new int[planes.length][];
		for(int i = 0; i < planes.length; i++)
			filtered[i] = filter.filter(planes[i], width, height, pixelType, kernelSize, boundary);

		return new FilterImage(title, pixelType, width, height, numChannels, numSlices, rgb, filtered);
	}

	@NotNull
	public ImagePlus toImagePlus()
	{
		final ImageStack stack = new ImageStack(width, height);
		for(int slice = 0; slice < numSlices; slice++)
			stack.addSlice(toProcessor(slice));

		return numSlices == 1 ? new ImagePlus(title, stack.getProcessor(1)) : new ImagePlus(title, stack);
	}

	private ImageProcessor toProcessor(int slice)
	{
		if(rgb)
		{
			final int[] red = planes[planeIndex(slice, 0)];
			final int[] green = numChannels == 3 ? planes[planeIndex(slice, 1)] : red;
			final int[] blue = numChannels == 3 ? planes[planeIndex(slice, 2)] : red;

			return new ColorProcessor(width, height, Utility.packChannels(red, green, blue));
		}

		final int[] plane = planes[planeIndex(slice, 0)];
		switch (pixelType)
		{
			case GRAY_8_BIT:
			{
				final byte[] bytes = new byte[plane.length];
				for(int i = 0; i < bytes.length; i++)
					bytes[i] = (byte) plane[i];

				return new ByteProcessor(width, height, bytes);
			}
			case GRAY_16_BIT:
			{
				final short[] shorts = new short[plane.length];
				for(int i = 0; i < shorts.length; i++)
					shorts[i] = (short) plane[i];

				return new ShortProcessor(width, height, shorts, null);
			}
			default:
				throw new RuntimeException("Unsupported pixel type: "+pixelType);
		}
	}

	private int planeIndex(int slice, int channel)
	{
		if(slice < 0 || slice >= numSlices || channel < 0 || channel >= numChannels)
			throw new IndexOutOfBoundsException("No plane for slice " + slice + " channel " + channel);

		return slice * numChannels + channel;
	}

	private static int[][] getImagePlusPlanes(ImagePlus imagePlus)
	{
		final ImageStack stack = imagePlus.getStack();
		final int numSlices = stack.getSize();

		switch (imagePlus.getType())
		{
			case ImagePlus.GRAY8:
			{
				final int[][] planes = new int[numSlices][];
				for(int slice = 0; slice < numSlices; slice++)
				{
					final byte[] bytes = (byte[]) stack.getProcessor(slice + 1).getPixels();
					planes[slice] = new int[bytes.length];
					for(int i = 0; i < bytes.length; i++)
						planes[slice][i] = bytes[i] & 0xff;
				}
				return planes;
			}
			case ImagePlus.GRAY16:
			{
				final int[][] planes = new int[numSlices][];
				for(int slice = 0; slice < numSlices; slice++)
				{
					final short[] shorts = (short[]) stack.getProcessor(slice + 1).getPixels();
					planes[slice] = new int[shorts.length];
					for(int i = 0; i < shorts.length; i++)
						planes[slice][i] = shorts[i] & 0xffff;
				}
				return planes;
			}
			case ImagePlus.COLOR_RGB:
			{
				final int numChannels = Utility.isGrayScale(imagePlus) ? 1 : 3;
				final int[][] planes = new int[numSlices * numChannels][];
				for(int slice = 0; slice < numSlices; slice++)
				{
					final ColorProcessor processor = (ColorProcessor) stack.getProcessor(slice + 1);
					if(numChannels == 1)
						planes[slice] = Utility.unpackChannel(processor, 2);
					else
						for(int c = 0; c < 3; c++)
							planes[slice * 3 + c] = Utility.unpackChannel(processor, c);
				}
				return planes;
			}
			default:
				throw new FilterConfigurationException("Unsupported pixel type for image " + imagePlus.getTitle());
		}
	}
}

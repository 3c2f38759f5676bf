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

import polarmedian.filter.FilterConfigurationException;

public enum PixelType {
	GRAY_8_BIT, GRAY_16_BIT;

	public int getMax()
	{
		switch (this)
		{
			case GRAY_8_BIT:
				return (1<<8)-1;
			case GRAY_16_BIT:
				return (1<<16)-1;
			default:
				throw new IllegalArgumentException("Pixel type not yet implemented: "+this);
		}
	}

	/** Size of the value domain, i.e. the number of histogram bins needed to cover every pixel value. */
	public int numValues()
	{
		return getMax() + 1;
	}

	public boolean contains(int value)
	{
		return value >= 0 && value <= getMax();
	}

	/**
	 * Rejects the first pixel that falls outside the value domain of this type.
	 */
	public void checkDomain(int[] pixels)
	{
		final int max = getMax();
		for(int i = 0; i < pixels.length; i++)
			if(pixels[i] < 0 || pixels[i] > max)
				throw new FilterConfigurationException("Pixel " + i + " has value " + pixels[i] +
						", outside the " + this + " domain [0, " + max + "]");
	}
}

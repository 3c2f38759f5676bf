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
 * Reference median filter: gathers and sorts every window. O(k^2 log k) per pixel, kept as a baseline for
 * correctness and timing comparisons.
 */
public class BruteForceMedianFilter extends NeighbourhoodMedianFilter
{
	static final long serialVersionUID = 42L;

	@Override
	protected int[] filterValidated(int[] pixels, int width, int height, PixelType pixelType, int kernelSize, BoundaryPolicy boundary)
	{
		final int radius = kernelSize / 2;
		final int[] output = new int[pixels.length];
		final int[] window = new int[kernelSize * kernelSize];

		for(int y = 0; y < height; y++)
			for(int x = 0; x < width; x++)
			{
				int n = 0;
				for(int dy = -radius; dy <= radius; dy++)
				{
					final int sourceY = boundary.map(y + dy, height);
					if(sourceY < 0)
						continue;

					for(int dx = -radius; dx <= radius; dx++)
					{
						final int sourceX = boundary.map(x + dx, width);
						if(sourceX >= 0)
							window[n++] = pixels[sourceY * width + sourceX];
					}
				}

				Arrays.sort(window, 0, n);
				output[y * width + x] = window[(n - 1) / 2];
			}

		return output;
	}

	@Override
	public String getName()
	{
		return "Brute force median";
	}
}

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

/**
 * How a window that overhangs the image edge is filled. The policy changes output values along the border, so it
 * is fixed for a whole filtering call.
 */
public enum BoundaryPolicy
{
	/** Out-of-range coordinates take the nearest edge pixel. Windows keep their full size. */
	CLAMP,
	/**
	 * Out-of-range coordinates are reflected about the edge pixel without repeating it, so -1 reads 1 and n reads
	 * n-2. Reflection repeats for windows wider than the image. Windows keep their full size.
	 */
	MIRROR,
	/** Out-of-range coordinates are dropped, so border windows hold fewer than kernelSize^2 values. */
	CROP;

	public static final BoundaryPolicy DEFAULT = MIRROR;

	/**
	 * Maps a coordinate along an axis of the given extent to the coordinate that supplies its pixel.
	 *
	 * @return the source coordinate, or -1 if the coordinate is excluded from the window
	 */
	public int map(int index, int extent)
	{
		if(index >= 0 && index < extent)
			return index;

		switch (this)
		{
			case CLAMP:
				return index < 0 ? 0 : extent - 1;
			case MIRROR:
				if(extent == 1)
					return 0;

				final int period = 2 * (extent - 1);
				int folded = Math.abs(index) % period;
				return folded < extent ? folded : period - folded;
			case CROP:
				return -1;
			default:
				throw new IllegalArgumentException("Boundary policy not yet implemented: "+this);
		}
	}

	/** True if every window holds exactly kernelSize^2 values under this policy. */
	public boolean preservesWindowSize()
	{
		return this != CROP;
	}
}

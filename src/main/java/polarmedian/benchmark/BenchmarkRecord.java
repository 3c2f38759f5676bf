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

import java.util.Locale;

public class BenchmarkRecord
{
	public final String name;
	public final double elapsedMillis;
	public final double psnr;
	public final FilterImage image;

	public BenchmarkRecord(String name, double elapsedMillis, double psnr, FilterImage image)
	{
		this.name = name;
		this.elapsedMillis = elapsedMillis;
		this.psnr = psnr;
		this.image = image;
	}

	@Override
	public String toString()
	{
		return String.format(Locale.ROOT, "%-24s time=%.2fms  PSNR=%.2f dB", name, elapsedMillis, psnr);
	}
}

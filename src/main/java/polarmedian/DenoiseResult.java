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

package polarmedian;

import polarmedian.image.FilterImage;

/**
 * Images and measurements from one denoising run. {@code noisy} is the image that was filtered, which is the original
 * when no noise was added.
 */
public class DenoiseResult
{
	public final FilterImage original;
	public final FilterImage noisy;
	public final FilterImage denoised;
	public final String filterName;
	public final int kernelSize;
	public final double runtimeMillis;
	public final double psnr;

	public DenoiseResult(FilterImage original, FilterImage noisy, FilterImage denoised, String filterName,
						 int kernelSize, double runtimeMillis, double psnr)
	{
		this.original = original;
		this.noisy = noisy;
		this.denoised = denoised;
		this.filterName = filterName;
		this.kernelSize = kernelSize;
		this.runtimeMillis = runtimeMillis;
		this.psnr = psnr;
	}
}

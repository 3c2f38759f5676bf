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

import org.junit.Assert;
import org.junit.Test;
import polarmedian.image.FilterImage;
import polarmedian.image.PixelType;

public class FilterMetricsTest {

    @Test
    public void identicalImagesHaveInfinitePsnr() {
        int[] pixels = {1, 2, 3};
        Assert.assertEquals(Double.POSITIVE_INFINITY, FilterMetrics.psnr(pixels, pixels.clone(), 255), 0);
    }

    @Test
    public void unitErrorEverywhere() {
        Assert.assertEquals(20 * Math.log10(255), FilterMetrics.psnr(new int[]{10, 10}, new int[]{11, 9}, 255), 1e-9);
    }

    @Test
    public void fullScaleErrorIsZeroDecibels() {
        Assert.assertEquals(0, FilterMetrics.psnr(new int[]{0}, new int[]{255}, 255), 1e-9);
    }

    @Test
    public void imagesUseTheirPixelMaximum() {
        FilterImage reference = FilterImage.gray("a", PixelType.GRAY_16_BIT, 2, 1, new int[]{0, 0});
        FilterImage test = FilterImage.gray("b", PixelType.GRAY_16_BIT, 2, 1, new int[]{1, 1});

        Assert.assertEquals(20 * Math.log10(65535), FilterMetrics.psnr(reference, test), 1e-9);
    }

    @Test(expected = IllegalArgumentException.class)
    public void lengthsMustMatch() {
        FilterMetrics.psnr(new int[]{1, 2}, new int[]{1}, 255);
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptyInputIsRejected() {
        FilterMetrics.psnr(new int[0], new int[0], 255);
    }
}

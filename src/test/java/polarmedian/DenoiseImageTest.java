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

import org.junit.Assert;
import org.junit.Test;
import polarmedian.benchmark.SaltAndPepperNoise;
import polarmedian.filter.BoundaryPolicy;
import polarmedian.filter.SlidingWindowMedianFilter;
import polarmedian.image.FilterImage;
import polarmedian.image.PixelType;

import java.util.Arrays;

public class DenoiseImageTest {

    private static FilterImage constantImage() {
        int[] pixels = new int[20 * 20];
        Arrays.fill(pixels, 100);
        return FilterImage.gray("flat", PixelType.GRAY_8_BIT, 20, 20, pixels);
    }

    @Test
    public void restoresNoisyFlatImage() {
        FilterImage original = constantImage();

        DenoiseResult result = DenoiseImage.run(original, new SlidingWindowMedianFilter(), 4, BoundaryPolicy.MIRROR,
                new SaltAndPepperNoise(0.1, 5L));

        Assert.assertEquals(5, result.kernelSize);
        Assert.assertEquals("Sliding window median", result.filterName);
        Assert.assertNotSame(original, result.noisy);
        Assert.assertArrayEquals(original.getPixels(0, 0), result.denoised.getPixels(0, 0));
        Assert.assertEquals(Double.POSITIVE_INFINITY, result.psnr, 0);
        Assert.assertTrue(result.runtimeMillis >= 0);
    }

    @Test
    public void filtersOriginalWithoutNoise() {
        FilterImage original = constantImage();

        DenoiseResult result = DenoiseImage.run(original, new SlidingWindowMedianFilter(), 3, BoundaryPolicy.CROP, null);

        Assert.assertSame(original, result.noisy);
        Assert.assertArrayEquals(original.getPixels(0, 0), result.denoised.getPixels(0, 0));
    }

    @Test
    public void kernelSizeIsClampedAndMadeOdd() {
        Assert.assertEquals(3, PolarMedianSettings.clampKernelSize(-5));
        Assert.assertEquals(3, PolarMedianSettings.clampKernelSize(0));
        Assert.assertEquals(3, PolarMedianSettings.clampKernelSize(1));
        Assert.assertEquals(3, PolarMedianSettings.clampKernelSize(2));
        Assert.assertEquals(5, PolarMedianSettings.clampKernelSize(4));
        Assert.assertEquals(7, PolarMedianSettings.clampKernelSize(7));
        Assert.assertEquals(31, PolarMedianSettings.clampKernelSize(30));
        Assert.assertEquals(31, PolarMedianSettings.clampKernelSize(100));
    }

    @Test
    public void parsesOptionalSeed() {
        Assert.assertNull(DenoiseImage.parseSeed(""));
        Assert.assertNull(DenoiseImage.parseSeed(null));
        Assert.assertEquals(Long.valueOf(12), DenoiseImage.parseSeed(" 12 "));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsMalformedSeed() {
        DenoiseImage.parseSeed("abc");
    }
}

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

package polarmedian.filter.histogram;

import org.junit.Assert;
import org.junit.Test;
import polarmedian.filter.BoundaryPolicy;
import polarmedian.filter.BruteForceMedianFilter;
import polarmedian.filter.SlidingWindowMedianFilter;
import polarmedian.image.PixelType;

import java.util.Random;

public class HistogramMedianFilterTest {

    private static int[] randomPixels(int n, int numValues, long seed) {
        Random random = new Random(seed);
        int[] pixels = new int[n];
        for (int i = 0; i < n; i++)
            pixels[i] = random.nextInt(numValues);

        return pixels;
    }

    @Test
    public void matchesBruteForce() {
        int[] pixels = randomPixels(21 * 17, 256, 21);

        for (BoundaryPolicy boundary : BoundaryPolicy.values())
            for (int kernel : new int[]{3, 5, 9}) {
                int[] expected = new BruteForceMedianFilter().filter(pixels, 21, 17, PixelType.GRAY_8_BIT, kernel, boundary);
                int[] actual = new HistogramMedianFilter().filter(pixels, 21, 17, PixelType.GRAY_8_BIT, kernel, boundary);

                Assert.assertArrayEquals(boundary + " k=" + kernel, expected, actual);
            }
    }

    @Test
    public void matchesSlidingWindowOn16BitImage() {
        int[] pixels = randomPixels(64 * 48, 65536, 22);

        int[] expected = new SlidingWindowMedianFilter().filter(pixels, 64, 48, PixelType.GRAY_16_BIT, 7, BoundaryPolicy.MIRROR);
        int[] actual = new HistogramMedianFilter().filter(pixels, 64, 48, PixelType.GRAY_16_BIT, 7, BoundaryPolicy.MIRROR);

        Assert.assertArrayEquals(expected, actual);
    }

    @Test
    public void singleColumnImage() {
        int[] pixels = {9, 0, 9, 9, 0, 0, 0};

        int[] expected = new BruteForceMedianFilter().filter(pixels, 1, 7, PixelType.GRAY_8_BIT, 3, BoundaryPolicy.CLAMP);
        Assert.assertArrayEquals(expected, new HistogramMedianFilter().filter(pixels, 1, 7, PixelType.GRAY_8_BIT, 3, BoundaryPolicy.CLAMP));
    }
}

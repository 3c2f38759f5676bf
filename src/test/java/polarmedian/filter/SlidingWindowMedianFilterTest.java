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

import org.junit.Assert;
import org.junit.Test;
import polarmedian.image.PixelType;

import java.util.Arrays;
import java.util.Random;

public class SlidingWindowMedianFilterTest {

    private static int[] randomPixels(int n, int numValues, long seed) {
        Random random = new Random(seed);
        int[] pixels = new int[n];
        for (int i = 0; i < n; i++)
            pixels[i] = random.nextInt(numValues);

        return pixels;
    }

    @Test
    public void removesIsolatedSpike() {
        int[] pixels = new int[5 * 5];
        pixels[2 * 5 + 2] = 255;

        int[] filtered = new SlidingWindowMedianFilter().filter(pixels, 5, 5, PixelType.GRAY_8_BIT, 3, BoundaryPolicy.CLAMP);

        Assert.assertArrayEquals(new int[25], filtered);
    }

    @Test
    public void removesSpikeFromSingleRow() {
        int[] pixels = {10, 200, 10, 10, 10};

        int[] filtered = new SlidingWindowMedianFilter().filter(pixels, 5, 1, PixelType.GRAY_8_BIT, 3, BoundaryPolicy.CLAMP);

        Assert.assertArrayEquals(new int[]{10, 10, 10, 10, 10}, filtered);
    }

    @Test
    public void constantImageIsUnchanged() {
        int[] pixels = new int[9 * 7];
        Arrays.fill(pixels, 77);

        for (BoundaryPolicy boundary : BoundaryPolicy.values())
            Assert.assertArrayEquals(pixels, new SlidingWindowMedianFilter().filter(pixels, 9, 7, PixelType.GRAY_8_BIT, 5, boundary));
    }

    @Test
    public void matchesBruteForceForEveryKernelAndBoundary() {
        int width = 23;
        int height = 19;
        int[] pixels = randomPixels(width * height, 256, 11);

        for (BoundaryPolicy boundary : BoundaryPolicy.values())
            for (int kernel : new int[]{1, 3, 5, 7, 9}) {
                int[] expected = new BruteForceMedianFilter().filter(pixels, width, height, PixelType.GRAY_8_BIT, kernel, boundary);
                int[] actual = new SlidingWindowMedianFilter().filter(pixels, width, height, PixelType.GRAY_8_BIT, kernel, boundary);

                Assert.assertArrayEquals(boundary + " k=" + kernel, expected, actual);
            }
    }

    @Test
    public void matchesBruteForceWhenKernelIsLargerThanImage() {
        int[] pixels = randomPixels(3 * 2, 256, 12);

        for (BoundaryPolicy boundary : BoundaryPolicy.values()) {
            int[] expected = new BruteForceMedianFilter().filter(pixels, 3, 2, PixelType.GRAY_8_BIT, 7, boundary);
            Assert.assertArrayEquals(boundary.toString(), expected, new SlidingWindowMedianFilter().filter(pixels, 3, 2, PixelType.GRAY_8_BIT, 7, boundary));
        }
    }

    @Test
    public void filters16BitPixels() {
        int[] pixels = randomPixels(15 * 11, 65536, 13);

        int[] expected = new BruteForceMedianFilter().filter(pixels, 15, 11, PixelType.GRAY_16_BIT, 5, BoundaryPolicy.MIRROR);
        int[] actual = SlidingWindowMedianFilter.withCrossCheck().filter(pixels, 15, 11, PixelType.GRAY_16_BIT, 5, BoundaryPolicy.MIRROR);

        Assert.assertArrayEquals(expected, actual);
    }

    @Test
    public void isDeterministicAndLeavesInputAlone() {
        int[] pixels = randomPixels(20 * 20, 256, 14);
        int[] copy = Arrays.copyOf(pixels, pixels.length);

        SlidingWindowMedianFilter filter = new SlidingWindowMedianFilter();
        int[] first = filter.filter(pixels, 20, 20, PixelType.GRAY_8_BIT, 5);
        int[] second = filter.filter(pixels, 20, 20, PixelType.GRAY_8_BIT, 5);

        Assert.assertArrayEquals(first, second);
        Assert.assertArrayEquals(copy, pixels);
    }

    @Test
    public void bandedOutputMatchesSingleBand() {
        int[] pixels = randomPixels(31 * 29, 256, 15);

        int[] single = new SlidingWindowMedianFilter().filter(pixels, 31, 29, PixelType.GRAY_8_BIT, 7, BoundaryPolicy.MIRROR);
        int[] banded = new SlidingWindowMedianFilter(false, false, 4).filter(pixels, 31, 29, PixelType.GRAY_8_BIT, 7, BoundaryPolicy.MIRROR);
        int[] moreBandsThanRows = new SlidingWindowMedianFilter(false, false, 64).filter(pixels, 31, 29, PixelType.GRAY_8_BIT, 7, BoundaryPolicy.MIRROR);

        Assert.assertArrayEquals(single, banded);
        Assert.assertArrayEquals(single, moreBandsThanRows);
    }

    @Test
    public void evenKernelIsPromotedToNextOddSize() {
        int[] pixels = randomPixels(12 * 12, 256, 16);
        SlidingWindowMedianFilter filter = new SlidingWindowMedianFilter();

        Assert.assertArrayEquals(filter.filter(pixels, 12, 12, PixelType.GRAY_8_BIT, 5), filter.filter(pixels, 12, 12, PixelType.GRAY_8_BIT, 4));
        Assert.assertEquals(5, NeighbourhoodMedianFilter.normaliseKernelSize(4));
        Assert.assertEquals(3, NeighbourhoodMedianFilter.normaliseKernelSize(3));
    }

    @Test
    public void kernelOfOneCopiesInput() {
        int[] pixels = randomPixels(8 * 8, 256, 17);
        int[] filtered = new SlidingWindowMedianFilter().filter(pixels, 8, 8, PixelType.GRAY_8_BIT, 1);

        Assert.assertArrayEquals(pixels, filtered);
        Assert.assertNotSame(pixels, filtered);
    }

    @Test(expected = FilterConfigurationException.class)
    public void zeroKernelIsRejected() {
        new SlidingWindowMedianFilter().filter(new int[9], 3, 3, PixelType.GRAY_8_BIT, 0);
    }

    @Test(expected = FilterConfigurationException.class)
    public void pixelOutsideDomainIsRejected() {
        int[] pixels = new int[9];
        pixels[4] = 256;
        new SlidingWindowMedianFilter().filter(pixels, 3, 3, PixelType.GRAY_8_BIT, 3);
    }

    @Test(expected = FilterConfigurationException.class)
    public void pixelCountMustMatchExtent() {
        new SlidingWindowMedianFilter().filter(new int[10], 3, 3, PixelType.GRAY_8_BIT, 3);
    }

    @Test(expected = FilterConfigurationException.class)
    public void emptyImageIsRejected() {
        new SlidingWindowMedianFilter().filter(new int[0], 0, 0, PixelType.GRAY_8_BIT, 3);
    }

    @Test(expected = ResourceExhaustionException.class)
    public void imageOverPixelLimitIsRejected() {
        SlidingWindowMedianFilter filter = new SlidingWindowMedianFilter();
        filter.setMaxPixels(50);
        filter.filter(new int[64], 8, 8, PixelType.GRAY_8_BIT, 3);
    }

    @Test(expected = ResourceExhaustionException.class)
    public void kernelOverPixelLimitIsRejected() {
        SlidingWindowMedianFilter filter = new SlidingWindowMedianFilter();
        filter.setMaxPixels(64);
        filter.filter(new int[64], 8, 8, PixelType.GRAY_8_BIT, 9);
    }

    @Test
    public void excludingExtremesIgnoresSaturatedPixels() {
        int[] pixels = {
                255, 255, 255,
                255, 100, 100,
                100, 100, 255};

        int[] plain = new SlidingWindowMedianFilter().filter(pixels, 3, 3, PixelType.GRAY_8_BIT, 3, BoundaryPolicy.CLAMP);
        int[] unsaturated = new SlidingWindowMedianFilter(true, true, 1).filter(pixels, 3, 3, PixelType.GRAY_8_BIT, 3, BoundaryPolicy.CLAMP);

        Assert.assertEquals(255, plain[4]);
        Assert.assertEquals(100, unsaturated[4]);
    }

    @Test
    public void excludingExtremesFallsBackWhenAllSaturated() {
        int[] pixels = {0, 255, 0, 255, 255, 0, 255, 0, 255};

        int[] plain = new SlidingWindowMedianFilter().filter(pixels, 3, 3, PixelType.GRAY_8_BIT, 3, BoundaryPolicy.MIRROR);
        int[] unsaturated = new SlidingWindowMedianFilter(false, true, 1).filter(pixels, 3, 3, PixelType.GRAY_8_BIT, 3, BoundaryPolicy.MIRROR);

        Assert.assertArrayEquals(plain, unsaturated);
    }

    @Test
    public void filtersUnsignedBytes() {
        byte[] pixels = new byte[5 * 5];
        Arrays.fill(pixels, (byte) 200);
        pixels[12] = 0;

        byte[] filtered = new SlidingWindowMedianFilter().filter(pixels, 5, 5, 3, BoundaryPolicy.MIRROR);

        for (byte b : filtered)
            Assert.assertEquals(200, b & 0xff);
    }

    @Test
    public void filtersUnsignedShorts() {
        short[] pixels = new short[4 * 4];
        Arrays.fill(pixels, (short) 60000);
        pixels[5] = 3;

        short[] filtered = new SlidingWindowMedianFilter().filter(pixels, 4, 4, 3, BoundaryPolicy.CLAMP);

        for (short s : filtered)
            Assert.assertEquals(60000, s & 0xffff);
    }

    @Test
    public void describesOptions() {
        Assert.assertEquals("Sliding window median", new SlidingWindowMedianFilter().getDescription());
        Assert.assertEquals("Sliding window median [excluding extremes] [2 bands]",
                new SlidingWindowMedianFilter(false, true, 2).toString());
    }
}

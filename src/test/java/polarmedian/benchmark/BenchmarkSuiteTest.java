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
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import polarmedian.filter.BoundaryPolicy;
import polarmedian.filter.SlidingWindowMedianFilter;
import polarmedian.image.FilterImage;
import polarmedian.image.PixelType;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class BenchmarkSuiteTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static FilterImage gradient() {
        int[] pixels = new int[32 * 32];
        for (int y = 0; y < 32; y++)
            for (int x = 0; x < 32; x++)
                pixels[y * 32 + x] = (x + y) * 4;

        return FilterImage.gray("gradient", PixelType.GRAY_8_BIT, 32, 32, pixels);
    }

    @Test
    public void everyFilterProducesTheSameMedianImage() {
        List<String> messages = new ArrayList<>();
        BenchmarkSuite suite = new BenchmarkSuite(3, new SaltAndPepperNoise(0.1, 1L), 1, BoundaryPolicy.MIRROR, messages::add);

        FilterImage clean = gradient();
        List<BenchmarkRecord> records = suite.run(clean);

        Assert.assertEquals(3, records.size());
        Assert.assertEquals("Brute force", records.get(0).name);
        Assert.assertEquals("Optimized (dual heap)", records.get(1).name);
        Assert.assertEquals("Histogram", records.get(2).name);

        for (BenchmarkRecord record : records) {
            Assert.assertArrayEquals(records.get(0).image.getPixels(0, 0), record.image.getPixels(0, 0));
            Assert.assertEquals(records.get(0).psnr, record.psnr, 0);
            Assert.assertTrue(record.elapsedMillis >= 0);
        }

        double noisyPsnr = FilterMetrics.psnr(clean, new SaltAndPepperNoise(0.1, 1L).apply(clean));
        Assert.assertTrue(records.get(0).psnr > noisyPsnr);
        Assert.assertFalse(messages.isEmpty());
    }

    @Test
    public void savesImagesAndSummary() throws IOException {
        File outputDir = new File(folder.getRoot(), "results");
        BenchmarkSuite suite = new BenchmarkSuite(3, new SaltAndPepperNoise(0.1, 2L), 1, BoundaryPolicy.CLAMP, message -> { });

        suite.run(gradient(), outputDir);

        File[] images = outputDir.listFiles((dir, name) -> name.endsWith(".png"));
        File[] summaries = outputDir.listFiles((dir, name) -> name.startsWith("benchmark_") && name.endsWith(".tsv"));
        Assert.assertNotNull(images);
        Assert.assertEquals(4, images.length);
        Assert.assertNotNull(summaries);
        Assert.assertEquals(1, summaries.length);

        List<String> lines = Files.readAllLines(summaries[0].toPath(), StandardCharsets.UTF_8);
        Assert.assertEquals("source\tgradient", lines.get(0));
        Assert.assertEquals("name\telapsed_ms\tpsnr", lines.get(5));
        Assert.assertEquals(9, lines.size());
    }

    @Test
    public void scalingReportsEverySide() {
        BenchmarkSuite suite = new BenchmarkSuite(3, new SaltAndPepperNoise(0, 0L), 1, BoundaryPolicy.MIRROR, message -> { });

        double[] millisPerPixel = suite.scaling(new SlidingWindowMedianFilter(), new int[]{8, 16, 24}, 5);

        Assert.assertEquals(3, millisPerPixel.length);
        for (double value : millisPerPixel)
            Assert.assertTrue(value >= 0);
    }

    @Test
    public void recordFormatsIndependentlyOfLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.GERMANY);
        try {
            String text = new BenchmarkRecord("Histogram", 1.5, 32.25, gradient()).toString();

            Assert.assertTrue(text, text.contains("time=1.50ms"));
            Assert.assertTrue(text, text.contains("PSNR=32.25 dB"));
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void needsAtLeastOneRepeat() {
        new BenchmarkSuite(3, new SaltAndPepperNoise(0.1, 1L), 0, BoundaryPolicy.MIRROR, message -> { });
    }
}

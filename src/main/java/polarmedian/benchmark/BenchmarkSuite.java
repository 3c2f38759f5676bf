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

import ij.io.FileSaver;
import polarmedian.filter.BoundaryPolicy;
import polarmedian.filter.FilterStrategy;
import polarmedian.filter.MedianFilter;
import polarmedian.image.FilterImage;
import polarmedian.image.PixelType;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * Times the median filter implementations against each other on a noisy copy of a clean image and scores each
 * result against the clean original.
 */
public class BenchmarkSuite
{
	private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

	private final int kernelSize;
	private final SaltAndPepperNoise noise;
	private final int repeats;
	private final BoundaryPolicy boundary;
	private final Logger log;

	public BenchmarkSuite(int kernelSize, SaltAndPepperNoise noise, int repeats, BoundaryPolicy boundary, Logger log)
	{
		if(repeats < 1)
			throw new IllegalArgumentException("At least one repeat is required");

		this.kernelSize = kernelSize;
		this.noise = noise;
		this.repeats = repeats;
		this.boundary = boundary;
		this.log = log;
	}

	/**
	 * Adds noise to {@code clean} and runs the brute force, heap and histogram filters on the noisy image.
	 */
	public List<BenchmarkRecord> run(FilterImage clean)
	{
		return runCases(clean, noise.apply(clean));
	}

	/**
	 * Runs {@link #run(FilterImage)} and writes the noisy image, each denoised image and a tab separated summary to
	 * {@code outputDir}.
	 */
	public List<BenchmarkRecord> run(FilterImage clean, File outputDir) throws IOException
	{
		final FilterImage noisy = noise.apply(clean);
		final List<BenchmarkRecord> records = runCases(clean, noisy);

		save(records, noisy, clean.title, outputDir);
		return records;
	}

	private List<BenchmarkRecord> runCases(FilterImage clean, FilterImage noisy)
	{
		log.info("Noisy input PSNR: " + format(FilterMetrics.psnr(clean, noisy)) + " dB");

		final List<BenchmarkRecord> records = new ArrayList<>();
		for(FilterStrategy strategy : new FilterStrategy[] {FilterStrategy.BRUTE_FORCE, FilterStrategy.HEAP, FilterStrategy.HISTOGRAM})
			records.add(benchmarkCase(strategy.label, strategy.create(), noisy, clean));

		log.info("Benchmark results (kernel " + kernelSize + ", noise " + noise.getAmount() + ", " + repeats + " repeats)");
		for(BenchmarkRecord record : records)
			log.info("- " + record);

		return records;
	}

	BenchmarkRecord benchmarkCase(String name, MedianFilter filter, FilterImage noisy, FilterImage clean)
	{
		FilterImage output = null;
		long totalNanos = 0;
		for(int i = 0; i < repeats; i++)
		{
			final long start = System.nanoTime();
			final FilterImage candidate = noisy.filter(filter, kernelSize, boundary);
			totalNanos += System.nanoTime() - start;

			if(output == null)
				output = candidate;
		}

		final double elapsedMillis = totalNanos / 1e6 / repeats;
		return new BenchmarkRecord(name, elapsedMillis, FilterMetrics.psnr(clean, output), output);
	}

	/**
	 * Times {@code filter} on random square 8-bit images with the given side lengths, keeping the kernel fixed.
	 *
	 * @return elapsed milliseconds per pixel for each side length, in order
	 */
	public double[] scaling(MedianFilter filter, int[] sides, long seed)
	{
		final Random random = new Random(seed);
		final double[] millisPerPixel = new double[sides.length];

		for(int s = 0; s < sides.length; s++)
		{
			final int side = sides[s];
			final int[] pixels = new int[side * side];
			for(int i = 0; i < pixels.length; i++)
				pixels[i] = random.nextInt(256);

			final long start = System.nanoTime();
			for(int r = 0; r < repeats; r++)
				filter.filter(pixels, side, side, PixelType.GRAY_8_BIT, kernelSize, boundary);

			millisPerPixel[s] = (System.nanoTime() - start) / 1e6 / repeats / pixels.length;
			log.info(filter.getName() + " " + side + "x" + side + ": " + String.format(Locale.ROOT, "%.6f", millisPerPixel[s]) + " ms/pixel");
		}

		return millisPerPixel;
	}

	private void save(List<BenchmarkRecord> records, FilterImage noisy, String source, File outputDir) throws IOException
	{
		if(!outputDir.isDirectory() && !outputDir.mkdirs())
			throw new IOException("Failed to create output folder " + outputDir);

		final String timestamp = LocalDateTime.now().format(TIMESTAMP);

		saveImage(noisy, new File(outputDir, "noisy_" + timestamp + ".png"));
		for(BenchmarkRecord record : records)
			saveImage(record.image, new File(outputDir, record.name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_") + "_" + timestamp + ".png"));

		final List<String> lines = new ArrayList<>(Arrays.asList(
				"source\t" + source,
				"kernel\t" + kernelSize,
				"noise\t" + noise.getAmount(),
				"repeats\t" + repeats,
				"boundary\t" + boundary,
				"name\telapsed_ms\tpsnr"));
		for(BenchmarkRecord record : records)
			lines.add(record.name + "\t" + String.format(Locale.ROOT, "%.3f", record.elapsedMillis) + "\t" + format(record.psnr));

		final File summary = new File(outputDir, "benchmark_" + timestamp + ".tsv");
		Files.write(summary.toPath(), lines, StandardCharsets.UTF_8);
		log.info("Wrote benchmark summary to " + summary);
	}

	private static void saveImage(FilterImage image, File file) throws IOException
	{
		if(!new FileSaver(image.toImagePlus()).saveAsPng(file.getAbsolutePath()))
			throw new IOException("Failed to save " + file);
	}

	private static String format(double psnr)
	{
		return Double.isInfinite(psnr) ? "inf" : String.format(Locale.ROOT, "%.2f", psnr);
	}

	public interface Logger {
		void info(String message);
	}
}

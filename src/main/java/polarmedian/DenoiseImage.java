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

import ij.ImagePlus;
import org.scijava.ItemIO;
import org.scijava.app.StatusService;
import org.scijava.command.Command;
import org.scijava.log.LogService;
import org.scijava.plugin.Parameter;
import org.scijava.plugin.Plugin;
import org.scijava.prefs.PrefService;
import org.scijava.widget.NumberWidget;
import polarmedian.benchmark.FilterMetrics;
import polarmedian.benchmark.SaltAndPepperNoise;
import polarmedian.filter.BoundaryPolicy;
import polarmedian.filter.FilterStrategy;
import polarmedian.filter.MedianFilter;
import polarmedian.image.FilterImage;

import java.util.Locale;

@Plugin(type = Command.class, headless = true,
	menuPath = "Plugins>Filters>PolarMedian>Median Filter")
public class DenoiseImage implements Command
{
	@Parameter
	private LogService log;

	@Parameter
	private StatusService statusService;

	@Parameter
	private PrefService prefService;

	@Parameter(label = "Input image", type = ItemIO.BOTH)
	private ImagePlus image;

	@Parameter(label = "Kernel size", type = ItemIO.INPUT, style = NumberWidget.SPINNER_STYLE, min = "3", max = "31",
			initializer = "initialiseValues",
			description = "Side length of the square neighbourhood. Values outside 3-31 are clamped and even values " +
					"are increased to the next odd size.")
	private int kernelSize = PolarMedianSettings.DEFAULT_KERNEL_SIZE;

	@Parameter(label = "Filter strategy", type = ItemIO.INPUT, initializer = "initialiseValues",
			choices = {"AUTO", "HEAP", "HISTOGRAM", "BRUTE_FORCE"})
	private String strategy = PolarMedianSettings.DEFAULT_STRATEGY;

	@Parameter(label = "Border handling", type = ItemIO.INPUT, initializer = "initialiseValues",
			choices = {"MIRROR", "CLAMP", "CROP"})
	private String boundary = PolarMedianSettings.DEFAULT_BOUNDARY;

	@Parameter(label = "Add salt and pepper noise first", type = ItemIO.INPUT,
			description = "Corrupt a copy of the image before filtering and report how closely the result matches the original.")
	private boolean addNoise = false;

	@Parameter(label = "Noise amount", type = ItemIO.INPUT, style = NumberWidget.SLIDER_STYLE, min = "0", max = "1",
			stepSize = "0.01")
	private double noiseAmount = 0.05;

	@Parameter(label = "Noise seed", type = ItemIO.INPUT, required = false,
			description = "Leave empty for different noise on every run.")
	private String noiseSeed = "";

	protected void initialiseValues()
	{
		kernelSize = PolarMedianSettings.getKernelSize(prefService);
		strategy = PolarMedianSettings.getStrategy(prefService).name();
		boundary = PolarMedianSettings.getBoundary(prefService).name();
	}

	@Override
	public void run()
	{
		try
		{
			statusService.showStatus("Median filtering " + image.getTitle());

			final FilterImage original = new FilterImage(image);
			final FilterStrategy filterStrategy = FilterStrategy.fromName(strategy);
			final MedianFilter filter = PolarMedianSettings.createFilter(prefService, filterStrategy, original.width, original.height);
			final SaltAndPepperNoise noise = addNoise ? new SaltAndPepperNoise(noiseAmount, parseSeed(noiseSeed)) : null;

			final DenoiseResult result = run(original, filter, kernelSize, BoundaryPolicy.valueOf(boundary), noise);

			log.info(filter.getName() + " with " + result.kernelSize + "x" + result.kernelSize + " kernel took " +
					String.format(Locale.ROOT, "%.1f", result.runtimeMillis) + " ms");
			if(noise != null)
				log.info("PSNR against the original: " + String.format(Locale.ROOT, "%.2f", result.psnr) + " dB");

			image.setStack(result.denoised.toImagePlus().getStack());
			statusService.clearStatus();
		}
		catch (Exception e)
		{
			log.error(e);
			throw new RuntimeException(e);
		}
	}

	/**
	 * Optionally corrupts {@code original}, then median filters it. The kernel size is clamped with
	 * {@link PolarMedianSettings#clampKernelSize(int)}. PSNR is measured against the original, so it is infinite when
	 * no noise is added and the filter leaves the image unchanged.
	 *
	 * @param noise noise to add before filtering, or null to filter the original
	 */
	public static DenoiseResult run(FilterImage original, MedianFilter filter, int kernelSize, BoundaryPolicy boundary, SaltAndPepperNoise noise)
	{
		final int kernel = PolarMedianSettings.clampKernelSize(kernelSize);
		final FilterImage noisy = noise == null ? original : noise.apply(original);

		final long start = System.nanoTime();
		final FilterImage denoised = noisy.filter(filter, kernel, boundary);
		final double runtimeMillis = (System.nanoTime() - start) / 1e6;

		return new DenoiseResult(original, noisy, denoised, filter.getName(), kernel, runtimeMillis,
				FilterMetrics.psnr(original, denoised));
	}

	static Long parseSeed(String seed)
	{
		if(seed == null || seed.trim().isEmpty())
			return null;

		try
		{
			return Long.parseLong(seed.trim());
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException("Noise seed must be a whole number, got \"" + seed + "\"", e);
		}
	}
}

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

import ij.IJ;
import ij.ImagePlus;
import org.scijava.Context;
import org.scijava.ItemIO;
import org.scijava.app.StatusService;
import org.scijava.command.Command;
import org.scijava.command.CommandService;
import org.scijava.log.LogService;
import org.scijava.plugin.Parameter;
import org.scijava.plugin.Plugin;
import org.scijava.prefs.PrefService;
import org.scijava.widget.FileWidget;
import org.scijava.widget.NumberWidget;
import polarmedian.benchmark.BenchmarkRecord;
import polarmedian.benchmark.BenchmarkSuite;
import polarmedian.benchmark.SaltAndPepperNoise;
import polarmedian.image.FilterImage;

import java.io.File;
import java.util.List;

/**
 * Compares the brute force, dual-heap and histogram filters on a noisy copy of an image file and saves their outputs
 * with a timing summary.
 */
@Plugin(type = Command.class, headless = true,
	menuPath = "Plugins>Filters>PolarMedian>Benchmark Median Filters")
public class BenchmarkMedianFilters implements Command
{
	@Parameter
	private LogService log;

	@Parameter
	private StatusService statusService;

	@Parameter
	private PrefService prefService;

	@Parameter(label = "Image", type = ItemIO.INPUT, style = FileWidget.OPEN_STYLE)
	private File imageFile;

	@Parameter(label = "Output folder", type = ItemIO.INPUT, style = FileWidget.DIRECTORY_STYLE)
	private File outputFolder;

	@Parameter(label = "Kernel size", type = ItemIO.INPUT, style = NumberWidget.SPINNER_STYLE, min = "3", max = "31",
			initializer = "initialiseValues")
	private int kernelSize = PolarMedianSettings.DEFAULT_KERNEL_SIZE;

	@Parameter(label = "Noise amount", type = ItemIO.INPUT, style = NumberWidget.SLIDER_STYLE, min = "0", max = "1",
			stepSize = "0.01")
	private double noiseAmount = 0.05;

	@Parameter(label = "Repeats", type = ItemIO.INPUT, style = NumberWidget.SPINNER_STYLE, min = "1")
	private int repeats = 3;

	@Parameter(label = "Noise seed", type = ItemIO.INPUT)
	private long seed = 42;

	public static void main(final String... args) throws Exception {
		final Context context = new Context();

		context.service(CommandService.class).run(BenchmarkMedianFilters.class, true).get();
		context.dispose();
	}

	protected void initialiseValues()
	{
		kernelSize = PolarMedianSettings.getKernelSize(prefService);
	}

	@Override
	public void run()
	{
		try
		{
			final ImagePlus imagePlus = IJ.openImage(imageFile.getAbsolutePath());
			if(imagePlus == null)
				throw new IllegalArgumentException("Could not open " + imageFile);

			statusService.showStatus("Benchmarking median filters on " + imagePlus.getTitle());

			final BenchmarkSuite suite = new BenchmarkSuite(PolarMedianSettings.clampKernelSize(kernelSize),
					new SaltAndPepperNoise(noiseAmount, seed), repeats, PolarMedianSettings.getBoundary(prefService), log::info);

			final List<BenchmarkRecord> records = suite.run(new FilterImage(imagePlus), outputFolder);
			for(BenchmarkRecord record : records)
				log.info(record.toString());

			statusService.clearStatus();
		}
		catch (Exception e)
		{
			log.error(e);
			throw new RuntimeException(e);
		}
	}
}

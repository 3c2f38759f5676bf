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

import org.scijava.Context;
import org.scijava.ItemIO;
import org.scijava.command.Command;
import org.scijava.command.CommandService;
import org.scijava.plugin.Parameter;
import org.scijava.plugin.Plugin;
import org.scijava.prefs.PrefService;
import org.scijava.widget.NumberWidget;
import polarmedian.filter.BoundaryPolicy;
import polarmedian.filter.FilterStrategy;
import polarmedian.filter.MedianFilter;
import polarmedian.filter.SlidingWindowMedianFilter;

/**
 * Runs the Plugins::Filters::PolarMedian::Median Filter Settings dialog.
 */
@Plugin(type = Command.class, menuPath = "Plugins>Filters>PolarMedian>Median Filter Settings")
public class PolarMedianSettings implements Command
{
	public static final int DEFAULT_KERNEL_SIZE = 3;
	public static final int MIN_KERNEL_SIZE = 3;
	public static final int MAX_KERNEL_SIZE = 31;
	public static final String DEFAULT_STRATEGY = FilterStrategy.AUTO.name();
	public static final String DEFAULT_BOUNDARY = BoundaryPolicy.DEFAULT.name();
	public static final long DEFAULT_AUTO_THRESHOLD = FilterStrategy.DEFAULT_AUTO_THRESHOLD;
	public static final boolean DEFAULT_CROSS_CHECK = false;
	public static final boolean DEFAULT_EXCLUDE_EXTREMES = false;

	public static final String POLARMEDIAN_KERNEL_SIZE = "PolarMedian Kernel Size";
	public static final String POLARMEDIAN_STRATEGY = "PolarMedian Strategy";
	public static final String POLARMEDIAN_BOUNDARY = "PolarMedian Boundary";
	public static final String POLARMEDIAN_AUTO_THRESHOLD = "PolarMedian Auto Threshold";
	public static final String POLARMEDIAN_CROSS_CHECK = "PolarMedian Cross Check";
	public static final String POLARMEDIAN_EXCLUDE_EXTREMES = "PolarMedian Exclude Extremes";

	@Parameter
	private PrefService preferences;

	@Parameter(label = "Kernel size", type = ItemIO.INPUT,
			style = NumberWidget.SPINNER_STYLE, min = "3", max = "31", initializer = "initialiseValues",
			description = "Side length of the square neighbourhood, from 3 to 31. Even sizes are increased to the next odd size.")
	private int kernelSize = DEFAULT_KERNEL_SIZE;

	@Parameter(label = "Filter strategy", type = ItemIO.INPUT, initializer = "initialiseValues",
			choices = {"AUTO", "HEAP", "HISTOGRAM", "BRUTE_FORCE"},
			description = "AUTO uses the dual-heap engine for images up to the threshold below and the histogram " +
					"backend above it. BRUTE_FORCE sorts every window and is only useful as a reference.")
	private String strategy = DEFAULT_STRATEGY;

	@Parameter(label = "Border handling", type = ItemIO.INPUT, initializer = "initialiseValues",
			choices = {"MIRROR", "CLAMP", "CROP"},
			description = "MIRROR reflects the image about its edge, CLAMP repeats the edge pixel and CROP shrinks " +
					"windows at the border to the pixels inside the image.")
	private String boundary = DEFAULT_BOUNDARY;

	@Parameter(label = "Automatic strategy threshold (pixels)", type = ItemIO.INPUT,
			style = NumberWidget.SPINNER_STYLE, min = "1", initializer = "initialiseValues",
			description = "Images with more pixels than this use the histogram backend when the strategy is AUTO.")
	private long autoThreshold = DEFAULT_AUTO_THRESHOLD;

	@Parameter(label = "Verify medians", type = ItemIO.INPUT, initializer = "initialiseValues",
			description = "Cross-check every dual-heap median against the frequency tree. Slower; for diagnosis.")
	private boolean crossCheck = DEFAULT_CROSS_CHECK;

	@Parameter(label = "Ignore saturated pixels", type = ItemIO.INPUT, initializer = "initialiseValues",
			description = "Take the median over pixels that are neither black nor white where the window has any.")
	private boolean excludeExtremes = DEFAULT_EXCLUDE_EXTREMES;

	protected void initialiseValues()
	{
		kernelSize = getKernelSize(preferences);
		strategy = getStrategy(preferences).name();
		boundary = getBoundary(preferences).name();
		autoThreshold = preferences.getLong(PolarMedianSettings.class, POLARMEDIAN_AUTO_THRESHOLD, DEFAULT_AUTO_THRESHOLD);
		crossCheck = preferences.getBoolean(PolarMedianSettings.class, POLARMEDIAN_CROSS_CHECK, DEFAULT_CROSS_CHECK);
		excludeExtremes = preferences.getBoolean(PolarMedianSettings.class, POLARMEDIAN_EXCLUDE_EXTREMES, DEFAULT_EXCLUDE_EXTREMES);
	}

	@Override
	public void run()
	{
		preferences.put(PolarMedianSettings.class, POLARMEDIAN_KERNEL_SIZE, clampKernelSize(kernelSize));
		preferences.put(PolarMedianSettings.class, POLARMEDIAN_STRATEGY, FilterStrategy.fromName(strategy).name());
		preferences.put(PolarMedianSettings.class, POLARMEDIAN_BOUNDARY, BoundaryPolicy.valueOf(boundary).name());
		preferences.put(PolarMedianSettings.class, POLARMEDIAN_AUTO_THRESHOLD, Math.max(1, autoThreshold));
		preferences.put(PolarMedianSettings.class, POLARMEDIAN_CROSS_CHECK, crossCheck);
		preferences.put(PolarMedianSettings.class, POLARMEDIAN_EXCLUDE_EXTREMES, excludeExtremes);
	}

	/**
	 * Kernel sizes accepted from users: at least {@link #MIN_KERNEL_SIZE}, at most {@link #MAX_KERNEL_SIZE}, and odd.
	 */
	public static int clampKernelSize(int kernelSize)
	{
		int clamped = Math.max(MIN_KERNEL_SIZE, Math.min(kernelSize, MAX_KERNEL_SIZE));
		if(clamped % 2 == 0)
			clamped++;

		return Math.min(clamped, MAX_KERNEL_SIZE);
	}

	public static int getKernelSize(PrefService preferences)
	{
		return clampKernelSize(preferences.getInt(PolarMedianSettings.class, POLARMEDIAN_KERNEL_SIZE, DEFAULT_KERNEL_SIZE));
	}

	public static FilterStrategy getStrategy(PrefService preferences)
	{
		return FilterStrategy.fromName(preferences.get(PolarMedianSettings.class, POLARMEDIAN_STRATEGY, DEFAULT_STRATEGY));
	}

	public static BoundaryPolicy getBoundary(PrefService preferences)
	{
		return BoundaryPolicy.valueOf(preferences.get(PolarMedianSettings.class, POLARMEDIAN_BOUNDARY, DEFAULT_BOUNDARY));
	}

	public static long getAutoThreshold(PrefService preferences)
	{
		return preferences.getLong(PolarMedianSettings.class, POLARMEDIAN_AUTO_THRESHOLD, DEFAULT_AUTO_THRESHOLD);
	}

	/**
	 * Filter for an image of the given size, honouring the stored strategy options. The heap engine picks up the
	 * cross-check and saturated-pixel settings.
	 */
	public static MedianFilter createFilter(PrefService preferences, FilterStrategy strategy, int width, int height)
	{
		final FilterStrategy resolved = strategy.resolve((long) width * height, getAutoThreshold(preferences));
		final boolean crossCheck = preferences.getBoolean(PolarMedianSettings.class, POLARMEDIAN_CROSS_CHECK, DEFAULT_CROSS_CHECK);
		final boolean excludeExtremes = preferences.getBoolean(PolarMedianSettings.class, POLARMEDIAN_EXCLUDE_EXTREMES, DEFAULT_EXCLUDE_EXTREMES);

		if(resolved == FilterStrategy.HEAP && (crossCheck || excludeExtremes))
			return new SlidingWindowMedianFilter(crossCheck, excludeExtremes, 1);

		return resolved.create();
	}

	public static void main(final String... args) throws Exception {
		final Context context = new Context();

		context.service(CommandService.class).run(PolarMedianSettings.class, true).get();
		context.dispose();
	}
}

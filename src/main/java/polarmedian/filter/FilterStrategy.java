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

import polarmedian.filter.histogram.HistogramMedianFilter;

import java.util.Locale;

/**
 * Which median implementation to run. The choice is made by the caller before a filter is constructed; all
 * implementations honour the same contract, so their outputs can be compared directly.
 */
public enum FilterStrategy
{
	/** {@link #HEAP} up to the automatic threshold, {@link #HISTOGRAM} above it. */
	AUTO("Automatic"),
	HEAP("Optimized (dual heap)"),
	HISTOGRAM("Histogram"),
	BRUTE_FORCE("Brute force");

	/** Pixel count (not side length) above which {@link #AUTO} switches to the histogram backend. */
	public static final long DEFAULT_AUTO_THRESHOLD = 320 * 320;

	public final String label;

	FilterStrategy(String label)
	{
		this.label = label;
	}

	/**
	 * Resolves {@link #AUTO} for an image of the given size. Other strategies resolve to themselves.
	 */
	public FilterStrategy resolve(long numPixels, long autoThreshold)
	{
		if(this != AUTO)
			return this;

		return numPixels <= autoThreshold ? HEAP : HISTOGRAM;
	}

	public MedianFilter create()
	{
		switch (this)
		{
			case HEAP:
				return new SlidingWindowMedianFilter();
			case HISTOGRAM:
				return new HistogramMedianFilter();
			case BRUTE_FORCE:
				return new BruteForceMedianFilter();
			case AUTO:
				throw new IllegalStateException("Resolve AUTO against an image size before creating a filter");
			default:
				throw new IllegalArgumentException("Strategy not yet implemented: "+this);
		}
	}

	public static MedianFilter select(FilterStrategy strategy, int width, int height, long autoThreshold)
	{
		return strategy.resolve((long) width * height, autoThreshold).create();
	}

	/**
	 * Parses a strategy from its name or label, case-insensitively. The short names {@code optimized},
	 * {@code brute} and {@code vectorized} are accepted as aliases.
	 */
	public static FilterStrategy fromName(String name)
	{
		if(name == null)
			throw new FilterConfigurationException("Filter strategy is required");

		final String key = name.trim().toLowerCase(Locale.ROOT);
		switch (key)
		{
			case "optimized":
			case "heap":
				return HEAP;
			case "brute":
			case "brute_force":
				return BRUTE_FORCE;
			case "vectorized":
			case "histogram":
				return HISTOGRAM;
			case "auto":
				return AUTO;
			default:
				break;
		}

		for(FilterStrategy strategy : values())
			if(strategy.label.equalsIgnoreCase(key) || strategy.name().equalsIgnoreCase(key))
				return strategy;

		throw new FilterConfigurationException("Unknown filter strategy: " + name);
	}
}

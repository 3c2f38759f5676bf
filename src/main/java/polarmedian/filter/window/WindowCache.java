package polarmedian.filter.window;

import polarmedian.filter.InvariantViolationException;

import java.util.Arrays;

/**
 * Memoizes the samples of each window column for the row band currently being traversed.
 * <p>
 * Sliding a window one step sideways inserts the column that enters and removes the column that leaves, so every
 * column is visited twice per band. The cache gathers it once. Entries are keyed by window column and stamped
 * with the band that produced them; moving to another band requires an explicit {@link #invalidate(int)}.
 * One cache belongs to one traversal and is discarded with it.
 */
public class WindowCache {

    private static final int NO_BAND = Integer.MIN_VALUE;

    private final WindowSource source;
    private final int firstColumn;

    private final int[][] columns;
    private final int[] stamps;

    private int band = NO_BAND;
    private long hits = 0;
    private long misses = 0;

    WindowCache(WindowSource source) {
        this.source = source;
        this.firstColumn = -source.radius;

        final int numColumns = source.width + 2 * source.radius;
        this.columns = new int[numColumns][];
        this.stamps = new int[numColumns];
        Arrays.fill(stamps, NO_BAND);
    }

    /**
     * Samples of window column {@code column} for windows centred on row {@code rowBand}, gathered on first use.
     *
     * @throws InvariantViolationException if another band is still live
     */
    public int[] getColumn(int column, int rowBand) {
        if (band == NO_BAND)
            band = rowBand;
        else if (band != rowBand)
            throw new InvariantViolationException("Column requested for row band " + rowBand + " while band " + band + " is live");

        final int index = column - firstColumn;
        if (index < 0 || index >= columns.length)
            throw new IndexOutOfBoundsException("Window column " + column + " outside [" + firstColumn + ", " + (firstColumn + columns.length - 1) + "]");

        if (stamps[index] == rowBand) {
            hits++;
            return columns[index];
        }

        misses++;
        final int[] samples = source.columnSamples(column, rowBand);
        columns[index] = samples;
        stamps[index] = rowBand;

        return samples;
    }

    /** Releases every column gathered for {@code rowBand}. Invalidating a band that is not live is a no-op. */
    public void invalidate(int rowBand) {
        if (band != rowBand)
            return;

        band = NO_BAND;
        Arrays.fill(columns, null);
        Arrays.fill(stamps, NO_BAND);
    }

    public long getHits() {
        return hits;
    }

    public long getMisses() {
        return misses;
    }
}

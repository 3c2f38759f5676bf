package polarmedian.filter.window;

import polarmedian.filter.BoundaryPolicy;
import polarmedian.filter.InvariantViolationException;

/**
 * One pass of a square median window over a band of output rows.
 * <p>
 * The window moves in serpentine order: left to right on the first row of the band, right to left on the next,
 * and so on. A horizontal slide inserts the entering column and removes the leaving one, both read through the
 * {@link WindowCache}; the step down at the end of a row inserts the entering image row and removes the leaving
 * one, so the window is seeded once per band and never rebuilt.
 * <p>
 * Each traversal owns its tracker, tree and cache and can be run once. Several traversals may read the same input
 * concurrently as long as their output rows do not overlap.
 */
public final class MedianWindowTraversal {

    public enum State {
        INIT, ROW_TRAVERSAL, COLUMN_TRAVERSAL, WINDOW_UPDATE, MEDIAN_EMIT, DONE
    }

    private final WindowSource source;
    private final int numValues;
    private final int rowStart;
    private final int rowEnd;
    private final boolean crossCheck;
    private final boolean excludeExtremes;

    private final DualHeapMedianTracker tracker;
    private final FrequencyRangeTree tree;
    private final WindowCache cache;

    private State state = State.INIT;
    private long slides = 0;

    private MedianWindowTraversal(Builder builder) {
        final int radius = builder.kernelSize / 2;
        this.source = new WindowSource(builder.pixels, builder.width, builder.height, radius, builder.boundary);
        this.numValues = builder.numValues;
        this.rowStart = builder.rowStart;
        this.rowEnd = builder.rowEnd;
        this.crossCheck = builder.crossCheck;
        this.excludeExtremes = builder.excludeExtremes;

        final int diameter = source.diameter();
        this.tracker = new DualHeapMedianTracker(numValues, diameter * diameter);
        this.tree = new FrequencyRangeTree(numValues);
        this.cache = new WindowCache(source);
    }

    public static Builder builder(int[] pixels, int width, int height, int numValues) {
        return new Builder(pixels, width, height, numValues);
    }

    public State getState() {
        return state;
    }

    /** Horizontal and vertical window moves made so far. */
    public long getSlides() {
        return slides;
    }

    public WindowCache getCache() {
        return cache;
    }

    /**
     * Writes the median of every window centred in rows [rowStart, rowEnd) into {@code output}, which is indexed
     * like the input.
     *
     * @throws IllegalStateException if this traversal has already run
     */
    public void run(int[] output) {
        if (state != State.INIT)
            throw new IllegalStateException("Traversal has already run; create a new one for each pass");

        if (output.length != source.pixels.length)
            throw new IllegalArgumentException("Output holds " + output.length + " pixels, expected " + source.pixels.length);

        final int width = source.width;
        final int radius = source.radius;

        int x = 0;
        if (rowStart < rowEnd) {
            state = State.ROW_TRAVERSAL;
            for (int column = -radius; column <= radius; column++)
                insertAll(cache.getColumn(column, rowStart));
        }

        for (int y = rowStart; y < rowEnd; y++) {
            state = State.ROW_TRAVERSAL;
            final int direction = ((y - rowStart) & 1) == 0 ? 1 : -1;

            emit(output, x, y);

            state = State.COLUMN_TRAVERSAL;
            for (int step = 1; step < width; step++) {
                state = State.WINDOW_UPDATE;

                final int entering = direction > 0 ? x + radius + 1 : x - radius - 1;
                final int leaving = direction > 0 ? x - radius : x + radius;
                insertAll(cache.getColumn(entering, y));
                removeAll(cache.getColumn(leaving, y));
                x += direction;
                afterSlide();

                emit(output, x, y);
            }

            cache.invalidate(y);

            if (y + 1 < rowEnd) {
                state = State.WINDOW_UPDATE;
                insertAll(source.rowSamples(y + 1 + radius, x));
                removeAll(source.rowSamples(y - radius, x));
                afterSlide();
            }
        }

        state = State.DONE;
    }

    private void insertAll(int[] values) {
        for (int value : values) {
            tracker.insert(value);
            tree.increment(value);
        }
    }

    private void removeAll(int[] values) {
        for (int value : values) {
            tracker.remove(value);
            tree.decrement(value);
        }
    }

    private void afterSlide() {
        slides++;

        if (!tracker.isBalanced())
            throw new InvariantViolationException("Heap sizes out of balance after slide " + slides +
                    ": lower=" + tracker.lowerSize() + " upper=" + tracker.upperSize());
    }

    private void emit(int[] output, int x, int y) {
        state = State.MEDIAN_EMIT;

        final int median = tracker.median();

        if (crossCheck) {
            if (tracker.size() != tree.total())
                throw new InvariantViolationException("Tracker holds " + tracker.size() + " values but tree counts " +
                        tree.total() + " at (" + x + ", " + y + ")");

            final int rankMedian = tree.rankQuery((tree.total() + 1) / 2);
            if (rankMedian != median)
                throw new InvariantViolationException("Heap median " + median + " disagrees with rank median " +
                        rankMedian + " at (" + x + ", " + y + ")");
        }

        output[y * source.width + x] = excludeExtremes ? unsaturatedMedian(median) : median;
    }

    /**
     * Median of the window values strictly between 0 and the domain maximum, which are the values salt-and-pepper
     * noise cannot produce. Falls back to the plain median when the whole window is saturated.
     */
    private int unsaturatedMedian(int median) {
        if (numValues < 3)
            return median;

        final int unsaturated = tree.rangeCount(1, numValues - 2);
        if (unsaturated == 0)
            return median;

        return tree.rankQuery(tree.count(0) + (unsaturated + 1) / 2);
    }

    public static final class Builder {
        private final int[] pixels;
        private final int width;
        private final int height;
        private final int numValues;

        private int kernelSize = 3;
        private BoundaryPolicy boundary = BoundaryPolicy.DEFAULT;
        private int rowStart = 0;
        private int rowEnd;
        private boolean crossCheck = false;
        private boolean excludeExtremes = false;

        private Builder(int[] pixels, int width, int height, int numValues) {
            this.pixels = pixels;
            this.width = width;
            this.height = height;
            this.numValues = numValues;
            this.rowEnd = height;
        }

        /** Must already be odd and positive; validation and promotion happen in the filter. */
        public Builder kernelSize(int kernelSize) {
            if (kernelSize < 1 || kernelSize % 2 == 0)
                throw new IllegalArgumentException("Traversal kernel size must be odd and positive, got " + kernelSize);

            this.kernelSize = kernelSize;
            return this;
        }

        public Builder boundary(BoundaryPolicy boundary) {
            this.boundary = boundary;
            return this;
        }

        public Builder rows(int rowStart, int rowEnd) {
            if (rowStart < 0 || rowEnd > height || rowStart > rowEnd)
                throw new IllegalArgumentException("Rows [" + rowStart + ", " + rowEnd + ") outside [0, " + height + ")");

            this.rowStart = rowStart;
            this.rowEnd = rowEnd;
            return this;
        }

        public Builder crossCheck(boolean crossCheck) {
            this.crossCheck = crossCheck;
            return this;
        }

        public Builder excludeExtremes(boolean excludeExtremes) {
            this.excludeExtremes = excludeExtremes;
            return this;
        }

        public MedianWindowTraversal build() {
            if (pixels.length != width * height)
                throw new IllegalArgumentException("Pixel array holds " + pixels.length + " values, expected " + (width * height));

            return new MedianWindowTraversal(this);
        }
    }
}

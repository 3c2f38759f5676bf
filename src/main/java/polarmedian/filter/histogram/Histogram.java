package polarmedian.filter.histogram;

import polarmedian.filter.InvariantViolationException;

import java.util.PrimitiveIterator;

/**
 * Dense value histogram with an ordered index of its occupied bins. Order statistics walk only the occupied bins,
 * so their cost follows the number of distinct values in the window rather than the size of the value domain.
 */
public class Histogram {

    private final int[] counts;
    private final SkipList included = new SkipList();

    private int numPixels = 0;

    public Histogram(int numValues) {
        if (numValues < 1)
            throw new IllegalArgumentException("Histogram needs at least one bin");

        counts = new int[numValues];
    }

    /** Empty histogram over the same domain. */
    public Histogram copy() {
        return new Histogram(counts.length);
    }

    public int getNumValues() {
        return counts.length;
    }

    public int getNumPixels() {
        return numPixels;
    }

    public int getNumUniquePixelValues() {
        return included.size();
    }

    public int getCount(int value) {
        return counts[value];
    }

    void increment(int value) {
        if (counts[value] == 0)
            included.add(value);

        counts[value]++;
        numPixels++;
    }

    void decrement(int value) {
        if (counts[value] <= 0)
            throw new InvariantViolationException("Cannot decrement bin " + value + " below 0");

        counts[value]--;
        if (counts[value] == 0)
            included.remove(value);

        numPixels--;
    }

    /**
     * Smallest value with at least {@code rank} pixels at or below it (1-based).
     */
    public int rankValue(int rank) {
        if (rank < 1 || rank > numPixels)
            throw new IllegalArgumentException("Rank " + rank + " outside [1, " + numPixels + "]");

        int counted = 0;
        final PrimitiveIterator.OfInt it = included.ascending();
        while (it.hasNext()) {
            final int value = it.nextInt();
            counted += counts[value];
            if (counted >= rank)
                return value;
        }

        throw new InvariantViolationException("Histogram counts " + counted + " pixels but reports " + numPixels);
    }

    /** Lower median of the counted pixels. */
    public int median() {
        return rankValue((numPixels + 1) / 2);
    }

    PrimitiveIterator.OfInt occupiedValues() {
        return included.ascending();
    }

    public void reset() {
        final PrimitiveIterator.OfInt it = included.ascending();
        while (it.hasNext())
            counts[it.nextInt()] = 0;

        numPixels = 0;
        included.clear();
    }
}

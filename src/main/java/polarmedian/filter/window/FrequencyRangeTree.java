package polarmedian.filter.window;

import polarmedian.filter.InvariantViolationException;

import java.util.Arrays;

/**
 * Fenwick tree of value frequencies over the domain [0, numValues - 1].
 * <p>
 * Node {@code i} (1-based) aggregates the counts of the {@code i & -i} values ending at value {@code i - 1}. Every
 * update touches O(log V) nodes, and order statistics are found by descending the implicit tree from the highest
 * power of two, so {@link #rankQuery(int)} is O(log V) without a separate search.
 */
public class FrequencyRangeTree {

    private final int numValues;
    private final int[] tree;
    private final int[] leaves;
    private final int topBit;

    private int total = 0;

    public FrequencyRangeTree(int numValues) {
        if (numValues < 1)
            throw new IllegalArgumentException("Value domain must hold at least one value");

        this.numValues = numValues;
        this.tree = new int[numValues + 1];
        this.leaves = new int[numValues];
        this.topBit = Integer.highestOneBit(numValues);
    }

    public int numValues() {
        return numValues;
    }

    /**
     * Adds {@code delta} occurrences of {@code value}.
     *
     * @throws InvariantViolationException if the count of {@code value} would drop below zero
     */
    public void add(int value, int delta) {
        checkDomain(value);

        if (leaves[value] + delta < 0)
            throw new InvariantViolationException("Count of " + value + " would become " + (leaves[value] + delta));

        leaves[value] += delta;
        total += delta;

        for (int i = value + 1; i <= numValues; i += i & -i)
            tree[i] += delta;
    }

    public void increment(int value) {
        add(value, 1);
    }

    public void decrement(int value) {
        add(value, -1);
    }

    public int count(int value) {
        checkDomain(value);
        return leaves[value];
    }

    public int total() {
        return total;
    }

    /** Number of values {@code <= value}. Negative arguments give 0 and arguments past the domain give the total. */
    public int prefixCount(int value) {
        if (value < 0)
            return 0;

        int sum = 0;
        for (int i = Math.min(value + 1, numValues); i > 0; i -= i & -i)
            sum += tree[i];

        return sum;
    }

    /** Number of values in [lo, hi], clipped to the domain. Empty ranges give 0. */
    public int rangeCount(int lo, int hi) {
        if (hi < lo)
            return 0;

        return prefixCount(hi) - prefixCount(lo - 1);
    }

    /**
     * Smallest value v such that at least {@code rank} values are {@code <= v}, i.e. the rank-th order statistic
     * (1-based).
     *
     * @throws IllegalArgumentException if rank is not in [1, total]
     */
    public int rankQuery(int rank) {
        if (rank < 1 || rank > total)
            throw new IllegalArgumentException("Rank " + rank + " outside [1, " + total + "]");

        int position = 0;
        int remaining = rank;
        for (int step = topBit; step > 0; step >>= 1) {
            final int next = position + step;
            if (next <= numValues && tree[next] < remaining) {
                position = next;
                remaining -= tree[next];
            }
        }

        // position is the largest 1-based index whose prefix count is below rank, which is the 0-based answer
        return position;
    }

    /** Lower median of everything counted, matching {@link DualHeapMedianTracker#median()}. */
    public int median() {
        return rankQuery((total + 1) / 2);
    }

    public void clear() {
        Arrays.fill(tree, 0);
        Arrays.fill(leaves, 0);
        total = 0;
    }

    private void checkDomain(int value) {
        if (value < 0 || value >= numValues)
            throw new IllegalArgumentException("Value " + value + " outside domain [0, " + (numValues - 1) + "]");
    }
}

package polarmedian.filter.window;

import polarmedian.filter.InvariantViolationException;

import java.util.NoSuchElementException;

/**
 * Tracks the median of a multiset of pixel values that changes one value at a time.
 * <p>
 * Values are split between {@code lower}, a max heap holding the smaller half, and {@code upper}, a min heap holding
 * the larger half. The live sizes always satisfy {@code 0 <= |lower| - |upper| <= 1}, so the head of {@code lower}
 * is the median for odd sizes and the lower of the two middle values for even sizes, which keeps the output an
 * integer pixel value.
 * <p>
 * Removal is lazy: a removed value is recorded in a per-heap pending-deletion counter and left in place until it
 * surfaces at the head, where it is popped. Heaps whose physical size runs far ahead of their live size are
 * compacted, which bounds memory by the window size rather than by the number of updates.
 * <p>
 * Insert is O(log k); remove and median are amortized O(log k) and O(1) respectively. Not thread safe.
 */
public class DualHeapMedianTracker {

    private static final int COMPACTION_SLACK = 64;

    private final int numValues;

    private final IntHeap lower;
    private final IntHeap upper;

    private final int[] lowerPending;
    private final int[] upperPending;
    private final int[] live;

    private int lowerSize = 0;
    private int upperSize = 0;

    /**
     * @param numValues size of the value domain; values must lie in [0, numValues - 1]
     * @param expectedSize expected number of live values, used to size the heaps
     */
    public DualHeapMedianTracker(int numValues, int expectedSize) {
        if (numValues < 1)
            throw new IllegalArgumentException("Value domain must hold at least one value");

        this.numValues = numValues;
        this.lower = IntHeap.maxHeap(expectedSize / 2 + 1);
        this.upper = IntHeap.minHeap(expectedSize / 2 + 1);
        this.lowerPending = new int[numValues];
        this.upperPending = new int[numValues];
        this.live = new int[numValues];
    }

    public DualHeapMedianTracker(int numValues) {
        this(numValues, 16);
    }

    public void insert(int value) {
        checkDomain(value);
        live[value]++;

        if (lowerSize == 0 || value <= lowerHead()) {
            lower.push(value);
            lowerSize++;
        } else {
            upper.push(value);
            upperSize++;
        }

        rebalance();
    }

    /**
     * Removes one occurrence of {@code value}.
     *
     * @throws InvariantViolationException if the value is not currently tracked
     */
    public void remove(int value) {
        checkDomain(value);
        if (live[value] == 0)
            throw new InvariantViolationException("Cannot remove " + value + ": value is not in the window");

        live[value]--;

        // Every live value in lower is <= its head and every live value in upper is >= it, so the comparison
        // against the pruned head decides which heap owns the occurrence.
        if (lowerSize > 0 && value <= lowerHead()) {
            lowerPending[value]++;
            lowerSize--;
            prune(lower, lowerPending);
        } else {
            upperPending[value]++;
            upperSize--;
            prune(upper, upperPending);
        }

        rebalance();
        compactIfSparse();
    }

    /**
     * @return the head of the lower heap
     * @throws NoSuchElementException if no values are tracked
     */
    public int median() {
        if (size() == 0)
            throw new NoSuchElementException("Median requested from an empty window");

        return lowerHead();
    }

    public int size() {
        return lowerSize + upperSize;
    }

    public int lowerSize() {
        return lowerSize;
    }

    public int upperSize() {
        return upperSize;
    }

    public boolean isBalanced() {
        final int difference = lowerSize - upperSize;
        return difference == 0 || difference == 1;
    }

    /** Number of live occurrences of {@code value}. */
    public int count(int value) {
        checkDomain(value);
        return live[value];
    }

    /** Physical heap entries, live and stale. Exposed so the bound on stale entries can be checked. */
    int physicalSize() {
        return lower.size() + upper.size();
    }

    private int lowerHead() {
        prune(lower, lowerPending);
        return lower.peek();
    }

    private int upperHead() {
        prune(upper, upperPending);
        return upper.peek();
    }

    private static void prune(IntHeap heap, int[] pending) {
        while (!heap.isEmpty()) {
            final int head = heap.peek();
            if (pending[head] == 0)
                return;

            pending[head]--;
            heap.pop();
        }
    }

    private void rebalance() {
        if (lowerSize > upperSize + 1) {
            final int moved = lowerHead();
            lower.pop();
            lowerSize--;
            upper.push(moved);
            upperSize++;
        } else if (upperSize > lowerSize) {
            final int moved = upperHead();
            upper.pop();
            upperSize--;
            lower.push(moved);
            lowerSize++;
        }

        if (!isBalanced())
            throw new InvariantViolationException("Heap sizes out of balance: lower=" + lowerSize + " upper=" + upperSize);
    }

    private void compactIfSparse() {
        if (lower.size() > 2 * lowerSize + COMPACTION_SLACK)
            compact(lower, lowerPending);

        if (upper.size() > 2 * upperSize + COMPACTION_SLACK)
            compact(upper, upperPending);
    }

    private static void compact(IntHeap heap, int[] pending) {
        heap.retainAll(value -> {
            if (pending[value] > 0) {
                pending[value]--;
                return false;
            }
            return true;
        });
    }

    private void checkDomain(int value) {
        if (value < 0 || value >= numValues)
            throw new IllegalArgumentException("Value " + value + " outside domain [0, " + (numValues - 1) + "]");
    }
}

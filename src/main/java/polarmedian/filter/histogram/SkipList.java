package polarmedian.filter.histogram;

import it.unimi.dsi.util.XorShift1024StarPhiRandom;

import java.util.Arrays;
import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;

/**
 * Ordered set of distinct ints with expected O(log n) insertion and removal and O(1) steps in ascending order.
 * Used to visit only the occupied bins of a histogram whose domain is much larger than a window.
 * <p>
 * Node levels come from a seeded generator owned by the list, so two lists fed the same operations have the same
 * shape.
 */
class SkipList {

    private static final int MAX_LEVEL = 24;
    private static final double PROMOTION_PROBABILITY = 0.25;
    private static final long SEED = 0x5DEECE66DL;

    private final XorShift1024StarPhiRandom random = new XorShift1024StarPhiRandom(SEED);

    private final Node head = new Node(Integer.MIN_VALUE, MAX_LEVEL);
    private final Node[] update = new Node[MAX_LEVEL];

    private int level = 1;
    private int size = 0;

    int size() {
        return size;
    }

    boolean isEmpty() {
        return size == 0;
    }

    boolean contains(int value) {
        final Node candidate = findPredecessors(value).next[0];
        return candidate != null && candidate.value == value;
    }

    /** Adds the value if it is absent. */
    void add(int value) {
        final Node predecessor = findPredecessors(value);
        final Node candidate = predecessor.next[0];
        if (candidate != null && candidate.value == value)
            return;

        final int nodeLevel = randomLevel();
        if (nodeLevel > level) {
            for (int i = level; i < nodeLevel; i++)
                update[i] = head;
            level = nodeLevel;
        }

        final Node node = new Node(value, nodeLevel);
        for (int i = 0; i < nodeLevel; i++) {
            node.next[i] = update[i].next[i];
            update[i].next[i] = node;
        }

        size++;
    }

    /**
     * @throws NoSuchElementException if the value is absent
     */
    void remove(int value) {
        findPredecessors(value);
        final Node node = update[0].next[0];
        if (node == null || node.value != value)
            throw new NoSuchElementException("Value " + value + " is not in the list");

        for (int i = 0; i < level && update[i].next[i] == node; i++)
            update[i].next[i] = node.next[i];

        while (level > 1 && head.next[level - 1] == null)
            level--;

        size--;
    }

    void clear() {
        Arrays.fill(head.next, null);
        level = 1;
        size = 0;
    }

    int firstValue() {
        final Node first = head.next[0];
        if (first == null)
            throw new NoSuchElementException();

        return first.value;
    }

    PrimitiveIterator.OfInt ascending() {
        return new PrimitiveIterator.OfInt() {
            Node node = head.next[0];

            @Override
            public boolean hasNext() {
                return node != null;
            }

            @Override
            public int nextInt() {
                if (node == null)
                    throw new NoSuchElementException();

                final int value = node.value;
                node = node.next[0];
                return value;
            }
        };
    }

    /** Fills {@link #update} with the last node before {@code value} on every level and returns the level 0 one. */
    private Node findPredecessors(int value) {
        Node node = head;
        for (int i = level - 1; i >= 0; i--) {
            while (node.next[i] != null && node.next[i].value < value)
                node = node.next[i];
            update[i] = node;
        }
        return node;
    }

    private int randomLevel() {
        int nodeLevel = 1;
        while (nodeLevel < MAX_LEVEL && random.nextDouble() < PROMOTION_PROBABILITY)
            nodeLevel++;

        return nodeLevel;
    }

    private static final class Node {
        final int value;
        final Node[] next;

        Node(int value, int level) {
            this.value = value;
            this.next = new Node[level];
        }
    }
}

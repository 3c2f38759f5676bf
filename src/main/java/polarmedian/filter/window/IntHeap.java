package polarmedian.filter.window;

import java.util.Arrays;
import java.util.NoSuchElementException;
import java.util.function.IntPredicate;

/**
 * Array-backed binary heap of primitive ints. Ordering is fixed at construction: a max heap keeps the largest value
 * at its head, a min heap the smallest. Duplicates are ordered by value only.
 */
class IntHeap {

    private final boolean maxAtHead;
    private int[] elements;
    private int size = 0;

    private IntHeap(boolean maxAtHead, int capacity) {
        this.maxAtHead = maxAtHead;
        this.elements = new int[Math.max(capacity, 1)];
    }

    static IntHeap maxHeap(int capacity) {
        return new IntHeap(true, capacity);
    }

    static IntHeap minHeap(int capacity) {
        return new IntHeap(false, capacity);
    }

    int size() {
        return size;
    }

    boolean isEmpty() {
        return size == 0;
    }

    int peek() {
        if (size == 0)
            throw new NoSuchElementException("Heap is empty");

        return elements[0];
    }

    void push(int value) {
        if (size == elements.length)
            elements = Arrays.copyOf(elements, elements.length * 2);

        elements[size] = value;
        siftUp(size);
        size++;
    }

    int pop() {
        final int head = peek();

        size--;
        if (size > 0) {
            elements[0] = elements[size];
            siftDown(0);
        }

        return head;
    }

    /**
     * Drops every element the predicate rejects and restores heap order in O(n). The predicate sees each physical
     * element exactly once, in array order.
     */
    void retainAll(IntPredicate keep) {
        int kept = 0;
        for (int i = 0; i < size; i++)
            if (keep.test(elements[i]))
                elements[kept++] = elements[i];

        size = kept;
        for (int i = size / 2 - 1; i >= 0; i--)
            siftDown(i);
    }


    private boolean above(int a, int b) {
        return maxAtHead ? a > b : a < b;
    }

    private void siftUp(int index) {
        final int value = elements[index];
        while (index > 0) {
            final int parent = (index - 1) >>> 1;
            if (!above(value, elements[parent]))
                break;

            elements[index] = elements[parent];
            index = parent;
        }
        elements[index] = value;
    }

    private void siftDown(int index) {
        final int value = elements[index];
        final int half = size >>> 1;
        while (index < half) {
            int child = 2 * index + 1;
            final int right = child + 1;
            if (right < size && above(elements[right], elements[child]))
                child = right;

            if (!above(elements[child], value))
                break;

            elements[index] = elements[child];
            index = child;
        }
        elements[index] = value;
    }
}

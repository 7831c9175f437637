package ai.prettylayout.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Growable circular queue addressed by absolute position. Indices keep increasing across pops and clears,
 * so an index handed out by {@link #push} stays valid for as long as its element is buffered.
 */
final class RingBuffer<T> {

    private static final int INITIAL_CAPACITY = 16;

    private List<T> data = slots(INITIAL_CAPACITY);
    private int head;
    private int size;
    private long offset;

    long push(T value) {
        if (size == data.size()) {
            grow();
        }
        data.set(slot(head + size), value);
        size++;
        return offset + size - 1;
    }

    boolean isEmpty() {
        return size == 0;
    }

    int size() {
        return size;
    }

    void clear() {
        Collections.fill(data, null);
        offset += size;
        head = 0;
        size = 0;
    }

    long indexOfFirst() {
        return offset;
    }

    T first() {
        requireNonEmpty();
        return element(head);
    }

    T last() {
        requireNonEmpty();
        return element(head + size - 1);
    }

    T secondLast() {
        if (size < 2) {
            throw new NoSuchElementException("fewer than two buffered elements");
        }
        return element(head + size - 2);
    }

    T popFirst() {
        T value = first();
        data.set(head, null);
        head = slot(head + 1);
        size--;
        offset++;
        return value;
    }

    T popLast() {
        T value = last();
        data.set(slot(head + size - 1), null);
        size--;
        return value;
    }

    T get(long index) {
        long relative = index - offset;
        if (relative < 0 || relative >= size) {
            throw new IndexOutOfBoundsException("index " + index + " outside [" + offset + ", " + (offset + size) + ")");
        }
        return element(head + (int) relative);
    }

    private T element(int position) {
        return data.get(slot(position));
    }

    private int slot(int position) {
        return position & (data.size() - 1);
    }

    private void requireNonEmpty() {
        if (size == 0) {
            throw new NoSuchElementException("ring buffer is empty");
        }
    }

    private void grow() {
        List<T> larger = slots(data.size() * 2);
        for (int i = 0; i < size; i++) {
            larger.set(i, data.get(slot(head + i)));
        }
        data = larger;
        head = 0;
    }

    private static <T> List<T> slots(int capacity) {
        return new ArrayList<>(Collections.<T>nCopies(capacity, null));
    }
}

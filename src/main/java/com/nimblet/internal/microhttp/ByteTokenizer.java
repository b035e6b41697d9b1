package com.nimblet.internal.microhttp;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Growable first-in first-out byte array. Bytes are appended at the tail; tokens are consumed from the head.
 */
class ByteTokenizer {
    private byte[] array = new byte[0];
    private int position;
    private int size;

    int size() {
        return size;
    }

    int remaining() {
        return size - position;
    }

    boolean isEmpty() {
        return remaining() == 0;
    }

    void compact() {
        if (position == 0) {
            return;
        }
        array = Arrays.copyOfRange(array, position, size);
        size -= position;
        position = 0;
    }

    void add(ByteBuffer buffer) {
        int length = buffer.remaining();
        ensureCapacity(length);
        buffer.get(array, size, length);
        size += length;
    }

    void add(byte[] bytes) {
        ensureCapacity(bytes.length);
        System.arraycopy(bytes, 0, array, size, bytes.length);
        size += bytes.length;
    }

    byte[] next(int length) {
        if (remaining() < length) {
            return null;
        }
        byte[] result = Arrays.copyOfRange(array, position, position + length);
        position += length;
        return result;
    }

    byte[] next(byte[] delimiter) {
        int index = indexOf(delimiter);
        if (index < 0) {
            return null;
        }
        byte[] result = Arrays.copyOfRange(array, position, index);
        position = index + delimiter.length;
        return result;
    }

    private void ensureCapacity(int additional) {
        if (array.length - size < additional) {
            array = Arrays.copyOf(array, Math.max(size + additional, array.length * 2));
        }
    }

    private int indexOf(byte[] delimiter) {
        byte first = delimiter[0];
        int last = size - delimiter.length;
        for (int i = position; i <= last; i++) {
            if (array[i] != first) {
                continue;
            }
            if (Arrays.equals(delimiter, 0, delimiter.length, array, i, i + delimiter.length)) {
                return i;
            }
        }
        return -1;
    }
}

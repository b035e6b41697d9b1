package com.nimblet.internal.microhttp;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates byte arrays and concatenates them into one array on demand.
 */
class ByteMerger {
    private final List<byte[]> arrays = new ArrayList<>();
    private int length;

    void add(byte[] array) {
        arrays.add(array);
        length += array.length;
    }

    int length() {
        return length;
    }

    byte[] merge() {
        byte[] result = new byte[length];
        int offset = 0;
        for (byte[] array : arrays) {
            System.arraycopy(array, 0, result, offset, array.length);
            offset += array.length;
        }
        return result;
    }
}

package com.nimblet.internal.microhttp;

/**
 * Monotonic time source, replaceable in tests.
 */
interface Clock {
    long nanoTime();
}

package com.nimblet.internal.microhttp;

/**
 * A connection listener that performs no work.
 */
public final class NoopConnectionListener implements ConnectionListener {
    private static final NoopConnectionListener INSTANCE = new NoopConnectionListener();

    private NoopConnectionListener() {
    }

    public static ConnectionListener instance() {
        return INSTANCE;
    }
}

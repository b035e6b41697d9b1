package com.nimblet.internal.microhttp;

import java.net.InetSocketAddress;

/**
 * Listener for connection lifecycle events. Invoked on event loop threads; implementations must be fast and thread-safe.
 */
public interface ConnectionListener {

    /**
     * Called when a connection is accepted and registered with a connection event loop.
     *
     * @param remoteAddress best-effort remote address, or {@code null} if unavailable
     */
    default void didAcceptConnection(InetSocketAddress remoteAddress) {
        // No-op by default
    }

    /**
     * Called when a connection is refused because the connection limit was reached.
     *
     * @param remoteAddress best-effort remote address, or {@code null} if unavailable
     */
    default void didFailToAcceptConnection(InetSocketAddress remoteAddress) {
        // No-op by default
    }

    /**
     * Called exactly once when an accepted connection closes, for whatever reason.
     */
    default void didCloseConnection(InetSocketAddress remoteAddress) {
        // No-op by default
    }

    /**
     * Called when a connection is closed for sitting idle between requests longer than the idle timeout.
     */
    default void didDisconnectIdleConnection(InetSocketAddress remoteAddress) {
        // No-op by default
    }

    /**
     * Called when a connection is closed for failing to deliver a complete request within the request timeout.
     */
    default void didTimeOutRequest(InetSocketAddress remoteAddress) {
        // No-op by default
    }
}

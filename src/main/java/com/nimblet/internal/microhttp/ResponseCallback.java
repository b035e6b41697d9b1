package com.nimblet.internal.microhttp;

/**
 * Hands a finished response back to the connection that produced the request.
 * May be invoked from any thread; the write itself always happens on the connection's event loop thread.
 */
public interface ResponseCallback {

    /**
     * Queue a response for writing. Ignored if the connection has already closed.
     */
    void respond(MicrohttpResponse response);

    /**
     * Close the connection without writing a response.
     */
    void abort();

}

package com.nimblet.internal.microhttp;

/**
 * Receives parsed requests on the event loop thread. Implementations must not block;
 * they hand the request off and answer later through the callback.
 */
@FunctionalInterface
public interface MicrohttpHandler {

    void handle(MicrohttpRequest request, ResponseCallback callback);

}

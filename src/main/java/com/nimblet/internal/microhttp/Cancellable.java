package com.nimblet.internal.microhttp;

/**
 * Handle returned by {@link Scheduler} for a deferred task.
 */
interface Cancellable {

    void cancel();

}

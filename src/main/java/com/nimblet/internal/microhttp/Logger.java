package com.nimblet.internal.microhttp;

/**
 * Diagnostic sink for low-level event loop activity. Callers check {@link #enabled()} before building fields.
 */
public interface Logger {

    boolean enabled();

    void log(LogField... fields);

    void log(Exception e, LogField... fields);

}

package com.nimblet.internal.microhttp;

/**
 * A key/value pair attached to an engine diagnostic log line.
 */
public record LogField(String key, String value) {
}

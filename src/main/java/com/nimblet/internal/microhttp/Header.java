package com.nimblet.internal.microhttp;

/**
 * A single HTTP header line. Duplicate names are represented as separate instances.
 */
public record Header(String name, String value) {
}

package com.nimblet.internal.microhttp;

import java.io.Closeable;
import java.io.IOException;

final class CloseUtils {
    private CloseUtils() {
    }

    // Close failures on teardown paths are reported through the loop logger rather than propagated.
    static void closeQuietly(Closeable closeable, Logger logger) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (IOException e) {
            if (logger.enabled()) {
                logger.log(e, new LogField("event", "close_error"));
            }
        }
    }
}

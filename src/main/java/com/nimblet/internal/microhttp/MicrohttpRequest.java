package com.nimblet.internal.microhttp;

import java.net.InetSocketAddress;
import java.util.List;

/**
 * A fully parsed HTTP request as read off the wire.
 */
public record MicrohttpRequest(
        String method,
        String uri,
        String version,
        List<Header> headers,
        byte[] body,
        InetSocketAddress remoteAddress) {

    public String header(String name) {
        for (Header header : headers) {
            if (header.name().equalsIgnoreCase(name)) {
                return header.value();
            }
        }
        return null;
    }
}

package com.nimblet.internal.microhttp;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public record MicrohttpResponse(
        int status,
        String reason,
        List<Header> headers,
        byte[] body) {

    static final byte[] COLON_SPACE = ": ".getBytes(StandardCharsets.US_ASCII);
    static final byte[] SPACE = " ".getBytes(StandardCharsets.US_ASCII);
    static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    public static MicrohttpResponse plainText(int status, String reason, List<Header> headers, String text) {
        List<Header> allHeaders = new ArrayList<>(headers.size() + 1);
        allHeaders.addAll(headers);
        allHeaders.add(new Header("Content-Type", "text/plain; charset=UTF-8"));
        return new MicrohttpResponse(status, reason, List.copyOf(allHeaders), text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Copy of this response that tells the client the connection will close, unless a Connection header is already set.
     */
    public MicrohttpResponse withConnectionClose() {
        if (hasHeader("Connection")) {
            return this;
        }
        List<Header> closingHeaders = new ArrayList<>(headers);
        closingHeaders.add(new Header("Connection", "close"));
        return new MicrohttpResponse(status, reason, closingHeaders, body);
    }

    public boolean hasHeader(String name) {
        for (Header header : headers) {
            if (header.name().equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }

    byte[] serialize(String version, List<Header> connectionHeaders) {
        ByteMerger merger = new ByteMerger();
        merger.add(version.getBytes(StandardCharsets.US_ASCII));
        merger.add(SPACE);
        merger.add(Integer.toString(status).getBytes(StandardCharsets.US_ASCII));
        merger.add(SPACE);
        merger.add(reason.getBytes(StandardCharsets.ISO_8859_1));
        merger.add(CRLF);
        appendHeaders(merger, connectionHeaders);
        appendHeaders(merger, headers);
        merger.add(CRLF);
        merger.add(body);
        return merger.merge();
    }

    private static void appendHeaders(ByteMerger merger, List<Header> headers) {
        for (Header header : headers) {
            merger.add(header.name().getBytes(StandardCharsets.US_ASCII));
            merger.add(COLON_SPACE);
            merger.add(header.value().getBytes(StandardCharsets.ISO_8859_1));
            merger.add(CRLF);
        }
    }
}

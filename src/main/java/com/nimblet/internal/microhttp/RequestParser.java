package com.nimblet.internal.microhttp;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Incremental HTTP/1.x request parser. Call {@link #parse()} whenever more bytes arrive;
 * it returns {@code true} once a full request (including any body) is available.
 */
class RequestParser {

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] SPACE = " ".getBytes(StandardCharsets.US_ASCII);

    private static final String HEADER_CONTENT_LENGTH = "Content-Length";
    private static final String HEADER_TRANSFER_ENCODING = "Transfer-Encoding";
    private static final String CHUNKED = "chunked";
    private static final byte[] EMPTY_BODY = new byte[0];

    enum State {
        METHOD(p -> p.tokenizer.next(SPACE), RequestParser::parseMethod),
        URI(p -> p.tokenizer.next(SPACE), RequestParser::parseUri),
        VERSION(p -> p.tokenizer.next(CRLF), RequestParser::parseVersion),
        HEADER(p -> p.tokenizer.next(CRLF), RequestParser::parseHeader),
        BODY(p -> p.tokenizer.next(p.contentLength), RequestParser::parseBody),
        CHUNK_SIZE(p -> p.tokenizer.next(CRLF), RequestParser::parseChunkSize),
        CHUNK_DATA(p -> p.tokenizer.next(p.chunkSize), RequestParser::parseChunkData),
        CHUNK_DATA_END(p -> p.tokenizer.next(CRLF), RequestParser::parseChunkDataEnd),
        CHUNK_TRAILER(p -> p.tokenizer.next(CRLF), RequestParser::parseChunkTrailer),
        DONE(null, null);

        final Function<RequestParser, byte[]> tokenSupplier;
        final BiConsumer<RequestParser, byte[]> tokenConsumer;

        State(Function<RequestParser, byte[]> tokenSupplier, BiConsumer<RequestParser, byte[]> tokenConsumer) {
            this.tokenSupplier = tokenSupplier;
            this.tokenConsumer = tokenConsumer;
        }
    }

    private final ByteTokenizer tokenizer;
    private final InetSocketAddress remoteAddress;

    private State state = State.METHOD;
    private int contentLength;
    private int chunkSize;
    private final ByteMerger chunks = new ByteMerger();

    private String method;
    private String uri;
    private String version;
    private final List<Header> headers = new ArrayList<>();
    private byte[] body;

    RequestParser(ByteTokenizer tokenizer, InetSocketAddress remoteAddress) {
        this.tokenizer = tokenizer;
        this.remoteAddress = remoteAddress;
    }

    boolean parse() {
        while (state != State.DONE) {
            byte[] token = state.tokenSupplier.apply(this);
            if (token == null) {
                return false;
            }
            state.tokenConsumer.accept(this, token);
        }
        return true;
    }

    MicrohttpRequest request() {
        return new MicrohttpRequest(method, uri, version, List.copyOf(headers), body, remoteAddress);
    }

    private void parseMethod(byte[] token) {
        method = ascii(token, "method");
        if (method.isEmpty()) {
            throw new MalformedRequestException("empty method");
        }
        state = State.URI;
    }

    private void parseUri(byte[] token) {
        uri = ascii(token, "uri");
        if (uri.isEmpty()) {
            throw new MalformedRequestException("empty uri");
        }
        state = State.VERSION;
    }

    private void parseVersion(byte[] token) {
        version = ascii(token, "version");
        if (!version.startsWith("HTTP/1.")) {
            throw new MalformedRequestException("unsupported version");
        }
        state = State.HEADER;
    }

    private void parseHeader(byte[] token) {
        if (token.length > 0) {
            headers.add(parseHeaderLine(token));
            return;
        }

        // blank line, end of headers
        Integer declaredLength = findContentLength();
        List<String> transferEncodings = findTransferEncodings();
        boolean hasTransferEncoding = hasHeader(HEADER_TRANSFER_ENCODING);

        if (hasTransferEncoding && declaredLength != null) {
            throw new MalformedRequestException("multiple message lengths");
        }

        if (hasTransferEncoding) {
            if (transferEncodings.size() != 1 || !CHUNKED.equals(transferEncodings.get(0))) {
                throw new MalformedRequestException("unsupported transfer-encoding");
            }
            state = State.CHUNK_SIZE;
        } else if (declaredLength != null) {
            contentLength = declaredLength;
            state = State.BODY;
        } else {
            body = EMPTY_BODY;
            state = State.DONE;
        }
    }

    private static Header parseHeaderLine(byte[] line) {
        int colon = -1;
        for (int i = 0; i < line.length; i++) {
            if (line[i] == ':') {
                colon = i;
                break;
            }
            if ((line[i] & 0x80) != 0) {
                throw new MalformedRequestException("non-ascii header name");
            }
        }
        if (colon <= 0) {
            throw new MalformedRequestException("malformed header line");
        }
        int valueStart = colon + 1;
        while (valueStart < line.length && (line[valueStart] == ' ' || line[valueStart] == '\t')) {
            valueStart++;
        }
        int valueEnd = line.length;
        while (valueEnd > valueStart && (line[valueEnd - 1] == ' ' || line[valueEnd - 1] == '\t')) {
            valueEnd--;
        }
        return new Header(
                new String(line, 0, colon, StandardCharsets.US_ASCII),
                new String(line, valueStart, valueEnd - valueStart, StandardCharsets.ISO_8859_1));
    }

    private static String ascii(byte[] token, String field) {
        for (byte b : token) {
            if ((b & 0x80) != 0) {
                throw new MalformedRequestException("non-ascii " + field);
            }
        }
        return new String(token, StandardCharsets.US_ASCII);
    }

    private void parseChunkSize(byte[] token) {
        String line = new String(token, StandardCharsets.US_ASCII);
        int semicolon = line.indexOf(';');
        String size = (semicolon < 0 ? line : line.substring(0, semicolon)).trim();
        try {
            chunkSize = Integer.parseInt(size, 16);
        } catch (NumberFormatException e) {
            throw new MalformedRequestException("invalid chunk size");
        }
        if (chunkSize < 0) {
            throw new MalformedRequestException("invalid chunk size");
        }
        state = chunkSize == 0 ? State.CHUNK_TRAILER : State.CHUNK_DATA;
    }

    private void parseChunkData(byte[] token) {
        chunks.add(token);
        state = State.CHUNK_DATA_END;
    }

    private void parseChunkDataEnd(byte[] token) {
        if (token.length != 0) {
            throw new MalformedRequestException("missing chunk terminator");
        }
        state = State.CHUNK_SIZE;
    }

    private void parseChunkTrailer(byte[] token) {
        if (token.length == 0) {
            body = chunks.merge();
            state = State.DONE;
        }
    }

    private void parseBody(byte[] token) {
        body = token;
        state = State.DONE;
    }

    private Integer findContentLength() {
        Integer result = null;
        for (Header header : headers) {
            if (!header.name().equalsIgnoreCase(HEADER_CONTENT_LENGTH)) {
                continue;
            }
            if (result != null) {
                throw new MalformedRequestException("multiple content-length headers");
            }
            try {
                result = Integer.parseInt(header.value().trim());
            } catch (NumberFormatException e) {
                throw new MalformedRequestException("invalid content-length header value");
            }
            if (result < 0) {
                throw new MalformedRequestException("invalid content-length header value");
            }
        }
        return result;
    }

    private boolean hasHeader(String name) {
        for (Header header : headers) {
            if (header.name().equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }

    private List<String> findTransferEncodings() {
        List<String> encodings = new ArrayList<>();
        for (Header header : headers) {
            if (!header.name().equalsIgnoreCase(HEADER_TRANSFER_ENCODING)) {
                continue;
            }
            for (String part : header.value().split(",")) {
                int semicolon = part.indexOf(';');
                String encoding = (semicolon < 0 ? part : part.substring(0, semicolon)).trim();
                if (!encoding.isEmpty()) {
                    encodings.add(encoding.toLowerCase(Locale.ROOT));
                }
            }
        }
        return encodings;
    }
}

package com.nimblet.internal.microhttp;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

public class RequestParserTest {

    @Test
    public void requestWithoutBody() {
        ByteTokenizer tokenizer = new ByteTokenizer();
        RequestParser parser = new RequestParser(tokenizer, null);

        tokenizer.add(bytes("GET /echo?a=1 HTTP/1.1\r\nHost: localhost\r\nUser-Agent:  curl/8 \r\n\r\n"));

        Assertions.assertTrue(parser.parse());
        MicrohttpRequest request = parser.request();
        Assertions.assertEquals("GET", request.method());
        Assertions.assertEquals("/echo?a=1", request.uri());
        Assertions.assertEquals("HTTP/1.1", request.version());
        Assertions.assertEquals("curl/8", request.header("user-agent"));
        Assertions.assertNull(request.header("Referer"));
        Assertions.assertEquals(0, request.body().length);
    }

    @Test
    public void requestArrivingInPieces() {
        ByteTokenizer tokenizer = new ByteTokenizer();
        RequestParser parser = new RequestParser(tokenizer, null);

        tokenizer.add(bytes("POST /submit HTTP/1.1\r\nContent-"));
        Assertions.assertFalse(parser.parse());

        tokenizer.add(bytes("Length: 5\r\n\r\nhel"));
        Assertions.assertFalse(parser.parse());

        tokenizer.add(bytes("lo"));
        Assertions.assertTrue(parser.parse());
        Assertions.assertEquals("hello", new String(parser.request().body(), StandardCharsets.US_ASCII));
    }

    @Test
    public void chunkedBodyIsMerged() {
        ByteTokenizer tokenizer = new ByteTokenizer();
        RequestParser parser = new RequestParser(tokenizer, null);

        tokenizer.add(bytes("POST / HTTP/1.1\r\nTransfer-Encoding: chunked\r\n\r\n3\r\nabc\r\n2;ext=1\r\nde\r\n0\r\n\r\n"));

        Assertions.assertTrue(parser.parse());
        Assertions.assertEquals("abcde", new String(parser.request().body(), StandardCharsets.US_ASCII));
    }

    @Test
    public void malformedRequestsAreRejected() {
        for (String raw : List.of(
                "GET / SPDY/3\r\n\r\n",
                "GET / HTTP/1.1\r\nno-colon-here\r\n\r\n",
                "POST / HTTP/1.1\r\nContent-Length: 3\r\nTransfer-Encoding: chunked\r\n\r\n",
                "POST / HTTP/1.1\r\nTransfer-Encoding: gzip\r\n\r\n")) {
            ByteTokenizer tokenizer = new ByteTokenizer();
            RequestParser parser = new RequestParser(tokenizer, null);
            tokenizer.add(bytes(raw));

            Assertions.assertThrows(MalformedRequestException.class, parser::parse, raw);
        }
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.ISO_8859_1);
    }
}

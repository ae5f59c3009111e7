package com.hostscout.core.http;

import javax.net.ssl.SSLSession;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Optional;

/**
 * 응답 본문을 스트림으로 받아 maxBytes 까지만 읽는다.
 * 스트림을 닫으면 HttpClient 는 나머지 수신을 취소하므로 메모리에는 상한만큼만 올라온다.
 */
public final class BoundedBody {

    private BoundedBody() {}

    public static byte[] read(InputStream in, int maxBytes) throws IOException {
        if (in == null) return new byte[0];
        try (InputStream s = in) {
            return s.readNBytes(Math.max(0, maxBytes));
        }
    }

    /** 스트림 응답 → 본문이 잘린 byte[] 응답 */
    static HttpResponse<byte[]> toBytes(HttpResponse<InputStream> resp, int maxBytes) throws IOException {
        return new Capped(resp, read(resp.body(), maxBytes));
    }

    private static final class Capped implements HttpResponse<byte[]> {
        private final HttpResponse<InputStream> delegate;
        private final byte[] body;

        Capped(HttpResponse<InputStream> delegate, byte[] body) {
            this.delegate = delegate;
            this.body = body;
        }

        @Override public int statusCode() { return delegate.statusCode(); }
        @Override public HttpRequest request() { return delegate.request(); }
        @Override public Optional<HttpResponse<byte[]>> previousResponse() { return Optional.empty(); }
        @Override public HttpHeaders headers() { return delegate.headers(); }
        @Override public byte[] body() { return body; }
        @Override public Optional<SSLSession> sslSession() { return delegate.sslSession(); }
        @Override public URI uri() { return delegate.uri(); }
        @Override public HttpClient.Version version() { return delegate.version(); }
    }
}

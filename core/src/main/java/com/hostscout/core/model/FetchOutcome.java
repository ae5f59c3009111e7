package com.hostscout.core.model;

import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/** fetch 결과 캡처. 시도마다 하나씩 만들어지고 fetcher는 마지막 것을 돌려준다. */
public final class FetchOutcome {
    private final FetchStatus status;
    private final int httpCode;           // 응답이 없으면 -1
    private final byte[] body;            // SUCCESS 일 때만 non-null
    private final URI requestUri;
    private final URI finalUri;
    private final Map<String, List<String>> headers;
    private final String contentType;
    private final int attempts;
    private final long elapsedMs;

    private FetchOutcome(Builder b) {
        this.status = b.status;
        this.httpCode = b.httpCode;
        this.body = b.body;
        this.requestUri = b.requestUri;
        this.finalUri = (b.finalUri == null) ? b.requestUri : b.finalUri;
        this.headers = (b.headers == null) ? Map.of() : Collections.unmodifiableMap(b.headers);
        this.contentType = b.contentType;
        this.attempts = Math.max(1, b.attempts);
        this.elapsedMs = b.elapsedMs;
    }

    public FetchStatus getStatus() { return status; }
    public boolean isSuccess() { return status == FetchStatus.SUCCESS; }
    public OptionalInt getHttpCode() { return httpCode < 0 ? OptionalInt.empty() : OptionalInt.of(httpCode); }
    public Optional<byte[]> getBody() { return Optional.ofNullable(body); }
    public URI getRequestUri() { return requestUri; }
    public URI getFinalUri() { return finalUri; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public String getContentType() { return contentType; }
    public int getAttempts() { return attempts; }
    public long getElapsedMs() { return elapsedMs; }

    /** 본문을 텍스트로. Content-Type charset 우선, 없으면 UTF-8 */
    public String bodyText() {
        if (body == null) return "";
        return new String(body, charsetOf(contentType));
    }

    /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        if (name == null) return null;
        for (var e : headers.entrySet()) {
            String k = e.getKey();
            if (k != null && k.equalsIgnoreCase(name)) {
                List<String> vs = e.getValue();
                return (vs == null || vs.isEmpty()) ? null : vs.get(0);
            }
        }
        return null;
    }

    /** 시도 횟수만 바꾼 사본 */
    public FetchOutcome withAttempts(int n) {
        return toBuilder().attempts(n).build();
    }

    static Charset charsetOf(String contentType) {
        if (contentType == null) return StandardCharsets.UTF_8;
        for (String part : contentType.split(";")) {
            String p = part.trim();
            if (p.regionMatches(true, 0, "charset=", 0, 8)) {
                String cs = p.substring(8).replace("\"", "").trim();
                try {
                    return Charset.forName(cs);
                } catch (RuntimeException e) {
                    return StandardCharsets.UTF_8;
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    @Override public String toString() {
        return "FetchOutcome{" + status + ", code=" + httpCode + ", uri=" + finalUri + ", attempts=" + attempts + "}";
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() {
        return new Builder()
                .status(status).httpCode(httpCode).body(body)
                .requestUri(requestUri).finalUri(finalUri)
                .headers(headers).contentType(contentType)
                .attempts(attempts).elapsedMs(elapsedMs);
    }

    public static final class Builder {
        private FetchStatus status;
        private int httpCode = -1;
        private byte[] body;
        private URI requestUri;
        private URI finalUri;
        private Map<String, List<String>> headers;
        private String contentType;
        private int attempts = 1;
        private long elapsedMs;

        public Builder status(FetchStatus status) { this.status = status; return this; }
        public Builder httpCode(int httpCode) { this.httpCode = httpCode; return this; }
        public Builder body(byte[] body) { this.body = body; return this; }
        public Builder requestUri(URI requestUri) { this.requestUri = requestUri; return this; }
        public Builder finalUri(URI finalUri) { this.finalUri = finalUri; return this; }
        public Builder headers(Map<String, List<String>> headers) { this.headers = headers; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder attempts(int attempts) { this.attempts = attempts; return this; }
        public Builder elapsedMs(long elapsedMs) { this.elapsedMs = elapsedMs; return this; }

        public FetchOutcome build() {
            Objects.requireNonNull(status, "status");
            Objects.requireNonNull(requestUri, "requestUri");
            // SUCCESS 가 아니면 본문은 버린다
            if (status != FetchStatus.SUCCESS) body = null;
            else if (body == null) body = new byte[0];
            return new FetchOutcome(this);
        }
    }
}

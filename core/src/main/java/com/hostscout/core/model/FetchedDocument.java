package com.hostscout.core.model;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;

/**
 * 성공한 fetch 결과의 텍스트 뷰.
 * jsoup Document 는 처음 요청될 때 한 번만 파싱되어 추출 전략들과 소스 프로바이더가 공유한다.
 * 한 워커 스레드 안에서만 쓰인다.
 */
public final class FetchedDocument {
    private final URI uri;
    private final String body;
    private final String contentType;
    private Document dom;

    public FetchedDocument(URI uri, String body, String contentType) {
        this.uri = Objects.requireNonNull(uri, "uri");
        this.body = (body == null) ? "" : body;
        this.contentType = contentType;
    }

    public static FetchedDocument of(FetchOutcome outcome) {
        return new FetchedDocument(outcome.getFinalUri(), outcome.bodyText(), outcome.getContentType());
    }

    public URI uri() { return uri; }
    public String body() { return body; }
    public String contentType() { return contentType; }

    public Document dom() {
        if (dom == null) {
            dom = Jsoup.parse(body, uri.toString());
        }
        return dom;
    }

    /** Content-Type 이 JSON 이거나 본문이 JSON 객체/배열처럼 보이면 true */
    public boolean looksLikeJson() {
        if (contentType != null && contentType.toLowerCase(Locale.ROOT).contains("json")) return true;
        String t = body.stripLeading();
        return t.startsWith("{") || t.startsWith("[");
    }
}

package com.hostscout.core.crawler;

import com.hostscout.core.api.IFetcher;
import com.hostscout.core.http.FetchListener;
import com.hostscout.core.model.FetchOutcome;
import com.hostscout.core.model.FetchStatus;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;

/** URL → 고정 응답. 등록되지 않은 URL 은 404(CLIENT_ERROR) */
public final class MapFetcher implements IFetcher {

    private final Map<String, FetchOutcome> pages = new ConcurrentHashMap<>();
    public final List<URI> requested = new CopyOnWriteArrayList<>();
    private volatile FetchListener listener = FetchListener.NONE;
    private volatile Runnable onFetch = () -> {};

    public MapFetcher html(String url, String body) {
        URI u = URI.create(url);
        pages.put(url, FetchOutcome.builder()
                .status(FetchStatus.SUCCESS).httpCode(200)
                .requestUri(u).contentType("text/html; charset=utf-8")
                .body(body.getBytes(StandardCharsets.UTF_8))
                .build());
        return this;
    }

    public MapFetcher status(String url, FetchStatus status, int code) {
        pages.put(url, FetchOutcome.builder().status(status).httpCode(code).requestUri(URI.create(url)).build());
        return this;
    }

    /** 매 fetch 직전에 실행할 훅(취소 테스트용) */
    public MapFetcher onFetch(Runnable r) {
        this.onFetch = r;
        return this;
    }

    public boolean wasRequested(String url) {
        return requested.contains(URI.create(url));
    }

    @Override
    public void bind(FetchListener listener, BooleanSupplier stopRequested) {
        this.listener = (listener != null) ? listener : FetchListener.NONE;
    }

    @Override
    public FetchOutcome fetch(URI uri, int attemptBudget) {
        requested.add(uri);
        onFetch.run();
        FetchOutcome out = pages.get(uri.toString());
        if (out == null) {
            out = FetchOutcome.builder().status(FetchStatus.CLIENT_ERROR).httpCode(404).requestUri(uri).build();
        }
        listener.onAttempt(uri, out);
        return out;
    }
}

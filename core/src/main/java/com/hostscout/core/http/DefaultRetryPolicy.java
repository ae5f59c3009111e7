package com.hostscout.core.http;

import com.hostscout.core.model.FetchStatus;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * RATE_LIMITED: 지수 대기 base × 2^attempt (1000ms → 2000ms …, base 500 기준)
 * SERVER_ERROR / NETWORK_ERROR / TIMEOUT: 선형 대기 base × attempt (500ms → 1000ms …)
 * BLOCKED / CLIENT_ERROR: 재시도 없음
 * 지연에는 ±jitter 비율의 흔들림이 붙는다(기본 10%).
 */
public final class DefaultRetryPolicy implements RetryPolicy {
    private final long baseMillis;
    private final double jitter;

    public DefaultRetryPolicy() { this(500, 0.1); }
    public DefaultRetryPolicy(long baseMillis) { this(baseMillis, 0.1); }
    public DefaultRetryPolicy(long baseMillis, double jitter) {
        this.baseMillis = Math.max(0, baseMillis);
        this.jitter = Math.max(0.0, Math.min(0.5, jitter));
    }

    @Override public boolean shouldRetry(FetchStatus status) {
        return status != null && status.isRetryable();
    }

    @Override public Duration nextDelay(FetchStatus status, int attempt) {
        int n = Math.max(1, attempt);
        long raw = (status == FetchStatus.RATE_LIMITED)
                ? baseMillis * (1L << Math.min(n, 20))
                : baseMillis * n;
        if (jitter == 0.0 || raw == 0) return Duration.ofMillis(raw);
        double f = (1.0 - jitter) + ThreadLocalRandom.current().nextDouble(2 * jitter);
        return Duration.ofMillis((long) (raw * f));
    }
}

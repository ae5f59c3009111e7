package com.hostscout.core.util;

import java.util.function.LongSupplier;

/**
 * 전역 요청 슬롯 토큰 버킷.
 * fetch 시도(재시도 포함) 하나가 토큰 하나를 소비한다.
 */
public final class RateLimiter {
    private final long capacity;
    private final double refillPerSecond;
    private final LongSupplier nanoClock;
    private double tokens;
    private long lastNs;

    public RateLimiter(long capacity, long refillPerSecond) {
        this(capacity, refillPerSecond, System::nanoTime);
    }

    RateLimiter(long capacity, long refillPerSecond, LongSupplier nanoClock) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
        if (refillPerSecond < 1) throw new IllegalArgumentException("refillPerSecond must be >= 1");
        this.capacity = capacity;
        this.refillPerSecond = refillPerSecond;
        this.nanoClock = nanoClock;
        this.tokens = capacity;
        this.lastNs = nanoClock.getAsLong();
    }

    /** 초당 rps 개, 버스트 rps 개 */
    public static RateLimiter perSecond(int rps) {
        return new RateLimiter(Math.max(1, rps), Math.max(1, rps));
    }

    public synchronized void acquire() throws InterruptedException {
        for (;;) {
            refill();
            if (tokens >= 1.0) { tokens -= 1.0; return; }
            this.wait(5);
        }
    }

    /** 대기 없이 시도. 토큰이 없으면 false */
    public synchronized boolean tryAcquire() {
        refill();
        if (tokens >= 1.0) { tokens -= 1.0; return true; }
        return false;
    }

    synchronized double availableTokens() {
        refill();
        return tokens;
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        double add = (now - lastNs) / 1_000_000_000.0 * refillPerSecond;
        if (add > 0) {
            tokens = Math.min(capacity, tokens + add);
            lastNs = now;
        }
    }
}

package com.hostscout.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 런타임 텔레메트리 누적기 (스레드 세이프). */
public final class CrawlStats {
    private final AtomicLong attemptsTotal = new AtomicLong(0);   // HTTP 시도(재시도 포함) = 요청 슬롯 소비량
    private final AtomicLong retriesTotal  = new AtomicLong(0);
    private final AtomicLong sumAttemptMs  = new AtomicLong(0);
    private final AtomicLong processed     = new AtomicLong(0);   // 처리 완료된 프런티어 아이템
    private final AtomicLong blocked       = new AtomicLong(0);
    private final AtomicLong failed        = new AtomicLong(0);
    private final AtomicLong disallowed    = new AtomicLong(0);   // robots / 호스트 차단
    private final AtomicLong overflowDropped = new AtomicLong(0);
    private final AtomicLong newEntities   = new AtomicLong(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    public void addAttempt(long elapsedMs) {
        attemptsTotal.incrementAndGet();
        sumAttemptMs.addAndGet(Math.max(0, elapsedMs));
    }
    public void addRetry() { retriesTotal.incrementAndGet(); }
    public void incProcessed() { processed.incrementAndGet(); }
    public void incBlocked() { blocked.incrementAndGet(); }
    public void incFailed() { failed.incrementAndGet(); }
    public void incDisallowed() { disallowed.incrementAndGet(); }
    public void incOverflow() { overflowDropped.incrementAndGet(); }
    public void addNewEntities(long n) { newEntities.addAndGet(n); }

    /** 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        long attempts = attemptsTotal.get();
        long avg = sumAttemptMs.get() / Math.max(1, attempts);
        return new Snapshot(attempts, retriesTotal.get(), processed.get(), blocked.get(), failed.get(),
                disallowed.get(), overflowDropped.get(), newEntities.get(), maxObservedConcurrency.get(), avg);
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long attemptsTotal;
        public final long retriesTotal;
        public final long processed;
        public final long blocked;
        public final long failed;
        public final long disallowed;
        public final long overflowDropped;
        public final long newEntities;
        public final int  maxObservedConcurrency;
        public final long avgAttemptMs;

        public Snapshot(long attemptsTotal, long retriesTotal, long processed, long blocked, long failed,
                        long disallowed, long overflowDropped, long newEntities, int maxObservedConcurrency,
                        long avgAttemptMs) {
            this.attemptsTotal = attemptsTotal;
            this.retriesTotal = retriesTotal;
            this.processed = processed;
            this.blocked = blocked;
            this.failed = failed;
            this.disallowed = disallowed;
            this.overflowDropped = overflowDropped;
            this.newEntities = newEntities;
            this.maxObservedConcurrency = maxObservedConcurrency;
            this.avgAttemptMs = avgAttemptMs;
        }

        @Override public String toString() {
            return "attempts=" + attemptsTotal + ", retries=" + retriesTotal + ", processed=" + processed
                    + ", blocked=" + blocked + ", failed=" + failed + ", disallowed=" + disallowed
                    + ", overflow=" + overflowDropped + ", newEntities=" + newEntities
                    + ", maxCC=" + maxObservedConcurrency + ", avgAttemptMs=" + avgAttemptMs;
        }
    }
}

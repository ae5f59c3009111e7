package com.hostscout.core.model;

import com.hostscout.core.dedupe.DedupStore;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/** 크롤 1회 결과 요약 */
public final class CrawlReport {
    private final RunState state;
    private final DedupStore entities;
    private final Map<String, DedupStore> perSource;
    private final CrawlStats.Snapshot stats;
    private final Instant startedAt;
    private final Instant finishedAt;

    public CrawlReport(RunState state, DedupStore entities, Map<String, DedupStore> perSource,
                       CrawlStats.Snapshot stats, Instant startedAt, Instant finishedAt) {
        this.state = Objects.requireNonNull(state, "state");
        this.entities = Objects.requireNonNull(entities, "entities");
        this.perSource = (perSource == null) ? Map.of() : Map.copyOf(perSource);
        this.stats = Objects.requireNonNull(stats, "stats");
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    public RunState getState() { return state; }
    /** 모든 소스 스토어의 병합 결과 */
    public DedupStore getEntities() { return entities; }
    public Map<String, DedupStore> getPerSource() { return perSource; }
    public CrawlStats.Snapshot getStats() { return stats; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }

    public Duration elapsed() {
        if (startedAt == null || finishedAt == null) return Duration.ZERO;
        return Duration.between(startedAt, finishedAt);
    }
}

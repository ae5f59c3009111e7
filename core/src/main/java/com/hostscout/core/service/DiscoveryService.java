package com.hostscout.core.service;

import com.hostscout.core.api.IFetcher;
import com.hostscout.core.api.ISourceProvider;
import com.hostscout.core.api.IVerifier;
import com.hostscout.core.crawler.CrawlCoordinator;
import com.hostscout.core.crawler.politeness.PolitenessClock;
import com.hostscout.core.crawler.politeness.PolitenessGate;
import com.hostscout.core.crawler.robots.HttpRobotsFetcher;
import com.hostscout.core.crawler.robots.RobotsRepository;
import com.hostscout.core.dedupe.DedupStore;
import com.hostscout.core.http.HttpFetcher;
import com.hostscout.core.http.RequestIdentity;
import com.hostscout.core.model.CanonicalEntity;
import com.hostscout.core.model.CrawlConfig;
import com.hostscout.core.model.CrawlReport;
import com.hostscout.core.service.export.JsonEntitySink;
import com.hostscout.core.service.export.SinkCoordinator;
import com.hostscout.core.sources.SourceProviders;
import com.hostscout.core.util.DefaultSleeper;
import com.hostscout.core.util.ProgressListener;
import com.hostscout.core.util.Sleeper;
import com.hostscout.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 한 번의 발견 실행 전체:
 *  1) CrawlCoordinator 로 모든 소스 크롤
 *  2) (선택) IVerifier 로 최종 집합 필터(워커 수 = concurrency)
 *  3) output.mergeExisting 이면 이전 JSON 산출물과 병합
 *  4) 모든 싱크 기록
 */
public final class DiscoveryService {

    private static final Logger LOG = LoggerFactory.getLogger(DiscoveryService.class);
    private static final StructuredLog SLOG = StructuredLog.get(DiscoveryService.class);

    /** 실행 결과: 크롤 리포트 + 실제로 기록한 최종 집합 */
    public record Result(CrawlReport report, DedupStore exported, int verifiedOut, int mergedFromPrevious) {}

    private final CrawlConfig config;
    private final IFetcher fetcher;
    private final PolitenessGate gate;
    private final List<ISourceProvider> providers;
    private final IVerifier verifier;          // null 이면 검증 생략
    private final SinkCoordinator sinks;
    private final Sleeper sleeper;

    private volatile CrawlCoordinator current;

    public DiscoveryService(CrawlConfig config, IFetcher fetcher, PolitenessGate gate,
                            List<ISourceProvider> providers, IVerifier verifier,
                            SinkCoordinator sinks, Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.gate = Objects.requireNonNull(gate, "gate");
        this.providers = List.copyOf(providers);
        this.verifier = verifier;
        this.sinks = Objects.requireNonNull(sinks, "sinks");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /** 프로덕션 조립: HttpFetcher + robots(HttpClient) + 설정의 소스/싱크 */
    public static DiscoveryService fromConfig(CrawlConfig cfg, IVerifier verifier) {
        cfg.validate();
        RequestIdentity identity = RequestIdentity.fromConfig(cfg);
        RobotsRepository robots = new RobotsRepository(
                new HttpRobotsFetcher(identity, cfg.getTimeout()), identity.robotsToken());
        PolitenessGate gate = new PolitenessGate(cfg.politeness(), robots, PolitenessClock.SYSTEM);
        return new DiscoveryService(cfg, new HttpFetcher(cfg), gate, SourceProviders.fromConfig(cfg),
                cfg.isVerify() ? verifier : null, SinkCoordinator.fromConfig(cfg.output()), DefaultSleeper.INSTANCE);
    }

    public Result run(ProgressListener listener) throws IOException, InterruptedException {
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;

        // 1) 크롤
        CrawlCoordinator coord = new CrawlCoordinator(config, fetcher, gate, sleeper);
        this.current = coord;
        CrawlReport report;
        try {
            report = coord.run(providers, pl);
        } finally {
            this.current = null;
        }
        DedupStore found = report.getEntities();

        // 2) 검증
        int verifiedOut = 0;
        if (verifier != null && !found.isEmpty()) {
            DedupStore kept = verify(found, pl);
            verifiedOut = found.size() - kept.size();
            found = kept;
        }

        // 3) 이전 결과 병합
        int fromPrevious = 0;
        if (config.output().isMergeExisting()) {
            DedupStore previous = JsonEntitySink.load(config.output().jsonPath());
            DedupStore merged = previous.merge(found);
            fromPrevious = merged.size() - found.size();
            LOG.info("Merged with previous results: previous={}, current={}, total={}",
                    previous.size(), found.size(), merged.size());
            found = merged;
        }

        // 4) 싱크
        pl.onProgress(0.0, "export", 0, found.size());
        sinks.writeAll(found.entitySet());
        pl.onProgress(1.0, "export", found.size(), found.size());

        SLOG.info("discovery-done",
                "state", report.getState().name(),
                "found", report.getEntities().size(),
                "verifiedOut", verifiedOut,
                "mergedFromPrevious", fromPrevious,
                "exported", found.size(),
                "elapsedMs", report.elapsed().toMillis());
        return new Result(report, found, verifiedOut, fromPrevious);
    }

    /** 진행 중인 크롤 취소(없으면 무시) */
    public void cancel() {
        CrawlCoordinator c = current;
        if (c != null) c.cancel();
    }

    private DedupStore verify(DedupStore found, ProgressListener pl) throws InterruptedException {
        List<CanonicalEntity> all = found.entities();
        int cc = Math.min(config.getConcurrency(), all.size());
        LOG.info("Verifying {} entities with {} worker(s)", all.size(), cc);

        AtomicInteger seq = new AtomicInteger(1);
        ExecutorService exec = Executors.newFixedThreadPool(cc, r -> {
            Thread t = new Thread(r, "verify-worker-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        DedupStore kept = new DedupStore();
        AtomicInteger done = new AtomicInteger();
        try {
            List<Future<?>> futures = new ArrayList<>(all.size());
            for (CanonicalEntity e : all) {
                futures.add(exec.submit(() -> {
                    try {
                        if (verifier.verify(e)) kept.insert(e);
                        else LOG.debug("Not verified: {}", e.key());
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                    } catch (RuntimeException ex) {
                        LOG.warn("Verification failed for {}: {}", e.key(), ex.toString());
                    } finally {
                        int n = done.incrementAndGet();
                        pl.onProgress((double) n / all.size(), "verify", n, all.size());
                    }
                }));
            }
            for (Future<?> f : futures) {
                try {
                    f.get();
                } catch (ExecutionException ex) {
                    LOG.warn("Verify task died: {}", String.valueOf(ex.getCause()));
                }
            }
        } finally {
            exec.shutdownNow();
            exec.awaitTermination(30, TimeUnit.SECONDS);
        }
        LOG.info("Verification kept {}/{} entities", kept.size(), all.size());
        return kept;
    }
}

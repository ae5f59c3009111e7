package com.hostscout.core.crawler;

import com.hostscout.core.api.IFetcher;
import com.hostscout.core.api.ISourceProvider;
import com.hostscout.core.crawler.politeness.PolitenessGate;
import com.hostscout.core.dedupe.DedupStore;
import com.hostscout.core.extract.CandidateExtractor;
import com.hostscout.core.extract.Canonicalizer;
import com.hostscout.core.extract.FingerprintRules;
import com.hostscout.core.http.FetchListener;
import com.hostscout.core.model.CandidateMatch;
import com.hostscout.core.model.CanonicalEntity;
import com.hostscout.core.model.CrawlConfig;
import com.hostscout.core.model.CrawlReport;
import com.hostscout.core.model.CrawlStats;
import com.hostscout.core.model.FetchOutcome;
import com.hostscout.core.model.FetchStatus;
import com.hostscout.core.model.FetchedDocument;
import com.hostscout.core.model.FrontierItem;
import com.hostscout.core.model.RunState;
import com.hostscout.core.util.ProgressListener;
import com.hostscout.core.util.Sleeper;
import com.hostscout.core.util.StructuredLog;
import com.hostscout.core.util.UrlExclusion;
import com.hostscout.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 크롤 오케스트레이터:
 *  - 소스 시드 → Frontier → 워커 N개(고정 스레드풀) → 예절 게이트 → fetch → 추출 → 정규화 → 소스별 DedupStore
 *  - 발견 링크는 다시 Frontier 로(재귀 없음)
 *  - 상태: IDLE → RUNNING → (DRAINING → ABORTED | EXHAUSTED)
 *  - 아이템 단위 실패는 격리(로그 + 카운트), 실행 전체를 멈추는 것은 취소와 소진뿐
 *
 * 인스턴스 하나는 한 번만 run 할 수 있다.
 */
public final class CrawlCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlCoordinator.class);
    private static final StructuredLog SLOG = StructuredLog.get(CrawlCoordinator.class);

    private final CrawlConfig config;
    private final IFetcher fetcher;
    private final PolitenessGate gate;
    private final CandidateExtractor extractor;
    private final FingerprintRules rules;
    private final Canonicalizer canonicalizer;
    private final Sleeper sleeper;

    private final CrawlStats stats = new CrawlStats();
    private final AtomicReference<RunState> state = new AtomicReference<>(RunState.IDLE);
    private final AtomicBoolean cancel = new AtomicBoolean(false);
    private final AtomicInteger inFlight = new AtomicInteger(0);
    private final AtomicInteger done = new AtomicInteger(0);

    private final Map<String, ISourceProvider> owners = new ConcurrentHashMap<>();
    /** 대기 중인 상세 아이템(visitKey) → 결과를 합산할 목록 페이지 집계 */
    private final Map<String, PageTally> tallies = new ConcurrentHashMap<>();
    private final Map<String, DedupStore> stores = new LinkedHashMap<>();
    private volatile Frontier frontier;

    public CrawlCoordinator(CrawlConfig config, IFetcher fetcher, PolitenessGate gate, Sleeper sleeper) {
        this(config, fetcher, gate, new CandidateExtractor(), FingerprintRules.fromConfig(config), sleeper);
    }

    public CrawlCoordinator(CrawlConfig config, IFetcher fetcher, PolitenessGate gate,
                            CandidateExtractor extractor, FingerprintRules rules, Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.gate = Objects.requireNonNull(gate, "gate");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.rules = Objects.requireNonNull(rules, "rules");
        this.canonicalizer = new Canonicalizer(rules);
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /* =========================
       실행 API
       ========================= */

    public CrawlReport run(List<ISourceProvider> providers) {
        return run(providers, ProgressListener.NONE);
    }

    public CrawlReport run(List<ISourceProvider> providers, ProgressListener listener) {
        Objects.requireNonNull(providers, "providers");
        if (!state.compareAndSet(RunState.IDLE, RunState.RUNNING)) {
            throw new IllegalStateException("coordinator already used (state=" + state.get() + ")");
        }
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final Instant started = Instant.now();
        final int cc = config.getConcurrency();

        this.frontier = new Frontier(config.scope());
        fetcher.bind(new StatsListener(stats), cancel::get);

        LOG.info("Crawl start: sources={}, fingerprint={}, maxDepth={}, maxPages={}, emptyLimit={}, cc={}",
                providers.size(), config.getFingerprint(), config.scope().getMaxDepth(),
                config.scope().getMaxPagesPerQuery(), config.scope().getEmptyPageLimit(), cc);
        SLOG.info("crawl-start",
                "sources", providers.size(),
                "fingerprint", config.getFingerprint(),
                "maxDepth", config.scope().getMaxDepth(),
                "maxPagesPerQuery", config.scope().getMaxPagesPerQuery(),
                "cc", cc);

        // ---- 0) 시드 ----
        for (ISourceProvider p : providers) {
            synchronized (stores) {
                if (stores.putIfAbsent(p.name(), new DedupStore()) != null) {
                    throw new IllegalArgumentException("duplicate source provider name: " + p.name());
                }
            }
            List<FrontierItem> seeds;
            try {
                seeds = p.seeds();
            } catch (RuntimeException e) {
                LOG.warn("Source '{}' failed to produce seeds: {}", p.name(), e.toString());
                continue;
            }
            for (FrontierItem s : seeds) enqueue(p, s, null, null);
        }
        pl.onProgress(0.0, "crawl", 0, frontier.acceptedCount());

        // ---- 1) 워커 풀 ----
        ExecutorService exec = new ThreadPoolExecutor(
                cc, cc, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new NamedThreadFactory("crawl-worker"));
        List<Future<?>> workers = new ArrayList<>(cc);
        for (int i = 0; i < cc; i++) {
            workers.add(exec.submit(() -> workerLoop(pl)));
        }

        // ---- 2) 종료 대기 ----
        try {
            for (Future<?> f : workers) {
                try {
                    f.get();
                } catch (ExecutionException e) {
                    Throwable cause = (e.getCause() != null ? e.getCause() : e);
                    LOG.warn("Crawl worker died: {}", cause.toString());
                    SLOG.error("worker-failed", cause, "cause", cause.toString());
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            cancel();
        } finally {
            exec.shutdownNow();
            try {
                exec.awaitTermination(30, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }

        RunState end = cancel.get() ? RunState.ABORTED : RunState.EXHAUSTED;
        state.set(end);

        DedupStore merged;
        Map<String, DedupStore> perSource;
        synchronized (stores) {
            perSource = new LinkedHashMap<>(stores);
            merged = DedupStore.mergeAll(perSource.values());
        }
        CrawlStats.Snapshot snap = stats.snapshot();
        pl.onProgress(1.0, "crawl", done.get(), frontier.acceptedCount());

        LOG.info("Crawl done. state={}, entities={}, {}", end, merged.size(), snap);
        SLOG.info("crawl-done",
                "state", end.name(),
                "entities", merged.size(),
                "processed", snap.processed,
                "blocked", snap.blocked,
                "failed", snap.failed,
                "disallowed", snap.disallowed,
                "attempts", snap.attemptsTotal,
                "maxObservedCC", snap.maxObservedConcurrency);
        return new CrawlReport(end, merged, perSource, snap, started, Instant.now());
    }

    /** 협조적 취소: 새 dequeue 중단, 처리 중 아이템은 끝까지 */
    public void cancel() {
        if (cancel.compareAndSet(false, true)) {
            state.compareAndSet(RunState.RUNNING, RunState.DRAINING);
            LOG.info("Crawl cancel requested, draining in-flight items");
            Frontier f = frontier;
            if (f != null) f.close();
        }
    }

    public RunState getState() { return state.get(); }

    public CrawlStats.Snapshot getRuntimeSnapshot() { return stats.snapshot(); }

    /* =========================
       워커
       ========================= */

    private void workerLoop(ProgressListener pl) {
        while (!cancel.get()) {
            FrontierItem item;
            try {
                item = frontier.take();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return;
            }
            if (item == null) return;

            int cur = inFlight.incrementAndGet();
            stats.observeConcurrency(cur);
            try {
                process(item);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                // 아이템 단위 격리
                LOG.warn("Item failed: {} [{}]: {}", item.target(), item.sourceTag(), e.toString());
                stats.incFailed();
            } finally {
                inFlight.decrementAndGet();
                frontier.complete(item);
                int n = done.incrementAndGet();
                long total = Math.max(n, frontier.acceptedCount());
                try {
                    pl.onProgress((double) n / (double) total, "crawl", n, total);
                } catch (RuntimeException ignore) {
                    // 진행률 콜백 오류는 크롤에 영향 없음
                }
            }
        }
    }

    /**
     * 빈 페이지 판정은 목록 페이지 단위. 상세 페이지의 신규 엔티티는 자신을 낳은 목록 페이지에 합산되고,
     * 목록 페이지와 그 상세 페이지가 모두 끝났을 때 한 번만 기록한다.
     */
    void process(FrontierItem item) throws InterruptedException {
        PageTally tally = item.isListingPage()
                ? new PageTally(item.sourceTag())
                : tallies.remove(visitKey(item));
        int fresh = 0;
        try {
            fresh = visit(item, tally);
        } finally {
            if (tally != null && tally.settle(fresh)) recordPage(tally.tag, tally.total());
        }
    }

    private int visit(FrontierItem item, PageTally tally) throws InterruptedException {
        final URI target = item.target();
        final String tag = item.sourceTag();
        final ISourceProvider provider = owners.get(tag);

        // 1) 예절 게이트: authorize → (대기) → tryCommit
        while (true) {
            if (cancel.get()) return 0;
            PolitenessGate.Authorization a = gate.authorize(target);
            if (!a.allow()) {
                LOG.debug("Skip {} ({})", target, a.reason());
                stats.incProcessed();
                stats.incDisallowed();
                return 0;
            }
            Duration wait = a.waitDuration();
            if (!wait.isZero()) {
                sleeper.sleep(wait);
                continue;
            }
            if (gate.tryCommit(target)) break;
        }

        // 2) fetch
        FetchOutcome out = fetcher.fetch(target, config.retry().getAttemptBudget());
        gate.recordOutcome(target, out.getStatus());
        stats.incProcessed();

        if (out.getStatus() == FetchStatus.BLOCKED) {
            LOG.info("Blocked (403): {}", target);
            stats.incBlocked();
            return 0;
        }
        if (!out.isSuccess()) {
            LOG.info("Dropped {} after {} attempt(s): {}", target, out.getAttempts(), out.getStatus());
            stats.incFailed();
            return 0;
        }

        // 3) 추출 → 정규화 → 소스별 스토어
        FetchedDocument doc = FetchedDocument.of(out);
        Set<CandidateMatch> candidates = extractor.extract(doc, rules);
        DedupStore store = storeFor(provider);
        int fresh = 0;
        for (CandidateMatch c : candidates) {
            CanonicalEntity e = canonicalizer.canonicalize(c).orElse(null);
            if (e != null && store.insert(e)) fresh++;
        }
        stats.addNewEntities(fresh);
        LOG.debug("Page {} [{} d={} p={}] candidates={} new={}",
                target, tag, item.depth(), item.pageIndex(), candidates.size(), fresh);

        // 4) 다음 링크
        if (provider == null || !frontier.isQueryActive(tag)) return fresh;

        List<FrontierItem> next = provider.nextLinksFrom(doc, item);
        if (next != null) {
            for (FrontierItem n : next) enqueue(provider, n, item, tally);
        }
        return fresh;
    }

    private void recordPage(String tag, int fresh) {
        if (frontier.recordPage(tag, fresh)) {
            LOG.info("Query '{}' stopped after {} consecutive empty page(s)", tag, config.scope().getEmptyPageLimit());
            SLOG.info("query-stopped", "tag", tag, "reason", "empty-pages");
        }
    }

    private DedupStore storeFor(ISourceProvider provider) {
        String name = (provider == null) ? "_unowned" : provider.name();
        synchronized (stores) {
            return stores.computeIfAbsent(name, n -> new DedupStore());
        }
    }

    /**
     * 시드/발견 링크를 Frontier 로.
     * 발견 링크 중 부모와 다른 호스트이면서 제외 목록에 걸리는 것은 버린다(페이지네이션은 같은 호스트라 영향 없음).
     */
    private void enqueue(ISourceProvider provider, FrontierItem item, FrontierItem parent, PageTally tally) {
        if (!UrlUtils.isHttp(item.target())) return;
        if (parent != null && !UrlUtils.sameHost(parent.target(), item.target())) {
            if (UrlExclusion.isExcludedHost(item.target(), config.scope().getExcludeHosts())
                    || UrlExclusion.isExcluded(item.target(), config.scope().getExcludePatterns())) {
                LOG.trace("Excluded link {}", item.target());
                return;
            }
        }
        owners.putIfAbsent(item.sourceTag(), provider);

        // 상세 아이템은 꺼내지기 전에 집계에 걸어 둔다(이미 대기 중인 같은 키는 건드리지 않음)
        String key = visitKey(item);
        boolean tracked = tally != null && !item.isListingPage() && tallies.putIfAbsent(key, tally) == null;
        if (tracked) tally.expect();

        Frontier.OfferResult r = frontier.offer(item);
        if (r == Frontier.OfferResult.OVERFLOW) stats.incOverflow();
        if (tracked && r != Frontier.OfferResult.ACCEPTED && tallies.remove(key, tally)) {
            // 부모 몫이 아직 열려 있으므로 여기서 0 이 되지 않는다
            tally.settle(0);
        }
    }

    private static String visitKey(FrontierItem item) {
        return UrlUtils.normalize(item.target()) + " " + item.sourceTag();
    }

    /* =========================
       내부 유틸
       ========================= */

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /** 목록 페이지 1건 + 그 상세 페이지들의 신규 엔티티 합계. 열린 조각이 0이 되면 끝 */
    private static final class PageTally {
        final String tag;
        private final AtomicInteger open = new AtomicInteger(1);
        private final AtomicInteger fresh = new AtomicInteger(0);

        PageTally(String tag) { this.tag = tag; }

        void expect() { open.incrementAndGet(); }

        /** @return 마지막 조각이었으면 true */
        boolean settle(int n) {
            fresh.addAndGet(n);
            return open.decrementAndGet() == 0;
        }

        int total() { return fresh.get(); }
    }

    /** fetcher 시도/재시도 → CrawlStats */
    private static final class StatsListener implements FetchListener {
        private final CrawlStats stats;
        StatsListener(CrawlStats stats) { this.stats = stats; }
        @Override public void onAttempt(URI uri, FetchOutcome outcome) { stats.addAttempt(outcome.getElapsedMs()); }
        @Override public void onRetry(URI uri, FetchStatus status, int attempt, Duration delay) { stats.addRetry(); }
    }
}

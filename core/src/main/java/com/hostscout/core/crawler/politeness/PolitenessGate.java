package com.hostscout.core.crawler.politeness;

import com.hostscout.core.crawler.robots.RobotsPolicy;
import com.hostscout.core.crawler.robots.RobotsRepository;
import com.hostscout.core.model.CrawlConfig;
import com.hostscout.core.model.FetchStatus;
import com.hostscout.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 호스트 단위 예절 게이트.
 *  1) authorize(): robots 허용 여부 + 남은 대기 시간 계산(상태 변경 없음, robots 최초 로드 제외)
 *  2) tryCommit(): 간격이 지났는지 원자적으로 재확인하고 lastRequestAt 을 찍는다
 *  3) recordOutcome(): 연속 실패 카운트 갱신
 * 대기 자체는 호출자(워커)가 수행한다.
 */
public final class PolitenessGate {

    private static final Logger LOG = LoggerFactory.getLogger(PolitenessGate.class);

    public enum Reason { OK, DISALLOWED_BY_ROBOTS, HOST_FAILING }

    public record Authorization(boolean allow, Duration waitDuration, Reason reason) {
        static Authorization deny(Reason r) { return new Authorization(false, Duration.ZERO, r); }
        static Authorization allowAfter(Duration d) { return new Authorization(true, d, Reason.OK); }
    }

    private final RobotsRepository robots;   // null 이면 robots 무시
    private final HostPolicyCache cache;
    private final PolitenessClock clock;
    private final Duration minInterval;
    private final int hostFailureLimit;

    public PolitenessGate(CrawlConfig.Politeness cfg, RobotsRepository robots, PolitenessClock clock) {
        this(cfg.isRespectRobots() ? robots : null, new HostPolicyCache(), clock,
                cfg.minHostInterval(), cfg.getHostFailureLimit());
    }

    public PolitenessGate(RobotsRepository robots, HostPolicyCache cache, PolitenessClock clock,
                          Duration minInterval, int hostFailureLimit) {
        this.robots = robots;
        this.cache = Objects.requireNonNull(cache, "cache");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.minInterval = (minInterval == null || minInterval.isNegative()) ? Duration.ZERO : minInterval;
        this.hostFailureLimit = Math.max(0, hostFailureLimit);
    }

    public Authorization authorize(URI uri) throws InterruptedException {
        String key = UrlUtils.hostKey(uri);
        HostPolicyCache.HostState st = cache.get(key);

        if (hostFailureLimit > 0 && st.consecutiveFailures() >= hostFailureLimit) {
            return Authorization.deny(Reason.HOST_FAILING);
        }

        RobotsPolicy policy = st.robots();
        if (policy == null) {
            // robots 로드는 맵 락 밖에서
            RobotsPolicy loaded = (robots != null) ? robots.policyFor(uri) : RobotsPolicy.allowAll();
            st = cache.update(key, s -> s.withRobots(loaded));
            policy = st.robots();
        }
        if (!policy.allows(uri)) {
            return Authorization.deny(Reason.DISALLOWED_BY_ROBOTS);
        }
        return Authorization.allowAfter(remainingWait(st, policy, clock.nowMillis()));
    }

    /**
     * 간격이 지났으면 lastRequestAt 을 지금으로 찍고 true.
     * 다른 워커가 먼저 찍었으면 false (호출자는 authorize 부터 다시).
     */
    public boolean tryCommit(URI uri) {
        String key = UrlUtils.hostKey(uri);
        long now = clock.nowMillis();
        AtomicBoolean committed = new AtomicBoolean(false);
        cache.update(key, s -> {
            RobotsPolicy p = (s.robots() != null) ? s.robots() : RobotsPolicy.allowAll();
            if (!remainingWait(s, p, now).isZero()) return s;
            committed.set(true);
            return s.withLastRequestAt(now);
        });
        return committed.get();
    }

    public void recordOutcome(URI uri, FetchStatus status) {
        String key = UrlUtils.hostKey(uri);
        HostPolicyCache.HostState after = cache.update(key, s -> s.withOutcome(status));
        if (hostFailureLimit > 0 && status.isHostFailure() && after.consecutiveFailures() == hostFailureLimit) {
            LOG.warn("Host {} reached {} consecutive failures, skipping it for the rest of the run",
                    after.host(), hostFailureLimit);
        }
    }

    HostPolicyCache cache() { return cache; }

    /** max(0, interval − (now − lastRequestAt)). interval = max(minInterval, crawl-delay) */
    private Duration remainingWait(HostPolicyCache.HostState st, RobotsPolicy policy, long now) {
        if (st.lastRequestAt() < 0) return Duration.ZERO;
        Duration interval = minInterval;
        Duration delay = policy.crawlDelay().orElse(Duration.ZERO);
        if (delay.compareTo(interval) > 0) interval = delay;
        long left = interval.toMillis() - (now - st.lastRequestAt());
        return left > 0 ? Duration.ofMillis(left) : Duration.ZERO;
    }
}

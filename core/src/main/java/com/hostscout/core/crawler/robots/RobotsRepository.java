package com.hostscout.core.crawler.robots;

import com.hostscout.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * host:port 별 robots 정책 저장소(실행 1회 동안 유지, TTL 없음).
 * - 실패(네트워크, 2xx 외, 크로스 호스트 리다이렉트, 리다이렉트 과다)는 allow-all 로 fail-open
 * - 가져오기는 맵 락 밖에서 수행하고 putIfAbsent 로 저장(경쟁 시 먼저 저장된 정책이 이김)
 */
public final class RobotsRepository {

    private static final Logger LOG = LoggerFactory.getLogger(RobotsRepository.class);
    static final int MAX_REDIRECTS = 5;

    private final RobotsFetcher fetcher;
    private final String agentToken;
    private final ConcurrentHashMap<String, RobotsPolicy> cache = new ConcurrentHashMap<>();

    public RobotsRepository(RobotsFetcher fetcher, String agentToken) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.agentToken = (agentToken == null || agentToken.isBlank()) ? RobotsParser.UA_ALL : agentToken;
    }

    /** pageUri 기준 정책. 처음 보는 호스트면 robots.txt 를 가져온다 */
    public RobotsPolicy policyFor(URI pageUri) throws InterruptedException {
        String key = UrlUtils.hostKey(pageUri);
        RobotsPolicy cached = cache.get(key);
        if (cached != null) return cached;

        RobotsPolicy fresh = fetchAndBuild(pageUri);
        RobotsPolicy prev = cache.putIfAbsent(key, fresh);
        return (prev != null) ? prev : fresh;
    }

    boolean isCached(URI pageUri) {
        return cache.containsKey(UrlUtils.hostKey(pageUri));
    }

    int size() { return cache.size(); }

    private RobotsPolicy fetchAndBuild(URI pageUri) throws InterruptedException {
        URI robots = robotsTxtUri(pageUri);
        if (robots == null) return RobotsPolicy.allowAll();

        URI cur = robots;
        for (int hop = 0; hop <= MAX_REDIRECTS; hop++) {
            RobotsFetcher.Response r = fetcher.fetch(cur);
            int s = r.status();

            if (s == 0) {
                LOG.warn("robots.txt fetch failed, allowing all: {} ({})", cur, r.error());
                return RobotsPolicy.allowAll();
            }
            if (s >= 200 && s < 300) {
                try {
                    return RobotsPolicy.parse(r.body(), agentToken);
                } catch (RuntimeException e) {
                    LOG.warn("robots.txt parse failed, allowing all: {} ({})", cur, e.toString());
                    return RobotsPolicy.allowAll();
                }
            }
            if (r.isRedirect()) {
                // 동일 호스트 내에서만(스킴 전환 허용)
                if (!UrlUtils.sameHost(cur, r.location())) {
                    LOG.debug("robots.txt cross-host redirect {} -> {}, allowing all", cur, r.location());
                    return RobotsPolicy.allowAll();
                }
                cur = r.location();
                continue;
            }
            // 404/410/5xx 등
            LOG.debug("robots.txt {} returned {}, allowing all", cur, s);
            return RobotsPolicy.allowAll();
        }
        LOG.debug("robots.txt too many redirects from {}, allowing all", robots);
        return RobotsPolicy.allowAll();
    }

    static URI robotsTxtUri(URI page) {
        String host = page.getHost();
        String scheme = page.getScheme() == null ? "" : page.getScheme().toLowerCase(Locale.ROOT);
        if (host == null || host.isEmpty()) return null;
        if (!scheme.equals("http") && !scheme.equals("https")) return null;
        int port = page.getPort();
        String authority = (port < 0) ? host : host + ":" + port;
        return URI.create(scheme + "://" + authority + "/robots.txt");
    }
}

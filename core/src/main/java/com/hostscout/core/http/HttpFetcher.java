package com.hostscout.core.http;

import com.hostscout.core.api.IFetcher;
import com.hostscout.core.model.CrawlConfig;
import com.hostscout.core.model.FetchOutcome;
import com.hostscout.core.model.FetchStatus;
import com.hostscout.core.util.DefaultSleeper;
import com.hostscout.core.util.RateLimiter;
import com.hostscout.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * java.net.http 기반 fetcher.
 * - 시도마다 전역 RateLimiter 슬롯 1개 소비
 * - 응답 코드/예외를 FetchStatus 로 분류(예외를 밖으로 던지지 않음, InterruptedException 제외)
 * - 재시도는 RetryPolicy + Retry-After(상한 30s), 예산 초과 시 마지막 결과 반환
 * - 본문은 maxBodyBytes 까지만 읽는다(BoundedBody)
 */
public class HttpFetcher implements IFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(HttpFetcher.class);
    static final Duration RETRY_AFTER_CAP = Duration.ofSeconds(30);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<byte[]> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final CrawlConfig config;
    private final HttpSender sender;
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final RequestIdentity identity;
    private final RateLimiter limiter;

    private volatile FetchListener listener = FetchListener.NONE;
    private volatile BooleanSupplier stopRequested = () -> false;

    /** 프로덕션 경로: HttpClient 사용 */
    public HttpFetcher(CrawlConfig config) {
        this(config, clientSender(config), new DefaultRetryPolicy(config.retry().getBackoffBaseMs()),
                DefaultSleeper.INSTANCE, RequestIdentity.fromConfig(config), RateLimiter.perSecond(config.getRps()));
    }

    /** 테스트용 생성자(송신 훅/정책/슬리퍼 주입) */
    public HttpFetcher(CrawlConfig config, HttpSender sender, RetryPolicy policy, Sleeper sleeper,
                       RequestIdentity identity, RateLimiter limiter) {
        this.config = Objects.requireNonNull(config, "config");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.identity = Objects.requireNonNull(identity, "identity");
        this.limiter = Objects.requireNonNull(limiter, "limiter");
    }

    private static HttpSender clientSender(CrawlConfig config) {
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .build();
        int maxBody = config.getMaxBodyBytes();
        return req -> BoundedBody.toBytes(client.send(req, HttpResponse.BodyHandlers.ofInputStream()), maxBody);
    }

    @Override
    public void bind(FetchListener listener, BooleanSupplier stopRequested) {
        this.listener = (listener == null) ? FetchListener.NONE : listener;
        this.stopRequested = (stopRequested == null) ? () -> false : stopRequested;
    }

    @Override
    public FetchOutcome fetch(URI uri, int attemptBudget) throws InterruptedException {
        Objects.requireNonNull(uri, "uri");
        final int budget = Math.max(1, attemptBudget);
        final FetchListener l = listener;
        final BooleanSupplier stop = stopRequested;

        FetchOutcome last = null;
        int attempt = 0;
        while (attempt < budget) {
            limiter.acquire();
            attempt++;
            last = attemptOnce(uri);
            l.onAttempt(uri, last);

            FetchStatus st = last.getStatus();
            if (st == FetchStatus.SUCCESS || !policy.shouldRetry(st) || attempt >= budget) break;
            // 재시도 대기 전에 중단 플래그 확인
            if (stop.getAsBoolean()) {
                LOG.debug("Stop requested, skip retry: {} after {} attempt(s)", uri, attempt);
                break;
            }
            Duration delay = resolveRetryAfterOr(policy.nextDelay(st, attempt), last);
            l.onRetry(uri, st, attempt, delay);
            LOG.debug("Retry {} ({}), attempt {}/{} in {}ms", uri, st, attempt, budget, delay.toMillis());
            sleeper.sleep(delay);
        }
        return last.withAttempts(attempt);
    }

    /** 한 번 전송하고 분류한다. 네트워크 예외는 상태로 매핑 */
    FetchOutcome attemptOnce(URI uri) throws InterruptedException {
        long start = System.nanoTime();
        try {
            HttpRequest req = HttpRequest.newBuilder(uri)
                    .timeout(config.getTimeout())
                    .header("User-Agent", identity.userAgent())
                    .header("Accept", "text/html,application/xhtml+xml,application/json;q=0.9,*/*;q=0.8")
                    .GET()
                    .build();

            HttpResponse<byte[]> resp = sender.send(req);
            int code = resp.statusCode();
            FetchStatus status = classify(code);

            byte[] body = resp.body();
            if (body != null && body.length > config.getMaxBodyBytes()) {
                LOG.debug("Body truncated: {} ({} bytes)", uri, body.length);
                body = Arrays.copyOf(body, config.getMaxBodyBytes());
            }

            return FetchOutcome.builder()
                    .status(status)
                    .httpCode(code)
                    .body(body)
                    .requestUri(uri)
                    .finalUri(resp.uri() != null ? resp.uri() : uri)
                    .headers(resp.headers().map())
                    .contentType(resp.headers().firstValue("Content-Type").orElse(null))
                    .elapsedMs(elapsedMs(start))
                    .build();

        } catch (HttpTimeoutException e) {
            return failure(uri, FetchStatus.TIMEOUT, start, e);
        } catch (IOException e) {
            return failure(uri, FetchStatus.NETWORK_ERROR, start, e);
        } catch (IllegalArgumentException e) {
            // 요청으로 만들 수 없는 URI(스킴 없음 등): 대상 자체 문제
            return failure(uri, FetchStatus.CLIENT_ERROR, start, e);
        }
    }

    private static FetchOutcome failure(URI uri, FetchStatus status, long start, Exception e) {
        LOG.debug("Fetch {} failed: {} ({})", uri, status, e.toString());
        return FetchOutcome.builder()
                .status(status)
                .requestUri(uri)
                .elapsedMs(elapsedMs(start))
                .build();
    }

    /** HTTP 코드 → 분류. 따라가지 않은 3xx 는 CLIENT_ERROR */
    public static FetchStatus classify(int code) {
        if (code >= 200 && code < 300) return FetchStatus.SUCCESS;
        if (code == 403) return FetchStatus.BLOCKED;
        if (code == 429) return FetchStatus.RATE_LIMITED;
        if (code >= 500) return FetchStatus.SERVER_ERROR;
        return FetchStatus.CLIENT_ERROR;
    }

    /** Retry-After(초) 헤더를 존중하되 30초로 상한. HTTP-date 형태는 fallback */
    static Duration resolveRetryAfterOr(Duration fallback, FetchOutcome last) {
        String v = last.header("Retry-After");
        if (v == null || v.isBlank()) return fallback;
        try {
            long sec = Long.parseLong(v.trim());
            if (sec < 0) return fallback;
            Duration d = Duration.ofSeconds(sec);
            return d.compareTo(RETRY_AFTER_CAP) > 0 ? RETRY_AFTER_CAP : d;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static long elapsedMs(long startNs) {
        return (System.nanoTime() - startNs) / 1_000_000;
    }
}

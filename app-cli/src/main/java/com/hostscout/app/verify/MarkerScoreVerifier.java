package com.hostscout.app.verify;

import com.hostscout.core.api.IFetcher;
import com.hostscout.core.api.IVerifier;
import com.hostscout.core.model.CanonicalEntity;
import com.hostscout.core.model.FetchOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 엔티티 주소를 가져와 본문 마커 점수로 판정한다. 마커가 든 응답 헤더는 하나당 high 1개.
 * 통과 조건(하나라도 만족):
 *  - high ≥ 1
 *  - medium ≥ 2
 *  - medium ≥ 1 이고 low ≥ 2
 *  - anchor 가 있고 medium + low ≥ 3
 * 가져오기 실패(차단, 네트워크 오류 등)는 미통과.
 */
public final class MarkerScoreVerifier implements IVerifier {

    private static final Logger LOG = LoggerFactory.getLogger(MarkerScoreVerifier.class);

    /** 단계별 일치 개수 */
    public record Score(int high, int medium, int low, boolean anchor) {
        public boolean passes() {
            if (high >= 1) return true;
            if (medium >= 2) return true;
            if (medium >= 1 && low >= 2) return true;
            return anchor && (medium + low) >= 3;
        }
    }

    private final IFetcher fetcher;
    private final MarkerSet markers;
    private final int attemptBudget;

    public MarkerScoreVerifier(IFetcher fetcher, MarkerSet markers, int attemptBudget) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.markers = Objects.requireNonNull(markers, "markers");
        this.attemptBudget = Math.max(1, attemptBudget);
    }

    @Override
    public boolean verify(CanonicalEntity entity) throws InterruptedException {
        FetchOutcome out = fetcher.fetch(entity.uri(), attemptBudget);
        if (!out.isSuccess()) {
            LOG.debug("Verify fetch failed for {}: {}", entity.uri(), out.getStatus());
            return false;
        }
        Score s = score(out.bodyText(), out.getHeaders());
        LOG.debug("Verify {} -> {}", entity.key(), s);
        return s.passes();
    }

    public Score score(String html, Map<String, List<String>> headers) {
        Score body = score(html);
        int hits = headerHits(headers);
        return (hits == 0) ? body : new Score(body.high() + hits, body.medium(), body.low(), body.anchor());
    }

    /** "이름: 값" 에 헤더 마커가 들어 있는 헤더 수 */
    public int headerHits(Map<String, List<String>> headers) {
        if (headers == null || headers.isEmpty() || markers.headers().isEmpty()) return 0;
        int n = 0;
        for (Map.Entry<String, List<String>> e : headers.entrySet()) {
            List<String> values = (e.getValue() == null) ? List.of() : e.getValue();
            String line = (e.getKey() + ": " + String.join(",", values)).toLowerCase(Locale.ROOT);
            for (String p : markers.headers()) {
                if (line.contains(p)) {
                    n++;
                    break;
                }
            }
        }
        return n;
    }

    public Score score(String html) {
        if (html == null || html.isEmpty()) return new Score(0, 0, 0, false);
        String lc = html.toLowerCase(Locale.ROOT);
        int h = 0, m = 0, l = 0;
        for (String p : markers.high()) if (lc.contains(p)) h++;
        for (String p : markers.medium()) if (lc.contains(p)) m++;
        for (String p : markers.low()) if (lc.contains(p)) l++;
        boolean anchor = !markers.anchor().isEmpty() && lc.contains(markers.anchor());
        return new Score(h, m, l, anchor);
    }
}

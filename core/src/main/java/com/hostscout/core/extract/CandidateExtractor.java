package com.hostscout.core.extract;

import com.hostscout.core.model.CandidateMatch;
import com.hostscout.core.model.FetchedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 모든 전략을 독립적으로 전부 돌려 합집합을 만든다(앞 전략이 찾았어도 계속).
 * 합집합이 비었고 본문에 지문 문자열이 있으면 그때만 폴백 패턴을 돌린다.
 * 전략 하나가 실패해도 추출 전체는 실패하지 않는다.
 */
public final class CandidateExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(CandidateExtractor.class);

    private final List<ExtractionStrategy> strategies;
    private final ExtractionStrategy fallback;

    public CandidateExtractor() {
        this(List.of(new BodyPatternStrategy(), new LinkStrategy(),
                        new AttributeStrategy(), new EmbeddedPayloadStrategy()),
                new FallbackPatternStrategy());
    }

    public CandidateExtractor(List<ExtractionStrategy> strategies, ExtractionStrategy fallback) {
        this.strategies = List.copyOf(Objects.requireNonNull(strategies, "strategies"));
        this.fallback = fallback;
    }

    public Set<CandidateMatch> extract(FetchedDocument doc, FingerprintRules rules) {
        Objects.requireNonNull(doc, "doc");
        Objects.requireNonNull(rules, "rules");

        Set<CandidateMatch> out = new LinkedHashSet<>();
        for (ExtractionStrategy s : strategies) {
            out.addAll(runSafely(s, doc, rules));
        }
        if (out.isEmpty() && fallback != null && rules.containsFingerprint(doc.body())) {
            Set<CandidateMatch> fb = runSafely(fallback, doc, rules);
            if (!fb.isEmpty()) LOG.debug("Fallback pattern found {} candidate(s) in {}", fb.size(), doc.uri());
            out.addAll(fb);
        }
        return out;
    }

    private static Set<CandidateMatch> runSafely(ExtractionStrategy s, FetchedDocument doc, FingerprintRules rules) {
        try {
            Set<CandidateMatch> r = s.extract(doc, rules);
            return (r == null) ? Set.of() : r;
        } catch (Exception e) {
            LOG.debug("Extraction strategy '{}' failed on {}: {}", s.name(), doc.uri(), e.toString());
            return Set.of();
        }
    }
}

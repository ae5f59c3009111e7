package com.hostscout.core.extract;

import com.hostscout.core.model.CandidateMatch;
import com.hostscout.core.model.FetchedDocument;
import com.hostscout.core.model.OriginField;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * 모든 구조적 방법이 빈 결과일 때만 쓰는 초관대 패턴.
 * 이스케이프된 구분자(\/, %2F, ., %2E)를 먼저 풀어서 적용한다.
 */
public final class FallbackPatternStrategy implements ExtractionStrategy {

    @Override public String name() { return "fallback"; }

    @Override
    public Set<CandidateMatch> extract(FetchedDocument doc, FingerprintRules rules) {
        Set<CandidateMatch> out = new LinkedHashSet<>();
        Matcher m = rules.permissivePattern().matcher(unescape(doc.body()));
        while (m.find()) {
            out.add(new CandidateMatch(m.group(), OriginField.BODY, doc.uri()));
        }
        return out;
    }

    static String unescape(String s) {
        return s.replace("\\/", "/")
                .replace("%2F", "/").replace("%2f", "/")
                .replace("\\u002e", ".").replace("\\u002E", ".")
                .replace("%2E", ".").replace("%2e", ".");
    }
}

package com.hostscout.core.extract;

import com.hostscout.core.model.CandidateMatch;
import com.hostscout.core.model.FetchedDocument;
import com.hostscout.core.model.OriginField;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;

/** (a) 원문 본문에 strict 패턴 직접 적용 */
public final class BodyPatternStrategy implements ExtractionStrategy {

    @Override public String name() { return "body"; }

    @Override
    public Set<CandidateMatch> extract(FetchedDocument doc, FingerprintRules rules) {
        Set<CandidateMatch> out = new LinkedHashSet<>();
        Matcher m = rules.strictPattern().matcher(doc.body());
        while (m.find()) {
            out.add(new CandidateMatch(m.group(), OriginField.BODY, doc.uri()));
        }
        return out;
    }
}

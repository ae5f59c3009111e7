package com.hostscout.core.extract;

import com.hostscout.core.model.CandidateMatch;
import com.hostscout.core.model.FetchedDocument;
import com.hostscout.core.model.OriginField;
import org.jsoup.nodes.Element;

import java.util.LinkedHashSet;
import java.util.Set;

/** (b) a[href] 의 절대 href 와 보이는 링크 텍스트 */
public final class LinkStrategy implements ExtractionStrategy {

    @Override public String name() { return "links"; }

    @Override
    public Set<CandidateMatch> extract(FetchedDocument doc, FingerprintRules rules) {
        Set<CandidateMatch> out = new LinkedHashSet<>();
        for (Element a : doc.dom().select("a[href]")) {
            String href = a.attr("abs:href");
            if (href.isBlank()) href = a.attr("href");
            if (rules.containsFingerprint(href)) {
                out.add(new CandidateMatch(href.trim(), OriginField.LINK_HREF, doc.uri()));
            }
            String text = a.text();
            if (rules.containsFingerprint(text)) {
                out.add(new CandidateMatch(text.trim(), OriginField.LINK_TEXT, doc.uri()));
            }
        }
        return out;
    }
}

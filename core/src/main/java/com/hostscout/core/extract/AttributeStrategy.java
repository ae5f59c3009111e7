package com.hostscout.core.extract;

import com.hostscout.core.model.CandidateMatch;
import com.hostscout.core.model.FetchedDocument;
import com.hostscout.core.model.OriginField;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;

import java.util.LinkedHashSet;
import java.util.Set;

/** (c) 모든 요소의 모든 속성 값 중 지문을 포함하는 것. meta 요소는 META_TAG */
public final class AttributeStrategy implements ExtractionStrategy {

    @Override public String name() { return "attributes"; }

    @Override
    public Set<CandidateMatch> extract(FetchedDocument doc, FingerprintRules rules) {
        Set<CandidateMatch> out = new LinkedHashSet<>();
        for (Element el : doc.dom().getAllElements()) {
            OriginField origin = "meta".equals(el.normalName()) ? OriginField.META_TAG : OriginField.ATTRIBUTE;
            for (Attribute attr : el.attributes()) {
                String v = attr.getValue();
                if (rules.containsFingerprint(v)) {
                    out.add(new CandidateMatch(v.trim(), origin, doc.uri()));
                }
            }
        }
        return out;
    }
}

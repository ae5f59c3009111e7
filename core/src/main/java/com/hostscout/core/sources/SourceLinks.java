package com.hostscout.core.sources;

import com.hostscout.core.model.FetchedDocument;
import com.hostscout.core.util.UrlUtils;
import org.jsoup.nodes.Element;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** CSS 셀렉터로 절대 링크(abs:href)를 뽑는 공통 유틸 */
final class SourceLinks {
    private static final Logger LOG = LoggerFactory.getLogger(SourceLinks.class);

    private SourceLinks() {}

    /** 셀렉터에 걸린 요소들의 http(s) 링크(문서 순서, 중복 제거) */
    static List<URI> select(FetchedDocument page, String selector) {
        if (selector == null || selector.isBlank()) return List.of();
        Set<URI> out = new LinkedHashSet<>();
        try {
            for (Element e : page.dom().select(selector)) {
                String href = e.hasAttr("href") ? e.absUrl("href") : e.attr("abs:src");
                UrlUtils.parseHttp(href).ifPresent(out::add);
            }
        } catch (Selector.SelectorParseException | IllegalArgumentException ex) {
            LOG.warn("Invalid CSS selector '{}': {}", selector, ex.getMessage());
            return List.of();
        }
        return new ArrayList<>(out);
    }

    /** 첫 번째 링크만 */
    static Optional<URI> first(FetchedDocument page, String selector) {
        List<URI> all = select(page, selector);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(0));
    }
}

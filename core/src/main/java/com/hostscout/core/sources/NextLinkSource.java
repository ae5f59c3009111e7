package com.hostscout.core.sources;

import com.hostscout.core.api.ISourceProvider;
import com.hostscout.core.model.FetchedDocument;
import com.hostscout.core.model.FrontierItem;
import com.hostscout.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * "다음" 버튼으로 넘기는 목록(디렉터리 등).
 * 시작 URL 마다 태그 "name:url" 하나. 목록 페이지에서 nextSelector 첫 링크 → 다음 페이지,
 * followSelector 링크 → 상세 페이지(상세 페이지에서는 더 나가지 않는다).
 */
public final class NextLinkSource implements ISourceProvider {
    private static final Logger LOG = LoggerFactory.getLogger(NextLinkSource.class);

    private final String name;
    private final List<String> urls;
    private final String nextSelector;
    private final String followSelector;

    public NextLinkSource(String name, List<String> urls, String nextSelector, String followSelector) {
        this.name = Objects.requireNonNull(name, "name");
        this.urls = List.copyOf(urls);
        this.nextSelector = Objects.requireNonNull(nextSelector, "nextSelector");
        this.followSelector = (followSelector == null ? "" : followSelector);
    }

    @Override public String name() { return name; }

    @Override
    public List<FrontierItem> seeds() {
        List<FrontierItem> out = new ArrayList<>(urls.size());
        for (String u : urls) {
            URI uri = UrlUtils.parseHttp(u).orElse(null);
            if (uri == null) {
                LOG.warn("Source '{}': skipping invalid start URL '{}'", name, u);
                continue;
            }
            out.add(FrontierItem.seed(uri, name + ":" + uri));
        }
        return out;
    }

    @Override
    public List<FrontierItem> nextLinksFrom(FetchedDocument page, FrontierItem item) {
        if (!item.isListingPage()) return List.of();
        List<FrontierItem> out = new ArrayList<>();
        SourceLinks.first(page, nextSelector)
                .filter(u -> !UrlUtils.normalize(u).equals(UrlUtils.normalize(item.target())))
                .ifPresent(u -> out.add(item.nextPage(u)));
        for (URI u : SourceLinks.select(page, followSelector)) {
            out.add(item.child(u));
        }
        return out;
    }
}

package com.hostscout.core.sources;

import com.hostscout.core.api.ISourceProvider;
import com.hostscout.core.model.FetchedDocument;
import com.hostscout.core.model.FrontierItem;
import com.hostscout.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 번호 페이지 검색 결과.
 * URL 템플릿 치환: {query}(URL 인코딩) {page}(1부터) {offset}(= firstOffset + (page-1) × pageSize)
 * 쿼리마다 태그 "name:query" 를 하나씩 쓴다.
 * 결과 페이지를 가져올 때마다 다음 번호 페이지를 만들고, followSelector 가 있으면 상세 링크도 따라간다.
 * 언제 멈출지는 프런티어(빈 페이지 한도, 페이지 상한)가 정한다.
 */
public final class PagedSearchSource implements ISourceProvider {
    private static final Logger LOG = LoggerFactory.getLogger(PagedSearchSource.class);

    private final String name;
    private final String template;
    private final List<String> queries;
    private final int pageSize;
    private final int firstOffset;
    private final int maxPages;
    private final String followSelector;

    public PagedSearchSource(String name, String template, List<String> queries,
                             int pageSize, int firstOffset, int maxPages, String followSelector) {
        this.name = Objects.requireNonNull(name, "name");
        this.template = Objects.requireNonNull(template, "template");
        this.queries = List.copyOf(queries);
        this.pageSize = Math.max(1, pageSize);
        this.firstOffset = firstOffset;
        this.maxPages = Math.max(1, maxPages);
        this.followSelector = (followSelector == null ? "" : followSelector);
    }

    @Override public String name() { return name; }

    public String tagFor(String query) { return name + ":" + query; }

    @Override
    public List<FrontierItem> seeds() {
        List<FrontierItem> out = new ArrayList<>(queries.size());
        for (String q : queries) {
            URI uri = pageUri(q, 1);
            if (uri == null) continue;
            out.add(FrontierItem.seed(uri, tagFor(q)));
        }
        return out;
    }

    @Override
    public List<FrontierItem> nextLinksFrom(FetchedDocument page, FrontierItem item) {
        if (!item.isListingPage()) return List.of();
        List<FrontierItem> out = new ArrayList<>();

        if (item.pageIndex() < maxPages) {
            String query = queryOf(item.sourceTag());
            if (query != null) {
                URI next = pageUri(query, item.pageIndex() + 1);
                if (next != null) out.add(item.nextPage(next));
            }
        }
        for (URI u : SourceLinks.select(page, followSelector)) {
            out.add(item.child(u));
        }
        return out;
    }

    /** 치환된 페이지 URL. 결과가 http(s) 가 아니면 null */
    URI pageUri(String query, int pageIndex) {
        int offset = firstOffset + (pageIndex - 1) * pageSize;
        String url = template
                .replace("{query}", URLEncoder.encode(query, StandardCharsets.UTF_8))
                .replace("{page}", Integer.toString(pageIndex))
                .replace("{offset}", Integer.toString(offset));
        URI uri = UrlUtils.parseHttp(url).orElse(null);
        if (uri == null) LOG.warn("Source '{}': template produced invalid URL '{}'", name, url);
        return uri;
    }

    private String queryOf(String tag) {
        String prefix = name + ":";
        return tag.startsWith(prefix) ? tag.substring(prefix.length()) : null;
    }
}

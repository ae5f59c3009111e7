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
 * 고정 URL 목록. 페이지네이션 없음(시드 페이지만 가져온다).
 * 모든 시드가 하나의 쿼리 태그(= 소스 이름)를 공유한다.
 */
public final class StaticSeedSource implements ISourceProvider {
    private static final Logger LOG = LoggerFactory.getLogger(StaticSeedSource.class);

    private final String name;
    private final List<String> urls;

    public StaticSeedSource(String name, List<String> urls) {
        this.name = Objects.requireNonNull(name, "name");
        this.urls = List.copyOf(urls);
    }

    @Override public String name() { return name; }

    @Override
    public List<FrontierItem> seeds() {
        List<FrontierItem> out = new ArrayList<>(urls.size());
        for (String u : urls) {
            URI uri = UrlUtils.parseHttp(u).orElse(null);
            if (uri == null) {
                LOG.warn("Source '{}': skipping invalid seed URL '{}'", name, u);
                continue;
            }
            out.add(FrontierItem.seed(uri, name));
        }
        return out;
    }

    @Override
    public List<FrontierItem> nextLinksFrom(FetchedDocument page, FrontierItem item) {
        return List.of();
    }
}

package com.hostscout.core.sources;

import com.hostscout.core.api.ISourceProvider;
import com.hostscout.core.model.CrawlConfig;

import java.util.ArrayList;
import java.util.List;

/** 설정의 sources 목록 → 프로바이더 */
public final class SourceProviders {
    private SourceProviders() {}

    public static List<ISourceProvider> fromConfig(CrawlConfig cfg) {
        List<ISourceProvider> out = new ArrayList<>();
        for (CrawlConfig.SourceCfg s : cfg.getSources()) {
            out.add(create(s, cfg.scope().getMaxPagesPerQuery()));
        }
        return out;
    }

    public static ISourceProvider create(CrawlConfig.SourceCfg s, int maxPages) {
        return switch (s.getType()) {
            case STATIC -> new StaticSeedSource(s.getName(), s.getUrls());
            case SEARCH -> new PagedSearchSource(s.getName(), s.getTemplate(), s.getQueries(),
                    s.getPageSize(), s.getFirstOffset(), maxPages, s.getFollowSelector());
            case NEXT_LINK -> new NextLinkSource(s.getName(), s.getUrls(), s.getNextSelector(), s.getFollowSelector());
        };
    }
}

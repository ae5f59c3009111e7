package com.hostscout.core.model;

import java.net.URI;
import java.time.Instant;
import java.util.Objects;

/**
 * 프런티어 대기 작업 1건.
 * - depth / pageIndex 는 1부터 시작(시드 = depth 1, page 1)
 * - sourceTag 는 하나의 쿼리(하위 순회)를 식별한다. 방문 집합 키는 (정규화 target, sourceTag)
 */
public record FrontierItem(URI target, int depth, int pageIndex, String sourceTag, Instant bornAt) {

    public FrontierItem {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(sourceTag, "sourceTag");
        if (depth < 1) throw new IllegalArgumentException("depth must be >= 1");
        if (pageIndex < 1) throw new IllegalArgumentException("pageIndex must be >= 1");
        if (bornAt == null) bornAt = Instant.now();
    }

    public static FrontierItem seed(URI target, String sourceTag) {
        return new FrontierItem(target, 1, 1, sourceTag, Instant.now());
    }

    /** 같은 페이지에서 발견된 링크: depth+1, pageIndex 유지 */
    public FrontierItem child(URI next) {
        return new FrontierItem(next, depth + 1, pageIndex, sourceTag, Instant.now());
    }

    /** 결과 목록 페이지인지(상세 링크로 내려간 아이템이 아닌지): 페이지 이동만 depth 를 pageIndex 와 같이 올린다 */
    public boolean isListingPage() {
        return depth == pageIndex;
    }

    /** 다음 결과 페이지: depth+1, pageIndex+1 */
    public FrontierItem nextPage(URI next) {
        return new FrontierItem(next, depth + 1, pageIndex + 1, sourceTag, Instant.now());
    }
}

package com.hostscout.core.model;

import java.net.URI;
import java.util.Objects;

/** 정규화된 발견 결과. key 는 식별자 토큰(소문자), uri 는 재조립된 정식 주소 */
public record CanonicalEntity(String key, URI uri) {
    public CanonicalEntity {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(uri, "uri");
    }
}

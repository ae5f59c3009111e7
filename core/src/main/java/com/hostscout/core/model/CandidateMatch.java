package com.hostscout.core.model;

import java.net.URI;
import java.util.Objects;

/** 정규화 전 원시 후보 */
public record CandidateMatch(String rawText, OriginField originField, URI sourceUri) {
    public CandidateMatch {
        Objects.requireNonNull(rawText, "rawText");
        Objects.requireNonNull(originField, "originField");
    }
}

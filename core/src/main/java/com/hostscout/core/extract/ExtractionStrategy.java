package com.hostscout.core.extract;

import com.hostscout.core.model.CandidateMatch;
import com.hostscout.core.model.FetchedDocument;

import java.util.Set;

/** 문서에서 후보 문자열을 뽑는 방법 하나. 실패는 CandidateExtractor 가 흡수한다. */
public interface ExtractionStrategy {
    String name();
    Set<CandidateMatch> extract(FetchedDocument doc, FingerprintRules rules) throws Exception;
}

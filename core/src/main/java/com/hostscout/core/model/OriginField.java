package com.hostscout.core.model;

/** 후보 문자열이 문서의 어디에서 나왔는지 */
public enum OriginField {
    BODY,
    LINK_HREF,
    LINK_TEXT,
    ATTRIBUTE,
    META_TAG,
    /** JSON 등 중첩 key/value 페이로드의 문자열 리프 */
    EMBEDDED
}

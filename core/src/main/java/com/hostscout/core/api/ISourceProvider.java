// ISourceProvider.java
package com.hostscout.core.api;

import com.hostscout.core.model.FetchedDocument;
import com.hostscout.core.model.FrontierItem;

import java.util.List;

/**
 * 소스 프로바이더 계약.
 * - seeds(): 시드 아이템(쿼리마다 sourceTag 가 다를 수 있다)
 * - nextLinksFrom(): 가져온 페이지에서 다음에 방문할 아이템(다음 결과 페이지, 상세 링크 등)
 * 깊이/페이지/방문 여부 판정은 프런티어가 하므로 여기서는 후보만 돌려주면 된다.
 */
public interface ISourceProvider {
    String name();
    List<FrontierItem> seeds();
    List<FrontierItem> nextLinksFrom(FetchedDocument page, FrontierItem item);
}

// IVerifier.java
package com.hostscout.core.api;

import com.hostscout.core.model.CanonicalEntity;

/** (선택) 엔티티가 실제로 지문을 가진 사이트인지 깊게 확인한다. */
@FunctionalInterface
public interface IVerifier {
    boolean verify(CanonicalEntity entity) throws InterruptedException;
}

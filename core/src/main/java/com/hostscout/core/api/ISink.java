// ISink.java
package com.hostscout.core.api;

import com.hostscout.core.model.CanonicalEntity;

import java.io.IOException;
import java.util.Set;

/** 최종 엔티티 집합을 영속화한다. */
public interface ISink {
    String name();
    void write(Set<CanonicalEntity> entities) throws IOException;
}

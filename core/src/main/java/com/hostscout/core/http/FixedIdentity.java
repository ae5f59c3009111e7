package com.hostscout.core.http;

import java.util.Objects;

public final class FixedIdentity implements RequestIdentity {
    private final String userAgent;

    public FixedIdentity(String userAgent) {
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
    }

    @Override public String userAgent() { return userAgent; }
}

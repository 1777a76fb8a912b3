package com.forrestgump.contactapi.domain.model;

public enum RateLimitScope {
    SOURCE_IDENTITY("sourceIdentity"),
    EMAIL("email");

    private final String wireName;

    RateLimitScope(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}

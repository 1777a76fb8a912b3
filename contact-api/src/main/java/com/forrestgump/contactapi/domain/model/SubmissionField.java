package com.forrestgump.contactapi.domain.model;

public enum SubmissionField {
    NAME("name"),
    EMAIL("email"),
    MESSAGE("message");

    private final String wireName;

    SubmissionField(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}

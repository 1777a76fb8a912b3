package com.forrestgump.contactapi.domain.model;

public record FieldViolation(SubmissionField field, Kind kind, String message) {

    public enum Kind {
        INVALID_INPUT,
        INVALID_EMAIL_FORMAT
    }
}

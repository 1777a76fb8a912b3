package com.forrestgump.contactapi.domain.exception;

public class DuplicateSubmissionException extends SubmissionRejectedException {

    private final String contentHash;

    public DuplicateSubmissionException(String contentHash) {
        super("Duplicate submission detected for content hash " + contentHash);
        this.contentHash = contentHash;
    }

    public String getContentHash() {
        return contentHash;
    }
}

package com.forrestgump.contactapi.domain.exception;

/**
 * Base type for outcomes caused by the caller's submission. These are terminal for the request and
 * are reported back to the caller as-is.
 */
public abstract class SubmissionRejectedException extends RuntimeException {

    protected SubmissionRejectedException(String message) {
        super(message);
    }
}

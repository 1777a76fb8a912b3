package com.forrestgump.contactapi.domain.exception;

import com.forrestgump.contactapi.domain.model.RateLimitScope;

public class RateLimitExceededException extends SubmissionRejectedException {

    private final RateLimitScope scope;
    private final long retryAfterSeconds;

    public RateLimitExceededException(RateLimitScope scope, long retryAfterSeconds) {
        super("Too many submissions for scope " + scope.wireName() + ", retry after " + retryAfterSeconds + "s");
        this.scope = scope;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public RateLimitScope getScope() {
        return scope;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}

package com.forrestgump.contactapi.domain.model;

import java.time.Instant;

/**
 * A validated form that passed the duplicate and rate checks and waits for its id.
 */
public record SubmissionCandidate(ContactForm form, String contentHash, Instant acceptedAt) {

    public Submission withId(String id) {
        return new Submission(id, form.name(), form.email(), form.body(), contentHash,
                form.sourceIdentity(), acceptedAt);
    }
}

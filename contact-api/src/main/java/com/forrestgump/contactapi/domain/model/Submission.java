package com.forrestgump.contactapi.domain.model;

import java.time.Instant;

/**
 * An accepted, persisted contact submission. Instances are never modified once stored.
 */
public record Submission(
        String id,
        String name,
        String email,
        String body,
        String contentHash,
        String sourceIdentity,
        Instant createdAt
) {
    public Submission {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Submission id is required");
        }
        if (contentHash == null || contentHash.isBlank()) {
            throw new IllegalArgumentException("Content hash is required");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("Creation timestamp is required");
        }
    }
}

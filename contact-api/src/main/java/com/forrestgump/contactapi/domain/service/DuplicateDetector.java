package com.forrestgump.contactapi.domain.service;

import com.forrestgump.contactapi.domain.exception.DuplicateSubmissionException;
import com.forrestgump.contactapi.domain.port.SubmissionStore;
import com.forrestgump.contactapi.infrastructure.config.ContactProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

/**
 * Rejects content that was already accepted. This read is advisory only: two identical submissions can
 * both pass it, and {@link SubmissionStore#insertIfAbsent} decides between them.
 */
@Service
public class DuplicateDetector {

    private static final Logger logger = LoggerFactory.getLogger(DuplicateDetector.class);
    private final SubmissionStore submissionStore;
    private final Duration duplicateWindow;

    public DuplicateDetector(SubmissionStore submissionStore, ContactProperties contactProperties) {
        this.submissionStore = submissionStore;
        this.duplicateWindow = contactProperties.duplicateWindow();
    }

    public Mono<Void> check(String contentHash, Instant now) {
        return submissionStore.existsByContentHash(contentHash, duplicateSince(now))
                .flatMap(exists -> {
                    if (Boolean.TRUE.equals(exists)) {
                        logger.info("Duplicate content detected, contentHash: {}", contentHash);
                        return Mono.<Void>error(new DuplicateSubmissionException(contentHash));
                    }
                    return Mono.<Void>empty();
                });
    }

    /**
     * Earliest creation time that still counts as a duplicate, or {@code null} when detection never expires.
     */
    public Instant duplicateSince(Instant now) {
        return duplicateWindow == null ? null : now.minus(duplicateWindow);
    }
}

package com.forrestgump.contactapi.domain.port;

import com.forrestgump.contactapi.domain.model.Submission;
import com.forrestgump.contactapi.domain.model.SubmissionCandidate;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Durable, append-only storage of accepted submissions.
 *
 * <p>Every operation is a single attempt. Storage faults surface as
 * {@link com.forrestgump.contactapi.infrastructure.exception.StoreUnavailableException}.
 */
public interface SubmissionStore {

    /**
     * Whether a submission with the given content hash exists.
     *
     * @param since only consider submissions created at or after this instant; {@code null} means any time
     */
    Mono<Boolean> existsByContentHash(String contentHash, Instant since);

    /**
     * Submissions from one source identity created at or after {@code since}, oldest first, at most {@code limit}.
     */
    Flux<Submission> findBySourceIdentity(String sourceIdentity, Instant since, int limit);

    /**
     * Submissions from one sender email created at or after {@code since}, oldest first, at most {@code limit}.
     */
    Flux<Submission> findByEmail(String email, Instant since, int limit);

    /**
     * Atomically persists the candidate unless a submission with the same content hash already exists
     * (created at or after {@code duplicateSince}, or ever when {@code null}). The id is assigned here.
     *
     * <p>Signals {@link com.forrestgump.contactapi.domain.exception.DuplicateSubmissionException} when the
     * condition fails.
     *
     * <p>A failure signalled after the write was sent (a timeout, typically) does not prove the write was
     * lost: the submission may be stored even though the caller saw an error.
     */
    Mono<Submission> insertIfAbsent(SubmissionCandidate candidate, Instant duplicateSince);
}

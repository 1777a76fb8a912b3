package com.forrestgump.contactapi.support;

import com.forrestgump.contactapi.domain.exception.DuplicateSubmissionException;
import com.forrestgump.contactapi.domain.model.Submission;
import com.forrestgump.contactapi.domain.model.SubmissionCandidate;
import com.forrestgump.contactapi.domain.port.SubmissionStore;
import com.forrestgump.contactapi.infrastructure.exception.StoreUnavailableException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Store double with the same conditional-insert guarantee as the DynamoDB adapter: the content-hash claim
 * is taken atomically, so concurrent identical inserts leave exactly one record.
 */
public class InMemorySubmissionStore implements SubmissionStore {

    private final Map<String, Submission> submissions = new ConcurrentHashMap<>();
    private final Map<String, Submission> claims = new ConcurrentHashMap<>();
    private final AtomicInteger insertAttempts = new AtomicInteger();
    private volatile boolean unavailable;
    private volatile boolean writesUnavailable;

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    public void setWritesUnavailable(boolean writesUnavailable) {
        this.writesUnavailable = writesUnavailable;
    }

    public void preload(Submission submission) {
        submissions.put(submission.id(), submission);
        claims.merge(submission.contentHash(), submission,
                (existing, next) -> next.createdAt().isAfter(existing.createdAt()) ? next : existing);
    }

    public List<Submission> all() {
        return new ArrayList<>(submissions.values());
    }

    public int insertAttempts() {
        return insertAttempts.get();
    }

    @Override
    public Mono<Boolean> existsByContentHash(String contentHash, Instant since) {
        return Mono.fromCallable(() -> {
            checkAvailable();
            return submissions.values().stream()
                    .anyMatch(s -> s.contentHash().equals(contentHash) && inWindow(s, since));
        });
    }

    @Override
    public Flux<Submission> findBySourceIdentity(String sourceIdentity, Instant since, int limit) {
        return query(s -> s.sourceIdentity().equals(sourceIdentity), since, limit);
    }

    @Override
    public Flux<Submission> findByEmail(String email, Instant since, int limit) {
        return query(s -> s.email().equals(email), since, limit);
    }

    @Override
    public Mono<Submission> insertIfAbsent(SubmissionCandidate candidate, Instant duplicateSince) {
        return Mono.fromCallable(() -> {
            insertAttempts.incrementAndGet();
            checkAvailable();
            if (writesUnavailable) {
                throw new StoreUnavailableException("Simulated write outage", new IllegalStateException("down"));
            }
            Submission submission = candidate.withId(UUID.randomUUID().toString());
            AtomicBoolean claimed = new AtomicBoolean();
            claims.compute(candidate.contentHash(), (hash, existing) -> {
                if (existing == null || (duplicateSince != null && existing.createdAt().isBefore(duplicateSince))) {
                    claimed.set(true);
                    return submission;
                }
                return existing;
            });
            if (!claimed.get()) {
                throw new DuplicateSubmissionException(candidate.contentHash());
            }
            submissions.put(submission.id(), submission);
            return submission;
        });
    }

    private Flux<Submission> query(Predicate<Submission> key, Instant since, int limit) {
        return Flux.defer(() -> {
            checkAvailable();
            return Flux.fromIterable(submissions.values().stream()
                    .filter(key)
                    .filter(s -> inWindow(s, since))
                    .sorted(Comparator.comparing(Submission::createdAt))
                    .limit(limit)
                    .toList());
        });
    }

    private void checkAvailable() {
        if (unavailable) {
            throw new StoreUnavailableException("Simulated store outage", new IllegalStateException("down"));
        }
    }

    private static boolean inWindow(Submission submission, Instant since) {
        return since == null || !submission.createdAt().isBefore(since);
    }
}

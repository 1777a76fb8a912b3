package com.forrestgump.contactapi.application.usecase;

import com.forrestgump.contactapi.domain.exception.DuplicateSubmissionException;
import com.forrestgump.contactapi.domain.exception.RateLimitExceededException;
import com.forrestgump.contactapi.domain.exception.SubmissionRejectedException;
import com.forrestgump.contactapi.domain.exception.SubmissionValidationException;
import com.forrestgump.contactapi.domain.model.ContactForm;
import com.forrestgump.contactapi.domain.model.Submission;
import com.forrestgump.contactapi.domain.model.SubmissionCandidate;
import com.forrestgump.contactapi.domain.port.NotificationDispatcher;
import com.forrestgump.contactapi.domain.port.SubmissionStore;
import com.forrestgump.contactapi.domain.service.ContentHasher;
import com.forrestgump.contactapi.domain.service.DuplicateDetector;
import com.forrestgump.contactapi.domain.service.SubmissionNormalizer;
import com.forrestgump.contactapi.domain.service.SubmissionRateLimiter;
import com.forrestgump.contactapi.domain.service.SubmissionValidator;
import com.forrestgump.contactapi.infrastructure.metrics.MetricsPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * Runs one contact submission through normalization, validation, hashing, the duplicate and rate checks,
 * the conditional insert and the operator notification. The first failing stage ends the pipeline.
 *
 * <p>The insert is the commit point. Nothing after it can turn an accepted submission into a failure.
 */
@Service
public class SubmitContactUseCase {

    private static final Logger logger = LoggerFactory.getLogger(SubmitContactUseCase.class);
    private final SubmissionNormalizer normalizer;
    private final SubmissionValidator validator;
    private final ContentHasher contentHasher;
    private final DuplicateDetector duplicateDetector;
    private final SubmissionRateLimiter rateLimiter;
    private final SubmissionStore submissionStore;
    private final NotificationDispatcher notificationDispatcher;
    private final MetricsPublisher metricsPublisher;
    private final Clock clock;

    public SubmitContactUseCase(SubmissionNormalizer normalizer, SubmissionValidator validator,
                                ContentHasher contentHasher, DuplicateDetector duplicateDetector,
                                SubmissionRateLimiter rateLimiter, SubmissionStore submissionStore,
                                NotificationDispatcher notificationDispatcher, MetricsPublisher metricsPublisher,
                                Clock clock) {
        this.normalizer = normalizer;
        this.validator = validator;
        this.contentHasher = contentHasher;
        this.duplicateDetector = duplicateDetector;
        this.rateLimiter = rateLimiter;
        this.submissionStore = submissionStore;
        this.notificationDispatcher = notificationDispatcher;
        this.metricsPublisher = metricsPublisher;
        this.clock = clock;
    }

    public Mono<Submission> execute(ContactForm rawForm, String correlationId) {
        return Mono.defer(() -> {
                    Instant now = clock.instant();
                    ContactForm form = validator.validate(normalizer.normalize(rawForm));
                    SubmissionCandidate candidate = new SubmissionCandidate(form, contentHasher.hash(form), now);
                    logger.info("Submitting contact message, correlationId: {}, contentHash: {}, source: {}",
                            correlationId, candidate.contentHash(), form.sourceIdentity());
                    return duplicateDetector.check(candidate.contentHash(), now)
                            .then(rateLimiter.check(form, now))
                            .then(Mono.defer(() -> submissionStore.insertIfAbsent(candidate,
                                    duplicateDetector.duplicateSince(now))));
                })
                .flatMap(stored -> notificationDispatcher.dispatch(stored)
                        .defaultIfEmpty(Boolean.FALSE)
                        .map(notified -> {
                            logger.info("Contact message accepted, correlationId: {}, id: {}, notified: {}",
                                    correlationId, stored.id(), notified);
                            return stored;
                        }))
                .doOnSuccess(stored -> metricsPublisher.incrementSubmission("accepted"))
                .doOnError(SubmissionValidationException.class, e -> {
                    metricsPublisher.incrementSubmission("invalid");
                    logger.info("Contact message rejected, correlationId: {}, errors: {}", correlationId, e.getMessage());
                })
                .doOnError(DuplicateSubmissionException.class, e -> {
                    metricsPublisher.incrementSubmission("duplicate");
                    logger.info("Duplicate contact message rejected, correlationId: {}, contentHash: {}",
                            correlationId, e.getContentHash());
                })
                .doOnError(RateLimitExceededException.class, e -> {
                    metricsPublisher.incrementSubmission("rate_limited");
                    metricsPublisher.incrementRateLimit(e.getScope().wireName());
                })
                .doOnError(e -> !(e instanceof SubmissionRejectedException), e -> {
                    metricsPublisher.incrementSubmission("error");
                    logger.error("Failed to process contact message, correlationId: {}, error: {}",
                            correlationId, e.getMessage());
                });
    }
}

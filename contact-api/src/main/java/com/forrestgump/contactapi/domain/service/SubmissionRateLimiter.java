package com.forrestgump.contactapi.domain.service;

import com.forrestgump.contactapi.domain.exception.RateLimitExceededException;
import com.forrestgump.contactapi.domain.model.ContactForm;
import com.forrestgump.contactapi.domain.model.RateLimitScope;
import com.forrestgump.contactapi.domain.model.Submission;
import com.forrestgump.contactapi.domain.port.SubmissionStore;
import com.forrestgump.contactapi.infrastructure.config.ContactProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Sliding-window ceilings on accepted submissions per source identity and per sender email.
 *
 * <p>Counts come from stored history, so the check and the later insert are not atomic. Concurrent
 * submissions close to a ceiling may both pass. That weaker enforcement is accepted here; the front door
 * applies its own request throttling in front of this service.
 */
@Service
public class SubmissionRateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(SubmissionRateLimiter.class);
    private final SubmissionStore submissionStore;
    private final int perSource;
    private final int perEmail;
    private final Duration window;

    public SubmissionRateLimiter(SubmissionStore submissionStore, ContactProperties contactProperties) {
        this.submissionStore = submissionStore;
        this.perSource = contactProperties.rateLimit().perSource();
        this.perEmail = contactProperties.rateLimit().perEmail();
        this.window = contactProperties.rateLimit().window();
    }

    /**
     * Completes empty when both scopes are under their ceiling. The source identity is checked first.
     */
    public Mono<Void> check(ContactForm form, Instant now) {
        Instant since = now.minus(window);
        return Mono.defer(() -> checkScope(RateLimitScope.SOURCE_IDENTITY, form.sourceIdentity(),
                        submissionStore.findBySourceIdentity(form.sourceIdentity(), since, perSource), perSource, now))
                .then(Mono.defer(() -> checkScope(RateLimitScope.EMAIL, form.email(),
                        submissionStore.findByEmail(form.email(), since, perEmail), perEmail, now)));
    }

    private Mono<Void> checkScope(RateLimitScope scope, String key, Flux<Submission> recent, int ceiling, Instant now) {
        return recent.take(ceiling)
                .collectList()
                .flatMap(counted -> {
                    if (counted.size() < ceiling) {
                        return Mono.<Void>empty();
                    }
                    long retryAfter = retryAfterSeconds(oldest(counted), now);
                    logger.warn("Rate limit reached, scope: {}, key: {}, count: {}, retryAfterSeconds: {}",
                            scope.wireName(), key, counted.size(), retryAfter);
                    return Mono.<Void>error(new RateLimitExceededException(scope, retryAfter));
                });
    }

    private static Instant oldest(List<Submission> counted) {
        return counted.stream()
                .map(Submission::createdAt)
                .min(Comparator.naturalOrder())
                .orElseThrow();
    }

    long retryAfterSeconds(Instant oldest, Instant now) {
        long remainingMillis = Duration.between(now, oldest.plus(window)).toMillis();
        long seconds = (remainingMillis + 999) / 1000;
        return Math.max(1, seconds);
    }
}

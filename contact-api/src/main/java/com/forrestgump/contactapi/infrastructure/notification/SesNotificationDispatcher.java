package com.forrestgump.contactapi.infrastructure.notification;

import com.forrestgump.contactapi.domain.model.Submission;
import com.forrestgump.contactapi.domain.port.NotificationDispatcher;
import com.forrestgump.contactapi.infrastructure.config.ContactProperties;
import com.forrestgump.contactapi.infrastructure.exception.NotificationFailedException;
import com.forrestgump.contactapi.infrastructure.metrics.MetricsPublisher;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.services.ses.SesAsyncClient;
import software.amazon.awssdk.services.ses.model.Body;
import software.amazon.awssdk.services.ses.model.Content;
import software.amazon.awssdk.services.ses.model.Destination;
import software.amazon.awssdk.services.ses.model.Message;
import software.amazon.awssdk.services.ses.model.SendEmailRequest;

import java.time.Duration;

/**
 * Emails the operator through Amazon SES. Failures are logged and counted, then swallowed.
 */
@Component
public class SesNotificationDispatcher implements NotificationDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(SesNotificationDispatcher.class);
    private final SesAsyncClient sesAsyncClient;
    private final MetricsPublisher metricsPublisher;
    private final CircuitBreaker sesCircuitBreaker;
    private final ContactProperties.Notification settings;
    private final Duration timeout;

    public SesNotificationDispatcher(SesAsyncClient sesAsyncClient, MetricsPublisher metricsPublisher,
                                     @Qualifier("sesCircuitBreaker") CircuitBreaker sesCircuitBreaker,
                                     ContactProperties contactProperties) {
        this.sesAsyncClient = sesAsyncClient;
        this.metricsPublisher = metricsPublisher;
        this.sesCircuitBreaker = sesCircuitBreaker;
        this.settings = contactProperties.notification();
        this.timeout = settings.timeout();
    }

    @Override
    public Mono<Boolean> dispatch(Submission submission) {
        if (!settings.enabled() || isBlank(settings.sender()) || isBlank(settings.recipient())) {
            logger.debug("Notification disabled or not configured, skipping id: {}", submission.id());
            metricsPublisher.incrementNotification("skipped");
            return Mono.just(Boolean.FALSE);
        }

        return Mono.defer(() -> Mono.fromFuture(sesAsyncClient.sendEmail(buildRequest(submission))))
                .timeout(timeout)
                .transformDeferred(CircuitBreakerOperator.of(sesCircuitBreaker))
                .onErrorMap(e -> new NotificationFailedException("Failed to send notification via SES", e))
                .map(response -> {
                    metricsPublisher.incrementNotification("success");
                    logger.info("Notification sent, id: {}, sesMessageId: {}", submission.id(), response.messageId());
                    return Boolean.TRUE;
                })
                .onErrorResume(NotificationFailedException.class, e -> {
                    metricsPublisher.incrementNotification("error");
                    logger.warn("Notification failed, submission kept, id: {}, error: {}", submission.id(),
                            e.getCause() == null ? e.getMessage() : e.getCause().toString());
                    return Mono.just(Boolean.FALSE);
                });
    }

    SendEmailRequest buildRequest(Submission submission) {
        String text = "You have a new message from your portfolio:\n\n"
                + "Name: " + submission.name() + "\n"
                + "Email: " + submission.email() + "\n"
                + "Message: " + submission.body();
        return SendEmailRequest.builder()
                .source(settings.sender())
                .destination(Destination.builder().toAddresses(settings.recipient()).build())
                .replyToAddresses(submission.email())
                .message(Message.builder()
                        .subject(Content.builder().data("New Portfolio Contact: " + submission.name()).charset("UTF-8").build())
                        .body(Body.builder()
                                .text(Content.builder().data(text).charset("UTF-8").build())
                                .build())
                        .build())
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

package com.forrestgump.contactapi.domain.port;

import com.forrestgump.contactapi.domain.model.Submission;
import reactor.core.publisher.Mono;

/**
 * Best-effort notification of the operator about an accepted submission.
 */
public interface NotificationDispatcher {

    /**
     * Attempts one notification. Never signals an error.
     *
     * @return {@code true} when the notification was handed to the dispatch service
     */
    Mono<Boolean> dispatch(Submission submission);
}

package com.forrestgump.contactapi.infrastructure.exception;

/**
 * Raised inside the notification adapter only. It never escapes the dispatcher.
 */
public class NotificationFailedException extends InfrastructureException {

    public NotificationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}

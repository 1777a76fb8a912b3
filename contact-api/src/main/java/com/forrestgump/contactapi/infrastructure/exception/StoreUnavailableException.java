package com.forrestgump.contactapi.infrastructure.exception;

public class StoreUnavailableException extends InfrastructureException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.forrestgump.contactapi.interfaces.rest;

import com.forrestgump.contactapi.domain.exception.SubmissionRejectedException;
import com.forrestgump.contactapi.infrastructure.exception.InfrastructureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private final SubmissionResponseMapper responseMapper;

    public GlobalExceptionHandler(SubmissionResponseMapper responseMapper) {
        this.responseMapper = responseMapper;
    }

    @ExceptionHandler(SubmissionRejectedException.class)
    public Mono<ResponseEntity<Object>> handleRejectedSubmission(SubmissionRejectedException e) {
        return Mono.just(responseMapper.rejected(e));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<Object>> handleInputException(ServerWebInputException e) {
        logger.warn("Unreadable request: {}", e.getReason());
        return Mono.just(responseMapper.rejected(e));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<Object>> handleStatusException(ResponseStatusException e) {
        return Mono.just(ResponseEntity.status(e.getStatusCode()).build());
    }

    @ExceptionHandler(InfrastructureException.class)
    public Mono<ResponseEntity<Object>> handleInfrastructureException(InfrastructureException e) {
        logger.error("Infrastructure error: {}", e.getMessage());
        return Mono.just(responseMapper.rejected(e));
    }

    @ExceptionHandler(RuntimeException.class)
    public Mono<ResponseEntity<Object>> handleUnexpected(RuntimeException e) {
        logger.error("Unexpected error: {}", e.toString());
        return Mono.just(responseMapper.rejected(e));
    }
}

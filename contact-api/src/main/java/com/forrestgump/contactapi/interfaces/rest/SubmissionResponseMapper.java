package com.forrestgump.contactapi.interfaces.rest;

import com.forrestgump.contactapi.domain.exception.DuplicateSubmissionException;
import com.forrestgump.contactapi.domain.exception.RateLimitExceededException;
import com.forrestgump.contactapi.domain.exception.SubmissionValidationException;
import com.forrestgump.contactapi.domain.model.Submission;
import com.forrestgump.contactapi.domain.model.SubmissionField;
import com.forrestgump.contactapi.interfaces.rest.dto.ContactResponse;
import com.forrestgump.contactapi.interfaces.rest.dto.ErrorResponse;
import com.forrestgump.contactapi.interfaces.rest.dto.RateLimitedResponse;
import com.forrestgump.contactapi.interfaces.rest.dto.ValidationErrorResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebInputException;

import java.util.List;

/**
 * Translates pipeline outcomes into HTTP responses. Anything it does not recognise is an internal error
 * and is reported without detail.
 */
@Component
public class SubmissionResponseMapper {

    static final String UNREADABLE_REQUEST_FIELD = "request";

    public ResponseEntity<Object> accepted(Submission submission) {
        return ResponseEntity.ok(new ContactResponse(submission.id()));
    }

    public ResponseEntity<Object> rejected(Throwable error) {
        if (error instanceof SubmissionValidationException) {
            List<String> fields = ((SubmissionValidationException) error).getFields().stream()
                    .map(SubmissionField::wireName)
                    .toList();
            return ResponseEntity.badRequest().body(new ValidationErrorResponse(fields));
        }
        if (error instanceof ServerWebInputException) {
            return ResponseEntity.badRequest().body(new ValidationErrorResponse(List.of(UNREADABLE_REQUEST_FIELD)));
        }
        if (error instanceof DuplicateSubmissionException) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(new ErrorResponse("duplicate_message", "This message has already been submitted"));
        }
        if (error instanceof RateLimitExceededException) {
            RateLimitExceededException limited = (RateLimitExceededException) error;
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .header(HttpHeaders.RETRY_AFTER, Long.toString(limited.getRetryAfterSeconds()))
                    .body(new RateLimitedResponse(limited.getRetryAfterSeconds(), limited.getScope().wireName()));
        }
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("internal_error", "Internal server error"));
    }
}

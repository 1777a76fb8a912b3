package com.forrestgump.contactapi.interfaces.rest.controller;

import com.forrestgump.contactapi.application.usecase.SubmitContactUseCase;
import com.forrestgump.contactapi.domain.model.ContactForm;
import com.forrestgump.contactapi.interfaces.rest.SourceIdentityResolver;
import com.forrestgump.contactapi.interfaces.rest.SubmissionResponseMapper;
import com.forrestgump.contactapi.interfaces.rest.dto.ContactRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.UUID;

@RestController
@RequestMapping("/contact")
public class ContactController {

    static final String CORRELATION_ID = "X-Correlation-Id";

    private static final Logger logger = LoggerFactory.getLogger(ContactController.class);
    private final SubmitContactUseCase submitContactUseCase;
    private final SubmissionResponseMapper responseMapper;
    private final SourceIdentityResolver sourceIdentityResolver;

    public ContactController(SubmitContactUseCase submitContactUseCase, SubmissionResponseMapper responseMapper,
                             SourceIdentityResolver sourceIdentityResolver) {
        this.submitContactUseCase = submitContactUseCase;
        this.responseMapper = responseMapper;
        this.sourceIdentityResolver = sourceIdentityResolver;
    }

    @PostMapping
    public Mono<ResponseEntity<Object>> submit(
            @RequestBody(required = false) Mono<ContactRequest> requestMono,
            @RequestHeader(value = CORRELATION_ID, defaultValue = "") String correlationId,
            ServerWebExchange exchange) {
        String effectiveCorrelationId = correlationId.isBlank() ? UUID.randomUUID().toString() : correlationId;
        String sourceIdentity = sourceIdentityResolver.resolve(exchange.getRequest());
        exchange.getResponse().getHeaders().set(CORRELATION_ID, effectiveCorrelationId);

        return requestMono
                .defaultIfEmpty(ContactRequest.empty())
                .doOnError(e -> logger.warn("Unreadable contact request, correlationId: {}, source: {}, error: {}",
                        effectiveCorrelationId, sourceIdentity, e.getMessage()))
                .map(request -> new ContactForm(request.name(), request.email(), request.message(), sourceIdentity))
                .flatMap(form -> submitContactUseCase.execute(form, effectiveCorrelationId))
                .map(responseMapper::accepted);
    }
}

package com.forrestgump.contactapi.interfaces.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RateLimitedResponse(
        @JsonProperty("retryAfterSeconds") long retryAfterSeconds,
        @JsonProperty("scope") String scope
) {}

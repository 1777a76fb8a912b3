package com.forrestgump.contactapi.interfaces.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ValidationErrorResponse(
        @JsonProperty("errors") List<String> errors
) {}

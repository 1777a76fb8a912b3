package com.forrestgump.contactapi.interfaces.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ContactResponse(
        @JsonProperty("id") String id
) {}

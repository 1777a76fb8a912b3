package com.forrestgump.contactapi.interfaces.rest.dto;

public record ContactRequest(
        String name,
        String email,
        String message
) {
    public static ContactRequest empty() {
        return new ContactRequest(null, null, null);
    }
}

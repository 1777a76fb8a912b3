package com.forrestgump.contactapi.domain.model;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * A contact form as received from the caller. The constraints apply to the normalized form only;
 * run it through {@link com.forrestgump.contactapi.domain.service.SubmissionNormalizer} first.
 */
public record ContactForm(
        @NotBlank(message = "Name is required")
        @Size(max = 200, message = "Name must be at most 200 characters") String name,
        @NotBlank(message = "Email is required")
        @Size(max = 254, message = "Email must be at most 254 characters")
        @Email(regexp = ContactForm.EMAIL_PATTERN, message = "Invalid email format") String email,
        @NotBlank(message = "Message is required")
        @Size(max = 5000, message = "Message must be at most 5000 characters") String body,
        String sourceIdentity
) {
    public static final String EMAIL_PATTERN = "^[\\w.+-]+@([\\w-]+\\.)+[\\w-]{2,}$";
}

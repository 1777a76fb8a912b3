package com.forrestgump.contactapi.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Submission policy and collaborator settings under the {@code contact} prefix.
 *
 * <p>{@code duplicateWindow} left unset means duplicate detection never expires.
 */
@ConfigurationProperties(prefix = "contact")
public record ContactProperties(
        RateLimit rateLimit,
        Duration duplicateWindow,
        Store store,
        Notification notification,
        Cors cors
) {
    public ContactProperties {
        if (rateLimit == null) {
            rateLimit = new RateLimit(null, null, null);
        }
        if (store == null) {
            store = new Store(null);
        }
        if (notification == null) {
            notification = new Notification(null, null, null, null);
        }
        if (cors == null) {
            cors = new Cors(null);
        }
        if (duplicateWindow != null && (duplicateWindow.isZero() || duplicateWindow.isNegative())) {
            throw new IllegalArgumentException("contact.duplicate-window must be positive when set");
        }
    }

    public static ContactProperties defaults() {
        return new ContactProperties(null, null, null, null, null);
    }

    public record RateLimit(Integer perSource, Integer perEmail, Duration window) {
        public RateLimit {
            if (perSource == null) {
                perSource = 10;
            }
            if (perEmail == null) {
                perEmail = 5;
            }
            if (window == null) {
                window = Duration.ofHours(1);
            }
            if (perSource < 1 || perEmail < 1) {
                throw new IllegalArgumentException("Rate limit ceilings must be at least 1");
            }
            if (window.isZero() || window.isNegative()) {
                throw new IllegalArgumentException("contact.rate-limit.window must be positive");
            }
        }
    }

    public record Store(Duration timeout) {
        public Store {
            if (timeout == null) {
                timeout = Duration.ofSeconds(3);
            }
        }
    }

    public record Notification(Boolean enabled, String sender, String recipient, Duration timeout) {
        public Notification {
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
            if (timeout == null) {
                timeout = Duration.ofSeconds(5);
            }
        }
    }

    public record Cors(List<String> allowedOrigins) {
        public Cors {
            allowedOrigins = allowedOrigins == null || allowedOrigins.isEmpty() ? List.of("*") : List.copyOf(allowedOrigins);
        }
    }
}

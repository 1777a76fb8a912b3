package com.forrestgump.contactapi.infrastructure.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsPublisher {

    private final MeterRegistry meterRegistry;

    public MetricsPublisher(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void incrementSubmission(String outcome) {
        meterRegistry.counter("contact.submission.count", "outcome", outcome).increment();
    }

    public void incrementRateLimit(String scope) {
        meterRegistry.counter("contact.rate_limit.count", "scope", scope).increment();
    }

    public void incrementNotification(String status) {
        meterRegistry.counter("contact.notification.count", "status", status).increment();
    }
}

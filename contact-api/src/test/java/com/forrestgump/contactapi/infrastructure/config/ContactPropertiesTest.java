package com.forrestgump.contactapi.infrastructure.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ContactPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesConfiguration.class);

    @Test
    void appliesDefaultsWhenNothingIsSet() {
        contextRunner.run(context -> {
            ContactProperties properties = context.getBean(ContactProperties.class);
            assertThat(properties.rateLimit().perSource()).isEqualTo(10);
            assertThat(properties.rateLimit().perEmail()).isEqualTo(5);
            assertThat(properties.rateLimit().window()).isEqualTo(Duration.ofHours(1));
            assertThat(properties.duplicateWindow()).isNull();
            assertThat(properties.store().timeout()).isEqualTo(Duration.ofSeconds(3));
            assertThat(properties.notification().enabled()).isTrue();
            assertThat(properties.cors().allowedOrigins()).containsExactly("*");
        });
    }

    @Test
    void bindsOverrides() {
        contextRunner
                .withPropertyValues(
                        "contact.rate-limit.per-source=3",
                        "contact.rate-limit.window=10m",
                        "contact.duplicate-window=PT5M",
                        "contact.notification.sender=noreply@example.com",
                        "contact.notification.recipient=owner@example.com",
                        "contact.cors.allowed-origins=https://example.com,https://www.example.com")
                .run(context -> {
                    ContactProperties properties = context.getBean(ContactProperties.class);
                    assertThat(properties.rateLimit().perSource()).isEqualTo(3);
                    assertThat(properties.rateLimit().perEmail()).isEqualTo(5);
                    assertThat(properties.rateLimit().window()).isEqualTo(Duration.ofMinutes(10));
                    assertThat(properties.duplicateWindow()).isEqualTo(Duration.ofMinutes(5));
                    assertThat(properties.notification().recipient()).isEqualTo("owner@example.com");
                    assertThat(properties.cors().allowedOrigins())
                            .containsExactly("https://example.com", "https://www.example.com");
                });
    }

    @Test
    void rejectsNonPositiveCeiling() {
        contextRunner
                .withPropertyValues("contact.rate-limit.per-email=0")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void rejectsZeroDuplicateWindow() {
        contextRunner
                .withPropertyValues("contact.duplicate-window=0s")
                .run(context -> assertThat(context).hasFailed());
    }

    @Configuration
    @EnableConfigurationProperties(ContactProperties.class)
    static class PropertiesConfiguration {
    }
}

package com.forrestgump.contactapi.domain.service;

import com.forrestgump.contactapi.domain.exception.DuplicateSubmissionException;
import com.forrestgump.contactapi.domain.port.SubmissionStore;
import com.forrestgump.contactapi.infrastructure.config.ContactProperties;
import com.forrestgump.contactapi.infrastructure.exception.StoreUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DuplicateDetectorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private SubmissionStore store;

    @BeforeEach
    void setUp() {
        store = mock(SubmissionStore.class);
    }

    @Test
    void passesWhenContentIsNew() {
        when(store.existsByContentHash(eq("abc"), isNull())).thenReturn(Mono.just(false));

        StepVerifier.create(new DuplicateDetector(store, ContactProperties.defaults()).check("abc", NOW))
                .verifyComplete();
    }

    @Test
    void rejectsKnownContentWithoutExpiryByDefault() {
        when(store.existsByContentHash(eq("abc"), isNull())).thenReturn(Mono.just(true));

        StepVerifier.create(new DuplicateDetector(store, ContactProperties.defaults()).check("abc", NOW))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(DuplicateSubmissionException.class)
                        .extracting("contentHash").isEqualTo("abc"))
                .verify();
    }

    @Test
    void limitsLookupToConfiguredWindow() {
        ContactProperties properties = new ContactProperties(null, Duration.ofMinutes(5), null, null, null);
        DuplicateDetector detector = new DuplicateDetector(store, properties);
        Instant since = NOW.minus(Duration.ofMinutes(5));
        when(store.existsByContentHash("abc", since)).thenReturn(Mono.just(false));

        StepVerifier.create(detector.check("abc", NOW)).verifyComplete();

        verify(store).existsByContentHash("abc", since);
        assertThat(detector.duplicateSince(NOW)).isEqualTo(since);
    }

    @Test
    void propagatesStoreFailure() {
        when(store.existsByContentHash(eq("abc"), isNull()))
                .thenReturn(Mono.error(new StoreUnavailableException("down", new RuntimeException())));

        StepVerifier.create(new DuplicateDetector(store, ContactProperties.defaults()).check("abc", NOW))
                .expectError(StoreUnavailableException.class)
                .verify();
    }
}

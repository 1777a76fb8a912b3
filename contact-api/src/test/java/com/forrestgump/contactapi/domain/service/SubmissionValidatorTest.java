package com.forrestgump.contactapi.domain.service;

import com.forrestgump.contactapi.domain.exception.SubmissionValidationException;
import com.forrestgump.contactapi.domain.model.ContactForm;
import com.forrestgump.contactapi.domain.model.FieldViolation;
import com.forrestgump.contactapi.domain.model.SubmissionField;
import com.forrestgump.contactapi.support.TestPipelines;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.tuple;

/**
 * The validator runs on normalized forms, so the inputs here are already trimmed and lower-cased.
 */
class SubmissionValidatorTest {

    private final SubmissionValidator validator = TestPipelines.validator();

    @Test
    void acceptsCompleteForm() {
        ContactForm form = new ContactForm("John Doe", "john@example.com", "Hello!", "203.0.113.7");

        assertThat(validator.validate(form)).isSameAs(form);
    }

    @Test
    void reportsEmptyNameOnly() {
        SubmissionValidationException e = rejected(new ContactForm("", "john@example.com", "Hi", "ip"));

        assertThat(e.getFields()).containsExactly(SubmissionField.NAME);
        assertThat(e.getViolations().get(0).kind()).isEqualTo(FieldViolation.Kind.INVALID_INPUT);
    }

    @Test
    void reportsMalformedEmailAsFormatFailure() {
        SubmissionValidationException e = rejected(new ContactForm("A", "not-an-email", "Hi", "ip"));

        assertThat(e.getFields()).containsExactly(SubmissionField.EMAIL);
        assertThat(e.getViolations().get(0).kind()).isEqualTo(FieldViolation.Kind.INVALID_EMAIL_FORMAT);
    }

    @Test
    void reportsMissingEmailAsPresenceFailure() {
        SubmissionValidationException e = rejected(new ContactForm("A", "", "Hi", "ip"));

        assertThat(e.getViolations())
                .extracting(FieldViolation::field, FieldViolation::kind)
                .containsExactly(tuple(SubmissionField.EMAIL, FieldViolation.Kind.INVALID_INPUT));
    }

    @Test
    void reportsEveryViolatedFieldInFormOrder() {
        SubmissionValidationException e = rejected(new ContactForm("", "", "", "ip"));

        assertThat(e.getFields()).containsExactly(SubmissionField.NAME, SubmissionField.EMAIL, SubmissionField.MESSAGE);
    }

    @Test
    void reportsMixedPresenceAndFormatFailuresTogether() {
        SubmissionValidationException e = rejected(new ContactForm("", "john@", "Hi", "ip"));

        assertThat(e.getViolations())
                .extracting(FieldViolation::kind)
                .containsExactly(FieldViolation.Kind.INVALID_INPUT, FieldViolation.Kind.INVALID_EMAIL_FORMAT);
        assertThat(e.getFields()).containsExactly(SubmissionField.NAME, SubmissionField.EMAIL);
    }

    @ParameterizedTest
    @ValueSource(strings = {"user@domain", "@example.com", "user@", "user @example.com", "user@.com", "plainaddress"})
    void rejectsMalformedAddresses(String email) {
        SubmissionValidationException e = rejected(new ContactForm("A", email, "Hi", "ip"));

        assertThat(e.getFields()).containsExactly(SubmissionField.EMAIL);
    }

    @ParameterizedTest
    @ValueSource(strings = {"user@example.com", "user.name+tag@example.co.uk", "user_name@sub.example.com", "123@example.io"})
    void acceptsWellFormedAddresses(String email) {
        ContactForm form = new ContactForm("A", email, "Hi", "ip");

        assertThat(validator.validate(form)).isSameAs(form);
    }

    @Test
    void reportsOverlongMessage() {
        SubmissionValidationException e = rejected(new ContactForm("A", "a@example.com", "x".repeat(5001), "ip"));

        assertThat(e.getFields()).containsExactly(SubmissionField.MESSAGE);
        assertThat(e.getViolations().get(0).kind()).isEqualTo(FieldViolation.Kind.INVALID_INPUT);
    }

    @Test
    void exceptionMessageListsViolationMessages() {
        assertThatThrownBy(() -> validator.validate(new ContactForm("", "john@example.com", "", "ip")))
                .isInstanceOf(SubmissionValidationException.class)
                .hasMessageContaining("Name is required")
                .hasMessageContaining("Message is required");
    }

    private SubmissionValidationException rejected(ContactForm form) {
        SubmissionValidationException e = catchThrowableOfType(() -> validator.validate(form),
                SubmissionValidationException.class);
        assertThat(e).as("expected validation failure for %s", form).isNotNull();
        return e;
    }
}

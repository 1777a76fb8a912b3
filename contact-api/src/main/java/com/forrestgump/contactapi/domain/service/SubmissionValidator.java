package com.forrestgump.contactapi.domain.service;

import com.forrestgump.contactapi.domain.exception.SubmissionValidationException;
import com.forrestgump.contactapi.domain.model.ContactForm;
import com.forrestgump.contactapi.domain.model.FieldViolation;
import com.forrestgump.contactapi.domain.model.SubmissionField;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import org.springframework.stereotype.Service;

import java.lang.annotation.Annotation;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks a normalized {@link ContactForm} against its declared constraints and reports every offending
 * field at once, each field at most once, in form order.
 */
@Service
public class SubmissionValidator {

    private final Validator validator;

    public SubmissionValidator(Validator validator) {
        this.validator = validator;
    }

    public ContactForm validate(ContactForm form) {
        Set<ConstraintViolation<ContactForm>> violations = validator.validate(form);
        if (violations.isEmpty()) {
            return form;
        }

        Map<SubmissionField, ConstraintViolation<ContactForm>> byField = new EnumMap<>(SubmissionField.class);
        for (ConstraintViolation<ContactForm> violation : violations) {
            SubmissionField field = fieldOf(violation.getPropertyPath().toString());
            if (field != null) {
                byField.merge(field, violation, (current, next) -> rank(next) < rank(current) ? next : current);
            }
        }

        List<FieldViolation> report = byField.entrySet().stream()
                .map(entry -> new FieldViolation(entry.getKey(), kindOf(entry.getValue()), entry.getValue().getMessage()))
                .toList();
        throw new SubmissionValidationException(report);
    }

    private static SubmissionField fieldOf(String property) {
        switch (property) {
            case "name":
                return SubmissionField.NAME;
            case "email":
                return SubmissionField.EMAIL;
            case "body":
                return SubmissionField.MESSAGE;
            default:
                return null;
        }
    }

    private static FieldViolation.Kind kindOf(ConstraintViolation<ContactForm> violation) {
        return constraintType(violation) == Email.class
                ? FieldViolation.Kind.INVALID_EMAIL_FORMAT
                : FieldViolation.Kind.INVALID_INPUT;
    }

    // A missing value is reported in preference to a malformed one, a malformed one in preference to length.
    private static int rank(ConstraintViolation<ContactForm> violation) {
        Class<? extends Annotation> type = constraintType(violation);
        if (type == NotBlank.class) {
            return 0;
        }
        return type == Email.class ? 1 : 2;
    }

    private static Class<? extends Annotation> constraintType(ConstraintViolation<ContactForm> violation) {
        return violation.getConstraintDescriptor().getAnnotation().annotationType();
    }
}

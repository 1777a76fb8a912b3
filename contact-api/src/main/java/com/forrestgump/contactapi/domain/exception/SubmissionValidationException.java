package com.forrestgump.contactapi.domain.exception;

import com.forrestgump.contactapi.domain.model.FieldViolation;
import com.forrestgump.contactapi.domain.model.SubmissionField;

import java.util.List;
import java.util.stream.Collectors;

public class SubmissionValidationException extends SubmissionRejectedException {

    private final List<FieldViolation> violations;

    public SubmissionValidationException(List<FieldViolation> violations) {
        super(describe(violations));
        this.violations = List.copyOf(violations);
    }

    public List<FieldViolation> getViolations() {
        return violations;
    }

    public List<SubmissionField> getFields() {
        return violations.stream().map(FieldViolation::field).toList();
    }

    private static String describe(List<FieldViolation> violations) {
        return violations.stream()
                .map(FieldViolation::message)
                .collect(Collectors.joining("; "));
    }
}

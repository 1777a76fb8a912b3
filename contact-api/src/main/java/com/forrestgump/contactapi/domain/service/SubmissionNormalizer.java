package com.forrestgump.contactapi.domain.service;

import com.forrestgump.contactapi.domain.model.ContactForm;
import org.springframework.stereotype.Service;

import java.util.Locale;

@Service
public class SubmissionNormalizer {

    public static final String UNKNOWN_SOURCE = "unknown";

    public ContactForm normalize(ContactForm raw) {
        String sourceIdentity = trim(raw.sourceIdentity());
        return new ContactForm(
                trim(raw.name()),
                trim(raw.email()).toLowerCase(Locale.ROOT),
                trim(raw.body()),
                sourceIdentity.isEmpty() ? UNKNOWN_SOURCE : sourceIdentity);
    }

    private static String trim(String value) {
        return value == null ? "" : value.strip();
    }
}

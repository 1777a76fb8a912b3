package com.forrestgump.contactapi.domain.service;

import com.forrestgump.contactapi.domain.model.ContactForm;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 fingerprint of a normalized form's name, email and body. The source identity is not part of
 * the content.
 *
 * <p>Each field is digested as its UTF-8 byte length followed by its bytes, so no field content can
 * move a boundary between fields.
 */
@Service
public class ContentHasher {

    public String hash(ContactForm form) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            update(digest, form.name());
            update(digest, form.email());
            update(digest, form.body());
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private static void update(MessageDigest digest, String field) {
        byte[] bytes = field.getBytes(StandardCharsets.UTF_8);
        digest.update(ByteBuffer.allocate(Integer.BYTES).putInt(bytes.length).array());
        digest.update(bytes);
    }
}

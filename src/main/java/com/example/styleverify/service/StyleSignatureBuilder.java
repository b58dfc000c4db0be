package com.example.styleverify.service;

import com.example.styleverify.model.StyleProperties;
import com.example.styleverify.model.StyleSignature;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;

/**
 * Builds the canonical signature of a property set: {@code key=value} pairs of the canonical
 * properties in key order, joined with {@code ;}. Two property sets are equivalent iff their
 * signatures are equal.
 * <p>
 * Signatures longer than {@link #MAX_LENGTH} keep their first {@value #PREFIX_LENGTH} characters
 * followed by {@code ~} and 32 hex characters of the SHA-256 of the full text, and are flagged
 * as truncated.
 */
@Component
public class StyleSignatureBuilder {

    public static final int MAX_LENGTH = 500;

    private static final int DIGEST_HEX_LENGTH = 32;
    private static final int PREFIX_LENGTH = MAX_LENGTH - DIGEST_HEX_LENGTH - 1;

    public StyleSignature build(StyleProperties properties) {
        StringBuilder signature = new StringBuilder();
        for (Map.Entry<String, String> entry : properties.asMap().entrySet()) {
            if (signature.length() > 0) signature.append(';');
            signature.append(escape(entry.getKey())).append('=').append(escape(entry.getValue()));
        }
        String full = signature.toString();
        if (full.length() <= MAX_LENGTH) {
            return new StyleSignature(full, false);
        }
        String truncated = full.substring(0, PREFIX_LENGTH) + "~" + sha256Hex(full).substring(0, DIGEST_HEX_LENGTH);
        return new StyleSignature(truncated, true);
    }

    /** Convenience overload for raw property bags. */
    public StyleSignature build(Map<String, ?> rawProperties) {
        return build(StyleProperties.of(rawProperties));
    }

    private static String escape(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' || c == ';' || c == '=') out.append('\\');
            out.append(c);
        }
        return out.toString();
    }

    private static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

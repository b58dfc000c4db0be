package com.example.styleverify.model;

/**
 * Canonical signature of a property set.
 *
 * @param value     signature text, at most {@code StyleSignatureBuilder.MAX_LENGTH} characters
 * @param truncated whether the full signature exceeded the bound and was shortened
 */
public record StyleSignature(String value, boolean truncated) {

    public boolean sameAs(StyleSignature other) {
        return other != null && value.equals(other.value);
    }
}

package org.bloodmatch.engine.domain.model;

import org.bloodmatch.engine.domain.exception.MatchingException;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * The eight canonical ABO/Rh blood types, in canonical order.
 */
public enum BloodType {
    O_NEGATIVE("O-"),
    O_POSITIVE("O+"),
    A_NEGATIVE("A-"),
    A_POSITIVE("A+"),
    B_NEGATIVE("B-"),
    B_POSITIVE("B+"),
    AB_NEGATIVE("AB-"),
    AB_POSITIVE("AB+");

    private final String label;

    BloodType(String label) {
        this.label = label;
    }

    /**
     * Canonical label, e.g. {@code "AB+"}.
     */
    public String getLabel() {
        return label;
    }

    /**
     * Parse a user-supplied blood group.
     * Percent-escapes are decoded (a literal '+' is kept), whitespace is removed
     * and the result is upper-cased before lookup.
     *
     * @param raw the value as received
     * @return the canonical blood type
     * @throws MatchingException with INVALID_BLOOD_TYPE if no canonical type matches
     */
    public static BloodType parse(String raw) {
        String normalized = normalize(raw);
        for (BloodType type : values()) {
            if (type.label.equals(normalized)) {
                return type;
            }
        }
        throw MatchingException.invalidBloodType(raw);
    }

    static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String decoded;
        try {
            // URLDecoder turns '+' into a space, which would eat the Rh sign
            decoded = URLDecoder.decode(raw.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            decoded = raw;
        }
        return decoded.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return label;
    }
}

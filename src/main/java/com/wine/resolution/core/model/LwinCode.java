package com.wine.resolution.core.model;

import java.util.Optional;

/**
 * LWIN identification code variants, from least to most specific.
 * <ul>
 *   <li>{@link #LWIN7}: the wine label</li>
 *   <li>{@link #LWIN11}: wine + vintage</li>
 *   <li>{@link #LWIN18}: wine + vintage + bottle size</li>
 * </ul>
 */
public enum LwinCode {
    LWIN7(7),
    LWIN11(11),
    LWIN18(18);

    private final int length;

    LwinCode(int length) {
        this.length = length;
    }

    public int length() {
        return length;
    }

    /**
     * Returns true if the value is exactly {@link #length()} decimal digits.
     */
    public boolean isValid(String code) {
        if (code == null || code.length() != length) {
            return false;
        }
        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    /**
     * Validates a code of this variant. Null is accepted (absent codes are never an error).
     *
     * @return the code unchanged
     * @throws IllegalArgumentException if a non-null value is malformed
     */
    public String validate(String code) {
        if (code != null && !isValid(code)) {
            throw new IllegalArgumentException(
                    name() + " must be exactly " + length + " digits, got '" + code + "'");
        }
        return code;
    }

    /**
     * Picks the variant matching the code's length, if any.
     */
    public static Optional<LwinCode> forCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String trimmed = code.trim();
        for (LwinCode variant : values()) {
            if (trimmed.length() == variant.length) {
                return Optional.of(variant);
            }
        }
        return Optional.empty();
    }
}

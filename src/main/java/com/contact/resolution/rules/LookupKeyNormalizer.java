package com.contact.resolution.rules;

import com.contact.resolution.core.model.CacheKey;
import com.contact.resolution.core.model.LookupType;

import java.util.Locale;
import java.util.Objects;

/**
 * Canonicalizes raw phone numbers and email addresses into stable cache keys.
 *
 * <p>Phone numbers keep only digits and a leading {@code +}. A number that is already
 * {@code +}-prefixed is kept as-is, an 11-digit number starting with {@code 1} gains a
 * {@code +}, and a bare 10-digit number is treated as domestic and prefixed with
 * {@code +1}. Anything else is kept as digits only. Email addresses are trimmed and
 * lower-cased.</p>
 *
 * <p>Input that normalizes to nothing yields the empty sentinel
 * ({@link CacheKey#isEmpty()}). Normalization is idempotent:
 * {@code normalize(t, normalize(t, x).normalizedValue())} equals {@code normalize(t, x)}.</p>
 */
public class LookupKeyNormalizer {

    private static final String DOMESTIC_COUNTRY_CODE = "1";
    private static final int DOMESTIC_LENGTH = 10;

    /**
     * Normalizes a raw lookup value.
     *
     * @param type the lookup type
     * @param raw  the raw value, may be null
     * @return the normalized key, or the empty sentinel
     */
    public CacheKey normalize(LookupType type, String raw) {
        Objects.requireNonNull(type, "type is required");
        return new CacheKey(type, normalizeValue(type, raw));
    }

    /**
     * Normalizes a raw lookup value to its canonical string form.
     * Returns an empty string when nothing usable remains.
     */
    public String normalizeValue(LookupType type, String raw) {
        if (raw == null) {
            return "";
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return "";
        }
        return switch (type) {
            case EMAIL -> trimmed.toLowerCase(Locale.ROOT);
            case PHONE -> normalizePhone(trimmed);
        };
    }

    private String normalizePhone(String trimmed) {
        StringBuilder digits = new StringBuilder(trimmed.length());
        boolean leadingPlus = false;
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (c >= '0' && c <= '9') {
                digits.append(c);
            } else if (c == '+' && digits.length() == 0) {
                leadingPlus = true;
            }
        }

        if (digits.length() == 0) {
            return "";
        }
        if (leadingPlus) {
            return "+" + digits;
        }
        if (digits.length() == DOMESTIC_LENGTH + 1 && digits.charAt(0) == '1') {
            return "+" + digits;
        }
        if (digits.length() == DOMESTIC_LENGTH) {
            return "+" + DOMESTIC_COUNTRY_CODE + digits;
        }
        return digits.toString();
    }
}

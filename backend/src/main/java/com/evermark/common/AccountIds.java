package com.evermark.common;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form of account identifiers. EVM-style hex addresses are case-insensitive on chain, so they are
 * lower-cased; any other identifier is only trimmed.
 */
public final class AccountIds {

    private static final Pattern HEX_ADDRESS = Pattern.compile("^0[xX][0-9a-fA-F]+$");

    private AccountIds() {
    }

    /**
     * @return canonical account id, or null when the input is null or blank
     */
    public static String normalizeOrNull(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String trimmed = raw.trim();
        if (HEX_ADDRESS.matcher(trimmed).matches()) {
            return trimmed.toLowerCase(Locale.ROOT);
        }
        return trimmed;
    }

    /**
     * @throws IllegalArgumentException if the account id is null or blank
     */
    public static String normalize(String raw) {
        String normalized = normalizeOrNull(raw);
        if (normalized == null) {
            throw new IllegalArgumentException("accountId must not be blank");
        }
        return normalized;
    }
}

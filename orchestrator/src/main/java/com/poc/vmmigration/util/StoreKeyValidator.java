package com.poc.vmmigration.util;

import com.poc.vmmigration.exception.InvalidArgumentException;

import java.util.regex.Pattern;

/**
 * Validates object store keys so they are safe to use in file names.
 * Allows: letters, digits, dots, colons, percent signs, underscores and hyphens,
 * which covers IPv4, IPv6 (with zone) and generated migration IDs.
 */
public final class StoreKeyValidator {

    private static final Pattern KEY_PATTERN = Pattern.compile("^[a-zA-Z0-9._:%-]+$");

    private StoreKeyValidator() {
        // Utility class - prevent instantiation
    }

    public static boolean isValidKey(String key) {
        if (key == null || key.isEmpty()) {
            return false;
        }
        if (".".equals(key) || "..".equals(key)) {
            return false;
        }
        return KEY_PATTERN.matcher(key).matches();
    }

    /**
     * Throws exception if the key is invalid.
     */
    public static void validateKey(String key) {
        if (!isValidKey(key)) {
            throw new InvalidArgumentException("Invalid key: " + key);
        }
    }
}

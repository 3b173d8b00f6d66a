package com.openrangelabs.donpetre.credentials.support;

/**
 * Produces the display form of a key: the first and last few characters around "...".
 */
public final class KeyMasker {

    public static final int DEFAULT_VISIBLE = 4;
    private static final String FULLY_MASKED = "***";

    private KeyMasker() {
    }

    public static String mask(String key) {
        return mask(key, DEFAULT_VISIBLE);
    }

    public static String mask(String key, int visible) {
        if (key == null || key.length() <= visible * 2) {
            return FULLY_MASKED;
        }
        return key.substring(0, visible) + "..." + key.substring(key.length() - visible);
    }
}

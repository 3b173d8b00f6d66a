package com.openrangelabs.donpetre.credentials.validation;

import com.openrangelabs.donpetre.credentials.model.Provider;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Strips pasted-in whitespace from keys and normalizes provider prefixes.
 */
public final class KeySanitizer {

    private static final Pattern WHITESPACE = Pattern.compile(
            "[\\s\\u0085\\u00A0\\u1680\\u2000-\\u200B\\u2028\\u2029\\u202F\\u205F\\u3000\\uFEFF]+");

    private KeySanitizer() {
    }

    /**
     * Removes every whitespace code point, including unicode spaces, the zero-width space
     * and the byte-order mark. Null becomes the empty string.
     */
    public static String sanitize(String raw) {
        if (raw == null) {
            return "";
        }
        return WHITESPACE.matcher(raw).replaceAll("");
    }

    /**
     * Sanitizes and then repairs the casing and separator of a known provider prefix,
     * e.g. {@code SK_abc} becomes {@code sk-abc} for OpenAI.
     */
    public static String normalize(String raw, Provider provider) {
        String key = sanitize(raw);
        if (provider == null) {
            return key;
        }
        String upper = key.toUpperCase(Locale.ROOT);
        switch (provider) {
            case OPENAI: {
                String normalized = key.replace('_', '-');
                if (upper.startsWith("SK-") || upper.startsWith("SK_")) {
                    return "sk-" + normalized.substring(3);
                }
                return normalized;
            }
            case ANTHROPIC:
                if (upper.startsWith("SK-ANT-") || upper.startsWith("SK_ANT_")) {
                    return "sk-ant-" + key.substring(7);
                }
                return key;
            case GOOGLE:
                if (upper.startsWith("AIZA")) {
                    return "AIza" + key.substring(4);
                }
                return key;
            default:
                return key;
        }
    }
}

package com.openrangelabs.donpetre.credentials.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * AI providers whose API keys can be stored and validated.
 */
public enum Provider {

    OPENAI("openai"),
    ANTHROPIC("anthropic"),
    GOOGLE("google"),
    CUSTOM("custom");

    private final String tag;

    Provider(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    /**
     * Parses a provider tag, ignoring case and surrounding whitespace.
     *
     * @param tag the tag, e.g. "openai"
     * @return the provider, or empty if the tag is not a known provider
     */
    public static Optional<Provider> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (Provider provider : values()) {
            if (provider.tag.equals(normalized)) {
                return Optional.of(provider);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static Provider fromJson(String tag) {
        return fromTag(tag).orElseThrow(() -> new IllegalArgumentException("Unknown provider: " + tag));
    }

    @Override
    public String toString() {
        return tag;
    }
}

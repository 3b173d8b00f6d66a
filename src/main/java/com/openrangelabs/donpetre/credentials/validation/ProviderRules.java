package com.openrangelabs.donpetre.credentials.validation;

import com.openrangelabs.donpetre.credentials.model.KeyType;
import com.openrangelabs.donpetre.credentials.model.Provider;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * The fixed table of per-provider key rules, with provider and key-type detection.
 */
public final class ProviderRules {

    private static final Map<Provider, ProviderRule> RULES = new EnumMap<>(Provider.class);

    /** Providers tried by {@link #detect}, in order. Custom matches anything and is never detected. */
    private static final List<Provider> DETECTABLE = List.of(Provider.OPENAI, Provider.ANTHROPIC, Provider.GOOGLE);

    static {
        RULES.put(Provider.OPENAI, new ProviderRule(Provider.OPENAI,
                Pattern.compile("^sk-[A-Za-z0-9]{48}$"), 51, 51, "sk-",
                "OpenAI API keys start with \"sk-\" followed by 48 alphanumeric characters"));
        RULES.put(Provider.ANTHROPIC, new ProviderRule(Provider.ANTHROPIC,
                Pattern.compile("^sk-ant-[A-Za-z0-9]{40,52}$"), 47, 59, "sk-ant-",
                "Anthropic API keys start with \"sk-ant-\" followed by 40-52 alphanumeric characters"));
        RULES.put(Provider.GOOGLE, new ProviderRule(Provider.GOOGLE,
                Pattern.compile("^AIza[A-Za-z0-9_-]{35}$"), 39, 39, "AIza",
                "Google API keys start with \"AIza\" followed by 35 alphanumeric, underscore, or dash characters"));
        RULES.put(Provider.CUSTOM, new ProviderRule(Provider.CUSTOM,
                Pattern.compile("^.{1,1000}$", Pattern.DOTALL), 1, 1000, null,
                "Custom provider keys can be any format between 1-1000 characters"));
    }

    private ProviderRules() {
    }

    /**
     * Rule for a provider; null resolves to the custom rule.
     */
    public static ProviderRule rule(Provider provider) {
        return RULES.get(provider == null ? Provider.CUSTOM : provider);
    }

    /**
     * Rule for a provider tag; unknown tags resolve to the custom rule.
     */
    public static ProviderRule rule(String providerTag) {
        return rule(Provider.fromTag(providerTag).orElse(Provider.CUSTOM));
    }

    /**
     * First concrete provider whose pattern matches the already-sanitized key.
     */
    public static Optional<Provider> detect(String key) {
        if (key == null || key.isEmpty()) {
            return Optional.empty();
        }
        return DETECTABLE.stream()
                .filter(provider -> RULES.get(provider).matches(key))
                .findFirst();
    }

    /**
     * Provider key formats carry no tier information, so every key is standard.
     */
    public static KeyType detectKeyType(String key, Provider provider) {
        return KeyType.STANDARD;
    }
}

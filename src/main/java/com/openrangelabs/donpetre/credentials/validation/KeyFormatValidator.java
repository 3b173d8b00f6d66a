package com.openrangelabs.donpetre.credentials.validation;

import com.openrangelabs.donpetre.credentials.model.KeyType;
import com.openrangelabs.donpetre.credentials.model.Provider;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Uncached format check of a key against its provider's rule.
 */
public final class KeyFormatValidator {

    private KeyFormatValidator() {
    }

    public static ValidationResult validate(String rawKey, Provider provider) {
        String key = KeySanitizer.sanitize(rawKey);
        ProviderRule rule = ProviderRules.rule(provider);
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (key.length() < rule.getMinLength()) {
            errors.add(String.format("Key too short. Expected at least %d characters, got %d",
                    rule.getMinLength(), key.length()));
        }
        if (key.length() > rule.getMaxLength()) {
            errors.add(String.format("Key too long. Expected at most %d characters, got %d",
                    rule.getMaxLength(), key.length()));
        }
        if (rule.hasPrefix() && !key.startsWith(rule.getRequiredPrefix())) {
            errors.add("Key must start with \"" + rule.getRequiredPrefix() + "\"");
        }
        if (!rule.matches(key)) {
            errors.add("Key format invalid. " + rule.getDescription());
        }

        Optional<Provider> detected = ProviderRules.detect(key);
        Provider declared = rule.getProvider();
        if (detected.isPresent() && detected.get() != declared) {
            warnings.add("Key appears to be for " + detected.get() + ", not " + declared);
        }

        Provider resolved = detected.orElse(declared);
        KeyType keyType = ProviderRules.detectKeyType(key, resolved);
        return ValidationResult.builder()
                .valid(errors.isEmpty())
                .errors(List.copyOf(errors))
                .warnings(List.copyOf(warnings))
                .provider(resolved)
                .keyType(keyType)
                .estimatedTier(keyType)
                .fromCache(false)
                .build();
    }
}

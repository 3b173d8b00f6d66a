package com.openrangelabs.donpetre.credentials.validation;

import com.openrangelabs.donpetre.credentials.model.Provider;
import lombok.Value;

import java.util.regex.Pattern;

/**
 * Static format constraints for one provider's keys. {@code requiredPrefix} is null when
 * the provider has none.
 */
@Value
public class ProviderRule {

    Provider provider;
    Pattern pattern;
    int minLength;
    int maxLength;
    String requiredPrefix;
    String description;

    public boolean hasPrefix() {
        return requiredPrefix != null && !requiredPrefix.isEmpty();
    }

    public boolean matches(String key) {
        return pattern.matcher(key).matches();
    }
}

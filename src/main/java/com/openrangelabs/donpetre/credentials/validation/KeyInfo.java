package com.openrangelabs.donpetre.credentials.validation;

import com.openrangelabs.donpetre.credentials.model.KeyType;
import com.openrangelabs.donpetre.credentials.model.Provider;
import lombok.Builder;
import lombok.Value;

/**
 * Descriptive facts about a key that do not require knowing its provider up front.
 */
@Value
@Builder
public class KeyInfo {

    Provider provider;
    KeyType keyType;
    KeyType estimatedTier;
    String prefix;
    String maskedKey;
    boolean hasChecksum;
    double entropy;
    EntropyLevel entropyLevel;
    int length;
    CharacterSet characterSet;

    public enum EntropyLevel {
        LOW, MEDIUM, HIGH;

        public static EntropyLevel of(double entropy) {
            if (entropy < 3) {
                return LOW;
            }
            return entropy < 4 ? MEDIUM : HIGH;
        }
    }

    @Value
    public static class CharacterSet {
        boolean hasLowercase;
        boolean hasUppercase;
        boolean hasNumbers;
        boolean hasSpecialChars;
    }
}

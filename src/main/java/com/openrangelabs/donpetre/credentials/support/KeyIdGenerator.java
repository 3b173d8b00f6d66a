package com.openrangelabs.donpetre.credentials.support;

import com.openrangelabs.donpetre.credentials.model.Provider;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * Generates record ids of the form {@code <provider>-<epochMillis>-<6 base36 chars>},
 * optionally suffixed with the first 8 characters of the key hash.
 */
public class KeyIdGenerator {

    private static final String BASE36 = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int RANDOM_LENGTH = 6;
    private static final int HASH_PREFIX_LENGTH = 8;

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public KeyIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String generate(Provider provider, String keyHash) {
        StringBuilder id = new StringBuilder()
                .append(provider.getTag())
                .append('-')
                .append(clock.millis())
                .append('-');
        for (int i = 0; i < RANDOM_LENGTH; i++) {
            id.append(BASE36.charAt(random.nextInt(BASE36.length())));
        }
        if (keyHash != null && !keyHash.isEmpty()) {
            id.append('-').append(keyHash, 0, Math.min(HASH_PREFIX_LENGTH, keyHash.length()));
        }
        return id.toString();
    }
}

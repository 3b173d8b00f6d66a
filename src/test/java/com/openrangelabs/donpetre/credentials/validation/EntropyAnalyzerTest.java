package com.openrangelabs.donpetre.credentials.validation;

import com.openrangelabs.donpetre.credentials.TestKeys;
import com.openrangelabs.donpetre.credentials.model.Provider;
import org.junit.jupiter.api.Test;

import java.security.SecureRandom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EntropyAnalyzerTest {

    private static final String ALPHANUMERIC = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

    @Test
    void entropy_UniformString_IsZero() {
        assertThat(EntropyAnalyzer.entropy("aaaa")).isEqualTo(0.0);
        assertThat(EntropyAnalyzer.entropy("")).isEqualTo(0.0);
    }

    @Test
    void entropy_TwoEqualSymbols_IsOneBit() {
        assertThat(EntropyAnalyzer.entropy("abab")).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void entropyWarnings_ZeroPaddedKey_FlagsLowEntropy() {
        assertThat(EntropyAnalyzer.entropyWarnings("sk-" + "0".repeat(48)))
            .contains("Key has low entropy and may be weak or predictable");
    }

    @Test
    void entropyWarnings_RandomKey_NoLowEntropyWarning() {
        SecureRandom random = new SecureRandom();
        StringBuilder key = new StringBuilder("sk-");
        for (int i = 0; i < 48; i++) {
            key.append(ALPHANUMERIC.charAt(random.nextInt(ALPHANUMERIC.length())));
        }

        assertThat(EntropyAnalyzer.entropyWarnings(key.toString()))
            .doesNotContain("Key has low entropy and may be weak or predictable");
    }

    @Test
    void entropyWarnings_RepeatingAndSequential_AreFlagged() {
        assertThat(EntropyAnalyzer.entropyWarnings("sk-xyzxyzxyzQ"))
            .contains("Key contains repeating patterns which reduces security");
        assertThat(EntropyAnalyzer.entropyWarnings("sk-abcabcabc"))
            .contains("Key contains sequential patterns which reduces security");
    }

    @Test
    void exposedKeyWarnings_TestKey_IsFlagged() {
        assertThat(EntropyAnalyzer.exposedKeyWarnings("sk-test-" + "a".repeat(20)))
            .contains("Key matches a known weak or test key pattern",
                "Key contains \"test\" which suggests it may be a test key");
    }

    @Test
    void exposedKeyWarnings_RealisticKey_IsClean() {
        assertThat(EntropyAnalyzer.exposedKeyWarnings(TestKeys.OPENAI)).isEmpty();
    }

    @Test
    void recommendations_IncludeProviderSpecificAdvice() {
        assertThat(EntropyAnalyzer.recommendations(Provider.ANTHROPIC, false))
            .contains("Monitor token usage to avoid unexpected charges")
            .doesNotContain("Generate a new API key to address security concerns");
        assertThat(EntropyAnalyzer.recommendations(Provider.GOOGLE, true))
            .contains("Restrict API key usage by IP address when possible",
                "Generate a new API key to address security concerns");
    }
}

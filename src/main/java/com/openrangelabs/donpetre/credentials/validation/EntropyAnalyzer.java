package com.openrangelabs.donpetre.credentials.validation;

import com.openrangelabs.donpetre.credentials.model.Provider;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Heuristic security analysis of a key: character entropy, known weak or sample keys,
 * and the recommendations that follow from them.
 */
public final class EntropyAnalyzer {

    public static final double LOW_ENTROPY_THRESHOLD = 3.0;

    private static final Pattern REPEATING = Pattern.compile("(.{3,})\\1{2,}");
    private static final Pattern SEQUENTIAL = Pattern.compile("(?:abc|123|xyz|789){3,}", Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> WEAK_KEYS = List.of(
            Pattern.compile("^sk-0+$"),
            Pattern.compile("^sk-1+$"),
            Pattern.compile("^sk-test", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^sk-demo", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^sk-example", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^sk-1234567890abcdefghijklmnopqrstuvwxyzABCDEFGHIJKL$"));

    private static final List<String> TEST_WORDS = List.of("test", "demo", "example", "sample");

    private EntropyAnalyzer() {
    }

    /**
     * Shannon entropy in bits per character.
     */
    public static double entropy(String key) {
        if (key == null || key.isEmpty()) {
            return 0;
        }
        Map<Integer, Integer> counts = new HashMap<>();
        key.codePoints().forEach(cp -> counts.merge(cp, 1, Integer::sum));
        double length = key.codePointCount(0, key.length());
        double entropy = 0;
        for (int count : counts.values()) {
            double p = count / length;
            entropy -= p * (Math.log(p) / Math.log(2));
        }
        return entropy;
    }

    public static List<String> entropyWarnings(String key) {
        List<String> warnings = new ArrayList<>();
        if (entropy(key) < LOW_ENTROPY_THRESHOLD) {
            warnings.add("Key has low entropy and may be weak or predictable");
        }
        if (REPEATING.matcher(key).find()) {
            warnings.add("Key contains repeating patterns which reduces security");
        }
        if (SEQUENTIAL.matcher(key).find()) {
            warnings.add("Key contains sequential patterns which reduces security");
        }
        return warnings;
    }

    public static List<String> exposedKeyWarnings(String key) {
        List<String> warnings = new ArrayList<>();
        if (WEAK_KEYS.stream().anyMatch(pattern -> pattern.matcher(key).find())) {
            warnings.add("Key matches a known weak or test key pattern");
        }
        String lower = key.toLowerCase(Locale.ROOT);
        for (String word : TEST_WORDS) {
            if (lower.contains(word)) {
                warnings.add("Key contains \"" + word + "\" which suggests it may be a test key");
            }
        }
        return warnings;
    }

    public static List<String> recommendations(Provider provider, boolean hasSecurityWarnings) {
        List<String> recommendations = new ArrayList<>();
        recommendations.add("Store API keys securely using encryption");
        recommendations.add("Use environment variables or secure vaults for production");
        recommendations.add("Regularly rotate API keys");
        recommendations.add("Monitor API key usage for unusual activity");

        if (provider == Provider.OPENAI) {
            recommendations.add("Consider using OpenAI organization-level keys for team access");
            recommendations.add("Set usage limits in your OpenAI dashboard");
        } else if (provider == Provider.ANTHROPIC) {
            recommendations.add("Monitor token usage to avoid unexpected charges");
        } else if (provider == Provider.GOOGLE) {
            recommendations.add("Restrict API key usage by IP address when possible");
        }

        if (hasSecurityWarnings) {
            recommendations.add("Generate a new API key to address security concerns");
        }
        return recommendations;
    }
}

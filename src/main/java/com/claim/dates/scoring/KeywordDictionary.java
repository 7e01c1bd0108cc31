package com.claim.dates.scoring;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable keyword sets consulted by the context-based scoring rules.
 * Loaded once from a classpath properties file and shared by reference.
 */
public final class KeywordDictionary {

    public static final String DEFAULT_RESOURCE = "date-relevance-keywords.properties";

    private final Set<String> positive;
    private final Set<String> negative;
    private final Set<String> documentMetadata;
    private final Set<String> enrollment;
    private final Set<String> expiry;

    public KeywordDictionary(Set<String> positive, Set<String> negative, Set<String> documentMetadata,
                             Set<String> enrollment, Set<String> expiry) {
        this.positive = lowerCased(positive);
        this.negative = lowerCased(negative);
        this.documentMetadata = lowerCased(documentMetadata);
        this.enrollment = lowerCased(enrollment);
        this.expiry = lowerCased(expiry);
    }

    /**
     * Returns the dictionary bundled with the library.
     */
    public static KeywordDictionary defaults() {
        return DefaultHolder.INSTANCE;
    }

    /**
     * Loads a dictionary from a classpath properties resource (UTF-8).
     *
     * @throws IllegalArgumentException if the resource does not exist
     * @throws UncheckedIOException     if the resource cannot be read
     */
    public static KeywordDictionary load(String resource) {
        try (InputStream in = KeywordDictionary.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Keyword resource not found: " + resource);
            }
            Properties props = new Properties();
            props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
            return new KeywordDictionary(
                    split(props, "positive"),
                    split(props, "negative"),
                    split(props, "documentMetadata"),
                    split(props, "enrollment"),
                    split(props, "expiry"));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load keyword resource " + resource, e);
        }
    }

    public Set<String> positive() {
        return positive;
    }

    public Set<String> negative() {
        return negative;
    }

    public Set<String> documentMetadata() {
        return documentMetadata;
    }

    public Set<String> enrollment() {
        return enrollment;
    }

    public Set<String> expiry() {
        return expiry;
    }

    /**
     * Returns true when any keyword occurs in the text (case-insensitive).
     */
    public static boolean containsAny(String text, Set<String> keywords) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> split(Properties props, String key) {
        String value = props.getProperty(key, "");
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet());
    }

    private static Set<String> lowerCased(Set<String> keywords) {
        return keywords == null ? Set.of() : keywords.stream()
                .map(k -> k.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    private static final class DefaultHolder {
        private static final KeywordDictionary INSTANCE = load(DEFAULT_RESOURCE);
    }
}

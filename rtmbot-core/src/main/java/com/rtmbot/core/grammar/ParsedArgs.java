package com.rtmbot.core.grammar;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Arguments captured by a successful command match.
 * <p>
 * Only named groups that took part in the match are present, so optional
 * parts of an expression can be tested with {@link #has(String)}.
 */
public final class ParsedArgs {

    private static final ParsedArgs EMPTY = new ParsedArgs("", Map.of());

    private final String matchedText;
    private final Map<String, String> captures;

    public ParsedArgs(String matchedText, Map<String, String> captures) {
        this.matchedText = matchedText != null ? matchedText : "";
        this.captures = Collections.unmodifiableMap(new LinkedHashMap<>(captures));
    }

    public static ParsedArgs empty() {
        return EMPTY;
    }

    /** The command text consumed by the expression, without the alert prefix. */
    public String matchedText() {
        return matchedText;
    }

    public boolean has(String name) {
        return captures.containsKey(name);
    }

    public Optional<String> get(String name) {
        return Optional.ofNullable(captures.get(name));
    }

    public String getOrDefault(String name, String fallback) {
        return captures.getOrDefault(name, fallback);
    }

    /**
     * @throws NoSuchElementException if the group did not take part in the match
     */
    public String require(String name) {
        String value = captures.get(name);
        if (value == null) {
            throw new NoSuchElementException("No captured argument '" + name + "'");
        }
        return value;
    }

    public Map<String, String> asMap() {
        return captures;
    }

    public boolean isEmpty() {
        return captures.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ParsedArgs other)) {
            return false;
        }
        return matchedText.equals(other.matchedText) && captures.equals(other.captures);
    }

    @Override
    public int hashCode() {
        return 31 * matchedText.hashCode() + captures.hashCode();
    }

    @Override
    public String toString() {
        return "ParsedArgs" + captures;
    }
}

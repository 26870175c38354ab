package com.rtmbot.core.grammar;

import java.util.Arrays;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Regex fragments and combinators for writing command expressions.
 *
 * <pre>
 * Pattern greet = CommandExpressions.compile(
 *         CommandExpressions.literal("greet"),
 *         CommandExpressions.named("name", CommandExpressions.WORD));
 * </pre>
 *
 * Fragments are joined with {@code \s+} by {@link #sequence(String...)}.
 */
public final class CommandExpressions {

    private CommandExpressions() {
    }

    public static final String EMOJI = ":\\S+:";
    public static final String WORD = "[A-Za-z0-9]+";
    public static final String MESSAGE_WORDS = "[A-Za-z0-9#]+(?:\\s+[A-Za-z0-9#]+)*";
    public static final String CHANNEL_NAME = "[A-Za-z0-9-]+";
    public static final String USER_NAME = "[A-Za-z0-9._-]+";
    public static final String MENTION = "<@U[0-9A-Z]{8}>";
    public static final String LINK = "\\S+";
    public static final String INTEGER = "\\d+";
    public static final String QUOTED = "\"(?:[^\"\\\\]|\\\\.)*\"|'(?:[^'\\\\]|\\\\.)*'|“[^”]*”|‘[^’]*’";
    public static final String COMMA_LIST = "(?:" + QUOTED + "|[^,\\s][^,]*?)(?:\\s*,\\s*(?:" + QUOTED + "|[^,\\s][^,]*?))*";

    /**
     * Case-insensitive literal word.
     */
    public static String literal(String word) {
        return "(?i:" + Pattern.quote(word) + ")";
    }

    /**
     * Capture a fragment under a name readable through {@link ParsedArgs}.
     */
    public static String named(String name, String fragment) {
        return "(?<" + name + ">" + fragment + ")";
    }

    /**
     * Optional whitespace-separated fragment.
     */
    public static String optional(String fragment) {
        return "(?:\\s+" + fragment + ")?";
    }

    /**
     * Everything after a single separating whitespace, including newlines.
     */
    public static String tail(String name) {
        return "\\s(?<" + name + ">(?s:.+))";
    }

    /**
     * A {@code -x} or {@code --name} switch captured under {@code name}.
     */
    public static String flag(String name) {
        String dashes = name.length() > 1 ? "--" : "-";
        return named(name, literal(dashes + name));
    }

    /**
     * A switch followed by an argument, the argument captured under {@code name}.
     */
    public static String flagWithArg(String name, String argFragment) {
        String dashes = name.length() > 1 ? "--" : "-";
        return literal(dashes + name) + "\\s+" + named(name, argFragment);
    }

    /**
     * Require that nothing but whitespace follows.
     */
    public static String end() {
        return "\\s*$";
    }

    /**
     * Join fragments with mandatory whitespace. Fragments produced by
     * {@link #optional(String)}, {@link #tail(String)} and {@link #end()}
     * carry their own leading separator and are appended directly.
     */
    public static String sequence(String... fragments) {
        StringBuilder sb = new StringBuilder();
        for (String fragment : fragments) {
            if (sb.length() > 0 && !selfSeparated(fragment)) {
                sb.append("\\s+");
            }
            sb.append(fragment);
        }
        return sb.toString();
    }

    public static Pattern compile(String... fragments) {
        return Pattern.compile(sequence(fragments));
    }

    /**
     * Alternation of fragments, tried left to right.
     */
    public static String anyOf(String... fragments) {
        return Arrays.stream(fragments).collect(Collectors.joining("|", "(?:", ")"));
    }

    private static boolean selfSeparated(String fragment) {
        return fragment.startsWith("(?:\\s+") || fragment.startsWith("\\s");
    }
}

package com.rtmbot.core.grammar;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One alternative of the command grammar.
 *
 * @param priority   higher priorities are tried first
 * @param name       handler name reported on a match
 * @param expression pattern matched at the start of the command text
 * @param groupNames named capture groups declared by {@code expression}
 */
public record GrammarEntry(int priority, String name, Pattern expression, List<String> groupNames) {

    private static final Pattern GROUP_NAME = Pattern.compile("\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>");

    public GrammarEntry {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(expression, "expression");
        groupNames = List.copyOf(groupNames);
    }

    public static GrammarEntry of(int priority, String name, Pattern expression) {
        return new GrammarEntry(priority, name, expression, declaredGroups(expression));
    }

    /**
     * Names of the {@code (?<name>...)} groups in a pattern, in declaration order.
     */
    static List<String> declaredGroups(Pattern pattern) {
        List<String> names = new ArrayList<>();
        Matcher m = GROUP_NAME.matcher(pattern.pattern());
        while (m.find()) {
            if (!isEscaped(pattern.pattern(), m.start()) && !names.contains(m.group(1))) {
                names.add(m.group(1));
            }
        }
        return names;
    }

    private static boolean isEscaped(String source, int index) {
        int backslashes = 0;
        for (int i = index - 1; i >= 0 && source.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }
}

package com.rtmbot.core.grammar;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered alternation of every registered command expression.
 * <p>
 * Entries are kept sorted by descending priority. A new entry is inserted in
 * front of the existing entries of the same priority, so within a priority
 * tier the most recently added expression is tried first. Insertion rebuilds
 * the alternation in linear time, which is fine for the few hundred commands a
 * bot carries.
 * <p>
 * Channel text must start with the alert prefix to be considered; in a direct
 * message the prefix is optional. The prefix is matched case-insensitively and
 * whitespace after it is skipped. Each expression is anchored at the start of
 * the remaining text but need not consume all of it; add
 * {@link CommandExpressions#end()} to require that.
 */
@Slf4j
public class CommandGrammar {

    private final String alertPrefix;
    private volatile List<GrammarEntry> entries = List.of();

    public CommandGrammar(String alertPrefix) {
        this.alertPrefix = Objects.requireNonNull(alertPrefix, "alertPrefix");
    }

    public String getAlertPrefix() {
        return alertPrefix;
    }

    /**
     * Add an expression under a handler name.
     */
    public synchronized void add(Pattern expression, String name, int priority) {
        GrammarEntry entry = GrammarEntry.of(priority, name, expression);
        List<GrammarEntry> next = new ArrayList<>(entries.size() + 1);
        boolean inserted = false;
        for (GrammarEntry existing : entries) {
            if (!inserted && priority >= existing.priority()) {
                next.add(entry);
                inserted = true;
            }
            next.add(existing);
        }
        if (!inserted) {
            next.add(entry);
        }
        entries = List.copyOf(next);
        log.debug("Grammar entry added: {} (priority {}, {} entries)", name, priority, next.size());
    }

    public void add(String expression, String name, int priority) {
        add(Pattern.compile(expression), name, priority);
    }

    /**
     * Try every entry in order against the text.
     *
     * @param text          raw message text
     * @param directMessage whether the text came from a direct-message session
     */
    public GrammarMatch match(String text, boolean directMessage) {
        if (text == null) {
            return GrammarMatch.noMatch();
        }
        int start = skipPrefix(text, directMessage);
        if (start < 0) {
            return GrammarMatch.noMatch();
        }
        String body = text.substring(start);
        for (GrammarEntry entry : entries) {
            Matcher m = entry.expression().matcher(body);
            if (m.lookingAt()) {
                return new GrammarMatch.Matched(entry.name(), capture(entry, m));
            }
        }
        return GrammarMatch.noMatch();
    }

    /**
     * Whether the text starts with the alert prefix, ignoring case.
     */
    public boolean hasAlertPrefix(String text) {
        return text != null && text.regionMatches(true, 0, alertPrefix, 0, alertPrefix.length());
    }

    public boolean matches(String text, boolean directMessage) {
        return match(text, directMessage).isMatched();
    }

    /**
     * Current alternation, highest priority first.
     */
    public List<GrammarEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Index where the command body starts, or -1 when a required prefix is absent.
     */
    private int skipPrefix(String text, boolean directMessage) {
        int index = 0;
        if (hasAlertPrefix(text)) {
            index = alertPrefix.length();
        } else if (!directMessage) {
            return -1;
        }
        while (index < text.length() && Character.isWhitespace(text.charAt(index))) {
            index++;
        }
        return index;
    }

    private static ParsedArgs capture(GrammarEntry entry, Matcher m) {
        Map<String, String> captures = new LinkedHashMap<>();
        for (String group : entry.groupNames()) {
            String value = m.group(group);
            if (value != null) {
                captures.put(group, value);
            }
        }
        return new ParsedArgs(m.group(), captures);
    }
}

package com.rtmbot.core.grammar;

/**
 * Outcome of {@link CommandGrammar#match(String, boolean)}: either a matched
 * handler name with its captured arguments, or no match.
 */
public interface GrammarMatch {

    boolean isMatched();

    static GrammarMatch noMatch() {
        return NoMatch.INSTANCE;
    }

    record Matched(String name, ParsedArgs args) implements GrammarMatch {
        @Override
        public boolean isMatched() {
            return true;
        }
    }

    enum NoMatch implements GrammarMatch {
        INSTANCE;

        @Override
        public boolean isMatched() {
            return false;
        }
    }
}

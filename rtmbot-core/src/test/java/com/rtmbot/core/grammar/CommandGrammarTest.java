package com.rtmbot.core.grammar;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static com.rtmbot.core.grammar.CommandExpressions.*;
import static org.junit.jupiter.api.Assertions.*;

class CommandGrammarTest {

    private CommandGrammar grammar;

    @BeforeEach
    void setUp() {
        grammar = new CommandGrammar("!");
    }

    private static List<String> names(CommandGrammar grammar) {
        return grammar.entries().stream().map(GrammarEntry::name).toList();
    }

    // =========================================================================
    // Ordering
    // =========================================================================

    @Nested
    class Ordering {

        @Test
        void add_keepsDescendingPriority() {
            grammar.add("low", "low", 0);
            grammar.add("high", "high", 10);
            grammar.add("mid", "mid", 5);

            assertEquals(List.of("high", "mid", "low"), names(grammar));
        }

        @Test
        void add_equalPriority_newestFirst() {
            grammar.add("a", "first", 1);
            grammar.add("b", "second", 1);
            grammar.add("c", "third", 1);

            assertEquals(List.of("third", "second", "first"), names(grammar));
        }

        @Test
        void add_equalPriority_newestWinsOverlappingMatch() {
            grammar.add(compile(literal("roll"), tail("rest")), "old", 0);
            grammar.add(compile(literal("roll"), tail("rest")), "new", 0);

            GrammarMatch match = grammar.match("!roll 2d6", false);
            assertEquals("new", ((GrammarMatch.Matched) match).name());
        }

        @Test
        void match_higherPriorityTriedFirst() {
            grammar.add(compile(literal("show"), tail("what")), "generic", 0);
            grammar.add(compile(literal("show"), literal("stats"), end()), "stats", 5);

            assertEquals("stats", ((GrammarMatch.Matched) grammar.match("!show stats", false)).name());
            assertEquals("generic", ((GrammarMatch.Matched) grammar.match("!show me", false)).name());
        }
    }

    // =========================================================================
    // Prefix handling
    // =========================================================================

    @Nested
    class Prefix {

        @BeforeEach
        void register() {
            grammar.add(compile(literal("ping"), end()), "ping", 0);
        }

        @Test
        void channelText_requiresPrefix() {
            assertTrue(grammar.matches("!ping", false));
            assertFalse(grammar.matches("ping", false));
        }

        @Test
        void directMessage_prefixOptional() {
            assertTrue(grammar.matches("ping", true));
            assertTrue(grammar.matches("!ping", true));
        }

        @Test
        void whitespaceAfterPrefix_skipped() {
            assertTrue(grammar.matches("!   ping", false));
        }

        @Test
        void prefix_caseInsensitive() {
            CommandGrammar wordy = new CommandGrammar("bot:");
            wordy.add(compile(literal("ping"), end()), "ping", 0);

            assertTrue(wordy.matches("BOT: ping", false));
            assertTrue(wordy.hasAlertPrefix("Bot:ping"));
            assertFalse(wordy.matches("ping", false));
        }

        @Test
        void nullText_noMatch() {
            assertSame(GrammarMatch.NoMatch.INSTANCE, grammar.match(null, true));
        }

        @Test
        void emptyGrammar_noMatch() {
            assertFalse(new CommandGrammar("!").matches("!anything", false));
        }
    }

    // =========================================================================
    // Required arguments
    // =========================================================================

    @Nested
    class RequiredArgument {

        @BeforeEach
        void register() {
            grammar.add(compile(literal("greet"), named("name", WORD)), "greet", 0);
        }

        @Test
        void greet_inChannel_capturesName() {
            GrammarMatch match = grammar.match("!greet Ada", false);

            assertEquals("Ada", ((GrammarMatch.Matched) match).args().require("name"));
        }

        @Test
        void greet_inDirectMessage_withoutPrefix() {
            GrammarMatch match = grammar.match("greet Ada", true);

            assertEquals("Ada", ((GrammarMatch.Matched) match).args().require("name"));
        }

        @Test
        void greet_withoutName_noMatch() {
            GrammarMatch match = grammar.match("!greet", false);

            assertFalse(match.isMatched());
            assertInstanceOf(GrammarMatch.NoMatch.class, match);
        }
    }

    // =========================================================================
    // Arguments
    // =========================================================================

    @Nested
    class Arguments {

        @BeforeEach
        void register() {
            grammar.add(compile(literal("greet"), optional(named("name", WORD)), end()), "greet", 0);
        }

        @Test
        void greet_inChannel_capturesName() {
            GrammarMatch match = grammar.match("!greet Ada", false);

            assertTrue(match.isMatched());
            GrammarMatch.Matched matched = (GrammarMatch.Matched) match;
            assertEquals("greet", matched.name());
            assertEquals("Ada", matched.args().require("name"));
            assertEquals("greet Ada", matched.args().matchedText());
        }

        @Test
        void greet_inDirectMessage_withoutPrefix() {
            GrammarMatch match = grammar.match("greet Ada", true);

            assertEquals("Ada", ((GrammarMatch.Matched) match).args().get("name").orElseThrow());
        }

        @Test
        void greet_withoutName_optionalGroupAbsent() {
            GrammarMatch match = grammar.match("!greet", false);

            assertTrue(match.isMatched());
            assertFalse(((GrammarMatch.Matched) match).args().has("name"));
        }

        @Test
        void greet_extraWords_rejectedByEnd() {
            assertFalse(grammar.matches("!greet Ada Lovelace", false));
        }

        @Test
        void literal_caseInsensitive() {
            assertTrue(grammar.matches("!GREET ada", false));
        }

        @Test
        void withoutEnd_trailingTextAllowed() {
            grammar.add(compile(literal("echo")), "echo", 0);

            assertTrue(grammar.matches("!echo anything at all", false));
        }

        @Test
        void tail_capturesMultilineRemainder() {
            grammar.add(compile(literal("say"), tail("text")), "say", 1);

            GrammarMatch.Matched matched = (GrammarMatch.Matched) grammar.match("!say hello\nworld", false);
            assertEquals("hello\nworld", matched.args().require("text"));
        }

        @Test
        void flags_captureOnlyWhenPresent() {
            grammar.add(compile(literal("list"), optional(flag("all")), optional(flagWithArg("n", INTEGER)), end()),
                    "list", 1);

            ParsedArgs withFlags = ((GrammarMatch.Matched) grammar.match("!list --all -n 5", false)).args();
            assertTrue(withFlags.has("all"));
            assertEquals("5", withFlags.require("n"));

            ParsedArgs bare = ((GrammarMatch.Matched) grammar.match("!list", false)).args();
            assertTrue(bare.isEmpty());
        }
    }

    // =========================================================================
    // Expressions and helpers
    // =========================================================================

    @Test
    void anyOf_matchesAlternatives() {
        grammar.add(compile(named("verb", anyOf(literal("add"), literal("remove"))), named("item", WORD), end()),
                "edit", 0);

        assertEquals("remove", ((GrammarMatch.Matched) grammar.match("!remove apples", false)).args().require("verb"));
    }

    @Test
    void mention_roundTripsUserId() {
        assertEquals("<@U12345678>", Mentions.fromUserId("U12345678"));
        assertEquals("U12345678", Mentions.toUserId("<@U12345678>").orElseThrow());
        assertTrue(Mentions.toUserId("<@U12345678> trailing").isEmpty());
        assertTrue(Mentions.toUserId("hello").isEmpty());
    }

    @Test
    void mentionFragment_matchesInCommand() {
        grammar.add(compile(literal("poke"), named("who", MENTION), end()), "poke", 0);

        assertEquals("<@UABCDEFGH>",
                ((GrammarMatch.Matched) grammar.match("!poke <@UABCDEFGH>", false)).args().require("who"));
    }

    @Test
    void entry_groupNamesExtracted() {
        GrammarEntry entry = GrammarEntry.of(0, "x", Pattern.compile("(?<first>a)(b)\\(?<notgroup>(?<second>c)"));

        assertEquals(List.of("first", "second"), entry.groupNames());
    }

    @Test
    void parsedArgs_requireMissing_throws() {
        assertThrows(java.util.NoSuchElementException.class, () -> ParsedArgs.empty().require("nope"));
    }
}

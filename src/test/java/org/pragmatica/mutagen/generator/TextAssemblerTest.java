package org.pragmatica.mutagen.generator;

import org.junit.jupiter.api.Test;
import org.pragmatica.mutagen.node.ControlMark;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextAssemblerTest {

    private static String assemble(Object... parts) {
        var tokens = new ArrayList<Token>();
        for (var part : parts) {
            tokens.add(part instanceof ControlMark mark
                       ? Token.mark(mark)
                       : Token.word((String) part));
        }
        return TextAssembler.assemble(tokens);
    }

    @Test
    void words_areSpacedCapitalizedAndTerminated() {
        assertEquals("Hello there world.", assemble("hello", "there", "world"));
    }

    @Test
    void noTokens_producesEmptyText() {
        assertEquals("", TextAssembler.assemble(List.of()));
    }

    @Test
    void emptyWords_areSkipped() {
        assertEquals("Hello world.", assemble("", "hello", "", "world"));
    }

    @Test
    void period_startsNewCapitalizedSentence() {
        assertEquals("Hello. Goodbye.", assemble("hello", ControlMark.PERIOD, "goodbye"));
    }

    @Test
    void period_overridesPendingComma() {
        assertEquals("Hello. Goodbye.", assemble("hello", ControlMark.COMMA, ControlMark.PERIOD, "goodbye"));
    }

    @Test
    void comma_neverWeakensStrongerMark() {
        assertEquals("Hello. Goodbye.", assemble("hello", ControlMark.PERIOD, ControlMark.COMMA, "goodbye"));
        assertEquals("Hello; goodbye.", assemble("hello", ControlMark.SEMICOLON, ControlMark.COMMA, "goodbye"));
        assertEquals("Hello -- goodbye.", assemble("hello", ControlMark.DASH, ControlMark.COMMA, "goodbye"));
    }

    @Test
    void separators_followPrecedence() {
        assertEquals("One, two.", assemble("one", ControlMark.COMMA, "two"));
        assertEquals("One -- two.", assemble("one", ControlMark.COMMA, ControlMark.DASH, "two"));
        assertEquals("One; two.", assemble("one", ControlMark.DASH, ControlMark.SEMICOLON, "two"));
        assertEquals("One; two.", assemble("one", ControlMark.SEMICOLON, ControlMark.DASH, "two"));
    }

    @Test
    void punctuationBeforeFirstWord_isIgnored() {
        assertEquals("Hello.", assemble(ControlMark.COMMA, ControlMark.SEMICOLON, ControlMark.DASH, "hello"));
    }

    @Test
    void aAn_beforeVowel_becomesAn() {
        assertEquals("An elephant.", assemble(ControlMark.A_AN, "elephant"));
        assertEquals("I saw an Emu.", assemble("I", "saw", ControlMark.A_AN, "Emu"));
    }

    @Test
    void aAn_beforeConsonant_staysA() {
        assertEquals("A cat.", assemble(ControlMark.A_AN, "cat"));
        assertEquals("It was a hole.", assemble("it", "was", ControlMark.A_AN, "hole"));
    }

    @Test
    void aAn_atEnd_isTerminated() {
        assertEquals("Take a.", assemble("take", ControlMark.A_AN));
    }

    @Test
    void aAn_afterComma_keepsCommaSeparator() {
        assertEquals("Chloe, an aesthete.", assemble("Chloe", ControlMark.COMMA, ControlMark.A_AN, "aesthete"));
    }

    @Test
    void concat_suppressesSpace() {
        assertEquals("Five pm.", assemble("five", ControlMark.CONCAT, "pm"));
        assertEquals("Three weeks ago.", assemble("three", "week", ControlMark.CONCAT, "s", "ago"));
    }

    @Test
    void trailingPeriodMark_endsWithoutExtraPeriod() {
        // A final period mark leaves the assembler waiting for a new sentence that never comes
        assertEquals("Hello", assemble("hello", ControlMark.PERIOD));
    }

    @Test
    void trailingComma_isReplacedByPeriod() {
        assertEquals("Hello.", assemble("hello", ControlMark.COMMA));
    }
}

package org.pragmatica.mutagen.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.mutagen.grammar.GrammarParser;
import org.pragmatica.mutagen.source.SourceLocation;
import org.pragmatica.mutagen.source.SourceSpan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DiagnosticTest {

    @Test
    void format_undefinedRule_pointsAtReference() {
        var text = "-greeting- = hello -nme-";
        var exception = assertThrows(MutagenException.class, () -> GrammarParser.parse(text).validate());
        var error = (GrammarError) exception.error();

        var formatted = error.diagnostic().format(text, "story.mut");

        assertThat(formatted).contains("error: undefined rule '-nme-'")
                             .contains("--> story.mut:1:20")
                             .contains("1 | -greeting- = hello -nme-")
                             .contains(" ".repeat(19) + "^^^^^ not defined in this grammar")
                             .contains("= help: define it with: -nme- = ...");
    }

    @Test
    void format_withoutFilename_showsPositionOnly() {
        var span = SourceSpan.of(SourceLocation.at(1, 3, 2), SourceLocation.at(1, 4, 3));

        var formatted = Diagnostic.warning("odd word", span).format("a b c", null);

        assertThat(formatted).startsWith("warning: odd word\n")
                             .contains("--> 1:3\n")
                             .contains("  ^\n");
    }

    @Test
    void formatSimple_isSingleLine() {
        var span = SourceSpan.of(SourceLocation.at(2, 5, 12), SourceLocation.at(2, 8, 15));

        assertEquals("2:5: error: bad thing", Diagnostic.error("bad thing", span).formatSimple());
    }

    @Test
    void withLabelAndNote_accumulate() {
        var diagnostic = Diagnostic.error("oops", SourceSpan.START)
                                   .withLabel("here")
                                   .withNote("first")
                                   .withHelp("second");

        assertEquals(1, diagnostic.labels().size());
        assertEquals(2, diagnostic.notes().size());
        assertEquals("help: second", diagnostic.notes().get(1));
    }

    @Test
    void message_includesLocation() {
        var exception = assertThrows(MutagenException.class, () -> GrammarParser.parse("-x- = (a"));

        assertThat(exception.getMessage()).startsWith("Unexpected end of input at 1:9")
                                          .endsWith("expected ')'");
    }
}

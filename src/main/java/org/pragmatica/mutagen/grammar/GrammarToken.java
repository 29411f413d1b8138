package org.pragmatica.mutagen.grammar;

import org.pragmatica.mutagen.node.ControlMark;
import org.pragmatica.mutagen.source.SourceSpan;

/**
 * Token types for the grammar lexer.
 */
public sealed interface GrammarToken {
    SourceSpan span();

    // -rule-name-
    record Name(SourceSpan span, String name) implements GrammarToken {}

    record Word(SourceSpan span, String text) implements GrammarToken {}

    // . , ; --
    record Punct(SourceSpan span, ControlMark mark) implements GrammarToken {}

    // Operators
    record Equals(SourceSpan span) implements GrammarToken {}

    record Slash(SourceSpan span) implements GrammarToken {}

    // Delimiters
    record LParen(SourceSpan span) implements GrammarToken {}

    record RParen(SourceSpan span) implements GrammarToken {}

    record LBrace(SourceSpan span) implements GrammarToken {}

    record RBrace(SourceSpan span) implements GrammarToken {}

    record LBracket(SourceSpan span) implements GrammarToken {}

    record RBracket(SourceSpan span) implements GrammarToken {}

    // Special
    record Eof(SourceSpan span) implements GrammarToken {}

    record Error(SourceSpan span, String message) implements GrammarToken {}
}

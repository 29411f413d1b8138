package org.pragmatica.mutagen.grammar;

import org.pragmatica.mutagen.node.ControlMark;
import org.pragmatica.mutagen.source.SourceSpan;

import java.util.List;

/**
 * Grammar expression types - the parsed, unresolved body of a rule.
 */
public sealed interface Expression {

    /**
     * Source location of this expression in the grammar.
     */
    SourceSpan span();

    // === Terminals ===

    /**
     * A single word: {@code dragon}
     */
    record Literal(SourceSpan span, String text) implements Expression {}

    /**
     * Rule reference: {@code -name-}
     */
    record Reference(SourceSpan span, String ruleName) implements Expression {}

    /**
     * Punctuation: {@code . , ; --}
     */
    record Punctuation(SourceSpan span, ControlMark mark) implements Expression {}

    /**
     * Nothing, as in {@code ()} or an empty alternative.
     */
    record Empty(SourceSpan span) implements Expression {}

    // === Combinators ===

    /**
     * Sequence: {@code e1 e2 e3}
     */
    record Sequence(SourceSpan span, List<Expression> elements) implements Expression {}

    /**
     * Weighted alternatives: {@code [2] e1 / e2 / e3}
     */
    record Choice(SourceSpan span, List<Alternative> alternatives) implements Expression {}

    /**
     * Draw without repeats: {@code { e1 / e2 / e3 }}
     */
    record Shuffle(SourceSpan span, List<Expression> elements) implements Expression {}

    /**
     * Labelled choice correlated with every other use of the label: {@code gender{ e1 / e2 }}
     */
    record Fixed(SourceSpan span, String label, Choice choice) implements Expression {}

    /**
     * One branch of a {@link Choice}; weight is 1 unless written as {@code [n]}.
     */
    record Alternative(int weight, Expression expression) {}
}

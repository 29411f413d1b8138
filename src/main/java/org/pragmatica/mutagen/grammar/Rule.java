package org.pragmatica.mutagen.grammar;

import org.pragmatica.mutagen.source.SourceSpan;

/**
 * A grammar rule: {@code -name- = alternatives}
 */
public record Rule(
 SourceSpan span,
 String name,
 Expression expression) {}

package org.pragmatica.mutagen.node;

/**
 * Control tokens consumed by the text assembler rather than emitted as words.
 */
public enum ControlMark {
    /**
     * Ends the sentence; the next word is capitalized.
     */
    PERIOD,
    COMMA,
    SEMICOLON,
    /**
     * Rendered as {@code " -- "}.
     */
    DASH,
    /**
     * Resolves to "a" or "an" depending on the word that follows.
     */
    A_AN,
    /**
     * Suppresses the space before the next word.
     */
    CONCAT
}

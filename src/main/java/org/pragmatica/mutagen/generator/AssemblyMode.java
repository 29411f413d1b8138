package org.pragmatica.mutagen.generator;

/**
 * Separator pending before the next word.
 *
 * <p>Punctuation precedence, strongest first: {@code NEW_SENTENCE}, {@code SEMICOLON}, {@code DASH},
 * {@code COMMA}, {@code INTERWORD}. A pending mark is only ever upgraded, never weakened.
 */
public enum AssemblyMode {
    BEGINNING(""),
    NEW_SENTENCE(". "),
    INTERWORD(" "),
    COMMA(", "),
    SEMICOLON("; "),
    DASH(" -- "),
    A_AN(" "),
    CONCAT("");

    private final String separator;

    AssemblyMode(String separator) {
        this.separator = separator;
    }

    public String separator() {
        return separator;
    }

    /**
     * Whether the next word opens a sentence and must be capitalized.
     */
    public boolean startsSentence() {
        return this == BEGINNING || this == NEW_SENTENCE;
    }
}

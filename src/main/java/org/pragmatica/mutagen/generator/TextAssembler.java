package org.pragmatica.mutagen.generator;

import org.pragmatica.mutagen.node.ControlMark;

import java.util.List;
import java.util.Locale;

/**
 * Single-pass state machine turning a token stream into punctuated, capitalized prose.
 *
 * <p>Marks never print on their own: each one only changes the separator emitted before the
 * next word. After the last word a period is appended unless the text is empty or already
 * ends a sentence.
 */
public final class TextAssembler {
    private static final int DEFAULT_TEXT_CAPACITY = 128;
    private static final String VOWELS = "aeiouAEIOU";

    private final StringBuilder out;
    private AssemblyMode mode;

    private TextAssembler() {
        this.out = new StringBuilder(DEFAULT_TEXT_CAPACITY);
        this.mode = AssemblyMode.BEGINNING;
    }

    public static String assemble(List<Token> tokens) {
        var assembler = new TextAssembler();
        for (var token : tokens) {
            assembler.accept(token);
        }
        return assembler.finish();
    }

    private void accept(Token token) {
        if (token instanceof Token.Mark mark) {
            acceptMark(mark.mark());
        } else if (token instanceof Token.Word word) {
            if (!word.text().isEmpty()) {
                appendWord(word.text(), AssemblyMode.INTERWORD);
            }
        }
    }

    private void acceptMark(ControlMark mark) {
        switch (mark) {
            case PERIOD -> mode = AssemblyMode.NEW_SENTENCE;
            case COMMA -> upgrade(AssemblyMode.COMMA, AssemblyMode.INTERWORD);
            case DASH -> upgrade(AssemblyMode.DASH, AssemblyMode.INTERWORD, AssemblyMode.COMMA);
            case SEMICOLON -> upgrade(AssemblyMode.SEMICOLON,
                                      AssemblyMode.INTERWORD,
                                      AssemblyMode.COMMA,
                                      AssemblyMode.DASH);
            case CONCAT -> mode = AssemblyMode.CONCAT;
            case A_AN -> appendWord("a", AssemblyMode.A_AN);
        }
    }

    private void upgrade(AssemblyMode target, AssemblyMode... weaker) {
        for (var candidate : weaker) {
            if (mode == candidate) {
                mode = target;
                return;
            }
        }
    }

    private void appendWord(String text, AssemblyMode nextMode) {
        var word = mode.startsSentence()
                   ? capitalize(text)
                   : text;
        if (mode == AssemblyMode.A_AN && startsWithVowel(word)) {
            out.append('n');
        }
        out.append(mode.separator())
           .append(word);
        mode = nextMode;
    }

    private String finish() {
        if (!mode.startsSentence()) {
            out.append('.');
        }
        return out.toString();
    }

    private static String capitalize(String text) {
        return text.substring(0, 1)
                   .toUpperCase(Locale.ROOT) + text.substring(1);
    }

    private static boolean startsWithVowel(String text) {
        return VOWELS.indexOf(text.charAt(0)) >= 0;
    }
}

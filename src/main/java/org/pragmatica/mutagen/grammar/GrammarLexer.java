package org.pragmatica.mutagen.grammar;

import org.pragmatica.mutagen.node.ControlMark;
import org.pragmatica.mutagen.source.SourceLocation;
import org.pragmatica.mutagen.source.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for the rule grammar syntax.
 *
 * <p>Rule names are wrapped in dashes ({@code -person-name-}), words are runs of letters, digits and
 * apostrophes, and {@code #} starts a comment running to the end of the line.
 */
public final class GrammarLexer {
    private static final int MAX_INPUT_SIZE = 1_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 32;

    private final String input;
    private int pos;
    private int line;
    private int column;

    private GrammarLexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public static List<GrammarToken> tokenize(String input) {
        if (input.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException(
            "Grammar input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        return new GrammarLexer(input).tokenizeAll();
    }

    private List<GrammarToken> tokenizeAll() {
        var tokens = new ArrayList<GrammarToken>();
        while (!isAtEnd()) {
            skipWhitespaceAndComments();
            if (!isAtEnd()) {
                tokens.add(nextToken());
            }
        }
        tokens.add(new GrammarToken.Eof(currentSpan()));
        return tokens;
    }

    private GrammarToken nextToken() {
        var start = currentLocation();
        char c = peek();
        if (isWordPart(c)) {
            return scanWord(start);
        }
        if (c == '-') {
            return scanNameOrDash(start);
        }
        return scanOperator(start);
    }

    private GrammarToken scanWord(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isWordPart(peek())) {
            sb.append(advance());
        }
        return new GrammarToken.Word(span(start), sb.toString());
    }

    /**
     * A name runs to the last dash of the name-character run that follows the opening dash,
     * with at least one character in between. A bare {@code --} followed by whitespace is a dash mark.
     */
    private GrammarToken scanNameOrDash(SourceLocation start) {
        int runEnd = pos + 1;
        int closing = -1;
        while (runEnd < input.length() && isNamePart(input.charAt(runEnd))) {
            if (input.charAt(runEnd) == '-' && runEnd > pos + 1) {
                closing = runEnd;
            }
            runEnd++ ;
        }
        if (closing > 0) {
            var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
            while (pos <= closing) {
                sb.append(advance());
            }
            return new GrammarToken.Name(span(start), sb.toString());
        }
        if (isDashMark()) {
            advance();
            advance();
            return new GrammarToken.Punct(span(start), ControlMark.DASH);
        }
        advance();
        return new GrammarToken.Error(span(start), "Unterminated rule name");
    }

    private boolean isDashMark() {
        if (pos + 1 >= input.length() || input.charAt(pos + 1) != '-') {
            return false;
        }
        return pos + 2 >= input.length() || Character.isWhitespace(input.charAt(pos + 2));
    }

    private GrammarToken scanOperator(SourceLocation start) {
        char c = advance();
        return switch (c) {
            case '=' -> new GrammarToken.Equals(span(start));
            case '/' -> new GrammarToken.Slash(span(start));
            case '(' -> new GrammarToken.LParen(span(start));
            case ')' -> new GrammarToken.RParen(span(start));
            case '{' -> new GrammarToken.LBrace(span(start));
            case '}' -> new GrammarToken.RBrace(span(start));
            case '[' -> new GrammarToken.LBracket(span(start));
            case ']' -> new GrammarToken.RBracket(span(start));
            case '.' -> new GrammarToken.Punct(span(start), ControlMark.PERIOD);
            case ',' -> new GrammarToken.Punct(span(start), ControlMark.COMMA);
            case ';' -> new GrammarToken.Punct(span(start), ControlMark.SEMICOLON);
            default -> new GrammarToken.Error(span(start), "Unexpected character: " + c);
        };
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '#') {
                // Line comment
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else {
                break;
            }
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        char c = input.charAt(pos++ );
        if (c == '\n') {
            line++ ;
            column = 1;
        } else {
            column++ ;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan currentSpan() {
        return SourceSpan.at(currentLocation());
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private static boolean isWordPart(char c) {
        return Character.isLetterOrDigit(c) || c == '\'';
    }

    private static boolean isNamePart(char c) {
        return isWordPart(c) || c == '-';
    }
}

package org.pragmatica.mutagen.grammar;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.mutagen.error.GrammarError;
import org.pragmatica.mutagen.error.MutagenException;
import org.pragmatica.mutagen.source.SourceLocation;
import org.pragmatica.mutagen.source.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for the rule grammar syntax.
 * Converts grammar text into a {@link Grammar}.
 *
 * <pre>
 * -greeting- = hello -who- .
 * -who-      = [2] world / gender{ sir / madam } / { one / two / three }
 * </pre>
 */
public final class GrammarParser {
    private static final Logger logger = LogManager.getLogger(GrammarParser.class);

    private final List<GrammarToken> tokens;
    private int pos;

    private GrammarParser(List<GrammarToken> tokens) {
        this.tokens = tokens;
        this.pos = 0;
    }

    /**
     * Parse grammar text into a Grammar object.
     *
     * @throws MutagenException carrying a {@link GrammarError} on malformed input
     */
    public static Grammar parse(String grammarText) {
        var tokens = GrammarLexer.tokenize(grammarText);

        // Check for lexer errors
        for (var token : tokens) {
            if (token instanceof GrammarToken.Error error) {
                throw new GrammarError.InvalidToken(error.span(), error.message()).exception();
            }
        }

        var grammar = new GrammarParser(tokens).parseGrammar();
        logger.debug("Parsed grammar with {} rules", grammar.rules().size());
        return grammar;
    }

    private Grammar parseGrammar() {
        var rules = new ArrayList<Rule>();

        while (!isAtEnd()) {
            if (!isRuleDefinitionStart()) {
                throw unexpected("rule definition");
            }
            rules.add(parseRule());
        }
        return new Grammar(rules);
    }

    private Rule parseRule() {
        var start = peek().span().start();
        var name = (GrammarToken.Name) peek();
        advance();
        // skip =
        advance();

        var expression = parseChoice();
        var span = SourceSpan.of(start, currentLocation());
        return new Rule(span, name.name(), expression);
    }

    /**
     * A single unweighted alternative collapses to its own expression.
     */
    private Expression parseChoice() {
        var start = peek().span().start();
        var alternatives = parseAlternatives();
        if (alternatives.size() == 1) {
            return alternatives.get(0).expression();
        }
        return new Expression.Choice(SourceSpan.of(start, currentLocation()), alternatives);
    }

    private List<Expression.Alternative> parseAlternatives() {
        var alternatives = new ArrayList<Expression.Alternative>();
        alternatives.add(parseAlternative());

        while (peek() instanceof GrammarToken.Slash) {
            advance();
            alternatives.add(parseAlternative());
        }
        return alternatives;
    }

    private Expression.Alternative parseAlternative() {
        var weight = 1;
        if (peek() instanceof GrammarToken.LBracket) {
            weight = parseWeight();
        }
        return new Expression.Alternative(weight, parseSequence());
    }

    private int parseWeight() {
        var start = peek().span().start();
        advance();
        // skip [
        if (!(peek() instanceof GrammarToken.Word word) || !isNumber(word.text())) {
            throw unexpected("weight number");
        }
        advance();
        if (!(peek() instanceof GrammarToken.RBracket)) {
            throw unexpected("']'");
        }
        advance();

        int weight;
        try {
            weight = Integer.parseInt(word.text());
        } catch (NumberFormatException e) {
            throw new GrammarError.SemanticError(SourceSpan.of(start, currentLocation()),
                                                 "Weight " + word.text() + " is too large").exception();
        }
        if (weight < 1) {
            throw new GrammarError.SemanticError(SourceSpan.of(start, currentLocation()),
                                                 "Weight must be a positive integer").exception();
        }
        return weight;
    }

    private Expression parseSequence() {
        var start = peek().span().start();
        var elements = new ArrayList<Expression>();

        while (isSequenceElement()) {
            elements.add(parseFactor());
        }

        var span = SourceSpan.of(start, currentLocation());
        if (elements.isEmpty()) {
            return new Expression.Empty(span);
        }
        if (elements.size() == 1) {
            return elements.get(0);
        }
        return new Expression.Sequence(span, elements);
    }

    private boolean isSequenceElement() {
        var token = peek();
        // Name followed by = is a new rule definition, not a reference
        if (token instanceof GrammarToken.Name) {
            return !isRuleDefinitionStart();
        }
        return token instanceof GrammarToken.Word
            || token instanceof GrammarToken.Punct
            || token instanceof GrammarToken.LParen
            || token instanceof GrammarToken.LBrace;
    }

    private boolean isRuleDefinitionStart() {
        if (!(peek() instanceof GrammarToken.Name)) {
            return false;
        }
        return pos + 1 < tokens.size() && tokens.get(pos + 1) instanceof GrammarToken.Equals;
    }

    private Expression parseFactor() {
        var token = peek();
        var start = token.span().start();

        if (token instanceof GrammarToken.Name name) {
            advance();
            return new Expression.Reference(token.span(), name.name());
        }

        if (token instanceof GrammarToken.Punct punct) {
            advance();
            return new Expression.Punctuation(token.span(), punct.mark());
        }

        // Grouping ( ... )
        if (token instanceof GrammarToken.LParen) {
            advance();
            var inner = parseChoice();
            expectClosing(GrammarToken.RParen.class, "')'");
            return inner;
        }

        // Shuffle { ... }
        if (token instanceof GrammarToken.LBrace) {
            return parseShuffle(start);
        }

        if (token instanceof GrammarToken.Word word) {
            advance();
            // Labelled choice word{ ... }
            if (peek() instanceof GrammarToken.LBrace) {
                return parseFixed(start, word.text());
            }
            return new Expression.Literal(token.span(), word.text());
        }

        throw unexpected("expression");
    }

    private Expression parseShuffle(SourceLocation start) {
        advance();
        // skip {
        var alternatives = parseAlternatives();
        expectClosing(GrammarToken.RBrace.class, "'}'");
        var span = SourceSpan.of(start, currentLocation());

        var elements = new ArrayList<Expression>(alternatives.size());
        for (var alternative : alternatives) {
            if (alternative.weight() != 1) {
                throw new GrammarError.SemanticError(span, "Shuffle alternatives cannot be weighted").exception();
            }
            elements.add(alternative.expression());
        }
        return new Expression.Shuffle(span, elements);
    }

    private Expression parseFixed(SourceLocation start, String label) {
        var choiceStart = peek().span().start();
        advance();
        // skip {
        var alternatives = parseAlternatives();
        expectClosing(GrammarToken.RBrace.class, "'}'");
        var choice = new Expression.Choice(SourceSpan.of(choiceStart, currentLocation()), alternatives);
        return new Expression.Fixed(SourceSpan.of(start, currentLocation()), label, choice);
    }

    private void expectClosing(Class<? extends GrammarToken> tokenClass, String description) {
        if (!tokenClass.isInstance(peek())) {
            throw unexpected(description);
        }
        advance();
    }

    private MutagenException unexpected(String expected) {
        var token = peek();
        return new GrammarError.UnexpectedInput(token.span(), tokenDescription(token), expected).exception();
    }

    private boolean isAtEnd() {
        return peek() instanceof GrammarToken.Eof;
    }

    private GrammarToken peek() {
        return tokens.get(pos);
    }

    private void advance() {
        if (!isAtEnd()) {
            pos++ ;
        }
    }

    // Spans end where the next token starts, so trailing whitespace stays outside
    private SourceLocation currentLocation() {
        return pos > 0
               ? tokens.get(pos - 1).span().end()
               : peek().span().start();
    }

    private static boolean isNumber(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (!Character.isDigit(text.charAt(i))) {
                return false;
            }
        }
        return !text.isEmpty();
    }

    private static String tokenDescription(GrammarToken token) {
        if (token instanceof GrammarToken.Name name) {
            return "rule name '" + name.name() + "'";
        }
        if (token instanceof GrammarToken.Word word) {
            return "word '" + word.text() + "'";
        }
        if (token instanceof GrammarToken.Punct punct) {
            return "punctuation " + punct.mark();
        }
        if (token instanceof GrammarToken.Equals) {
            return "'='";
        }
        if (token instanceof GrammarToken.Slash) {
            return "'/'";
        }
        if (token instanceof GrammarToken.LParen) {
            return "'('";
        }
        if (token instanceof GrammarToken.RParen) {
            return "')'";
        }
        if (token instanceof GrammarToken.LBrace) {
            return "'{'";
        }
        if (token instanceof GrammarToken.RBrace) {
            return "'}'";
        }
        if (token instanceof GrammarToken.LBracket) {
            return "'['";
        }
        if (token instanceof GrammarToken.RBracket) {
            return "']'";
        }
        if (token instanceof GrammarToken.Eof) {
            return "end of input";
        }
        return "error";
    }
}

package org.pragmatica.mutagen.error;

import org.pragmatica.mutagen.source.SourceLocation;
import org.pragmatica.mutagen.source.SourceSpan;

import java.util.List;

/**
 * Grammar text error with location and context information.
 */
public sealed interface GrammarError extends MutagenError {
    SourceSpan span();

    default SourceLocation location() {
        return span().start();
    }

    /**
     * Rich diagnostic pointing at the offending part of the grammar text.
     */
    default Diagnostic diagnostic() {
        return Diagnostic.error(message(), span());
    }

    /**
     * Unexpected token while parsing.
     */
    record UnexpectedInput(SourceSpan span, String found, String expected) implements GrammarError {
        @Override
        public String message() {
            return "Unexpected " + found + " at " + location() + ", expected " + expected;
        }

        @Override
        public Diagnostic diagnostic() {
            return Diagnostic.error("unexpected " + found, span())
                             .withLabel("expected " + expected);
        }
    }

    /**
     * Text the lexer could not turn into a token.
     */
    record InvalidToken(SourceSpan span, String reason) implements GrammarError {
        @Override
        public String message() {
            return reason + " at " + location();
        }
    }

    /**
     * Reference to a rule that is neither defined nor built in.
     */
    record UndefinedRule(SourceSpan span, String name) implements GrammarError {
        @Override
        public String message() {
            return "Undefined rule reference: '" + name + "' at " + location();
        }

        @Override
        public Diagnostic diagnostic() {
            return Diagnostic.error("undefined rule '" + name + "'", span())
                             .withLabel("not defined in this grammar")
                             .withHelp("define it with: " + name + " = ...");
        }
    }

    record DuplicateRule(SourceSpan span, String name) implements GrammarError {
        @Override
        public String message() {
            return "Rule '" + name + "' is defined more than once, again at " + location();
        }
    }

    /**
     * A rule that reaches itself through its references.
     */
    record RecursiveRule(SourceSpan span, List<String> chain) implements GrammarError {
        public RecursiveRule {
            chain = List.copyOf(chain);
        }

        @Override
        public String message() {
            return "Recursive rule reference " + String.join(" -> ", chain) + " at " + location();
        }

        @Override
        public Diagnostic diagnostic() {
            return Diagnostic.error("recursive rule '" + chain.get(chain.size() - 1) + "'", span())
                             .withLabel("reference closes the cycle " + String.join(" -> ", chain))
                             .withNote("grammars must not refer back to themselves");
        }
    }

    record UnknownStartRule(String name) implements GrammarError {
        @Override
        public SourceSpan span() {
            return SourceSpan.START;
        }

        @Override
        public String message() {
            return "Unknown start rule: '" + name + "'";
        }
    }

    /**
     * Well-formed syntax with invalid meaning, such as a zero weight.
     */
    record SemanticError(SourceSpan span, String reason) implements GrammarError {
        @Override
        public String message() {
            return reason + " at " + location();
        }
    }
}

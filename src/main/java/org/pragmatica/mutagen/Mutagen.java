package org.pragmatica.mutagen;

import org.pragmatica.mutagen.compiler.CompilerConfig;
import org.pragmatica.mutagen.error.GrammarError;
import org.pragmatica.mutagen.generator.CompiledGenerator;
import org.pragmatica.mutagen.generator.Generator;
import org.pragmatica.mutagen.grammar.Grammar;
import org.pragmatica.mutagen.grammar.GrammarParser;
import org.pragmatica.mutagen.grammar.Rule;
import org.pragmatica.mutagen.node.Node;

import java.util.List;

/**
 * Entry point for creating text generators.
 *
 * <p>Example usage:
 * <pre>{@code
 * var generator = Mutagen.fromGrammar("""
 *     -greeting- = hello -who-
 *     -who-      = [2] world / gender{ sir / madam }
 *     """);
 *
 * var text = generator.generate(42);
 * }</pre>
 *
 * <p>All failures are reported as {@link org.pragmatica.mutagen.error.MutagenException}
 * carrying a typed {@link org.pragmatica.mutagen.error.MutagenError}.
 */
public final class Mutagen {
    private Mutagen() {}

    /**
     * Create a generator from a node tree.
     */
    public static Generator compile(Node root) {
        return compile(root, CompilerConfig.DEFAULT);
    }

    /**
     * Create a generator from a node tree with custom configuration.
     */
    public static Generator compile(Node root, CompilerConfig config) {
        return CompiledGenerator.create(root, config);
    }

    /**
     * Parse grammar text without resolving it.
     */
    public static Grammar parseGrammar(String grammarText) {
        return GrammarParser.parse(grammarText);
    }

    /**
     * Create a generator from grammar text, starting at the first rule.
     */
    public static Generator fromGrammar(String grammarText) {
        var grammar = GrammarParser.parse(grammarText);
        var startRule = grammar.effectiveStartRule()
                               .map(Rule::name)
                               .orElseThrow(() -> new GrammarError.UnknownStartRule("<none>").exception());
        return fromGrammar(grammar, startRule, CompilerConfig.DEFAULT);
    }

    /**
     * Create a generator from grammar text, starting at the named rule.
     */
    public static Generator fromGrammar(String grammarText, String startRule) {
        return fromGrammar(GrammarParser.parse(grammarText), startRule, CompilerConfig.DEFAULT);
    }

    /**
     * Create a generator from a pre-parsed grammar with custom configuration.
     */
    public static Generator fromGrammar(Grammar grammar, String startRule, CompilerConfig config) {
        return compile(grammar.resolve(startRule), config);
    }

    /**
     * Create a builder for more complex generator configuration.
     */
    public static Builder builder(String grammarText) {
        return new Builder(grammarText);
    }

    public static final class Builder {
        private final String grammarText;
        private String startRule;
        private List<Integer> primes = CompilerConfig.DEFAULT.primes();
        private boolean validateLabels = true;

        private Builder(String grammarText) {
            this.grammarText = grammarText;
        }

        public Builder startRule(String startRule) {
            this.startRule = startRule;
            return this;
        }

        public Builder primes(List<Integer> primes) {
            this.primes = primes;
            return this;
        }

        public Builder validateLabels(boolean enabled) {
            this.validateLabels = enabled;
            return this;
        }

        public Generator build() {
            var grammar = GrammarParser.parse(grammarText);
            var rule = startRule != null
                       ? startRule
                       : grammar.effectiveStartRule()
                                .map(Rule::name)
                                .orElseThrow(() -> new GrammarError.UnknownStartRule("<none>").exception());
            return fromGrammar(grammar, rule, new CompilerConfig(primes, validateLabels));
        }
    }
}

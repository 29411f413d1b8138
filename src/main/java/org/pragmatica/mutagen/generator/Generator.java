package org.pragmatica.mutagen.generator;

import org.pragmatica.mutagen.compiler.CompiledNode;

import java.util.List;

/**
 * Generator interface - turns a seed into text according to a compiled grammar.
 *
 * <p>Implementations are not thread-safe: shuffle nodes remember what they already produced
 * for the current seed. Serialize calls on one generator, or compile one generator per thread.
 */
public interface Generator {

    /**
     * Generate the finished text for {@code seed}.
     *
     * @throws IllegalArgumentException if {@code seed} is negative
     */
    String generate(long seed);

    /**
     * Generate the raw token stream for {@code seed}, before assembly.
     */
    List<Token> tokens(long seed);

    /**
     * Generate texts for {@code count} consecutive seeds starting at {@code firstSeed}.
     */
    List<String> sample(long firstSeed, int count);

    /**
     * Drop every shuffle's pending draw, so the next call starts fresh even for the last seed used.
     */
    void reset();

    /**
     * Root of the compiled tree driving this generator.
     */
    CompiledNode root();
}

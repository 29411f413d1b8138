package org.pragmatica.mutagen.generator;

import org.pragmatica.mutagen.compiler.CompiledNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks a compiled tree for one seed, producing the raw token stream.
 *
 * <p>Pure given the seed, except for shuffle state carried by the compiled tree.
 */
public final class Evaluator {
    private static final int DEFAULT_TOKEN_CAPACITY = 32;

    private final long seed;
    private final List<Token> tokens;

    private Evaluator(long seed) {
        this.seed = seed;
        this.tokens = new ArrayList<>(DEFAULT_TOKEN_CAPACITY);
    }

    public static List<Token> evaluate(CompiledNode root, long seed) {
        if (seed < 0) {
            throw new IllegalArgumentException("Seed must be non-negative, got " + seed);
        }
        var evaluator = new Evaluator(seed);
        evaluator.emit(root);
        return List.copyOf(evaluator.tokens);
    }

    private void emit(CompiledNode node) {
        if (node instanceof CompiledNode.Emit emit) {
            tokens.add(emit.token());
        } else if (node instanceof CompiledNode.Sequence sequence) {
            for (var child : sequence.children()) {
                emit(child);
            }
        } else if (node instanceof CompiledNode.Weighted weighted) {
            emit(weighted.select(seed));
        } else if (node instanceof CompiledNode.Shuffle shuffle) {
            emit(shuffle.next(seed));
        } else if (node instanceof CompiledNode.Fixed fixed) {
            emit(fixed.child());
        }
        // Silent emits nothing
    }
}

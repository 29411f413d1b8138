package org.pragmatica.mutagen.compiler;

import org.pragmatica.mutagen.generator.Token;

import java.util.List;

/**
 * A node bound to its assigned cycle and to the compiled forms of its children.
 */
public sealed interface CompiledNode {

    /**
     * Leaf emitting a single token.
     */
    record Emit(Token token) implements CompiledNode {}

    /**
     * Leaf emitting nothing.
     */
    record Silent() implements CompiledNode {}

    record Sequence(List<CompiledNode> children) implements CompiledNode {}

    /**
     * Weighted choice selecting by {@code (seed % cycle) % totalWeight}.
     */
    record Weighted(int cycle, int totalWeight, List<Branch> branches) implements CompiledNode {
        public CompiledNode select(long seed) {
            var value = (seed % cycle) % totalWeight;
            for (var branch : branches) {
                if (value < branch.weight()) {
                    return branch.node();
                }
                value -= branch.weight();
            }
            // Unreachable while totalWeight is the sum of branch weights
            return branches.get(branches.size() - 1).node();
        }
    }

    record Branch(int weight, CompiledNode node) {}

    /**
     * Draw without replacement across the invocations made for one seed.
     * Occurrences compiled from the same source node share {@code state}.
     */
    record Shuffle(int cycle, List<CompiledNode> children, ShuffleState state) implements CompiledNode {
        public CompiledNode next(long seed) {
            return state.next(seed, cycle, children);
        }
    }

    record Fixed(String label, CompiledNode child) implements CompiledNode {}
}

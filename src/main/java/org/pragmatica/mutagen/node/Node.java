package org.pragmatica.mutagen.node;

import org.pragmatica.mutagen.error.CompileError;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Generative node types - the building blocks of a text grammar.
 *
 * <p>Example usage:
 * <pre>{@code
 * var gender = Node.fixed("gender", Node.choice("aunt", "uncle"));
 * var name = Node.fixed("gender", Node.choice("Harriet", "Harold"));
 * var root = Node.sequence("my", gender, name, "arrived", Node.PERIOD);
 * }</pre>
 *
 * <p>Factory methods accepting {@code Object...} take either nodes or plain strings;
 * strings are wrapped into {@link Literal}.
 */
public sealed interface Node {

    Node EMPTY = new Empty();
    Node PERIOD = new Mark(ControlMark.PERIOD);
    Node COMMA = new Mark(ControlMark.COMMA);
    Node SEMICOLON = new Mark(ControlMark.SEMICOLON);
    Node DASH = new Mark(ControlMark.DASH);
    Node A_AN = new Mark(ControlMark.A_AN);
    Node CONCAT = new Mark(ControlMark.CONCAT);

    // === Terminals ===

    /**
     * Plain text, emitted unchanged regardless of the seed.
     */
    record Literal(String text) implements Node {
        public Literal {
            Objects.requireNonNull(text, "text");
        }
    }

    /**
     * Emits nothing.
     */
    record Empty() implements Node {}

    /**
     * Punctuation and other control tokens.
     */
    record Mark(ControlMark mark) implements Node {
        public Mark {
            Objects.requireNonNull(mark, "mark");
        }
    }

    // === Combinators ===

    /**
     * Emits every child in declared order.
     */
    record Sequence(List<Node> children) implements Node {
        public Sequence {
            children = List.copyOf(children);
        }
    }

    /**
     * Emits exactly one alternative, picked with probability proportional to its weight.
     */
    record Weighted(List<Alternative> alternatives) implements Node {
        public Weighted {
            if (alternatives.isEmpty()) {
                throw new CompileError.EmptyChoice("Weighted").exception();
            }
            alternatives = List.copyOf(alternatives);
            sumWeights(alternatives);
        }

        public int totalWeight() {
            return sumWeights(alternatives);
        }

        private static int sumWeights(List<Alternative> alternatives) {
            var total = 0;
            for (var alternative : alternatives) {
                try {
                    total = Math.addExact(total, alternative.weight());
                } catch (ArithmeticException e) {
                    throw new CompileError.WeightOverflow(alternatives.size()).exception();
                }
            }
            return total;
        }
    }

    /**
     * One weighted branch of a {@link Weighted} node.
     */
    record Alternative(int weight, Node node) {
        public Alternative {
            if (weight < 1) {
                throw new CompileError.InvalidWeight(weight).exception();
            }
            Objects.requireNonNull(node, "node");
        }
    }

    /**
     * Emits one child per invocation, avoiding repeats within the generation of a single seed
     * until every child has been used once.
     */
    record Shuffle(List<Node> children) implements Node {
        public Shuffle {
            if (children.isEmpty()) {
                throw new CompileError.EmptyChoice("Shuffle").exception();
            }
            children = List.copyOf(children);
        }
    }

    /**
     * Transparent wrapper that makes every choice carrying the same label resolve identically.
     */
    record Fixed(String label, Node node) implements Node {
        public Fixed {
            Objects.requireNonNull(label, "label");
            Objects.requireNonNull(node, "node");
        }
    }

    // === Factories ===

    static Node literal(String text) {
        return text.isEmpty()
               ? EMPTY
               : new Literal(text);
    }

    static Node sequence(Object... parts) {
        return new Sequence(toNodes(parts));
    }

    /**
     * Uniform choice: a {@link Weighted} node with every weight equal to one.
     */
    static Node choice(Object... parts) {
        var alternatives = new ArrayList<Alternative>(parts.length);
        for (var node : toNodes(parts)) {
            alternatives.add(new Alternative(1, node));
        }
        return new Weighted(alternatives);
    }

    /**
     * Weighted choice from alternating weight/node arguments:
     * {@code weighted(2, "human", 1, "elf", 1, "dwarf")}.
     */
    static Node weighted(Object... weightsAndParts) {
        if (weightsAndParts.length % 2 != 0) {
            throw new IllegalArgumentException("Weighted expects weight/node pairs, got "
                                               + weightsAndParts.length + " arguments");
        }
        var alternatives = new ArrayList<Alternative>(weightsAndParts.length / 2);
        for (int i = 0; i < weightsAndParts.length; i += 2) {
            if (!(weightsAndParts[i] instanceof Integer weight)) {
                throw new IllegalArgumentException("Expected integer weight at position " + i
                                                   + ", got " + weightsAndParts[i]);
            }
            alternatives.add(new Alternative(weight, toNode(weightsAndParts[i + 1])));
        }
        return new Weighted(alternatives);
    }

    static Node shuffle(Object... parts) {
        return new Shuffle(toNodes(parts));
    }

    static Node fixed(String label, Node node) {
        return new Fixed(label, node);
    }

    private static List<Node> toNodes(Object... parts) {
        var nodes = new ArrayList<Node>(parts.length);
        for (var part : parts) {
            nodes.add(toNode(part));
        }
        return nodes;
    }

    private static Node toNode(Object part) {
        if (part instanceof Node node) {
            return node;
        }
        if (part instanceof String text) {
            return literal(text);
        }
        if (part == null) {
            throw new NullPointerException("node");
        }
        throw new IllegalArgumentException("Not a node or string: " + part);
    }
}

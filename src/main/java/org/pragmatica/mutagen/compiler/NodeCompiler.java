package org.pragmatica.mutagen.compiler;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.mutagen.error.CompileError;
import org.pragmatica.mutagen.generator.Token;
import org.pragmatica.mutagen.node.Node;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Walks a node tree once, assigning a cycle prime to every choice point.
 *
 * <p>Cycles are allocated in pre-order: a choice takes its prime before its children are compiled.
 * The allocator and label map live only for the duration of {@link #compile(Node, CompilerConfig)}.
 */
public final class NodeCompiler {
    private static final Logger logger = LogManager.getLogger(NodeCompiler.class);

    private final CompilerConfig config;
    private final CycleAllocator allocator;
    private final Map<String, String> labelSignatures;
    private final Map<Node.Shuffle, ShuffleState> shuffleStates;

    private NodeCompiler(CompilerConfig config) {
        this.config = config;
        this.allocator = CycleAllocator.create(config.primes());
        this.labelSignatures = new HashMap<>();
        this.shuffleStates = new IdentityHashMap<>();
    }

    public static CompiledNode compile(Node root) {
        return compile(root, CompilerConfig.DEFAULT);
    }

    /**
     * Compile {@code root} into a tree ready for evaluation.
     *
     * @throws org.pragmatica.mutagen.error.MutagenException with {@link CompileError.PoolExhausted}
     *                                                       or {@link CompileError.LabelMismatch}
     */
    public static CompiledNode compile(Node root, CompilerConfig config) {
        var compiler = new NodeCompiler(config);
        var compiled = compiler.compileNode(root);
        logger.debug("Compiled node tree: {} cycles allocated, {} labels bound, {} primes left",
                     compiler.allocator.allocated(),
                     compiler.allocator.labelCount(),
                     compiler.allocator.remaining());
        return compiled;
    }

    private CompiledNode compileNode(Node node) {
        if (node instanceof Node.Literal literal) {
            return literal.text().isEmpty()
                   ? new CompiledNode.Silent()
                   : new CompiledNode.Emit(Token.word(literal.text()));
        }
        if (node instanceof Node.Empty) {
            return new CompiledNode.Silent();
        }
        if (node instanceof Node.Mark mark) {
            return new CompiledNode.Emit(Token.mark(mark.mark()));
        }
        if (node instanceof Node.Sequence sequence) {
            return new CompiledNode.Sequence(compileAll(sequence.children()));
        }
        if (node instanceof Node.Weighted weighted) {
            return compileWeighted(weighted, allocator.allocate());
        }
        if (node instanceof Node.Shuffle shuffle) {
            return compileShuffle(shuffle, allocator.allocate());
        }
        if (node instanceof Node.Fixed fixed) {
            return new CompiledNode.Fixed(fixed.label(), compileLabeled(fixed.label(), fixed.node()));
        }
        throw new IllegalStateException("Unknown node type: " + node);
    }

    // The label only reaches the immediate child; anything other than a choice ignores it.
    private CompiledNode compileLabeled(String label, Node node) {
        if (node instanceof Node.Weighted weighted) {
            checkSignature(label, signature(weighted));
            return compileWeighted(weighted, allocator.allocateForLabel(label));
        }
        if (node instanceof Node.Shuffle shuffle) {
            checkSignature(label, signature(shuffle));
            return compileShuffle(shuffle, allocator.allocateForLabel(label));
        }
        return compileNode(node);
    }

    private CompiledNode compileWeighted(Node.Weighted weighted, int cycle) {
        var branches = new ArrayList<CompiledNode.Branch>(weighted.alternatives().size());
        for (var alternative : weighted.alternatives()) {
            branches.add(new CompiledNode.Branch(alternative.weight(), compileNode(alternative.node())));
        }
        return new CompiledNode.Weighted(cycle, weighted.totalWeight(), List.copyOf(branches));
    }

    private CompiledNode compileShuffle(Node.Shuffle shuffle, int cycle) {
        var state = shuffleStates.computeIfAbsent(shuffle, key -> ShuffleState.create());
        return new CompiledNode.Shuffle(cycle, compileAll(shuffle.children()), state);
    }

    private List<CompiledNode> compileAll(List<Node> nodes) {
        var compiled = new ArrayList<CompiledNode>(nodes.size());
        for (var node : nodes) {
            compiled.add(compileNode(node));
        }
        return List.copyOf(compiled);
    }

    private void checkSignature(String label, String signature) {
        if (!config.validateLabels()) {
            return;
        }
        var expected = labelSignatures.putIfAbsent(label, signature);
        if (expected != null && !expected.equals(signature)) {
            throw new CompileError.LabelMismatch(label, expected, signature).exception();
        }
    }

    private static String signature(Node.Weighted weighted) {
        var weights = new ArrayList<Integer>(weighted.alternatives().size());
        for (var alternative : weighted.alternatives()) {
            weights.add(alternative.weight());
        }
        return "Weighted" + weights;
    }

    private static String signature(Node.Shuffle shuffle) {
        return "Shuffle of " + shuffle.children().size();
    }
}

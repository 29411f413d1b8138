package org.pragmatica.mutagen.generator;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.mutagen.compiler.CompiledNode;
import org.pragmatica.mutagen.compiler.CompilerConfig;
import org.pragmatica.mutagen.compiler.NodeCompiler;
import org.pragmatica.mutagen.node.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Generator backed by a compiled node tree: evaluation followed by text assembly.
 */
public final class CompiledGenerator implements Generator {
    private static final Logger logger = LogManager.getLogger(CompiledGenerator.class);

    private final CompiledNode root;

    private CompiledGenerator(CompiledNode root) {
        this.root = root;
    }

    public static CompiledGenerator create(Node node, CompilerConfig config) {
        return new CompiledGenerator(NodeCompiler.compile(node, config));
    }

    public static CompiledGenerator of(CompiledNode root) {
        return new CompiledGenerator(root);
    }

    @Override
    public String generate(long seed) {
        var text = TextAssembler.assemble(tokens(seed));
        logger.trace("Seed {} generated '{}'", seed, text);
        return text;
    }

    @Override
    public List<Token> tokens(long seed) {
        return Evaluator.evaluate(root, seed);
    }

    @Override
    public List<String> sample(long firstSeed, int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Sample count must be non-negative, got " + count);
        }
        var texts = new ArrayList<String>(count);
        for (int i = 0; i < count; i++) {
            texts.add(generate(firstSeed + i));
        }
        return texts;
    }

    @Override
    public void reset() {
        resetShuffles(root);
    }

    private static void resetShuffles(CompiledNode node) {
        if (node instanceof CompiledNode.Shuffle shuffle) {
            shuffle.state()
                   .reset();
            shuffle.children()
                   .forEach(CompiledGenerator::resetShuffles);
        } else if (node instanceof CompiledNode.Sequence sequence) {
            sequence.children()
                    .forEach(CompiledGenerator::resetShuffles);
        } else if (node instanceof CompiledNode.Weighted weighted) {
            weighted.branches()
                    .forEach(branch -> resetShuffles(branch.node()));
        } else if (node instanceof CompiledNode.Fixed fixed) {
            resetShuffles(fixed.child());
        }
        // Emit and Silent hold no state
    }

    @Override
    public CompiledNode root() {
        return root;
    }
}

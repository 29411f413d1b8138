package org.pragmatica.mutagen.grammar;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.mutagen.node.Node;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns validated rules into node trees, memoizing one node per rule.
 */
final class RuleResolver {
    private static final Logger logger = LogManager.getLogger(RuleResolver.class);

    private final Map<String, Rule> rules;
    private final Map<String, Node> resolved;

    private RuleResolver(Map<String, Rule> rules) {
        this.rules = rules;
        this.resolved = new HashMap<>();
    }

    static RuleResolver create(Map<String, Rule> rules) {
        return new RuleResolver(rules);
    }

    Node resolve(String ruleName) {
        var builtin = Grammar.BUILTINS.get(ruleName);
        if (builtin != null) {
            return builtin;
        }
        var node = resolved.get(ruleName);
        if (node == null) {
            node = toNode(rules.get(ruleName).expression());
            resolved.put(ruleName, node);
            logger.trace("Resolved rule {}", ruleName);
        }
        return node;
    }

    private Node toNode(Expression expr) {
        if (expr instanceof Expression.Literal literal) {
            return Node.literal(literal.text());
        }
        if (expr instanceof Expression.Reference ref) {
            return resolve(ref.ruleName());
        }
        if (expr instanceof Expression.Punctuation punctuation) {
            return new Node.Mark(punctuation.mark());
        }
        if (expr instanceof Expression.Empty) {
            return Node.EMPTY;
        }
        if (expr instanceof Expression.Sequence seq) {
            return new Node.Sequence(toNodes(seq.elements()));
        }
        if (expr instanceof Expression.Choice choice) {
            return toWeighted(choice);
        }
        if (expr instanceof Expression.Shuffle shuffle) {
            return new Node.Shuffle(toNodes(shuffle.elements()));
        }
        if (expr instanceof Expression.Fixed fixed) {
            return new Node.Fixed(fixed.label(), toWeighted(fixed.choice()));
        }
        throw new IllegalStateException("Unknown expression type: " + expr);
    }

    private Node toWeighted(Expression.Choice choice) {
        var alternatives = new ArrayList<Node.Alternative>(choice.alternatives().size());
        for (var alternative : choice.alternatives()) {
            alternatives.add(new Node.Alternative(alternative.weight(), toNode(alternative.expression())));
        }
        return new Node.Weighted(alternatives);
    }

    private List<Node> toNodes(List<Expression> expressions) {
        var nodes = new ArrayList<Node>(expressions.size());
        for (var expression : expressions) {
            nodes.add(toNode(expression));
        }
        return nodes;
    }
}

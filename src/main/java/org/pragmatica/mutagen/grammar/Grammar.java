package org.pragmatica.mutagen.grammar;

import org.pragmatica.mutagen.error.GrammarError;
import org.pragmatica.mutagen.node.Node;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A complete grammar - collection of named rules.
 *
 * <p>Rules may refer to rules defined later in the text, but never back to themselves,
 * directly or through other rules.
 */
public record Grammar(List<Rule> rules) {

    /**
     * Rules every grammar can reference without defining them.
     */
    public static final Map<String, Node> BUILTINS = builtins();

    public Grammar {
        rules = List.copyOf(rules);
    }

    /**
     * Get rule by name.
     */
    public Optional<Rule> rule(String name) {
        return rules.stream()
                    .filter(r -> r.name()
                                  .equals(name))
                    .findFirst();
    }

    /**
     * The first rule in the text, used when no start rule is named.
     */
    public Optional<Rule> effectiveStartRule() {
        return rules.isEmpty()
               ? Optional.empty()
               : Optional.of(rules.get(0));
    }

    /**
     * Build a lookup map for efficient rule access.
     */
    public Map<String, Rule> ruleMap() {
        var map = new LinkedHashMap<String, Rule>();
        for (var rule : rules) {
            map.putIfAbsent(rule.name(), rule);
        }
        return map;
    }

    /**
     * Check for duplicate or built-in rule names, undefined references and recursion.
     *
     * @throws org.pragmatica.mutagen.error.MutagenException with the first {@link GrammarError} found
     */
    public Grammar validate() {
        var seen = new HashSet<String>();
        for (var rule : rules) {
            if (BUILTINS.containsKey(rule.name())) {
                throw new GrammarError.SemanticError(rule.span(),
                                                     "Rule '" + rule.name() + "' redefines a built-in rule").exception();
            }
            if (!seen.add(rule.name())) {
                throw new GrammarError.DuplicateRule(rule.span(), rule.name()).exception();
            }
        }
        for (var rule : rules) {
            for (var reference : references(rule.expression())) {
                if (!seen.contains(reference.ruleName()) && !BUILTINS.containsKey(reference.ruleName())) {
                    throw new GrammarError.UndefinedRule(reference.span(), reference.ruleName()).exception();
                }
            }
        }
        checkRecursion();
        return this;
    }

    /**
     * Validate the grammar and turn the named rule into a node tree.
     * Every rule becomes exactly one node instance, shared by all references to it.
     */
    public Node resolve(String startRule) {
        validate();
        if (rule(startRule).isEmpty()) {
            throw new GrammarError.UnknownStartRule(startRule).exception();
        }
        return RuleResolver.create(ruleMap())
                           .resolve(startRule);
    }

    private void checkRecursion() {
        var ruleMap = ruleMap();
        var finished = new HashSet<String>();
        for (var rule : rules) {
            visit(rule, ruleMap, new ArrayList<>(), finished);
        }
    }

    private void visit(Rule rule, Map<String, Rule> ruleMap, List<String> path, Set<String> finished) {
        if (finished.contains(rule.name())) {
            return;
        }
        path.add(rule.name());
        for (var reference : references(rule.expression())) {
            var target = ruleMap.get(reference.ruleName());
            if (target == null) {
                // built-in
                continue;
            }
            if (path.contains(target.name())) {
                var chain = new ArrayList<>(path.subList(path.indexOf(target.name()), path.size()));
                chain.add(target.name());
                throw new GrammarError.RecursiveRule(reference.span(), chain).exception();
            }
            visit(target, ruleMap, path, finished);
        }
        path.remove(path.size() - 1);
        finished.add(rule.name());
    }

    /**
     * All rule references inside an expression, in source order.
     */
    static List<Expression.Reference> references(Expression expression) {
        var found = new ArrayList<Expression.Reference>();
        collectReferences(expression, found);
        return found;
    }

    private static void collectReferences(Expression expr, List<Expression.Reference> found) {
        if (expr instanceof Expression.Reference ref) {
            found.add(ref);
        } else if (expr instanceof Expression.Sequence seq) {
            seq.elements()
               .forEach(e -> collectReferences(e, found));
        } else if (expr instanceof Expression.Choice choice) {
            choice.alternatives()
                  .forEach(a -> collectReferences(a.expression(), found));
        } else if (expr instanceof Expression.Shuffle shuffle) {
            shuffle.elements()
                   .forEach(e -> collectReferences(e, found));
        } else if (expr instanceof Expression.Fixed fixed) {
            collectReferences(fixed.choice(), found);
        }
        // Terminals - no nested expressions
    }

    private static Map<String, Node> builtins() {
        var map = new HashMap<String, Node>();
        map.put("-a-", Node.A_AN);
        map.put("-an-", Node.A_AN);
        map.put("-a-an-", Node.A_AN);
        map.put("-adjoining-", Node.CONCAT);
        // Sentence starts are capitalized by the assembler already
        map.put("-capitalize-", Node.EMPTY);
        return Map.copyOf(map);
    }
}

package org.pragmatica.mutagen.grammar;

import org.junit.jupiter.api.Test;
import org.pragmatica.mutagen.error.GrammarError;
import org.pragmatica.mutagen.error.MutagenException;
import org.pragmatica.mutagen.node.Node;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GrammarTest {

    private static GrammarError validationError(String text) {
        var grammar = GrammarParser.parse(text);
        return (GrammarError) assertThrows(MutagenException.class, grammar::validate).error();
    }

    @Test
    void validate_forwardReference_isAllowed() {
        var grammar = GrammarParser.parse("""
            -first- = -second-
            -second- = x
            """);

        assertSame(grammar, grammar.validate());
        assertEquals(new Node.Literal("x"), grammar.resolve("-first-"));
    }

    @Test
    void validate_duplicateRule_fails() {
        var error = assertInstanceOf(GrammarError.DuplicateRule.class, validationError("""
            -x- = a
            -x- = b
            """));

        assertEquals("-x-", error.name());
        assertEquals(2, error.location().line());
    }

    @Test
    void validate_redefinedBuiltin_fails() {
        var error = assertInstanceOf(GrammarError.SemanticError.class, validationError("-a- = thing"));

        assertTrue(error.message().contains("redefines a built-in rule"));
    }

    @Test
    void validate_undefinedReference_fails() {
        var error = assertInstanceOf(GrammarError.UndefinedRule.class, validationError("-x- = hello -nobody-"));

        assertEquals("-nobody-", error.name());
    }

    @Test
    void validate_directRecursion_fails() {
        var error = assertInstanceOf(GrammarError.RecursiveRule.class, validationError("-x- = a / b -x-"));

        assertEquals(List.of("-x-", "-x-"), error.chain());
    }

    @Test
    void validate_indirectRecursion_reportsChain() {
        var error = assertInstanceOf(GrammarError.RecursiveRule.class, validationError("""
            -top- = -x-
            -x- = -y-
            -y- = b -x-
            """));

        assertEquals(List.of("-x-", "-y-", "-x-"), error.chain());
    }

    @Test
    void resolve_sharedRule_isOneNodeInstance() {
        var grammar = GrammarParser.parse("""
            -pair- = -mood- and -mood-
            -mood- = { glum / merry }
            """);

        var seq = assertInstanceOf(Node.Sequence.class, grammar.resolve("-pair-"));

        assertInstanceOf(Node.Shuffle.class, seq.children().get(0));
        assertSame(seq.children().get(0), seq.children().get(2));
    }

    @Test
    void resolve_builtins_mapToControlNodes() {
        var grammar = GrammarParser.parse("-x- = -capitalize- -a-an- apple -adjoining- s");

        var seq = assertInstanceOf(Node.Sequence.class, grammar.resolve("-x-"));

        assertEquals(Node.EMPTY, seq.children().get(0));
        assertEquals(Node.A_AN, seq.children().get(1));
        assertEquals(Node.CONCAT, seq.children().get(3));
    }

    @Test
    void resolve_weightsAndLabels_carryOver() {
        var grammar = GrammarParser.parse("-x- = [3] big / small / size{ tall / short }");

        var weighted = assertInstanceOf(Node.Weighted.class, grammar.resolve("-x-"));

        assertEquals(5, weighted.totalWeight());
        var fixed = assertInstanceOf(Node.Fixed.class, weighted.alternatives().get(2).node());
        assertEquals("size", fixed.label());
        assertInstanceOf(Node.Weighted.class, fixed.node());
    }

    @Test
    void resolve_unknownStartRule_fails() {
        var grammar = GrammarParser.parse("-x- = a");

        var exception = assertThrows(MutagenException.class, () -> grammar.resolve("-y-"));

        assertInstanceOf(GrammarError.UnknownStartRule.class, exception.error());
    }

    @Test
    void effectiveStartRule_isFirstRule() {
        var grammar = GrammarParser.parse("-b- = x\n-c- = y");

        assertEquals("-b-", grammar.effectiveStartRule().orElseThrow().name());
        assertTrue(grammar.rule("-c-").isPresent());
        assertTrue(grammar.rule("-d-").isEmpty());
    }
}

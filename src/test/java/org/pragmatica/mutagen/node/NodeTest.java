package org.pragmatica.mutagen.node;

import org.junit.jupiter.api.Test;
import org.pragmatica.mutagen.error.CompileError;
import org.pragmatica.mutagen.error.MutagenException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NodeTest {

    @Test
    void sequence_wrapsStringsAsLiterals() {
        var node = (Node.Sequence) Node.sequence("hello", Node.COMMA, "world");

        assertEquals(3, node.children().size());
        assertEquals(new Node.Literal("hello"), node.children().get(0));
        assertEquals(Node.COMMA, node.children().get(1));
        assertEquals(new Node.Literal("world"), node.children().get(2));
    }

    @Test
    void literal_emptyText_isEmptyNode() {
        assertEquals(Node.EMPTY, Node.literal(""));
        assertInstanceOf(Node.Literal.class, Node.literal("x"));
    }

    @Test
    void choice_isWeightedWithUnitWeights() {
        var node = (Node.Weighted) Node.choice("red", "green", "blue");

        assertEquals(3, node.alternatives().size());
        assertEquals(3, node.totalWeight());
        node.alternatives().forEach(alternative -> assertEquals(1, alternative.weight()));
    }

    @Test
    void weighted_pairsWeightsWithNodes() {
        var node = (Node.Weighted) Node.weighted(2, "human", 1, "elf", 1, "dwarf");

        assertEquals(4, node.totalWeight());
        assertEquals(2, node.alternatives().get(0).weight());
        assertEquals(new Node.Literal("elf"), node.alternatives().get(1).node());
    }

    @Test
    void weighted_oddArgumentCount_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> Node.weighted(2, "human", 1));
    }

    @Test
    void weighted_nonIntegerWeight_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> Node.weighted("human", 2));
    }

    @Test
    void weighted_zeroWeight_failsWithInvalidWeight() {
        var exception = assertThrows(MutagenException.class, () -> Node.weighted(0, "never"));

        var error = assertInstanceOf(CompileError.InvalidWeight.class, exception.error());
        assertEquals(0, error.weight());
    }

    @Test
    void weighted_totalAboveIntRange_failsWithWeightOverflow() {
        var exception = assertThrows(MutagenException.class,
                                     () -> Node.weighted(Integer.MAX_VALUE, "a", Integer.MAX_VALUE, "b", 2, "c"));

        var error = assertInstanceOf(CompileError.WeightOverflow.class, exception.error());
        assertEquals(3, error.alternatives());
    }

    @Test
    void weighted_totalAtIntLimit_isAccepted() {
        var node = (Node.Weighted) Node.weighted(Integer.MAX_VALUE - 1, "a", 1, "b");

        assertEquals(Integer.MAX_VALUE, node.totalWeight());
    }

    @Test
    void choice_withoutAlternatives_failsWithEmptyChoice() {
        var exception = assertThrows(MutagenException.class, () -> Node.choice());

        var error = assertInstanceOf(CompileError.EmptyChoice.class, exception.error());
        assertEquals("Weighted", error.kind());
    }

    @Test
    void shuffle_withoutChildren_failsWithEmptyChoice() {
        var exception = assertThrows(MutagenException.class, () -> new Node.Shuffle(List.of()));

        var error = assertInstanceOf(CompileError.EmptyChoice.class, exception.error());
        assertEquals("Shuffle", error.kind());
        assertEquals("Shuffle requires at least one alternative", exception.getMessage());
    }

    @Test
    void marks_compareStructurally() {
        assertEquals(Node.PERIOD, new Node.Mark(ControlMark.PERIOD));
        assertNotEquals(Node.PERIOD, Node.COMMA);
    }

    @Test
    void factories_rejectNullAndForeignObjects() {
        assertThrows(NullPointerException.class, () -> Node.sequence("a", null));
        assertThrows(IllegalArgumentException.class, () -> Node.sequence("a", 42));
        assertThrows(NullPointerException.class, () -> Node.fixed(null, Node.choice("a")));
    }
}

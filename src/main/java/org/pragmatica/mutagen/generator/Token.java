package org.pragmatica.mutagen.generator;

import org.pragmatica.mutagen.node.ControlMark;

/**
 * One element of the raw evaluator output: a word or a control mark.
 */
public sealed interface Token {

    record Word(String text) implements Token {}

    record Mark(ControlMark mark) implements Token {}

    static Token word(String text) {
        return new Word(text);
    }

    static Token mark(ControlMark mark) {
        return new Mark(mark);
    }
}

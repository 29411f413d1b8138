package org.pragmatica.mutagen.grammar;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.pragmatica.mutagen.Mutagen;
import org.pragmatica.mutagen.compiler.CompilerConfig;
import org.pragmatica.mutagen.error.CompileError;
import org.pragmatica.mutagen.error.MutagenException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class GoreyGrammarTest {
    private static String goreyText;

    @BeforeAll
    static void loadGrammar() throws IOException {
        try (var in = GoreyGrammarTest.class.getResourceAsStream("/gorey.mut")) {
            assertNotNull(in, "gorey.mut not on test classpath");
            goreyText = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void parse_goreyGrammar_readsAllRules() {
        var grammar = Mutagen.parseGrammar(goreyText);

        assertEquals(44, grammar.rules().size());
        assertEquals("-root-", grammar.effectiveStartRule().orElseThrow().name());
        assertSame(grammar, grammar.validate());
    }

    @Test
    void compile_goreyGrammar_withLabelValidation_reportsMismatch() {
        var exception = assertThrows(MutagenException.class, () -> Mutagen.fromGrammar(goreyText));

        var mismatch = assertInstanceOf(CompileError.LabelMismatch.class, exception.error());
        assertEquals("solidity", mismatch.label());
    }

    @Test
    void generate_goreyGrammar_withoutLabelValidation_producesSentences() {
        var grammar = Mutagen.parseGrammar(goreyText);
        var generator = Mutagen.fromGrammar(grammar, "-root-", CompilerConfig.DEFAULT.withValidateLabels(false));

        for (long seed = 0; seed < 200; seed++) {
            var text = generator.generate(seed);
            assertTrue(Character.isUpperCase(text.charAt(0)), text);
            assertThat(text).doesNotContain("  ")
                            .doesNotEndWith(" ");
        }
    }

    @Test
    void generate_goreyGrammar_isReproducible() {
        var config = CompilerConfig.DEFAULT.withValidateLabels(false);
        var first = Mutagen.fromGrammar(Mutagen.parseGrammar(goreyText), "-root-", config);
        var second = Mutagen.fromGrammar(Mutagen.parseGrammar(goreyText), "-root-", config);

        assertEquals(first.sample(0, 50), second.sample(0, 50));
    }
}

package org.pragmatica.mutagen.compiler;

import java.util.List;

/**
 * Compiler configuration options.
 *
 * @param primes         cycle pool, consumed from the end
 * @param validateLabels reject fixed labels shared by choices with different alternatives
 */
public record CompilerConfig(
    List<Integer> primes,
    boolean validateLabels
) {
    public static final CompilerConfig DEFAULT = new CompilerConfig(
        PrimeTable.DEFAULT,
        true
    );

    public CompilerConfig {
        primes = List.copyOf(primes);
    }

    public CompilerConfig withPrimes(List<Integer> primes) {
        return new CompilerConfig(primes, validateLabels);
    }

    public CompilerConfig withValidateLabels(boolean validateLabels) {
        return new CompilerConfig(primes, validateLabels);
    }
}

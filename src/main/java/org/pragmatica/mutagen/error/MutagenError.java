package org.pragmatica.mutagen.error;

/**
 * Base of every failure reported by the library.
 */
public sealed interface MutagenError permits CompileError, GrammarError {
    /**
     * Human-readable description of the failure.
     */
    String message();

    /**
     * Wrap this error into an unchecked exception ready to be thrown.
     */
    default MutagenException exception() {
        return new MutagenException(this);
    }
}

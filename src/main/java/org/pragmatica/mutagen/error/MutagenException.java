package org.pragmatica.mutagen.error;

/**
 * Unchecked carrier for a {@link MutagenError}.
 */
public final class MutagenException extends RuntimeException {
    private final transient MutagenError error;

    public MutagenException(MutagenError error) {
        super(error.message());
        this.error = error;
    }

    public MutagenError error() {
        return error;
    }
}

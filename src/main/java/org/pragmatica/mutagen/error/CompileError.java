package org.pragmatica.mutagen.error;

/**
 * Errors raised while building or compiling a node tree.
 */
public sealed interface CompileError extends MutagenError {

    /**
     * The cycle pool ran dry while a choice point still needed a prime.
     */
    record PoolExhausted(int allocated) implements CompileError {
        @Override
        public String message() {
            return "Out of cycle primes after " + allocated + " allocations";
        }
    }

    /**
     * A weighted choice or shuffle was built with nothing to choose from.
     */
    record EmptyChoice(String kind) implements CompileError {
        @Override
        public String message() {
            return kind + " requires at least one alternative";
        }
    }

    /**
     * A weight below one was supplied for an alternative.
     */
    record InvalidWeight(int weight) implements CompileError {
        @Override
        public String message() {
            return "Weight must be a positive integer, got " + weight;
        }
    }

    /**
     * The weights of one choice add up to more than an {@code int} can hold.
     */
    record WeightOverflow(int alternatives) implements CompileError {
        @Override
        public String message() {
            return "Total weight of " + alternatives + " alternatives exceeds " + Integer.MAX_VALUE;
        }
    }

    /**
     * Two nodes share a fixed label but disagree on their alternatives.
     */
    record LabelMismatch(String label, String expected, String found) implements CompileError {
        @Override
        public String message() {
            return "Fixed label '" + label + "' is bound to " + expected + " but also wraps " + found;
        }
    }
}

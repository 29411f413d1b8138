package org.pragmatica.mutagen.compiler;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-shuffle memory of which children are still pending for the seed currently being generated.
 *
 * <p>Mutated by every evaluation; a compiled tree holding shuffles must not be evaluated concurrently.
 */
public final class ShuffleState {
    private static final long NO_SEED = -1L;

    private final List<CompiledNode> pending;
    private long lastSeed;

    private ShuffleState() {
        this.pending = new ArrayList<>();
        this.lastSeed = NO_SEED;
    }

    public static ShuffleState create() {
        return new ShuffleState();
    }

    /**
     * Take the next child for {@code seed}, resetting on a seed change and refilling when drained.
     */
    public CompiledNode next(long seed, int cycle, List<CompiledNode> children) {
        if (seed != lastSeed) {
            pending.clear();
            lastSeed = seed;
        }
        if (pending.isEmpty()) {
            refill(seed, cycle, children);
        }
        return pending.remove(pending.size() - 1);
    }

    private void refill(long seed, int cycle, List<CompiledNode> children) {
        pending.addAll(children);
        int size = children.size();
        for (int i = 0; i < size; i++) {
            int j = (int) ((seed % (cycle + 2L * i)) % size);
            var swap = pending.get(i);
            pending.set(i, pending.get(j));
            pending.set(j, swap);
        }
    }

    public long lastSeed() {
        return lastSeed;
    }

    public int pendingCount() {
        return pending.size();
    }

    /**
     * Forget the current seed so the next call starts a fresh draw.
     */
    public void reset() {
        pending.clear();
        lastSeed = NO_SEED;
    }
}

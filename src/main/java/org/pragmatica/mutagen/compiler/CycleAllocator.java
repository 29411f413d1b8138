package org.pragmatica.mutagen.compiler;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.mutagen.error.CompileError;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Hands out cycle primes to choice points during one compilation.
 *
 * <p>Primes are popped from the end of the pool and never handed out twice, except through
 * {@link #allocateForLabel(String)} which returns the same prime for every request with a given label.
 */
public final class CycleAllocator {
    private static final Logger logger = LogManager.getLogger(CycleAllocator.class);

    private final List<Integer> pool;
    private final Map<String, Integer> labels;
    private int allocated;

    private CycleAllocator(List<Integer> primes) {
        this.pool = new ArrayList<>(primes);
        this.labels = new HashMap<>();
        this.allocated = 0;
    }

    public static CycleAllocator create(List<Integer> primes) {
        return new CycleAllocator(primes);
    }

    /**
     * Pop the next prime from the pool.
     *
     * @throws org.pragmatica.mutagen.error.MutagenException with {@link CompileError.PoolExhausted} when empty
     */
    public int allocate() {
        if (pool.isEmpty()) {
            throw new CompileError.PoolExhausted(allocated).exception();
        }
        int cycle = pool.remove(pool.size() - 1);
        allocated++;
        logger.trace("Allocated cycle {} ({} remaining)", cycle, pool.size());
        return cycle;
    }

    /**
     * Return the prime bound to {@code label}, allocating and binding a fresh one on first use.
     */
    public int allocateForLabel(String label) {
        var bound = labels.get(label);
        if (bound != null) {
            return bound;
        }
        var cycle = allocate();
        labels.put(label, cycle);
        logger.trace("Bound label '{}' to cycle {}", label, cycle);
        return cycle;
    }

    public int allocated() {
        return allocated;
    }

    public int remaining() {
        return pool.size();
    }

    public int labelCount() {
        return labels.size();
    }
}

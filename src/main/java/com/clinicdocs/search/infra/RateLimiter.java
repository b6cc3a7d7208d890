package com.clinicdocs.search.infra;

import java.util.function.Supplier;

public interface RateLimiter {

    /**
     * Blocks until the key has capacity for one request carrying {@code volume} units.
     * An interrupted wait restores the interrupt flag and raises
     * {@link java.util.concurrent.CancellationException}.
     */
    void acquire(String key, int volume);

    default <T> T execute(String key, int volume, Supplier<T> task) {
        acquire(key, volume);
        return task.get();
    }
}

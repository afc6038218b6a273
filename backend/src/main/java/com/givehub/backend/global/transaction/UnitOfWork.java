package com.givehub.backend.global.transaction;

import java.util.function.Supplier;

/**
 * Explicit transaction boundary for workflow operations.
 *
 * <p>Every write performed inside {@code work} becomes visible together when the unit commits.
 * If {@code work} throws, all of its writes are rolled back and the original exception is
 * rethrown unchanged.
 */
public interface UnitOfWork {

    /**
     * Runs {@code work} as a single atomic unit and returns its result.
     *
     * @param name short operation name used for logging
     * @param work the reads and writes to apply
     */
    <T> T execute(String name, Supplier<T> work);

    default void run(String name, Runnable work) {
        execute(name, () -> {
            work.run();
            return null;
        });
    }
}

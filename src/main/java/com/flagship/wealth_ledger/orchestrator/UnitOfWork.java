package com.flagship.wealth_ledger.orchestrator;

import java.util.function.Supplier;

/**
 * Atomic boundary around a multi-entity mutation.
 *
 * The work either commits as a whole or, when it throws, rolls back as a
 * whole; the exception is rethrown to the caller unchanged.
 */
public interface UnitOfWork {

    <T> T inTransaction(String operation, Supplier<T> work);

    default void run(String operation, Runnable work) {
        inTransaction(operation, () -> {
            work.run();
            return null;
        });
    }
}

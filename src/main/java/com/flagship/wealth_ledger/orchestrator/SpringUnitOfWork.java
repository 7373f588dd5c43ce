package com.flagship.wealth_ledger.orchestrator;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * {@link UnitOfWork} backed by Spring's transaction manager: begin, run the
 * work, commit; any exception rolls the transaction back.
 *
 * Each unit starts a new transaction, so a unit can never be absorbed into a
 * caller's transaction and committed only partially.
 */
@Component
@Slf4j
public class SpringUnitOfWork implements UnitOfWork {

    private final TransactionTemplate transactionTemplate;

    public SpringUnitOfWork(PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public <T> T inTransaction(String operation, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (RuntimeException e) {
            log.debug("Unit of work rolled back: operation={}, cause={}", operation, e.toString());
            throw e;
        }
    }
}

package com.givehub.backend.global.transaction;

import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link UnitOfWork} backed by the JPA transaction manager.
 * An enclosing transaction is joined, so nested workflow calls commit together.
 */
@Component
public class TransactionalUnitOfWork implements UnitOfWork {

    private static final Logger log = LoggerFactory.getLogger(TransactionalUnitOfWork.class);

    private final TransactionTemplate transactionTemplate;

    public TransactionalUnitOfWork(PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        this.transactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
    }

    @Override
    public <T> T execute(String name, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (RuntimeException | Error ex) {
            log.warn("Unit of work '{}' rolled back: {}", name, ex.toString());
            throw ex;
        }
    }
}

package com.mealshift.orderservice.service;

import com.mealshift.orderservice.exception.ConcurrentModificationConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Runs a unit of work in its own transaction, retrying a few times when it collides
 * with a concurrent writer. Business exceptions are never retried.
 */
@Component
@Slf4j
public class TransitionRetrier {

    static final int MAX_ATTEMPTS = 3;

    private final TransactionTemplate transactionTemplate;

    public TransitionRetrier(PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public <T> T execute(String operation, Supplier<T> work) {
        RuntimeException lastConflict = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                return transactionTemplate.execute(status -> work.get());
            } catch (TransientDataAccessException e) {
                // includes OptimisticLockingFailureException
                lastConflict = e;
                log.warn("Concurrent write conflict: operation={}, attempt={}/{}, cause={}",
                        operation, attempt, MAX_ATTEMPTS, e.getMessage());
            }
        }
        throw new ConcurrentModificationConflictException(
                "Operation '" + operation + "' kept conflicting with concurrent updates", lastConflict);
    }
}

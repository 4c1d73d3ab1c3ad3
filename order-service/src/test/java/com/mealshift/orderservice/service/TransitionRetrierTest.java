package com.mealshift.orderservice.service;

import com.mealshift.orderservice.exception.ConcurrentModificationConflictException;
import com.mealshift.orderservice.exception.OrderAlreadyFinalizedException;
import com.mealshift.orderservice.model.OrderStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

class TransitionRetrierTest {

    private PlatformTransactionManager transactionManager;
    private TransitionRetrier retrier;

    @BeforeEach
    void setUp() {
        transactionManager = mock(PlatformTransactionManager.class);
        retrier = new TransitionRetrier(transactionManager);
    }

    @Test
    void execute_RunsInNewTransaction() {
        String result = retrier.execute("collect", () -> "done");

        assertThat(result).isEqualTo("done");
        verify(transactionManager).getTransaction(argThat(definition ->
                definition.getPropagationBehavior() == TransactionDefinition.PROPAGATION_REQUIRES_NEW));
        verify(transactionManager).commit(any());
    }

    @Test
    void execute_RetriesTransientConflicts() {
        AtomicInteger attempts = new AtomicInteger();

        String result = retrier.execute("cancel", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new CannotAcquireLockException("deadlock detected");
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(attempts).hasValue(3);
        verify(transactionManager, times(2)).rollback(any());
    }

    @Test
    void execute_GivesUpAfterMaxAttempts() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> retrier.execute("cancel", () -> {
            attempts.incrementAndGet();
            throw new ObjectOptimisticLockingFailureException("Order", UUID.randomUUID());
        })).isInstanceOf(ConcurrentModificationConflictException.class);

        assertThat(attempts).hasValue(TransitionRetrier.MAX_ATTEMPTS);
    }

    @Test
    void execute_NeverRetriesBusinessRejections() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> retrier.execute("collect", () -> {
            attempts.incrementAndGet();
            throw new OrderAlreadyFinalizedException(UUID.randomUUID(), OrderStatus.CANCELLED);
        })).isInstanceOf(OrderAlreadyFinalizedException.class);

        assertThat(attempts).hasValue(1);
    }
}

package com.flagship.escrow_ledger.escrow;

import com.flagship.escrow_ledger.exception.ContentionException;
import com.flagship.escrow_ledger.observability.EscrowMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes every mutation of one escrow payment.
 *
 * Each payment ID maps to a ReentrantLock that is held for the whole
 * read-modify-write including the commit, so two writers can never both read
 * the same remaining balance. Locks are reference counted and dropped once no
 * thread holds or waits for them.
 *
 * Lock acquisition is bounded by escrow.coordinator.lock-timeout-ms. A timeout,
 * or an optimistic version conflict from another process, surfaces as
 * {@link ContentionException}.
 */
@Component
@Slf4j
public class EscrowCoordinator {

    private final ConcurrentHashMap<UUID, LockHandle> locks = new ConcurrentHashMap<>();
    private final TransactionOperations transactions;
    private final EscrowMetrics metrics;
    private final long lockTimeoutMs;

    @Autowired
    public EscrowCoordinator(PlatformTransactionManager transactionManager,
                             EscrowMetrics metrics,
                             @Value("${escrow.coordinator.lock-timeout-ms:5000}") long lockTimeoutMs) {
        this(new TransactionTemplate(transactionManager), metrics, lockTimeoutMs);
    }

    public EscrowCoordinator(TransactionOperations transactions, EscrowMetrics metrics, long lockTimeoutMs) {
        this.transactions = transactions;
        this.metrics = metrics;
        this.lockTimeoutMs = lockTimeoutMs;
    }

    /**
     * Runs {@code operation} in a transaction while holding the payment's lock.
     *
     * @throws ContentionException if the lock is not acquired in time or a version conflict occurs
     */
    public <T> T execute(UUID escrowPaymentId, Supplier<T> operation) {
        LockHandle handle = retain(escrowPaymentId);
        boolean locked = false;
        try {
            locked = handle.lock.tryLock(lockTimeoutMs, TimeUnit.MILLISECONDS);
            if (!locked) {
                metrics.recordContention("lock_timeout");
                log.warn("Timed out after {}ms waiting for escrow payment lock: escrowPaymentId={}",
                        lockTimeoutMs, escrowPaymentId);
                throw new ContentionException(escrowPaymentId,
                    String.format("Escrow payment %s is busy, retry later", escrowPaymentId));
            }
            return transactions.execute(status -> operation.get());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.recordContention("interrupted");
            throw new ContentionException(escrowPaymentId,
                "Interrupted while waiting for escrow payment " + escrowPaymentId, e);

        } catch (OptimisticLockingFailureException e) {
            metrics.recordContention("version_conflict");
            log.warn("Concurrent modification of escrow payment {}: {}", escrowPaymentId, e.getMessage());
            throw new ContentionException(escrowPaymentId,
                String.format("Escrow payment %s was modified concurrently, retry later", escrowPaymentId), e);

        } finally {
            if (locked) {
                handle.lock.unlock();
            }
            release(escrowPaymentId);
        }
    }

    public void run(UUID escrowPaymentId, Runnable operation) {
        execute(escrowPaymentId, () -> {
            operation.run();
            return null;
        });
    }

    /**
     * Number of payment IDs that currently have a lock registered.
     */
    int activeLockCount() {
        return locks.size();
    }

    private LockHandle retain(UUID escrowPaymentId) {
        return locks.compute(escrowPaymentId, (id, existing) -> {
            LockHandle handle = existing != null ? existing : new LockHandle();
            handle.references++;
            return handle;
        });
    }

    private void release(UUID escrowPaymentId) {
        locks.computeIfPresent(escrowPaymentId, (id, handle) -> {
            handle.references--;
            return handle.references == 0 ? null : handle;
        });
    }

    private static final class LockHandle {
        private final ReentrantLock lock = new ReentrantLock();
        private int references;
    }
}

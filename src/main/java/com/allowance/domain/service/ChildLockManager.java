package com.allowance.domain.service;

import com.allowance.config.GovernanceProperties;
import com.allowance.domain.exception.TransientException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes all writes of one child.
 *
 * Child ids hash onto a fixed array of lock stripes. The lock is held around a
 * whole database transaction, so the next writer of the same child reads what
 * the previous one committed. Locks are reentrant: a locked operation may call
 * another locked operation of the same child.
 *
 * Lock waits and transactions are bounded; running out of time surfaces as
 * {@link TransientException}.
 */
@Slf4j
@Component
public class ChildLockManager {

    private final ReentrantLock[] stripes;
    private final long lockTimeoutMillis;
    private final TransactionTemplate transactionTemplate;

    public ChildLockManager(GovernanceProperties properties, PlatformTransactionManager transactionManager) {
        int stripeCount = properties.getLocking().getStripes();
        if (stripeCount < 1) {
            throw new IllegalArgumentException("governance.locking.stripes must be positive");
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock(true);
        }
        this.lockTimeoutMillis = properties.getLocking().getTimeout().toMillis();
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout((int) properties.getStorage().getTransactionTimeout().toSeconds());
    }

    /**
     * Run {@code action} in a transaction while holding the child's lock.
     */
    public <T> T executeLocked(UUID childId, Supplier<T> action) {
        ReentrantLock lock = stripeFor(childId);
        acquire(lock, childId);
        try {
            return transactionTemplate.execute(status -> action.get());
        } catch (TransientDataAccessException | TransactionTimedOutException e) {
            log.warn("Storage timeout for child {}: {}", childId, e.getMessage());
            throw new TransientException("Storage temporarily unavailable", e);
        } finally {
            lock.unlock();
        }
    }

    public void runLocked(UUID childId, Runnable action) {
        executeLocked(childId, () -> {
            action.run();
            return null;
        });
    }

    private void acquire(ReentrantLock lock, UUID childId) {
        try {
            if (!lock.tryLock(lockTimeoutMillis, TimeUnit.MILLISECONDS)) {
                log.warn("Timed out waiting {} ms for lock of child {}", lockTimeoutMillis, childId);
                throw new TransientException("Another operation for this child is in progress, try again");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientException("Interrupted while waiting for child lock", e);
        }
    }

    private ReentrantLock stripeFor(UUID childId) {
        return stripes[Math.floorMod(childId.hashCode(), stripes.length)];
    }
}

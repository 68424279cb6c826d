package com.signalguard.oms;

import com.signalguard.risk.RiskPolicyConfig;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * One reentrant lock per symbol. The lifecycle manager, reconciliation, the local guard and the
 * panic sweeper all take it before mutating a position, so no two workers act on the same
 * symbol at once.
 */
@Component
public class PositionLockRegistry {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String symbol, Supplier<T> action) {
        ReentrantLock lock = lockFor(symbol);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(String symbol, Runnable action) {
        withLock(symbol, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Runs the action only if the lock is acquired within the timeout.
     *
     * @return false when the lock could not be taken
     */
    public boolean tryWithLock(String symbol, long timeoutMs, Runnable action) {
        ReentrantLock lock = lockFor(symbol);
        try {
            if (!lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS)) {
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        try {
            action.run();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isLocked(String symbol) {
        ReentrantLock lock = locks.get(RiskPolicyConfig.normalize(symbol));
        return lock != null && lock.isLocked();
    }

    private ReentrantLock lockFor(String symbol) {
        return locks.computeIfAbsent(RiskPolicyConfig.normalize(symbol), s -> new ReentrantLock());
    }
}

package com.grorchestrator.orchestration.util;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes reconciliation passes and operator commands which change topology on this node.
 */
@ApplicationScoped
public class ReconciliationPassLock {
    private final ReentrantLock lock = new ReentrantLock(true);

    public <T> T runExclusive(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runExclusive(Runnable action) {
        runExclusive(() -> {
            action.run();
            return null;
        });
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }
}

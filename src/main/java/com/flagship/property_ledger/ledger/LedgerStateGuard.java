package com.flagship.property_ledger.ledger;

import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single-writer guard shared by every ledger component.
 *
 * Each component owns its own maps, but all of them run their public operations
 * through this guard, so an operation (reads included) runs to completion before any
 * other operation can observe or mutate the shared state. The lock is reentrant:
 * a marketplace purchase that settles through {@link OwnershipLedger#transfer}
 * stays one indivisible unit.
 */
@Component
public class LedgerStateGuard {

    private final ReentrantLock lock = new ReentrantLock(true);

    public <T> T atomically(Supplier<T> operation) {
        lock.lock();
        try {
            return operation.get();
        } finally {
            lock.unlock();
        }
    }

    public void execute(Runnable operation) {
        lock.lock();
        try {
            operation.run();
        } finally {
            lock.unlock();
        }
    }
}

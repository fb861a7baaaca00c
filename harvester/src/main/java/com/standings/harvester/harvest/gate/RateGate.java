package com.standings.harvester.harvest.gate;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caps the number of remote calls in flight. Permits are scoped:
 * {@code try (RateGate.Permit permit = gate.acquire()) { ... }}.
 */
public class RateGate {
    private final int capacity;
    private final Semaphore slots;

    public RateGate(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1 (was " + capacity + ")");
        }
        this.capacity = capacity;
        this.slots = new Semaphore(capacity);
    }

    public Permit acquire() throws InterruptedException {
        slots.acquire();
        AtomicBoolean released = new AtomicBoolean(false);
        return () -> {
            if (released.compareAndSet(false, true)) {
                slots.release();
            }
        };
    }

    public int capacity() {
        return capacity;
    }

    public int inFlight() {
        return capacity - slots.availablePermits();
    }

    public interface Permit extends AutoCloseable {
        @Override
        void close();
    }
}

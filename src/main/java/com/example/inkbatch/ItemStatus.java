package com.example.inkbatch;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Lifecycle tracker for a single work item.
 */
public final class ItemStatus {
    private final WorkItem item;
    private final AtomicReference<ItemState> state = new AtomicReference<>(ItemState.PENDING);

    public ItemStatus(WorkItem item) {
        this.item = item;
    }

    public void transition(ItemState next) {
        ItemState current = state.get();
        if (!current.canTransitionTo(next) || !state.compareAndSet(current, next)) {
            throw new IllegalStateException(
                    "Illegal transition " + current + " -> " + next + " for " + item.displayPath());
        }
    }

    public ItemState state() {
        return state.get();
    }

    public WorkItem item() {
        return item;
    }
}

package com.example.inkbatch;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ItemStatusTest {
    @Test
    void followsRetryLifecycle() {
        ItemStatus status = new ItemStatus(WorkItem.looseImage(Path.of("a.png")));

        assertEquals(ItemState.PENDING, status.state());
        status.transition(ItemState.RUNNING);
        status.transition(ItemState.RETRYING);
        status.transition(ItemState.RUNNING);
        status.transition(ItemState.SUCCESS);

        assertTrue(status.state().isTerminal());
    }

    @Test
    void rejectsIllegalTransitions() {
        ItemStatus status = new ItemStatus(WorkItem.archiveMember(Path.of("book.cbz"), 2, "p3.jpg"));

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> status.transition(ItemState.SUCCESS));
        assertTrue(ex.getMessage().contains("book.cbz!/p3.jpg"));

        status.transition(ItemState.RUNNING);
        status.transition(ItemState.FAILED);
        assertThrows(IllegalStateException.class, () -> status.transition(ItemState.RUNNING));
    }

    @Test
    void terminalStatesAllowNothing() {
        for (ItemState next : ItemState.values()) {
            assertFalse(ItemState.SUCCESS.canTransitionTo(next));
            assertFalse(ItemState.FAILED.canTransitionTo(next));
        }
        assertFalse(ItemState.RETRYING.canTransitionTo(ItemState.FAILED));
    }
}

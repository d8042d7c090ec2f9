package com.example.inkbatch;

import java.util.EnumSet;
import java.util.Set;

public enum ItemState {
    PENDING,
    RUNNING,
    RETRYING,
    SUCCESS,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }

    public boolean canTransitionTo(ItemState next) {
        return allowedNext().contains(next);
    }

    private Set<ItemState> allowedNext() {
        switch (this) {
            case PENDING:
                return EnumSet.of(RUNNING);
            case RUNNING:
                return EnumSet.of(RETRYING, SUCCESS, FAILED);
            case RETRYING:
                return EnumSet.of(RUNNING);
            default:
                return EnumSet.noneOf(ItemState.class);
        }
    }
}

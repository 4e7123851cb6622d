package com.gtmalpha.research.orchestration.model;

public enum TaskState {
    PENDING,
    IN_FLIGHT,
    DELIVERED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == DELIVERED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(TaskState next) {
        if (next == null || isTerminal()) {
            return false;
        }
        return switch (this) {
            case PENDING -> next == IN_FLIGHT || next == CANCELLED;
            case IN_FLIGHT -> next.isTerminal();
            default -> false;
        };
    }
}

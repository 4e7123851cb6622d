package com.gtmalpha.research.orchestration.model;

public enum TerminalOutcome {
    DELIVERED(TaskState.DELIVERED),
    UNREACHABLE(TaskState.FAILED),
    DELIVERY_FAILED(TaskState.FAILED),
    CANCELLED(TaskState.CANCELLED);

    private final TaskState taskState;

    TerminalOutcome(TaskState taskState) {
        this.taskState = taskState;
    }

    public TaskState taskState() {
        return taskState;
    }
}

package com.lexcoach.orchestration.exception;

public class PlanningFailureException extends WorkflowException {

    public PlanningFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.lexcoach.orchestration.exception;

/**
 * The responder could not produce an answer. Never escapes the responder node, which answers with the canned apology.
 */
public class ResponderFailureException extends WorkflowException {

    public ResponderFailureException(String message) {
        super(message);
    }

    public ResponderFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.lexcoach.orchestration.exception;

/**
 * Raised by the language-model collaborator. Both subclasses are recoverable from the caller's point of view.
 */
public abstract class LanguageModelException extends WorkflowException {

    protected LanguageModelException(String message, Throwable cause) {
        super(message, cause);
    }
}

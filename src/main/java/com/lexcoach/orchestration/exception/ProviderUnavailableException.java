package com.lexcoach.orchestration.exception;

public class ProviderUnavailableException extends LanguageModelException {

    public ProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.lexcoach.orchestration.exception;

public class ProviderTimeoutException extends LanguageModelException {

    public ProviderTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}

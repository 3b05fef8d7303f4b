package com.lexcoach.orchestration.model;

public record ToolFailure(
        FailureKind kind,
        String message
) {
}

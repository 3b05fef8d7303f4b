package com.lexcoach.orchestration.model;

public enum FailureKind {
    UNKNOWN_TOOL,
    INVALID_ARGUMENTS,
    TOOL_TIMEOUT,
    TOOL_EXECUTION_ERROR
}

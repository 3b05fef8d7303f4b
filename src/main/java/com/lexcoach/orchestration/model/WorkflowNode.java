package com.lexcoach.orchestration.model;

public enum WorkflowNode {
    PLANNER,
    APPROVAL_GATE,
    TOOL_EXECUTION,
    RESPONDER,
    END
}

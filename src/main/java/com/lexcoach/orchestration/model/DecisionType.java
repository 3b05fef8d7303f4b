package com.lexcoach.orchestration.model;

public enum DecisionType {
    APPROVE,
    REJECT,
    MODIFY
}

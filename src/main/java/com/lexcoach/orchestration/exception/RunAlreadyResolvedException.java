package com.lexcoach.orchestration.exception;

public class RunAlreadyResolvedException extends WorkflowException {

    private final String runId;

    public RunAlreadyResolvedException(String runId) {
        super("Run " + runId + " has already been resolved.");
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}

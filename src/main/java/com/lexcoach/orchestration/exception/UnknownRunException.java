package com.lexcoach.orchestration.exception;

import com.lexcoach.orchestration.model.SessionKey;
import org.springframework.lang.Nullable;

public class UnknownRunException extends WorkflowException {

    @Nullable
    private final String runId;

    public UnknownRunException(String runId) {
        this(runId, "No suspended run found for id " + runId + ".");
    }

    private UnknownRunException(@Nullable String runId, String message) {
        super(message);
        this.runId = runId;
    }

    public static UnknownRunException noPendingRun(SessionKey session) {
        return new UnknownRunException(null, "No run awaiting approval in session " + session + ".");
    }

    public @Nullable String getRunId() {
        return runId;
    }
}

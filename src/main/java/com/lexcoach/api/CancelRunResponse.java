package com.lexcoach.api;

public record CancelRunResponse(
        String status,
        String message
) {
    public static CancelRunResponse success() {
        return new CancelRunResponse("success", "Run cancelled.");
    }

    public static CancelRunResponse notFound() {
        return new CancelRunResponse("not-found", "No suspended run to cancel.");
    }
}

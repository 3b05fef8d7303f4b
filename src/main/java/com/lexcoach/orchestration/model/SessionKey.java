package com.lexcoach.orchestration.model;

import org.springframework.util.StringUtils;

public record SessionKey(
        String userId,
        String sessionId
) {

    public static final String DEFAULT_SESSION = "default";

    public SessionKey {
        if (!StringUtils.hasText(userId)) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        userId = userId.trim();
        sessionId = StringUtils.hasText(sessionId) ? sessionId.trim() : DEFAULT_SESSION;
    }

    public static SessionKey of(String userId, String sessionId) {
        return new SessionKey(userId, sessionId);
    }

    @Override
    public String toString() {
        return userId + "_" + sessionId;
    }
}

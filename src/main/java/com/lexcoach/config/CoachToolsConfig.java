package com.lexcoach.config;

import java.time.Duration;
import java.util.*;

/**
 * Execution settings for coaching tools: pool size, timeouts, and which tools need a human in the loop
 * or strictly validated arguments.
 */
public class CoachToolsConfig {

    private int concurrency = 4;

    /**
     * Default per-invocation timeout.
     */
    private Duration timeout = Duration.ofSeconds(30);

    /**
     * Timeout overrides keyed by tool name.
     */
    private Map<String, Duration> timeouts = new HashMap<>();

    /**
     * Tool names that always require approval, in addition to tools that declare themselves sensitive.
     */
    private List<String> sensitive = new ArrayList<>();

    /**
     * Tool names whose arguments must match the declared schema before execution.
     */
    private List<String> strictValidation = new ArrayList<>();

    public CoachToolsConfig() {}

    public int getConcurrency() { return concurrency; }
    public void setConcurrency(int concurrency) { this.concurrency = concurrency > 0 ? concurrency : 1; }

    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout != null ? timeout : Duration.ofSeconds(30); }

    public Map<String, Duration> getTimeouts() { return timeouts; }
    public void setTimeouts(Map<String, Duration> timeouts) { this.timeouts = timeouts != null ? new HashMap<>(timeouts) : new HashMap<>(); }

    public List<String> getSensitive() { return sensitive; }
    public void setSensitive(List<String> sensitive) { this.sensitive = sensitive != null ? sensitive : new ArrayList<>(); }

    public List<String> getStrictValidation() { return strictValidation; }
    public void setStrictValidation(List<String> strictValidation) { this.strictValidation = strictValidation != null ? strictValidation : new ArrayList<>(); }

    public Duration getTimeoutFor(String toolName) {
        if (toolName != null) {
            Duration override = timeouts.get(toolName.toLowerCase(Locale.ROOT));
            if (override != null) {
                return override;
            }
        }
        return timeout;
    }

    public Set<String> sensitiveNames() {
        return normalize(sensitive);
    }

    public Set<String> strictValidationNames() {
        return normalize(strictValidation);
    }

    private Set<String> normalize(List<String> names) {
        return names.stream().filter(Objects::nonNull).map(String::trim).filter(s -> !s.isEmpty())
                .map(s -> s.toLowerCase(Locale.ROOT)).collect(java.util.stream.Collectors.toCollection(LinkedHashSet::new));
    }
}

package com.lexcoach.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "coach")
public class CoachProperties {

    private ApprovalConfig approval = new ApprovalConfig();
    private MemoryConfig memory = new MemoryConfig();
    private PlannerConfig planner = new PlannerConfig();
    private CoachToolsConfig tools = new CoachToolsConfig();
    private CheckpointConfig checkpoint = new CheckpointConfig();
    private String cannedApology = "I apologize, but I encountered an error while generating my response. "
            + "Please try asking your question again.";

    public static class ApprovalConfig {
        private boolean enabled = true;
        private double threshold = 0.7;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public double getThreshold() { return threshold; }
        public void setThreshold(double threshold) { this.threshold = threshold; }
    }

    public static class MemoryConfig {
        private int window = 6;

        public int getWindow() { return window; }
        public void setWindow(int window) { this.window = window; }
    }

    public static class PlannerConfig {
        private int maxInvocations = 4;
        private boolean keywordFallback = true;

        public int getMaxInvocations() { return maxInvocations; }
        public void setMaxInvocations(int maxInvocations) { this.maxInvocations = maxInvocations; }
        public boolean isKeywordFallback() { return keywordFallback; }
        public void setKeywordFallback(boolean keywordFallback) { this.keywordFallback = keywordFallback; }
    }

    public enum CheckpointStoreType {
        JPA, MEMORY
    }

    public static class CheckpointConfig {
        private CheckpointStoreType store = CheckpointStoreType.JPA;

        public CheckpointStoreType getStore() { return store; }
        public void setStore(CheckpointStoreType store) { this.store = store != null ? store : CheckpointStoreType.JPA; }
    }

    public ApprovalConfig getApproval() {
        return approval;
    }

    public void setApproval(ApprovalConfig approval) {
        this.approval = approval != null ? approval : new ApprovalConfig();
    }

    public MemoryConfig getMemory() {
        return memory;
    }

    public void setMemory(MemoryConfig memory) {
        this.memory = memory != null ? memory : new MemoryConfig();
    }

    public PlannerConfig getPlanner() {
        return planner;
    }

    public void setPlanner(PlannerConfig planner) {
        this.planner = planner != null ? planner : new PlannerConfig();
    }

    public CoachToolsConfig getTools() {
        return tools;
    }

    public void setTools(CoachToolsConfig tools) {
        this.tools = tools != null ? tools : new CoachToolsConfig();
    }

    public CheckpointConfig getCheckpoint() {
        return checkpoint;
    }

    public void setCheckpoint(CheckpointConfig checkpoint) {
        this.checkpoint = checkpoint != null ? checkpoint : new CheckpointConfig();
    }

    public String getCannedApology() {
        return cannedApology;
    }

    public void setCannedApology(String cannedApology) {
        if (cannedApology == null || cannedApology.isBlank()) {
            return;
        }
        this.cannedApology = cannedApology;
    }

    public Duration toolTimeout(String toolName) {
        return tools.getTimeoutFor(toolName);
    }
}

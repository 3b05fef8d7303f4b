package com.lexcoach.orchestration.service;

import com.lexcoach.config.CoachProperties;
import com.lexcoach.orchestration.model.FailureKind;
import com.lexcoach.orchestration.model.Plan;
import com.lexcoach.orchestration.model.ToolInvocation;
import com.lexcoach.orchestration.model.ToolResult;
import com.lexcoach.tools.RegisteredTool;
import com.lexcoach.tools.ToolArgumentValidator;
import com.lexcoach.tools.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs every invocation of an approved plan on the tool pool and collects one result per invocation,
 * in plan order. Tool failures are captured in the results and never thrown.
 */
@Service
@Slf4j
public class ToolExecutionNode {

    private final ToolRegistry toolRegistry;
    private final ToolArgumentValidator argumentValidator;
    private final JsonProcessingService jsonProcessingService;
    private final RunAuditService auditService;
    private final ExecutorService toolExecutor;
    private final CoachProperties properties;

    public ToolExecutionNode(ToolRegistry toolRegistry,
                             ToolArgumentValidator argumentValidator,
                             JsonProcessingService jsonProcessingService,
                             RunAuditService auditService,
                             @Qualifier("toolExecutor") ExecutorService toolExecutor,
                             CoachProperties properties) {
        this.toolRegistry = toolRegistry;
        this.argumentValidator = argumentValidator;
        this.jsonProcessingService = jsonProcessingService;
        this.auditService = auditService;
        this.toolExecutor = toolExecutor;
        this.properties = properties;
    }

    public List<ToolResult> execute(String runId, Plan plan) {
        List<ToolInvocation> invocations = plan.invocations();
        if (invocations.isEmpty()) {
            return List.of();
        }
        log.info("TOOLS: executing {} invocation(s) for run {}.", invocations.size(), runId);
        List<CompletableFuture<ToolResult>> futures = new ArrayList<>(invocations.size());
        for (int i = 0; i < invocations.size(); i++) {
            futures.add(submit(runId, i, invocations.get(i)));
        }
        List<ToolResult> results = futures.stream().map(CompletableFuture::join).toList();
        for (int i = 0; i < results.size(); i++) {
            auditService.logToolCall(runId, invocations.get(i), results.get(i));
        }
        long failed = results.stream().filter(result -> !result.success()).count();
        log.info("TOOLS: run {} finished tool execution ({} succeeded, {} failed).", runId, results.size() - failed, failed);
        return results;
    }

    private CompletableFuture<ToolResult> submit(String runId, int index, ToolInvocation invocation) {
        Optional<RegisteredTool> registered = toolRegistry.find(invocation.toolName());
        if (registered.isEmpty()) {
            log.warn("TOOLS: run {} requested unknown tool '{}'.", runId, invocation.toolName());
            return CompletableFuture.completedFuture(ToolResult.failure(index, invocation.toolName(),
                    FailureKind.UNKNOWN_TOOL, "Unknown tool: " + invocation.toolName()));
        }
        RegisteredTool tool = registered.get();
        if (invocation.structuredValidation()) {
            List<String> violations;
            try {
                violations = argumentValidator.validate(tool, invocation.arguments());
            } catch (RuntimeException ex) {
                log.warn("TOOLS: schema of {} could not be applied: {}", tool.name(), ex.getMessage());
                return CompletableFuture.completedFuture(ToolResult.failure(index, tool.name(),
                        FailureKind.INVALID_ARGUMENTS, "Schema of tool " + tool.name() + " could not be applied: " + ex.getMessage()));
            }
            if (!violations.isEmpty()) {
                log.warn("TOOLS: arguments for {} rejected: {}", tool.name(), violations);
                return CompletableFuture.completedFuture(ToolResult.failure(index, tool.name(),
                        FailureKind.INVALID_ARGUMENTS, String.join("; ", violations)));
            }
        }
        Duration timeout = properties.toolTimeout(tool.name());
        CompletableFuture<ToolResult> result = new CompletableFuture<>();
        Future<?> task;
        try {
            task = toolExecutor.submit(() -> {
                try {
                    result.complete(invoke(index, tool, invocation));
                } catch (Throwable ex) {
                    result.completeExceptionally(ex);
                }
            });
        } catch (RejectedExecutionException ex) {
            log.error("TOOLS: pool rejected invocation of {}: {}", tool.name(), ex.getMessage());
            return CompletableFuture.completedFuture(ToolResult.failure(index, tool.name(),
                    FailureKind.TOOL_EXECUTION_ERROR, "Tool pool rejected " + tool.name()));
        }
        // A timed-out tool is interrupted so it gives its pool thread back.
        return result.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((value, ex) -> {
                    if (ex != null && !task.isDone()) {
                        task.cancel(true);
                    }
                })
                .exceptionally(ex -> failed(index, tool.name(), ex, timeout));
    }

    private ToolResult invoke(int index, RegisteredTool tool, ToolInvocation invocation) {
        log.debug("TOOLS: invoking {} with {}", tool.name(),
                jsonProcessingService.truncate(jsonProcessingService.toCompactJson(invocation.arguments()), 300));
        try {
            Object output = tool.tool().invoke(invocation.arguments());
            return ToolResult.success(index, tool.name(), jsonProcessingService.toPayload(output));
        } catch (RuntimeException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new CompletionException(ex);
        }
    }

    private ToolResult failed(int index, String toolName, Throwable ex, Duration timeout) {
        Throwable cause = unwrap(ex);
        if (cause instanceof TimeoutException) {
            log.warn("TOOLS: {} timed out after {} ms.", toolName, timeout.toMillis());
            return ToolResult.failure(index, toolName, FailureKind.TOOL_TIMEOUT,
                    "Tool " + toolName + " timed out after " + timeout.toMillis() + " ms");
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        log.warn("TOOLS: {} failed: {}", toolName, message);
        return ToolResult.failure(index, toolName, FailureKind.TOOL_EXECUTION_ERROR, message);
    }

    private Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}

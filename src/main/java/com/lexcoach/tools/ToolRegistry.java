package com.lexcoach.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexcoach.config.CoachProperties;
import com.lexcoach.config.CoachToolsConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.*;

/**
 * Static name to capability mapping, built once at startup. Names are matched case-insensitively.
 * Planner output is checked against this registry and never trusted as-is.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, RegisteredTool> tools;

    @Autowired
    public ToolRegistry(ObjectProvider<CoachingTool> coachingTools,
                        ObjectProvider<ToolCallbackProvider> callbackProviders,
                        CoachProperties properties,
                        ObjectMapper objectMapper) {
        this(collect(coachingTools, callbackProviders, objectMapper), properties.getTools());
    }

    public ToolRegistry(Collection<? extends CoachingTool> candidates, CoachToolsConfig config) {
        Set<String> sensitive = config.sensitiveNames();
        Set<String> strict = config.strictValidationNames();
        Map<String, RegisteredTool> index = new LinkedHashMap<>();
        for (CoachingTool tool : candidates) {
            if (tool == null || !StringUtils.hasText(tool.name())) {
                throw new IllegalStateException("Coaching tool without a name: " + tool);
            }
            String key = normalize(tool.name());
            if (index.containsKey(key)) {
                throw new IllegalStateException("Duplicate coaching tool name: " + tool.name());
            }
            index.put(key, new RegisteredTool(tool, tool.sensitive() || sensitive.contains(key), strict.contains(key)));
        }
        warnUnmatched("sensitive", sensitive, index.keySet());
        warnUnmatched("strict-validation", strict, index.keySet());
        this.tools = Collections.unmodifiableMap(index);
        log.info("Tool registry initialised with {} tools: {}.", tools.size(), String.join(", ", tools.keySet()));
    }

    public Optional<RegisteredTool> find(String name) {
        if (!StringUtils.hasText(name)) {
            return Optional.empty();
        }
        return Optional.ofNullable(tools.get(normalize(name)));
    }

    public boolean isSensitive(String name) {
        return find(name).map(RegisteredTool::sensitive).orElse(false);
    }

    public Collection<RegisteredTool> all() {
        return tools.values();
    }

    /**
     * Renders name, description and parameters of every tool, one block per tool.
     */
    public String describe() {
        if (tools.isEmpty()) {
            return "(no tools available)";
        }
        StringBuilder sb = new StringBuilder();
        for (RegisteredTool registered : tools.values()) {
            sb.append("- ").append(registered.name()).append(": ").append(registered.tool().description().trim());
            if (registered.sensitive()) {
                sb.append(" [requires approval]");
            }
            sb.append("\n  Parameters:\n");
            var properties = registered.schema() == null ? null : registered.schema().path("properties");
            if (properties == null || !properties.isObject() || properties.isEmpty()) {
                sb.append("    None\n");
                continue;
            }
            properties.fields().forEachRemaining(field -> {
                String type = field.getValue().path("type").asText("any");
                String description = field.getValue().path("description").asText("No description");
                sb.append("    - ").append(field.getKey()).append(": ").append(description)
                        .append(" (type: ").append(type).append(")\n");
            });
        }
        return sb.toString();
    }

    private static List<CoachingTool> collect(ObjectProvider<CoachingTool> coachingTools,
                                              ObjectProvider<ToolCallbackProvider> callbackProviders,
                                              ObjectMapper objectMapper) {
        List<CoachingTool> all = new ArrayList<>(coachingTools.orderedStream().toList());
        callbackProviders.orderedStream().forEach(provider -> {
            ToolCallback[] callbacks = provider.getToolCallbacks();
            if (callbacks == null) {
                return;
            }
            for (ToolCallback callback : callbacks) {
                all.add(new ToolCallbackCoachingTool(callback, objectMapper));
            }
        });
        return all;
    }

    private static void warnUnmatched(String setting, Set<String> configured, Set<String> known) {
        for (String name : configured) {
            if (!known.contains(name)) {
                log.warn("coach.tools.{} references unknown tool '{}'.", setting, name);
            }
        }
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}

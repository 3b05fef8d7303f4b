package com.lexcoach.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.util.StringUtils;

import java.util.Map;
import java.util.Optional;

/**
 * Exposes a Spring AI {@link ToolCallback} (for example one discovered through an MCP client) as a coaching tool.
 */
@Slf4j
final class ToolCallbackCoachingTool implements CoachingTool {

    private final ToolCallback delegate;
    private final ObjectMapper objectMapper;
    private final JsonNode schema;

    ToolCallbackCoachingTool(ToolCallback delegate, ObjectMapper objectMapper) {
        this.delegate = delegate;
        this.objectMapper = objectMapper;
        this.schema = parseSchema(delegate.getToolDefinition());
    }

    @Override
    public String name() {
        return delegate.getToolDefinition().name();
    }

    @Override
    public String description() {
        String description = delegate.getToolDefinition().description();
        return StringUtils.hasText(description) ? description : name();
    }

    @Override
    public Optional<JsonNode> schema() {
        return Optional.ofNullable(schema);
    }

    @Override
    public Object invoke(Map<String, Object> arguments) throws Exception {
        String input = objectMapper.writeValueAsString(arguments);
        return delegate.call(input);
    }

    private JsonNode parseSchema(ToolDefinition definition) {
        String raw = definition.inputSchema();
        if (!StringUtils.hasText(raw)) {
            return null;
        }
        try {
            return objectMapper.readTree(raw);
        } catch (Exception ex) {
            log.warn("Ignoring unparseable input schema of tool {}: {}", definition.name(), ex.getMessage());
            return null;
        }
    }
}

package com.lexcoach.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Validates invocation arguments against a tool's declared JSON Schema. Compiled schemas are cached per tool.
 */
@Component
@Slf4j
public class ToolArgumentValidator {

    private final ObjectMapper objectMapper;
    private final JsonSchemaFactory schemaFactory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
    private final Map<String, JsonSchema> compiled = new ConcurrentHashMap<>();

    public ToolArgumentValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return validation messages, empty when the arguments conform or the tool declares no schema
     */
    public List<String> validate(RegisteredTool tool, Map<String, Object> arguments) {
        JsonNode schemaNode = tool.schema();
        if (schemaNode == null) {
            return List.of();
        }
        JsonSchema schema = compiled.computeIfAbsent(tool.name(), name -> schemaFactory.getSchema(schemaNode));
        JsonNode payload = objectMapper.valueToTree(arguments);
        Set<ValidationMessage> messages = schema.validate(payload);
        if (!messages.isEmpty()) {
            log.debug("Arguments for {} failed validation: {}", tool.name(), messages);
        }
        return messages.stream().map(ValidationMessage::getMessage).sorted().toList();
    }
}

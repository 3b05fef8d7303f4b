package com.lexcoach.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.lexcoach.tools.RegisteredTool;
import com.lexcoach.tools.ToolRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/tools")
public class ToolController {

    private final ToolRegistry toolRegistry;

    public ToolController(ToolRegistry toolRegistry) {
        this.toolRegistry = toolRegistry;
    }

    @GetMapping
    public ToolsResponse tools() {
        List<ToolInfo> tools = toolRegistry.all().stream()
                .map(ToolInfo::from)
                .toList();
        return new ToolsResponse(tools.size(), tools, toolRegistry.describe());
    }

    public record ToolsResponse(int count, List<ToolInfo> tools, String description) {}

    public record ToolInfo(String name, String description, boolean sensitive, boolean strictValidation, JsonNode schema) {

        static ToolInfo from(RegisteredTool registered) {
            return new ToolInfo(registered.name(), registered.tool().description(), registered.sensitive(),
                    registered.strictValidation(), registered.schema());
        }
    }
}

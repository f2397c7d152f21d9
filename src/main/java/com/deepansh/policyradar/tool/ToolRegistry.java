package com.deepansh.policyradar.tool;

import com.deepansh.policyradar.model.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static catalog of every research tool, keyed by name.
 *
 * Spring discovers every AgentTool bean; registration order is kept so models always
 * see tools in the same order.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, AgentTool> tools = new LinkedHashMap<>();

    public ToolRegistry(List<AgentTool> toolBeans) {
        toolBeans.forEach(tool -> {
            String name = tool.spec().name();
            if (tools.putIfAbsent(name, tool) != null) {
                throw new IllegalStateException("Duplicate tool name: " + name);
            }
            log.info("Registered tool: [{}] source={}", name,
                    tool.spec().source() != null ? tool.spec().source().key() : "always");
        });
        log.info("Total tools registered: {}", tools.size());
    }

    public Optional<AgentTool> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    /**
     * Tools of the selected sources plus the source-less tools, in registration order.
     */
    public List<ToolSpec> visibleTools(Set<DataSource> selected) {
        return tools.values().stream()
                .map(AgentTool::spec)
                .filter(spec -> spec.source() == null || selected.contains(spec.source()))
                .toList();
    }

    public Collection<ToolSpec> allSpecs() {
        return tools.values().stream().map(AgentTool::spec).toList();
    }

    public int toolCount() {
        return tools.size();
    }
}

package com.deepansh.policyradar.tool;

import com.deepansh.policyradar.config.RadarProperties;
import com.deepansh.policyradar.exception.RateLimitException;
import com.deepansh.policyradar.model.DataSource;
import com.deepansh.policyradar.model.SourceRecord;
import com.deepansh.policyradar.model.ToolCall;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.deepansh.policyradar.tool.JsonSchema.object;
import static com.deepansh.policyradar.tool.JsonSchema.properties;
import static com.deepansh.policyradar.tool.JsonSchema.string;
import static org.assertj.core.api.Assertions.assertThat;

class ToolExecutorTest {

    private ToolExecutor executor;

    /** Echoes its query or fails depending on the argument. */
    static class EchoTool implements AgentTool {

        @Override
        public ToolSpec spec() {
            return new ToolSpec("echo", "echo the query", object(properties("query", string("q")), "query"),
                    DataSource.REGULATIONS);
        }

        @Override
        public ToolResult execute(Map<String, Object> arguments, ToolContext context) {
            String query = ToolArgs.string(arguments, "query", "");
            if ("boom".equals(query)) throw new IllegalStateException("upstream exploded");
            if ("slow down".equals(query)) throw new RateLimitException("Too many requests", 30);
            if ("null".equals(query)) return null;
            return ToolResult.of(Map.of("query", query, "count", 1))
                    .withSources(List.of(SourceRecord.builder().title("Result for " + query).build()));
        }

        @Override
        public String label(Map<String, Object> arguments) {
            return "Echo: " + arguments.get("query");
        }
    }

    @BeforeEach
    void setUp() {
        ToolRegistry registry = new ToolRegistry(List.of(new EchoTool()));
        executor = new ToolExecutor(registry, new SanitizePolicy(new RadarProperties()), new ObjectMapper());
    }

    private static ToolCall call(String name, Map<String, Object> args) {
        return ToolCall.builder().id("call-1").toolName(name).arguments(args).build();
    }

    private static ToolContext context() {
        return new ToolContext("session-1", null, 30);
    }

    @Test
    void execute_success_returnsOutputSourcesAndPreview() {
        ToolExecution execution = executor.execute(call("echo", Map.of("query", "water")), context());

        assertThat(execution.failed()).isFalse();
        assertThat(execution.output().callId()).isEqualTo("call-1");
        assertThat(execution.output().content()).contains("\"query\":\"water\"");
        assertThat(execution.sources()).extracting(SourceRecord::getTitle).containsExactly("Result for water");
        assertThat(execution.label()).isEqualTo("Echo: water");
        assertThat(execution.preview()).containsEntry("count", 1);
    }

    @Test
    void execute_unknownTool_returnsErrorPayload() {
        ToolExecution execution = executor.execute(call("missing_tool", Map.of()), context());

        assertThat(execution.failed()).isTrue();
        assertThat(execution.error()).isEqualTo("Unknown tool: missing_tool");
        assertThat(execution.output().content()).contains("Unknown tool: missing_tool");
        assertThat(execution.label()).isEqualTo("Execute: missing_tool");
    }

    @Test
    void execute_toolThrows_becomesErrorPayload() {
        ToolExecution execution = executor.execute(call("echo", Map.of("query", "boom")), context());

        assertThat(execution.failed()).isTrue();
        assertThat(execution.error()).isEqualTo("upstream exploded");
        assertThat(execution.preview()).containsEntry("error", "upstream exploded");
        assertThat(execution.sources()).isEmpty();
    }

    @Test
    void execute_rateLimited_addsRetryAfter() {
        ToolExecution execution = executor.execute(call("echo", Map.of("query", "slow down")), context());

        assertThat(execution.failed()).isTrue();
        assertThat(execution.output().content()).contains("\"retry_after\":30");
    }

    @Test
    void execute_toolReturnsNull_isReportedAsError() {
        ToolExecution execution = executor.execute(call("echo", Map.of("query", "null")), context());

        assertThat(execution.error()).isEqualTo("Tool returned no result.");
    }

    @Test
    void label_unknownTool_fallsBackToGenericLabel() {
        assertThat(executor.label(call("missing_tool", Map.of()))).isEqualTo("Execute: missing_tool");
        assertThat(executor.label(call("echo", Map.of("query", "x")))).isEqualTo("Echo: x");
    }
}

package com.deepansh.policyradar.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One visible unit of progress. Emitted once as {@code running} and once more with the
 * same {@code stepId} as {@code done} or {@code error}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Step {

    @JsonProperty("step_id")
    private int stepId;

    private StepStatus status;

    private String label;

    @JsonProperty("tool_name")
    private String toolName;

    private Map<String, Object> args;

    @JsonProperty("result_preview")
    private Map<String, Object> resultPreview;

    public Step finish(StepStatus finalStatus, String finalLabel, Map<String, Object> preview) {
        return toBuilder()
                .status(finalStatus)
                .label(finalLabel != null ? finalLabel : label)
                .resultPreview(preview)
                .build();
    }
}

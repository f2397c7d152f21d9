package com.deepansh.policyradar.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCall {

    /** Backend-assigned id, echoed back with the tool output */
    private String id;

    private String toolName;

    private Map<String, Object> arguments;
}

package com.deepansh.policyradar.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatResponse {

    @JsonProperty("answer_text")
    private String answerText;

    private List<SourceRecord> sources;

    private List<Step> steps;

    private String model;

    /** Backend conversation handle; pass back as previous_handle to continue */
    private String handle;

    private int iterations;

    @JsonProperty("max_iterations_reached")
    private boolean maxIterationsReached;

    @JsonProperty("auto_selection_rationale")
    private String autoSelectionRationale;
}

package com.deepansh.policyradar.core;

import com.deepansh.policyradar.model.SourceRecord;
import com.deepansh.policyradar.model.Step;
import com.deepansh.policyradar.tool.ToolContext;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Mutable state of one chat turn, passed through the loop instead of living in
 * fields on the orchestrator.
 */
@Data
@Builder
public class ChatContext {

    private String requestId;
    private ToolContext toolContext;
    private CancellationToken token;

    /** Receives every step event in emission order; never null */
    private Consumer<Step> stepSink;

    @Builder.Default
    private List<Step> steps = new ArrayList<>();

    /** Discovery order, not deduplicated */
    @Builder.Default
    private List<SourceRecord> sources = new ArrayList<>();

    private int stepCounter;
    /** Completed tool rounds */
    private int iteration;

    int nextStepId() {
        return ++stepCounter;
    }

    /**
     * Records the step and forwards it. A finished step replaces its running
     * entry in the returned list so each step id appears once.
     */
    void emit(Step step) {
        steps.removeIf(s -> s.getStepId() == step.getStepId());
        steps.add(step);
        stepSink.accept(step);
    }
}

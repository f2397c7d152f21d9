package com.deepansh.policyradar.core;

import com.deepansh.policyradar.config.RadarProperties;
import com.deepansh.policyradar.exception.ChatCancelledException;
import com.deepansh.policyradar.llm.BackendFactory;
import com.deepansh.policyradar.llm.ConversationBackend;
import com.deepansh.policyradar.llm.ModelCallGuard;
import com.deepansh.policyradar.memory.EmbeddingConfig;
import com.deepansh.policyradar.memory.EmbeddingService;
import com.deepansh.policyradar.model.ChatEvent;
import com.deepansh.policyradar.model.ChatRequest;
import com.deepansh.policyradar.model.ChatResponse;
import com.deepansh.policyradar.model.DataSource;
import com.deepansh.policyradar.model.LlmResponse;
import com.deepansh.policyradar.model.Step;
import com.deepansh.policyradar.model.StepStatus;
import com.deepansh.policyradar.model.ToolCall;
import com.deepansh.policyradar.observability.TurnMetrics;
import com.deepansh.policyradar.tool.ToolContext;
import com.deepansh.policyradar.tool.ToolExecution;
import com.deepansh.policyradar.tool.ToolExecutor;
import com.deepansh.policyradar.tool.ToolOutput;
import com.deepansh.policyradar.tool.ToolRegistry;
import com.deepansh.policyradar.tool.ToolSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Tool-calling loop for one chat turn.
 *
 * Per-turn flow:
 * 1. Register the cancellation token and build the model backend
 * 2. Resolve sources, optionally auto-select with one model call
 * 3. Send the prompt with the visible tools
 * 4. While the model asks for tools: run every call in order, send all outputs back
 * 5. Return the final text with steps and sources; stream it in chunks when asked
 *
 * Cancellation is checked before each model call, around each tool call and between
 * streamed chunks. The token is cleared exactly once, whatever the outcome.
 */
@Service
@Slf4j
public class ChatOrchestrator {

    static final String AUTO_SELECT_TOOL = "auto_select_sources";

    private final BackendFactory backendFactory;
    private final ModelCallGuard guard;
    private final SourceRouter router;
    private final ToolRegistry registry;
    private final ToolExecutor executor;
    private final EmbeddingService embeddingService;
    private final CancellationRegistry cancellations;
    private final RadarProperties.Orchestrator settings;

    public ChatOrchestrator(BackendFactory backendFactory,
                            ModelCallGuard guard,
                            SourceRouter router,
                            ToolRegistry registry,
                            ToolExecutor executor,
                            EmbeddingService embeddingService,
                            CancellationRegistry cancellations,
                            RadarProperties properties) {
        this.backendFactory = backendFactory;
        this.guard = guard;
        this.router = router;
        this.registry = registry;
        this.executor = executor;
        this.embeddingService = embeddingService;
        this.cancellations = cancellations;
        this.settings = properties.getOrchestrator();
    }

    /** Runs a turn to completion without streaming. */
    public ChatResponse chat(ChatRequest request) {
        return run(request, step -> {}, null);
    }

    /**
     * Runs a turn, emitting step and assistant_delta events as they happen.
     * The terminal done/error event is left to the caller.
     */
    public ChatResponse stream(ChatRequest request, Consumer<ChatEvent> events) {
        return run(request, step -> events.accept(ChatEvent.step(step)), events);
    }

    private ChatResponse run(ChatRequest request, Consumer<Step> stepSink, Consumer<ChatEvent> events) {
        String requestId = request.getRequestId();
        CancellationToken token = cancellations.register(requestId);
        TurnMetrics metrics = new TurnMetrics();

        log.info("Chat turn started [requestId={}, session={}, provider={}, days={}]",
                requestId, request.getSessionId(), request.getProvider(), request.resolvedDays());
        try {
            ChatResponse response = execute(request, token, stepSink, events, metrics);
            log.info("Chat turn complete [requestId={}, iterations={}, modelCalls={}, tokens={}, tools={}, toolTime={}ms, latency={}ms] {}",
                    requestId, response.getIterations(), metrics.modelCalls(), metrics.totalTokens(),
                    metrics.toolCalls(), metrics.toolTimeMs(), metrics.elapsedMs(), metrics.breakdown());
            return response;
        } catch (ChatCancelledException e) {
            log.info("Chat turn cancelled [requestId={}, after={}ms, tools={}]", requestId, metrics.elapsedMs(), metrics.toolCalls());
            throw e;
        } finally {
            cancellations.clear(requestId);
        }
    }

    private ChatResponse execute(ChatRequest request,
                                 CancellationToken token,
                                 Consumer<Step> stepSink,
                                 Consumer<ChatEvent> events,
                                 TurnMetrics metrics) {
        token.throwIfCancelled();
        ConversationBackend backend = backendFactory.create(request);
        SourceRouter.Resolution resolution = router.resolve(request.getMode(), request.getSources());

        EmbeddingConfig embeddingConfig = embeddingService.defaultConfig().override(request.getEmbedding());
        int days = request.resolvedDays();
        ChatContext ctx = ChatContext.builder()
                .requestId(request.getRequestId())
                .toolContext(new ToolContext(request.getSessionId(), embeddingConfig, days))
                .token(token)
                .stepSink(stepSink)
                .build();

        SourceRouter.Selection selection = resolution.auto()
                ? autoSelect(ctx, request.getMessage(), resolution.allowed(), backend)
                : new SourceRouter.Selection(resolution.allowed(), null);

        List<ToolSpec> tools = registry.visibleTools(selection.sources());
        String prompt = PromptBuilder.userPrompt(request.getMessage(), days, selection.sources(), selection.rationale());
        log.debug("Visible tools [requestId={}]: {}", ctx.getRequestId(), tools.stream().map(ToolSpec::name).toList());

        token.throwIfCancelled();
        LlmResponse response = guard.invoke("start", () -> backend.start(PromptBuilder.SYSTEM_INSTRUCTIONS, prompt, tools));
        metrics.modelCall(response);
        ctx.setIteration(0);

        // The bound counts tool rounds; each round ends with one follow-up model call
        boolean maxReached = false;
        while (response.hasToolCalls()) {
            if (ctx.getIteration() >= settings.getMaxIterations()) {
                log.warn("Chat hit max iterations ({}) [requestId={}]", settings.getMaxIterations(), ctx.getRequestId());
                maxReached = true;
                break;
            }
            List<ToolOutput> outputs = executeRound(ctx, response.getToolCalls(), metrics);

            token.throwIfCancelled();
            response = guard.invoke("respond", () -> backend.respond(outputs));
            metrics.modelCall(response);
            ctx.setIteration(ctx.getIteration() + 1);
        }
        int iterations = maxReached ? ctx.getIteration() : ctx.getIteration() + 1;

        String answer = response.textOrEmpty();
        if (events != null) streamAnswer(answer, token, events);

        return ChatResponse.builder()
                .answerText(answer)
                .sources(ctx.getSources())
                .steps(ctx.getSteps())
                .model(backend.model())
                .handle(backend.handle())
                .iterations(iterations)
                .maxIterationsReached(maxReached)
                .autoSelectionRationale(selection.rationale())
                .build();
    }

    private SourceRouter.Selection autoSelect(ChatContext ctx, String message, Set<DataSource> allowed,
                                              ConversationBackend backend) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("allowed_sources", keys(allowed));
        Step running = Step.builder()
                .stepId(ctx.nextStepId())
                .status(StepStatus.RUNNING)
                .label("Auto-select sources")
                .toolName(AUTO_SELECT_TOOL)
                .args(args)
                .build();
        ctx.emit(running);

        ctx.getToken().throwIfCancelled();
        SourceRouter.Selection selection = router.select(message, allowed, backend);

        Map<String, Object> preview = new LinkedHashMap<>();
        preview.put("selected_sources", keys(selection.sources()));
        preview.put("rationale", selection.rationale());
        ctx.emit(running.finish(StepStatus.DONE, null, preview));
        return selection;
    }

    /** Every call of one model response, sequentially, one running/finished step pair each. */
    private List<ToolOutput> executeRound(ChatContext ctx, List<ToolCall> calls, TurnMetrics metrics) {
        List<ToolOutput> outputs = new ArrayList<>();
        for (ToolCall call : calls) {
            ctx.getToken().throwIfCancelled();
            Map<String, Object> args = withDefaults(call, ctx.getToolContext().days());
            ToolCall effective = ToolCall.builder().id(call.getId()).toolName(call.getToolName()).arguments(args).build();

            Step running = Step.builder()
                    .stepId(ctx.nextStepId())
                    .status(StepStatus.RUNNING)
                    .label(executor.label(effective))
                    .toolName(call.getToolName())
                    .args(args)
                    .build();
            ctx.emit(running);

            long start = System.currentTimeMillis();
            ToolExecution execution = executor.execute(effective, ctx.getToolContext());
            metrics.toolCall(call.getToolName(), System.currentTimeMillis() - start, execution);

            ctx.getSources().addAll(execution.sources());
            ctx.emit(running.finish(execution.failed() ? StepStatus.ERROR : StepStatus.DONE,
                    execution.label(), execution.preview()));
            outputs.add(execution.output());

            ctx.getToken().throwIfCancelled();
        }
        return outputs;
    }

    /** Injects the turn's time window when the tool takes {@code days} and the model left it out. */
    Map<String, Object> withDefaults(ToolCall call, int days) {
        Map<String, Object> args = new LinkedHashMap<>();
        if (call.getArguments() != null) args.putAll(call.getArguments());
        boolean declaresDays = registry.find(call.getToolName())
                .map(tool -> tool.spec().declaresParameter("days"))
                .orElse(false);
        if (declaresDays && !args.containsKey("days")) args.put("days", days);
        return args;
    }

    private void streamAnswer(String answer, CancellationToken token, Consumer<ChatEvent> events) {
        int size = Math.max(1, settings.getStreamChunkSize());
        for (int i = 0; i < answer.length(); i += size) {
            token.throwIfCancelled();
            events.accept(ChatEvent.delta(answer.substring(i, Math.min(answer.length(), i + size))));
            pause(token);
        }
        token.throwIfCancelled();
    }

    private void pause(CancellationToken token) {
        if (settings.getStreamDelayMs() <= 0) return;
        try {
            Thread.sleep(settings.getStreamDelayMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChatCancelledException(token.requestId());
        }
    }

    private static List<String> keys(Set<DataSource> sources) {
        return sources.stream().map(DataSource::key).sorted().toList();
    }
}

package com.deepansh.policyradar.api;

import com.deepansh.policyradar.core.CancellationRegistry;
import com.deepansh.policyradar.core.ChatOrchestrator;
import com.deepansh.policyradar.exception.ApiException;
import com.deepansh.policyradar.exception.BackendUnavailableException;
import com.deepansh.policyradar.exception.ChatCancelledException;
import com.deepansh.policyradar.exception.RateLimitException;
import com.deepansh.policyradar.model.ChatEvent;
import com.deepansh.policyradar.model.ChatRequest;
import com.deepansh.policyradar.model.ChatResponse;
import com.deepansh.policyradar.model.DataSource;
import com.deepansh.policyradar.provider.SourceAvailability;
import com.deepansh.policyradar.tool.ToolRegistry;
import com.deepansh.policyradar.tool.ToolSpec;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Chat endpoints.
 *
 * POST /api/v1/chat                      synchronous turn, JSON ChatResponse
 * POST /api/v1/chat/stream               SSE: step, assistant_delta, then done or error
 * POST /api/v1/chat/{requestId}/cancel   cooperative cancel, may arrive before the chat starts
 * GET  /api/v1/tools                     tool catalog
 * GET  /api/v1/sources                   configured data sources
 */
@RestController
@RequestMapping("/api/v1")
@Slf4j
public class ChatController {

    static final long STREAM_TIMEOUT_MS = 10 * 60 * 1000L;

    private final ChatOrchestrator orchestrator;
    private final CancellationRegistry cancellations;
    private final ToolRegistry toolRegistry;
    private final SourceAvailability availability;
    private final ThreadPoolTaskExecutor streamExecutor;

    public ChatController(ChatOrchestrator orchestrator,
                          CancellationRegistry cancellations,
                          ToolRegistry toolRegistry,
                          SourceAvailability availability,
                          @Qualifier("chatStreamExecutor") ThreadPoolTaskExecutor streamExecutor) {
        this.orchestrator = orchestrator;
        this.cancellations = cancellations;
        this.toolRegistry = toolRegistry;
        this.availability = availability;
        this.streamExecutor = streamExecutor;
    }

    @PostMapping("/chat")
    public ResponseEntity<ChatResponse> chat(@Valid @RequestBody ChatRequest request) {
        log.info("Chat request [session={}, requestId={}, mode={}]",
                request.getSessionId(), request.getRequestId(), request.getMode());
        return ResponseEntity.ok(orchestrator.chat(request));
    }

    @PostMapping(path = "/chat/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@Valid @RequestBody ChatRequest request) {
        log.info("Chat stream request [session={}, requestId={}, mode={}]",
                request.getSessionId(), request.getRequestId(), request.getMode());

        SseEmitter emitter = new SseEmitter(STREAM_TIMEOUT_MS);
        String requestId = request.getRequestId();
        StreamTurn turn = new StreamTurn(cancellations, requestId);
        // Client went away: stop the loop at its next checkpoint
        emitter.onTimeout(turn::clientGone);
        emitter.onError(e -> turn.clientGone());

        try {
            streamExecutor.execute(() -> {
                try {
                    runStream(request, emitter);
                } finally {
                    turn.finish();
                }
            });
        } catch (TaskRejectedException e) {
            log.warn("Chat stream rejected, executor saturated [requestId={}]", requestId);
            throw new BackendUnavailableException("Too many concurrent chat streams. Please retry shortly.", 503);
        }
        return emitter;
    }

    private void runStream(ChatRequest request, SseEmitter emitter) {
        String requestId = request.getRequestId();
        try {
            ChatResponse response = orchestrator.stream(request, event -> send(emitter, event, requestId));
            send(emitter, ChatEvent.done(response), requestId);
            emitter.complete();
        } catch (ChatCancelledException e) {
            log.info("Chat stream cancelled [requestId={}]", requestId);
            emitter.complete();
        } catch (RateLimitException e) {
            log.warn("Chat stream rate limited [requestId={}]: {}", requestId, e.getMessage());
            finishWithError(emitter, ChatEvent.rateLimited(e.getMessage(), e.getRetryAfterSeconds()), requestId);
        } catch (ApiException e) {
            log.error("Chat stream upstream error [requestId={}, status={}]: {}", requestId, e.getStatusCode(), e.getMessage());
            finishWithError(emitter, ChatEvent.error(e.getMessage()), requestId);
        } catch (RuntimeException e) {
            log.error("Chat stream failed [requestId={}]", requestId, e);
            finishWithError(emitter, ChatEvent.error(e.getMessage() != null ? e.getMessage() : "Chat failed."), requestId);
        }
    }

    /** A failed send means the client is gone; the turn stops as cancelled. */
    private void send(SseEmitter emitter, ChatEvent event, String requestId) {
        try {
            emitter.send(SseEmitter.event().name(event.type()).data(event, MediaType.APPLICATION_JSON));
        } catch (IOException | IllegalStateException e) {
            log.debug("SSE send failed [requestId={}]: {}", requestId, e.getMessage());
            throw new ChatCancelledException(requestId);
        }
    }

    private void finishWithError(SseEmitter emitter, ChatEvent event, String requestId) {
        try {
            send(emitter, event, requestId);
            emitter.complete();
        } catch (ChatCancelledException gone) {
            log.debug("Client disconnected before error event [requestId={}]", requestId);
            emitter.completeWithError(gone);
        }
    }

    @PostMapping("/chat/{requestId}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String requestId) {
        boolean live = cancellations.cancel(requestId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("request_id", requestId);
        body.put("cancelled", live);
        body.put("status", live ? "cancelling" : "pending");
        return ResponseEntity.ok(body);
    }

    @GetMapping("/tools")
    public ResponseEntity<List<Map<String, Object>>> tools() {
        List<Map<String, Object>> tools = toolRegistry.allSpecs().stream()
                .map(ChatController::describe)
                .toList();
        return ResponseEntity.ok(tools);
    }

    @GetMapping("/sources")
    public ResponseEntity<List<Map<String, Object>>> sources() {
        var configured = availability.configuredSources();
        List<Map<String, Object>> sources = Arrays.stream(DataSource.values())
                .map(s -> {
                    Map<String, Object> m = new LinkedHashMap<>();
                    m.put("key", s.key());
                    m.put("name", s.displayName());
                    m.put("configured", configured.contains(s));
                    return m;
                })
                .toList();
        return ResponseEntity.ok(sources);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of("status", "UP", "tools", toolRegistry.toolCount()));
    }

    /** Disconnect handling for one streamed turn. A disconnect after the turn finished is ignored. */
    static final class StreamTurn {

        private final CancellationRegistry cancellations;
        private final String requestId;
        private final AtomicBoolean finished = new AtomicBoolean();

        StreamTurn(CancellationRegistry cancellations, String requestId) {
            this.cancellations = cancellations;
            this.requestId = requestId;
        }

        void clientGone() {
            if (!finished.get()) cancellations.cancel(requestId);
        }

        void finish() {
            finished.set(true);
        }
    }

    private static Map<String, Object> describe(ToolSpec spec) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", spec.name());
        m.put("description", spec.description().strip());
        m.put("source", spec.source() != null ? spec.source().key() : null);
        m.put("parameters", spec.parameters());
        return m;
    }
}

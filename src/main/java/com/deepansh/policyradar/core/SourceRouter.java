package com.deepansh.policyradar.core;

import com.deepansh.policyradar.exception.ChatCancelledException;
import com.deepansh.policyradar.exception.RequestValidationException;
import com.deepansh.policyradar.llm.ConversationBackend;
import com.deepansh.policyradar.llm.ModelCallGuard;
import com.deepansh.policyradar.model.ChatMode;
import com.deepansh.policyradar.model.DataSource;
import com.deepansh.policyradar.model.SourceSelection;
import com.deepansh.policyradar.provider.SourceAvailability;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides which data sources a chat turn may use.
 *
 * {@link #resolve} applies the mode/selection rules and drops unconfigured sources;
 * {@link #select} optionally narrows the result with one model call. Selection never
 * fails a turn: any bad or missing answer falls back to every allowed source.
 */
@Component
@Slf4j
public class SourceRouter {

    public static final int MAX_AUTO_SOURCES = 6;

    static final String ONLY_ONE = "Only one source available.";
    static final String NO_VALID_SELECTION = "No valid selection returned; using all allowed sources.";
    static final String SELECTION_FAILED = "Auto selection failed; using all allowed sources.";

    private static final Map<DataSource, String> GUIDANCE = Map.of(
            DataSource.REGULATIONS, "rulemakings, dockets, proposed/final rules, agency regulatory actions",
            DataSource.GOVINFO, "official publications and broad federal documents",
            DataSource.FEDERAL_REGISTER, "rules, notices, presidential documents in the Federal Register",
            DataSource.CONGRESS, "bills, legislation status, roll call votes, sponsors, committees",
            DataSource.USASPENDING, "federal awards, contracts, grants, recipients, agencies, award totals",
            DataSource.FISCAL_DATA, "Treasury fiscal time series (debt, receipts, outlays, interest rates)",
            DataSource.DATAGOV, "datasets, open data resources, data catalog discovery",
            DataSource.DOJ, "DOJ press releases, enforcement announcements",
            DataSource.SEARCHGOV, "broad .gov site search");

    private static final String SELECTOR_INSTRUCTIONS = """
            You route user queries to the most relevant data sources.
            Use the routing guidance and choose the sources most likely to contain authoritative results.
            Return STRICT JSON only: {"sources":["source_key",...], "rationale":"short"}. Choose 1-6 sources; \
            choose fewer when the query is narrow.
            Only choose from the allowed list.""";

    private final SourceAvailability availability;
    private final ModelCallGuard guard;
    private final ObjectMapper objectMapper;

    public SourceRouter(SourceAvailability availability, ModelCallGuard guard, ObjectMapper objectMapper) {
        this.availability = availability;
        this.guard = guard;
        this.objectMapper = objectMapper;
    }

    public record Resolution(boolean auto, Set<DataSource> allowed) {}

    public record Selection(Set<DataSource> sources, String rationale) {}

    /**
     * @throws RequestValidationException when no source is left
     */
    public Resolution resolve(ChatMode mode, SourceSelection selection) {
        Resolution requested = requested(mode, selection);
        Set<DataSource> allowed = EnumSet.noneOf(DataSource.class);
        allowed.addAll(requested.allowed());
        allowed.retainAll(availability.configuredSources());

        if (allowed.isEmpty()) {
            throw new RequestValidationException("No sources enabled/available for this request.");
        }
        log.debug("Resolved sources [mode={}, auto={}, allowed={}]", mode, requested.auto(), allowed);
        return new Resolution(requested.auto(), allowed);
    }

    static Resolution requested(ChatMode mode, SourceSelection selection) {
        ChatMode effective = mode != null ? mode : ChatMode.BOTH;
        if (selection == null) {
            return switch (effective) {
                case REGULATIONS -> new Resolution(false, EnumSet.of(DataSource.REGULATIONS));
                case GOVINFO -> new Resolution(false, EnumSet.of(DataSource.GOVINFO));
                case BOTH -> new Resolution(true, EnumSet.allOf(DataSource.class));
            };
        }

        Set<DataSource> sources = selection.flagged();
        if (sources.isEmpty()) {
            if (!selection.isAuto()) return new Resolution(false, EnumSet.noneOf(DataSource.class));
            sources = EnumSet.allOf(DataSource.class);
        }
        if (effective == ChatMode.REGULATIONS) sources.retainAll(EnumSet.of(DataSource.REGULATIONS));
        if (effective == ChatMode.GOVINFO) sources.retainAll(EnumSet.of(DataSource.GOVINFO));
        return new Resolution(selection.isAuto(), sources);
    }

    /**
     * Narrows {@code allowed} with a single non-streamed model call.
     * Cancellation propagates; every other failure falls back to the full set.
     */
    public Selection select(String message, Set<DataSource> allowed, ConversationBackend backend) {
        if (allowed.size() == 1) return new Selection(allowed, ONLY_ONE);

        String raw;
        try {
            raw = guard.invoke("auto-select", () -> backend.complete(SELECTOR_INSTRUCTIONS, selectorPrompt(message, allowed)));
        } catch (ChatCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Auto source selection failed; using all allowed sources: {}", e.getMessage());
            return new Selection(allowed, SELECTION_FAILED);
        }
        return parseSelection(raw, allowed);
    }

    Selection parseSelection(String raw, Set<DataSource> allowed) {
        JsonNode data = extractJsonObject(raw);
        Set<DataSource> chosen = EnumSet.noneOf(DataSource.class);
        String rationale = null;

        if (data != null) {
            for (JsonNode source : data.path("sources")) {
                if (chosen.size() >= MAX_AUTO_SOURCES) break;
                if (!source.isTextual()) continue;
                DataSource.fromKey(source.asText())
                        .filter(allowed::contains)
                        .ifPresent(chosen::add);
            }
            if (data.path("rationale").isTextual()) rationale = data.get("rationale").asText();
        }

        if (chosen.isEmpty()) {
            log.warn("Auto source selection returned no valid sources. Raw: {}", raw);
            return new Selection(allowed, NO_VALID_SELECTION);
        }
        log.info("Auto-selected sources {} [rationale={}]", chosen, rationale);
        return new Selection(chosen, rationale);
    }

    /** The whole text first, then the outermost {...} span anywhere in it. */
    JsonNode extractJsonObject(String text) {
        if (text == null || text.isBlank()) return null;
        String trimmed = text.trim();
        JsonNode parsed = readObject(trimmed);
        if (parsed != null) return parsed;

        int open = trimmed.indexOf('{');
        int close = trimmed.lastIndexOf('}');
        if (open < 0 || close <= open) return null;
        return readObject(trimmed.substring(open, close + 1));
    }

    private JsonNode readObject(String candidate) {
        try {
            JsonNode node = objectMapper.readTree(candidate);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    static String selectorPrompt(String message, Set<DataSource> allowed) {
        String options = allowed.stream()
                .sorted((a, b) -> a.key().compareTo(b.key()))
                .map(s -> "- " + s.key() + ": " + s.displayName() + " - " + GUIDANCE.get(s))
                .collect(Collectors.joining("\n"));
        String guidance = Arrays.stream(DataSource.values())
                .map(s -> "- " + s.key() + ": " + GUIDANCE.get(s))
                .collect(Collectors.joining("\n"));
        return "User query: " + message
                + "\n\nAllowed sources:\n" + options
                + "\n\nRouting guidance:\n" + guidance;
    }
}

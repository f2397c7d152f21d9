package com.deepansh.policyradar.core;

import com.deepansh.policyradar.config.RadarProperties;
import com.deepansh.policyradar.exception.ApiException;
import com.deepansh.policyradar.exception.ChatCancelledException;
import com.deepansh.policyradar.exception.RequestValidationException;
import com.deepansh.policyradar.llm.ConversationBackend;
import com.deepansh.policyradar.llm.ModelCallGuard;
import com.deepansh.policyradar.model.ChatMode;
import com.deepansh.policyradar.model.DataSource;
import com.deepansh.policyradar.model.SourceSelection;
import com.deepansh.policyradar.provider.SourceAvailability;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.EnumSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SourceRouterTest {

    @Mock ConversationBackend backend;

    private RadarProperties properties;
    private SourceRouter router;

    @BeforeEach
    void setUp() {
        properties = new RadarProperties();
        properties.getProviders().setGovApiKey("key");
        properties.getProviders().setSearchgovAffiliate("affiliate");
        properties.getProviders().setSearchgovAccessKey("access");
        router = new SourceRouter(new SourceAvailability(properties), new ModelCallGuard(), new ObjectMapper());
    }

    // ── resolve ──────────────────────────────────────────────────────────────

    @Test
    void resolve_noSelection_followsMode() {
        assertThat(router.resolve(ChatMode.REGULATIONS, null))
                .isEqualTo(new SourceRouter.Resolution(false, EnumSet.of(DataSource.REGULATIONS)));
        assertThat(router.resolve(ChatMode.GOVINFO, null))
                .isEqualTo(new SourceRouter.Resolution(false, EnumSet.of(DataSource.GOVINFO)));
        assertThat(router.resolve(ChatMode.BOTH, null))
                .isEqualTo(new SourceRouter.Resolution(true, EnumSet.allOf(DataSource.class)));
    }

    @Test
    void resolve_explicitSelection_isNarrowedBySingleSourceMode() {
        SourceSelection selection = SourceSelection.builder().regulations(true).congress(true).build();

        assertThat(router.resolve(ChatMode.BOTH, selection).allowed())
                .containsExactlyInAnyOrder(DataSource.REGULATIONS, DataSource.CONGRESS);
        assertThat(router.resolve(ChatMode.REGULATIONS, selection).allowed())
                .containsExactly(DataSource.REGULATIONS);
    }

    @Test
    void resolve_autoWithoutFlags_allowsEverySource() {
        SourceRouter.Resolution resolution = router.resolve(ChatMode.BOTH, SourceSelection.builder().auto(true).build());

        assertThat(resolution.auto()).isTrue();
        assertThat(resolution.allowed()).containsExactlyInAnyOrder(DataSource.values());
    }

    @Test
    void resolve_nothingFlagged_throwsValidationError() {
        assertThatThrownBy(() -> router.resolve(ChatMode.BOTH, SourceSelection.builder().build()))
                .isInstanceOf(RequestValidationException.class)
                .hasMessage("No sources enabled/available for this request.");
    }

    @Test
    void resolve_modeExcludesEveryFlaggedSource_throwsValidationError() {
        SourceSelection selection = SourceSelection.builder().doj(true).build();

        assertThatThrownBy(() -> router.resolve(ChatMode.GOVINFO, selection))
                .isInstanceOf(RequestValidationException.class);
    }

    @Test
    void resolve_missingApiKey_dropsKeyedSources() {
        properties.getProviders().setGovApiKey("");
        SourceSelection selection = SourceSelection.builder().regulations(true).doj(true).build();

        assertThat(router.resolve(ChatMode.BOTH, selection).allowed()).containsExactly(DataSource.DOJ);
    }

    // ── select ───────────────────────────────────────────────────────────────

    @Test
    void select_singleAllowedSource_skipsModelCall() {
        SourceRouter.Selection selection = router.select("q", EnumSet.of(DataSource.DOJ), backend);

        assertThat(selection.sources()).containsExactly(DataSource.DOJ);
        assertThat(selection.rationale()).isEqualTo(SourceRouter.ONLY_ONE);
        verify(backend, never()).complete(anyString(), anyString());
    }

    @Test
    void select_validJson_keepsOnlyAllowedKnownSources() {
        Set<DataSource> allowed = EnumSet.of(DataSource.REGULATIONS, DataSource.CONGRESS, DataSource.DOJ);
        when(backend.complete(anyString(), anyString()))
                .thenReturn("{\"sources\":[\"congress\",\"govinfo\",\"nonsense\",7],\"rationale\":\"bills\"}");

        SourceRouter.Selection selection = router.select("recent bills", allowed, backend);

        assertThat(selection.sources()).containsExactly(DataSource.CONGRESS);
        assertThat(selection.rationale()).isEqualTo("bills");
    }

    @Test
    void select_jsonWrappedInProse_isStillParsed() {
        Set<DataSource> allowed = EnumSet.of(DataSource.REGULATIONS, DataSource.USASPENDING);
        when(backend.complete(anyString(), anyString()))
                .thenReturn("Sure! Here you go:\n```json\n{\"sources\":[\"usaspending\"],\"rationale\":\"awards\"}\n```");

        SourceRouter.Selection selection = router.select("contracts", allowed, backend);

        assertThat(selection.sources()).containsExactly(DataSource.USASPENDING);
    }

    @Test
    void select_unparsableAnswer_fallsBackToAllAllowed() {
        Set<DataSource> allowed = EnumSet.of(DataSource.REGULATIONS, DataSource.DOJ);
        when(backend.complete(anyString(), anyString())).thenReturn("regulations, I think");

        SourceRouter.Selection selection = router.select("q", allowed, backend);

        assertThat(selection.sources()).isEqualTo(allowed);
        assertThat(selection.rationale()).isEqualTo(SourceRouter.NO_VALID_SELECTION);
    }

    @Test
    void select_moreThanSixChosen_keepsFirstSix() {
        Set<DataSource> allowed = EnumSet.allOf(DataSource.class);
        when(backend.complete(anyString(), anyString())).thenReturn(
                "{\"sources\":[\"regulations\",\"govinfo\",\"congress\",\"federal_register\","
                        + "\"usaspending\",\"fiscal_data\",\"datagov\",\"doj\"]}");

        SourceRouter.Selection selection = router.select("everything", allowed, backend);

        assertThat(selection.sources()).hasSize(SourceRouter.MAX_AUTO_SOURCES)
                .doesNotContain(DataSource.DATAGOV, DataSource.DOJ);
        assertThat(selection.rationale()).isNull();
    }

    @Test
    void select_modelCallFails_fallsBackToAllAllowed() {
        Set<DataSource> allowed = EnumSet.of(DataSource.REGULATIONS, DataSource.DOJ);
        when(backend.complete(anyString(), anyString())).thenThrow(new ApiException("bad gateway", 502));

        SourceRouter.Selection selection = router.select("q", allowed, backend);

        assertThat(selection.sources()).isEqualTo(allowed);
        assertThat(selection.rationale()).isEqualTo(SourceRouter.SELECTION_FAILED);
    }

    @Test
    void select_cancelledDuringCall_propagates() {
        Set<DataSource> allowed = EnumSet.of(DataSource.REGULATIONS, DataSource.DOJ);
        when(backend.complete(anyString(), anyString())).thenThrow(new ChatCancelledException("req-1"));

        assertThatThrownBy(() -> router.select("q", allowed, backend))
                .isInstanceOf(ChatCancelledException.class);
    }

    @Test
    void selectorPrompt_listsAllowedSourcesSortedByKey() {
        String prompt = SourceRouter.selectorPrompt("water rules", EnumSet.of(DataSource.REGULATIONS, DataSource.DOJ));

        assertThat(prompt).startsWith("User query: water rules");
        assertThat(prompt.indexOf("- doj: ")).isLessThan(prompt.indexOf("- regulations: "));
        assertThat(prompt).contains("Routing guidance:");
    }
}

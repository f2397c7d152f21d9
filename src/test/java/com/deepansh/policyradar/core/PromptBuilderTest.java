package com.deepansh.policyradar.core;

import com.deepansh.policyradar.model.DataSource;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class PromptBuilderTest {

    @Test
    void userPrompt_listsDisplayNamesAlphabeticallyWithWindow() {
        String prompt = PromptBuilder.userPrompt("budget news", 14,
                EnumSet.of(DataSource.USASPENDING, DataSource.CONGRESS), null);

        assertThat(prompt).startsWith("User query: budget news");
        assertThat(prompt).contains("- Time window: Last 14 days");
        assertThat(prompt).contains("- Sources: " + DataSource.CONGRESS.displayName()
                + ", " + DataSource.USASPENDING.displayName());
        assertThat(prompt).doesNotContain("Auto selection");
    }

    @Test
    void userPrompt_withRationale_addsAutoSelectionLine() {
        String prompt = PromptBuilder.userPrompt("q", 30, EnumSet.of(DataSource.DOJ), "enforcement news");

        assertThat(prompt).contains("- Auto selection: enforcement news");
    }

    @Test
    void userPrompt_noSources_saysAuto() {
        assertThat(PromptBuilder.userPrompt("q", 30, Set.of(), null)).contains("- Sources: Auto");
    }
}

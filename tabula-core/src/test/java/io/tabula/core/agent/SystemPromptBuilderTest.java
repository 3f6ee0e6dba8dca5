package io.tabula.core.agent;

import static org.assertj.core.api.Assertions.assertThat;

import io.tabula.core.dataset.DatasetSnapshot;
import io.tabula.core.dataset.Table;
import java.util.List;
import org.junit.jupiter.api.Test;

class SystemPromptBuilderTest {
    private final DatasetSnapshot snapshot = new DatasetSnapshot(0, Table.of(
        List.of("city", "population"),
        List.of(List.of("Lisbon", 545_000L), List.of("Porto", 232_000L))
    ));

    @Test
    void shouldEmbedDatasetSummaryInFollowUpPrompt() {
        String prompt = new SystemPromptBuilder("cities").build(snapshot, false);

        assertThat(prompt)
            .startsWith("You are a data analyst assistant.")
            .contains("Table: `cities`", "Rows: 2", "  - population: INTEGER", "[Lisbon, 545000]")
            .contains("query runs read-only SQL against table `cities`")
            .doesNotContain("Dataset version");
    }

    @Test
    void shouldAskForOverviewInInitialMode() {
        String prompt = new SystemPromptBuilder(null).build(new DatasetSnapshot(2, snapshot.table()), true);

        assertThat(prompt)
            .contains("give a concise initial analysis")
            .contains("Only SELECT queries against table `data`")
            .contains("Dataset version: 2 (modified during this session)");
    }
}

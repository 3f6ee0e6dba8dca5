package io.tabula.core.sandbox;

import static org.assertj.core.api.Assertions.assertThat;

import io.tabula.core.dataset.DatasetSnapshot;
import io.tabula.core.dataset.Table;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SqlQuerySandboxTest {
    private SqlQuerySandbox sandbox;
    private DatasetSnapshot snapshot;

    @BeforeEach
    void setUp() {
        sandbox = new SqlQuerySandbox(new SandboxSettings("data", 50, 4000, 100_000, Duration.ofSeconds(2), 2));
        snapshot = new DatasetSnapshot(0, Table.of(
            List.of("product", "price", "qty"),
            List.of(
                List.of("apple", 80.0, 3),
                List.of("pear", 95.4, 1),
                List.of("plum", 60.0, 7)
            )
        ));
    }

    @AfterEach
    void tearDown() {
        sandbox.close();
    }

    @Test
    void shouldReturnAllRowsForSelectStar() {
        ExecutionResult result = sandbox.execute("SELECT * FROM data", snapshot);

        assertThat(result.success()).isTrue();
        assertThat(result.kind()).isEqualTo(ResultKind.TABLE);
        assertThat(result.rowCount()).isEqualTo(3);
        assertThat(result.table()).get().extracting(Table::columnNames).isEqualTo(List.of("product", "price", "qty"));
        assertThat(result.preview()).startsWith("product | price | qty").contains("pear | 95.4 | 1");
    }

    @Test
    void shouldRejectDropWithoutTouchingData() {
        ExecutionResult result = sandbox.execute("DROP TABLE data", snapshot);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("DROP");
        assertThat(sandbox.execute("SELECT COUNT(*) AS n FROM data", snapshot).value()).isEqualTo(3L);
    }

    @Test
    void shouldRenderScalarInPlainNotation() {
        ExecutionResult result = sandbox.execute(
            "SELECT ROUND(AVG(price), 1) AS avg_price FROM data WHERE product IN ('apple', 'pear')",
            snapshot
        );

        assertThat(result.kind()).isEqualTo(ResultKind.SCALAR);
        assertThat(result.value()).isEqualTo(87.7);
        assertThat(result.preview()).isEqualTo("avg_price: 87.7");
    }

    @Test
    void shouldClassifyAddedColumnAsTransform() {
        ExecutionResult result = sandbox.execute("SELECT *, price * qty AS revenue FROM data", snapshot);

        assertThat(result.kind()).isEqualTo(ResultKind.TABLE_TRANSFORM);
        assertThat(result.table()).get().extracting(Table::columnCount).isEqualTo(4);
    }

    @Test
    void shouldKeepAggregatesAsViews() {
        ExecutionResult result = sandbox.execute("SELECT product, SUM(qty) AS total FROM data GROUP BY product", snapshot);

        assertThat(result.kind()).isEqualTo(ResultKind.TABLE);
        assertThat(result.rowCount()).isEqualTo(3);
    }

    @Test
    void shouldReportFullRowCountWhenResultExceedsCap() {
        try (SqlQuerySandbox capped = new SqlQuerySandbox(new SandboxSettings("data", 5, 4000, 10, Duration.ofSeconds(2), 1))) {
            ExecutionResult result = capped.execute("SELECT * FROM data", fifteenRows());

            assertThat(result.success()).isTrue();
            assertThat(result.kind()).isEqualTo(ResultKind.TABLE);
            assertThat(result.rowCount()).isEqualTo(15);
            assertThat(result.truncated()).isTrue();
            assertThat(result.table()).get().extracting(Table::rowCount).isEqualTo(10);
            assertThat(result.preview()).endsWith("(result capped at 10 of 15 rows)");
        }
    }

    @Test
    void shouldNotTreatCappedResultAsTransform() {
        try (SqlQuerySandbox capped = new SqlQuerySandbox(new SandboxSettings("data", 5, 4000, 10, Duration.ofSeconds(2), 1))) {
            ExecutionResult result = capped.execute("SELECT *, n * 2 AS doubled FROM data", fifteenRows());

            assertThat(result.kind()).isEqualTo(ResultKind.TABLE);
            assertThat(result.rowCount()).isEqualTo(15);
            assertThat(result.truncated()).isTrue();
        }
    }

    @Test
    void shouldNotMarkResultAtExactlyCapAsTruncated() {
        try (SqlQuerySandbox capped = new SqlQuerySandbox(new SandboxSettings("data", 5, 4000, 15, Duration.ofSeconds(2), 1))) {
            ExecutionResult result = capped.execute("SELECT *, n * 2 AS doubled FROM data", fifteenRows());

            assertThat(result.kind()).isEqualTo(ResultKind.TABLE_TRANSFORM);
            assertThat(result.rowCount()).isEqualTo(15);
            assertThat(result.truncated()).isFalse();
        }
    }

    @Test
    void shouldReportEngineErrors() {
        ExecutionResult result = sandbox.execute("SELECT missing_column FROM data", snapshot);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("missing_column");
    }

    @Test
    void shouldReturnNoneKindForEmptyProjection() {
        ExecutionResult result = sandbox.execute("SELECT product FROM data WHERE qty > 100", snapshot);

        assertThat(result.success()).isTrue();
        assertThat(result.rowCount()).isZero();
    }

    @Test
    void shouldTimeOutRunawayQueries() {
        ExecutionResult result = sandbox.execute(
            "WITH RECURSIVE c(x) AS (SELECT 1 UNION ALL SELECT x + 1 FROM c) SELECT COUNT(*) FROM c",
            snapshot
        );

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Query timed out after 2s");
    }

    private static DatasetSnapshot fifteenRows() {
        List<List<Object>> rows = new ArrayList<>();
        for (int i = 1; i <= 15; i++) {
            rows.add(List.of(i));
        }
        return new DatasetSnapshot(0, Table.of(List.of("n"), rows));
    }
}

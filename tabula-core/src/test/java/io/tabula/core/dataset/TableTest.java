package io.tabula.core.dataset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class TableTest {

    @Test
    void shouldInferAndWidenColumnTypes() {
        Table table = Table.of(
            List.of("id", "price", "label", "empty"),
            List.of(
                Arrays.asList(1, 2, "x", null),
                Arrays.asList(2, 2.5, 7, null)
            )
        );

        assertThat(table.columns()).extracting(ColumnSchema::type)
            .containsExactly(ColumnType.INTEGER, ColumnType.REAL, ColumnType.TEXT, ColumnType.NULL);
        assertThat(table.rows().get(0).get(0)).isEqualTo(1L);
    }

    @Test
    void shouldPadMissingCellsWithNull() {
        Table table = Table.of(List.of("a", "b"), List.of(List.of(1)));

        assertThat(table.rows().get(0)).containsExactly(1L, null);
        assertThat(table.nonNullCells()).isEqualTo(1);
        assertThat(table.allNull()).isFalse();
    }

    @Test
    void shouldRejectRaggedRowsInCanonicalConstructor() {
        List<ColumnSchema> columns = List.of(new ColumnSchema("a", ColumnType.INTEGER));

        assertThatThrownBy(() -> new Table(columns, List.<List<Object>>of(List.of(1L, 2L))))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldTakeHead() {
        Table table = Table.of(List.of("n"), List.of(List.of(1), List.of(2), List.of(3)));

        assertThat(table.head(2).rowCount()).isEqualTo(2);
        assertThat(table.head(10)).isSameAs(table);
    }
}

package io.tabula.core.dataset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class DatasetHandleTest {
    private final Table original = Table.of(List.of("a"), List.of(List.of(1), List.of(2)));
    private final Table doubled = Table.of(List.of("a", "b"), List.of(List.of(1, 2), List.of(2, 4)));

    @Test
    void shouldAppendVersionsOnCommit() {
        DatasetHandle handle = new DatasetHandle(original);

        DatasetSnapshot next = handle.commit(handle.current(), doubled);

        assertThat(next.version()).isEqualTo(1);
        assertThat(handle.current()).isSameAs(next);
        assertThat(handle.version(0)).get().extracting(DatasetSnapshot::table).isEqualTo(original);
        assertThat(handle.version(5)).isEmpty();
        assertThat(handle.versionCount()).isEqualTo(2);
    }

    @Test
    void shouldRejectCommitFromStaleBase() {
        DatasetHandle handle = new DatasetHandle(original);
        DatasetSnapshot base = handle.current();
        handle.commit(base, doubled);

        assertThatThrownBy(() -> handle.commit(base, original))
            .isInstanceOfSatisfying(DatasetConflictException.class, e -> {
                assertThat(e.expectedVersion()).isZero();
                assertThat(e.actualVersion()).isEqualTo(1);
            });
        assertThat(handle.current().table()).isEqualTo(doubled);
    }

    @Test
    void shouldResetToOriginalAsNewVersion() {
        DatasetHandle handle = new DatasetHandle(original);
        handle.commit(handle.current(), doubled);

        DatasetSnapshot reset = handle.reset();

        assertThat(reset.version()).isEqualTo(2);
        assertThat(reset.table()).isEqualTo(original);
        assertThat(handle.original().version()).isZero();
    }
}

package io.tabula.core.dataset;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Versioned, copy-on-write handle over the canonical dataset of a session.
 * Readers always receive a complete immutable snapshot; commits are serialized and
 * append a new version, so earlier versions stay addressable.
 */
public final class DatasetHandle {
    private final List<DatasetSnapshot> versions = new ArrayList<>();

    public DatasetHandle(Table original) {
        versions.add(new DatasetSnapshot(0, Objects.requireNonNull(original, "original must not be null")));
    }

    public synchronized DatasetSnapshot current() {
        return versions.get(versions.size() - 1);
    }

    public synchronized DatasetSnapshot original() {
        return versions.get(0);
    }

    public synchronized Optional<DatasetSnapshot> version(int version) {
        if (version < 0 || version >= versions.size()) {
            return Optional.empty();
        }
        return Optional.of(versions.get(version));
    }

    /**
     * Publishes {@code table} as the next version, provided nobody committed since {@code base} was read.
     *
     * @throws DatasetConflictException when {@code base} is no longer the current version
     */
    public synchronized DatasetSnapshot commit(DatasetSnapshot base, Table table) {
        Objects.requireNonNull(base, "base must not be null");
        Objects.requireNonNull(table, "table must not be null");
        DatasetSnapshot current = current();
        if (base.version() != current.version()) {
            throw new DatasetConflictException(base.version(), current.version());
        }
        DatasetSnapshot next = new DatasetSnapshot(current.version() + 1, table);
        versions.add(next);
        return next;
    }

    /**
     * Restores the originally loaded content as a new version.
     */
    public synchronized DatasetSnapshot reset() {
        DatasetSnapshot next = new DatasetSnapshot(current().version() + 1, original().table());
        versions.add(next);
        return next;
    }

    public synchronized int versionCount() {
        return versions.size();
    }
}

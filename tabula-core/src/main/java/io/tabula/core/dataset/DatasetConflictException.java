package io.tabula.core.dataset;

public final class DatasetConflictException extends RuntimeException {
    private final int expectedVersion;
    private final int actualVersion;

    public DatasetConflictException(int expectedVersion, int actualVersion) {
        super("Dataset changed from version " + expectedVersion + " to " + actualVersion + " before this result was committed");
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public int expectedVersion() {
        return expectedVersion;
    }

    public int actualVersion() {
        return actualVersion;
    }
}

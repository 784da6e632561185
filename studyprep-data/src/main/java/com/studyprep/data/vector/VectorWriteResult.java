package com.studyprep.data.vector;

/**
 * Outcome of a vector write. A skipped write is a soft condition, not an error.
 */
public final class VectorWriteResult {

    public enum Status {
        STORED,
        CLEARED,
        SKIPPED
    }

    public enum SkipReason {
        CAPABILITY_UNAVAILABLE,
        ROW_NOT_FOUND
    }

    private static final VectorWriteResult STORED = new VectorWriteResult(Status.STORED, null);
    private static final VectorWriteResult CLEARED = new VectorWriteResult(Status.CLEARED, null);

    private final Status status;
    private final SkipReason skipReason;

    private VectorWriteResult(Status status, SkipReason skipReason) {
        this.status = status;
        this.skipReason = skipReason;
    }

    public static VectorWriteResult stored() {
        return STORED;
    }

    public static VectorWriteResult cleared() {
        return CLEARED;
    }

    public static VectorWriteResult skipped(SkipReason reason) {
        return new VectorWriteResult(Status.SKIPPED, reason);
    }

    public Status getStatus() { return status; }
    public SkipReason getSkipReason() { return skipReason; }

    public boolean isStored() {
        return status == Status.STORED;
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }

    @Override
    public String toString() {
        return skipReason == null ? status.name() : status.name() + "(" + skipReason.name() + ")";
    }
}

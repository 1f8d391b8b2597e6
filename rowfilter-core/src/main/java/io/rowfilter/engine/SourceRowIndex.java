package io.rowfilter.engine;

import io.rowfilter.kernel.RowIndex;

/**
 * Content of the "source" slot of an {@link EvaluationContext}.
 * <p>
 * Besides a concrete index the slot distinguishes two states: {@link Kind#ABSENT}, which
 * means every row of the source frame is selected, and {@link Kind#DEFERRED}, which means the
 * index exists but is only produced when the final index is computed (compiled filters and
 * sorted selections).
 */
public record SourceRowIndex(Kind kind, RowIndex rowIndex) {
    private static final SourceRowIndex ABSENT = new SourceRowIndex(Kind.ABSENT, null);
    private static final SourceRowIndex DEFERRED = new SourceRowIndex(Kind.DEFERRED, null);

    public enum Kind {
        ABSENT,
        KNOWN,
        DEFERRED
    }

    public SourceRowIndex {
        if (kind == null) {
            throw new IllegalArgumentException("kind required");
        }
        if ((kind == Kind.KNOWN) != (rowIndex != null)) {
            throw new IllegalArgumentException("rowIndex must be present exactly when kind is KNOWN");
        }
    }

    public static SourceRowIndex absent() {
        return ABSENT;
    }

    public static SourceRowIndex deferred() {
        return DEFERRED;
    }

    public static SourceRowIndex of(RowIndex rowIndex) {
        if (rowIndex == null) {
            return ABSENT;
        }
        return new SourceRowIndex(Kind.KNOWN, rowIndex);
    }

    public boolean isAbsent() {
        return kind == Kind.ABSENT;
    }

    public boolean isDeferred() {
        return kind == Kind.DEFERRED;
    }
}

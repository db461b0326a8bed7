package org.mitoseeker.pipeline;

import org.mitoseeker.utils.Utils;

import java.util.Objects;

/**
 * A variant record left out of an {@link AnnotatedResult} because it could not be interpreted.
 */
public final class SkippedRecord {

    private final String record;
    private final String reason;

    public SkippedRecord(final String record, final String reason) {
        this.record = Utils.nonNull(record, "record");
        this.reason = Utils.nonNull(reason, "reason");
    }

    /**
     * @return genomic key of the skipped call, or its {@code CHROM:POS} as written when the record could not be parsed.
     */
    public String getRecord() {
        return record;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final SkippedRecord that = (SkippedRecord) o;
        return record.equals(that.record) && reason.equals(that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(record, reason);
    }

    @Override
    public String toString() {
        return record + ": " + reason;
    }
}

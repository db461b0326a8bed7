package org.mitoseeker.pipeline;

import org.mitoseeker.utils.Utils;

import java.util.Objects;

/**
 * A variant set that could not be processed at all.  Its siblings are unaffected.
 */
public final class SetFailure {

    private final int index;
    private final String sampleName;
    private final String reason;

    /**
     * @param index position of the failed set in the run's input.
     * @param sampleName sample name of the failed set.
     * @param reason why it failed.
     */
    public SetFailure(final int index, final String sampleName, final String reason) {
        Utils.validateArg(index >= 0, "index must be >= 0");
        this.index = index;
        this.sampleName = Utils.nonNull(sampleName, "sampleName");
        this.reason = Utils.nonNull(reason, "reason");
    }

    public int getIndex() {
        return index;
    }

    public String getSampleName() {
        return sampleName;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final SetFailure that = (SetFailure) o;
        return index == that.index && sampleName.equals(that.sampleName) && reason.equals(that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, sampleName, reason);
    }

    @Override
    public String toString() {
        return "set " + index + " (" + sampleName + "): " + reason;
    }
}

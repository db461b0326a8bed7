package org.mitoseeker.variant;

import org.mitoseeker.exceptions.UserException;
import org.mitoseeker.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * The ordered variant calls of one sample.  This is the unit of work handed to worker threads.
 * <p>
 * Records of the sample that could not be parsed into calls travel with the set, so that they are reported with
 * its result.  They take no part in equality.
 * </p>
 */
public final class VariantSet implements Iterable<VariantCall> {

    private final String sampleName;
    private final List<VariantCall> calls;
    private final List<UserException.MalformedVariant> malformedRecords;

    public VariantSet(final String sampleName, final List<VariantCall> calls) {
        this(sampleName, calls, Collections.emptyList());
    }

    /**
     * @param malformedRecords records of the sample that could not be parsed, in input order.
     */
    public VariantSet(final String sampleName, final List<VariantCall> calls, final List<UserException.MalformedVariant> malformedRecords) {
        this.sampleName = Utils.nonNull(sampleName, "sampleName");
        Utils.containsNoNull(calls, "calls must not contain null");
        Utils.containsNoNull(malformedRecords, "malformedRecords must not contain null");
        this.calls = Collections.unmodifiableList(new ArrayList<>(calls));
        this.malformedRecords = Collections.unmodifiableList(new ArrayList<>(malformedRecords));
    }

    public String getSampleName() {
        return sampleName;
    }

    public List<VariantCall> getCalls() {
        return calls;
    }

    public List<UserException.MalformedVariant> getMalformedRecords() {
        return malformedRecords;
    }

    public int size() {
        return calls.size();
    }

    public boolean isEmpty() {
        return calls.isEmpty();
    }

    @Override
    public Iterator<VariantCall> iterator() {
        return calls.iterator();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final VariantSet that = (VariantSet) o;
        return sampleName.equals(that.sampleName) && calls.equals(that.calls);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sampleName, calls);
    }

    @Override
    public String toString() {
        return "VariantSet{" + sampleName + ", " + calls.size() + " calls}";
    }
}

package org.mitoseeker.pipeline;

import org.mitoseeker.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Output of a {@link PipelineOrchestrator} run: the results of every set that completed, in input order, and the
 * sets that failed, by input index.
 */
public final class PipelineResult {

    private final List<AnnotatedResult> results;
    private final List<SetFailure> failures;

    public PipelineResult(final List<AnnotatedResult> results, final List<SetFailure> failures) {
        this.results = Collections.unmodifiableList(new ArrayList<>(Utils.nonNull(results, "results")));
        this.failures = Collections.unmodifiableList(new ArrayList<>(Utils.nonNull(failures, "failures")));
    }

    public List<AnnotatedResult> getResults() {
        return results;
    }

    public List<SetFailure> getFailures() {
        return failures;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * @return total number of records skipped across all completed sets.
     */
    public int getSkippedRecordCount() {
        return results.stream().mapToInt(r -> r.getSkippedRecords().size()).sum();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final PipelineResult that = (PipelineResult) o;
        return results.equals(that.results) && failures.equals(that.failures);
    }

    @Override
    public int hashCode() {
        return Objects.hash(results, failures);
    }

    @Override
    public String toString() {
        return "PipelineResult{" + results.size() + " results, " + failures.size() + " failures}";
    }
}

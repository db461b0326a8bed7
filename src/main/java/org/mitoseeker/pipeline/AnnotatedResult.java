package org.mitoseeker.pipeline;

import org.mitoseeker.annotation.RegionClass;
import org.mitoseeker.coding.ConsequenceAnnotation;
import org.mitoseeker.enrichment.ImpactEnricher;
import org.mitoseeker.enrichment.ImpactRecord;
import org.mitoseeker.utils.Utils;
import org.mitoseeker.variant.AnnotatedVariant;
import org.mitoseeker.variant.VariantCall;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Everything the pipeline produced for one variant set.
 * <p>
 * {@code annotatedVariants} follows the input call order, minus filtered and skipped calls.  {@code consequences}
 * follows the same order, with the codons of each variant in ascending order.
 * </p>
 */
public final class AnnotatedResult {

    private final int index;
    private final String sampleName;
    private final List<AnnotatedVariant> annotatedVariants;
    private final List<ConsequenceAnnotation> consequences;
    private final List<SkippedRecord> skippedRecords;
    private final int filteredCount;
    private final ImpactEnricher.Enrichment enrichment;

    public AnnotatedResult(final int index,
                           final String sampleName,
                           final List<AnnotatedVariant> annotatedVariants,
                           final List<ConsequenceAnnotation> consequences,
                           final List<SkippedRecord> skippedRecords,
                           final int filteredCount,
                           final ImpactEnricher.Enrichment enrichment) {
        this.index = index;
        this.sampleName = Utils.nonNull(sampleName, "sampleName");
        this.annotatedVariants = Collections.unmodifiableList(new ArrayList<>(Utils.nonNull(annotatedVariants, "annotatedVariants")));
        this.consequences = Collections.unmodifiableList(new ArrayList<>(Utils.nonNull(consequences, "consequences")));
        this.skippedRecords = Collections.unmodifiableList(new ArrayList<>(Utils.nonNull(skippedRecords, "skippedRecords")));
        this.filteredCount = filteredCount;
        this.enrichment = Utils.nonNull(enrichment, "enrichment");
    }

    /**
     * @return position of the originating set in the run's input.
     */
    public int getIndex() {
        return index;
    }

    public String getSampleName() {
        return sampleName;
    }

    public List<AnnotatedVariant> getAnnotatedVariants() {
        return annotatedVariants;
    }

    public List<ConsequenceAnnotation> getConsequences() {
        return consequences;
    }

    public List<SkippedRecord> getSkippedRecords() {
        return skippedRecords;
    }

    /**
     * @return number of calls dropped by the quality filter.
     */
    public int getFilteredCount() {
        return filteredCount;
    }

    public Map<String, List<ImpactRecord>> getImpacts() {
        return enrichment.getImpacts();
    }

    /**
     * @return genomic keys of coding variants for which the impact source could not be consulted.
     */
    public List<String> getEnrichmentFailures() {
        return enrichment.getUnavailableKeys();
    }

    /**
     * @return the variants located in a coding region.
     */
    public List<AnnotatedVariant> getCodingVariants() {
        return annotatedVariants.stream().filter(AnnotatedVariant::isCoding).collect(Collectors.toList());
    }

    /**
     * @return the calls of the located variants, in input order.
     */
    public List<VariantCall> getCalls() {
        return annotatedVariants.stream().map(AnnotatedVariant::getCall).collect(Collectors.toList());
    }

    /**
     * @return the single-nucleotide (equal-length) calls.
     */
    public List<VariantCall> getSnvCalls() {
        return annotatedVariants.stream().map(AnnotatedVariant::getCall).filter(VariantCall::isSnv).collect(Collectors.toList());
    }

    /**
     * @return number of located variants in each region class.  Variants outside every interval are not counted.
     */
    public Map<RegionClass, Integer> getRegionTally() {
        final Map<RegionClass, Integer> tally = new EnumMap<>(RegionClass.class);
        for ( final AnnotatedVariant variant : annotatedVariants ) {
            if ( variant.getRegion() != null ) {
                tally.merge(variant.getRegion(), 1, Integer::sum);
            }
        }
        return tally;
    }

    /**
     * @return the consequences of the variant with the given genomic key.
     */
    public List<ConsequenceAnnotation> getConsequences(final String variantKey) {
        return consequences.stream().filter(c -> c.getVariantKey().equals(variantKey)).collect(Collectors.toList());
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final AnnotatedResult that = (AnnotatedResult) o;
        return index == that.index &&
                filteredCount == that.filteredCount &&
                sampleName.equals(that.sampleName) &&
                annotatedVariants.equals(that.annotatedVariants) &&
                consequences.equals(that.consequences) &&
                skippedRecords.equals(that.skippedRecords) &&
                enrichment.equals(that.enrichment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, sampleName, annotatedVariants, consequences, skippedRecords, filteredCount, enrichment);
    }

    @Override
    public String toString() {
        return "AnnotatedResult{" + sampleName + ": " + annotatedVariants.size() + " variants, " +
                consequences.size() + " consequences, " + skippedRecords.size() + " skipped}";
    }
}

package org.mitoseeker.variant;

import org.mitoseeker.annotation.GenomicInterval;
import org.mitoseeker.annotation.RegionClass;
import org.mitoseeker.coding.AminoAcid;
import org.mitoseeker.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A {@link VariantCall} together with its genic context.
 * <p>
 * {@code gene} and {@code region} come from the primary annotation hit; {@code overlapGenes} lists every hit.
 * Local coordinates are 0-based offsets from the start of {@code localInterval}, the coding interval used for
 * codon numbering, and are all {@code null} when the call overlaps no coding interval.
 * Whenever they are defined, {@code startCodon == localStart / 3} and {@code endCodon == localEnd / 3}.
 * </p>
 */
public final class AnnotatedVariant {

    private final VariantCall call;
    private final String gene;
    private final List<String> overlapGenes;
    private final RegionClass region;
    private final GenomicInterval localInterval;
    private final Integer localStart;
    private final Integer localEnd;
    private final Integer startCodon;
    private final Integer endCodon;

    public AnnotatedVariant(final VariantCall call,
                            final String gene,
                            final List<String> overlapGenes,
                            final RegionClass region,
                            final GenomicInterval localInterval,
                            final Integer localStart,
                            final Integer localEnd) {
        this.call = Utils.nonNull(call, "call");
        Utils.nonNull(overlapGenes, "overlapGenes");
        Utils.validateArg((localInterval == null) == (localStart == null) && (localStart == null) == (localEnd == null),
                "local coordinates and their interval must be either all present or all absent");
        Utils.validateArg(localInterval == null || localInterval.isCoding(), "local coordinates must refer to a coding interval");
        this.gene = gene;
        this.overlapGenes = Collections.unmodifiableList(new ArrayList<>(overlapGenes));
        this.region = region;
        this.localInterval = localInterval;
        this.localStart = localStart;
        this.localEnd = localEnd;
        this.startCodon = localStart == null ? null : Math.floorDiv(localStart, AminoAcid.CODON_LENGTH);
        this.endCodon = localEnd == null ? null : Math.floorDiv(localEnd, AminoAcid.CODON_LENGTH);
    }

    /**
     * @return an annotation of {@code call} recording that no interval overlaps it.
     */
    public static AnnotatedVariant unlocated(final VariantCall call) {
        return new AnnotatedVariant(call, null, Collections.emptyList(), null, null, null, null);
    }

    public VariantCall getCall() {
        return call;
    }

    /**
     * @return the gene of the primary annotation hit, or {@code null} if nothing overlaps this variant.
     */
    public String getGene() {
        return gene;
    }

    /**
     * @return the names of all overlapping intervals, primary hit first.
     */
    public List<String> getOverlapGenes() {
        return overlapGenes;
    }

    /**
     * @return the comma-joined overlapping gene names when more than one interval overlaps, otherwise {@code null}.
     */
    public String getOverlapGeneString() {
        return overlapGenes.size() > 1 ? String.join(",", overlapGenes) : null;
    }

    public boolean hasAmbiguousGene() {
        return overlapGenes.size() > 1;
    }

    public RegionClass getRegion() {
        return region;
    }

    public boolean isCoding() {
        return region == RegionClass.CODING;
    }

    public GenomicInterval getLocalInterval() {
        return localInterval;
    }

    public Integer getLocalStart() {
        return localStart;
    }

    public Integer getLocalEnd() {
        return localEnd;
    }

    public Integer getStartCodon() {
        return startCodon;
    }

    public Integer getEndCodon() {
        return endCodon;
    }

    /**
     * @return {@code true} iff gene, region, both local coordinates and both codon indices are all present.
     */
    public boolean isFullyAnnotated() {
        return gene != null && region != null && localStart != null && localEnd != null && startCodon != null && endCodon != null;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final AnnotatedVariant that = (AnnotatedVariant) o;
        return call.equals(that.call) &&
                Objects.equals(gene, that.gene) &&
                overlapGenes.equals(that.overlapGenes) &&
                region == that.region &&
                Objects.equals(localInterval, that.localInterval) &&
                Objects.equals(localStart, that.localStart) &&
                Objects.equals(localEnd, that.localEnd);
    }

    @Override
    public int hashCode() {
        return Objects.hash(call, gene, overlapGenes, region, localInterval, localStart, localEnd);
    }

    @Override
    public String toString() {
        return "AnnotatedVariant{" + call.getGenomicKey() +
                ", gene=" + gene +
                (hasAmbiguousGene() ? ", overlapGenes=" + getOverlapGeneString() : "") +
                ", region=" + region +
                ", local=" + localStart + "-" + localEnd +
                ", codons=" + startCodon + "-" + endCodon + "}";
    }
}

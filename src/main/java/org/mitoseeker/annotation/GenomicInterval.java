package org.mitoseeker.annotation;

import htsjdk.samtools.util.Locatable;
import htsjdk.tribble.annotation.Strand;
import org.mitoseeker.utils.Utils;

import java.util.Objects;

/**
 * An annotated span of the mitochondrial genome: a gene (or named region) together with its region class.
 * Coordinates are 1-based and closed.
 */
public final class GenomicInterval implements Locatable {

    private final String contig;
    private final int start;
    private final int end;
    private final Strand strand;
    private final String gene;
    private final RegionClass region;

    public GenomicInterval(final String contig,
                           final int start,
                           final int end,
                           final Strand strand,
                           final String gene,
                           final RegionClass region) {
        this.contig = Utils.nonNull(contig, "contig");
        Utils.validateArg(start > 0 && end >= start, () -> "Invalid interval " + contig + ":" + start + "-" + end + " for " + gene);
        this.start = start;
        this.end = end;
        this.strand = Utils.nonNull(strand, "strand");
        this.gene = Utils.nonEmpty(gene, "gene");
        this.region = Utils.nonNull(region, "region");
    }

    @Override
    public String getContig() {
        return contig;
    }

    @Override
    public int getStart() {
        return start;
    }

    @Override
    public int getEnd() {
        return end;
    }

    public Strand getStrand() {
        return strand;
    }

    public String getGene() {
        return gene;
    }

    public RegionClass getRegion() {
        return region;
    }

    public boolean isCoding() {
        return region == RegionClass.CODING;
    }

    /**
     * @param position 1-based genomic position.
     * @return {@code true} iff {@code position} lies within {@code [start, end]}.
     */
    public boolean containsPosition(final int position) {
        return getStart() <= position && position <= getEnd();
    }

    public int length() {
        return end - start + 1;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final GenomicInterval that = (GenomicInterval) o;
        return start == that.start &&
                end == that.end &&
                contig.equals(that.contig) &&
                strand == that.strand &&
                gene.equals(that.gene) &&
                region == that.region;
    }

    @Override
    public int hashCode() {
        return Objects.hash(contig, start, end, strand, gene, region);
    }

    @Override
    public String toString() {
        return gene + "[" + contig + ":" + start + "-" + end + " " + strand.encodeAsChar() + " " + region + "]";
    }
}

package org.mitoseeker.variant;

import htsjdk.samtools.util.Locatable;
import org.mitoseeker.utils.Utils;

import java.util.Objects;

/**
 * A single variant call as produced by an upstream mitochondrial variant caller.
 * Positions are 1-based; the call spans {@code [pos, pos + refAllele.length() - 1]}.
 * <p>
 * Construction only requires non-null fields so that malformed calls can still be represented and reported;
 * {@link VariantCallValidator} decides whether a call can be annotated.
 * </p>
 */
public final class VariantCall implements Locatable {

    private final String contig;
    private final int pos;
    private final String refAllele;
    private final String altAllele;
    private final int depth;
    private final boolean passFilter;

    public VariantCall(final String contig,
                       final int pos,
                       final String refAllele,
                       final String altAllele,
                       final int depth,
                       final boolean passFilter) {
        this.contig = Utils.nonNull(contig, "contig");
        this.pos = pos;
        this.refAllele = Utils.nonNull(refAllele, "refAllele");
        this.altAllele = Utils.nonNull(altAllele, "altAllele");
        this.depth = depth;
        this.passFilter = passFilter;
    }

    @Override
    public String getContig() {
        return contig;
    }

    @Override
    public int getStart() {
        return pos;
    }

    /**
     * @return the last reference position covered by the reference allele.
     */
    @Override
    public int getEnd() {
        return pos + Math.max(refAllele.length(), 1) - 1;
    }

    public int getPos() {
        return pos;
    }

    public String getRefAllele() {
        return refAllele;
    }

    public String getAltAllele() {
        return altAllele;
    }

    public int getDepth() {
        return depth;
    }

    public boolean isPassFilter() {
        return passFilter;
    }

    public VariantType getType() {
        return VariantType.of(refAllele, altAllele);
    }

    public boolean isSnv() {
        return getType() == VariantType.SNV;
    }

    /**
     * @return {@code start} for single-base calls, otherwise {@code start_end}.
     */
    public String getPositionString() {
        return getStart() == getEnd() ? Integer.toString(getStart()) : getStart() + "_" + getEnd();
    }

    /**
     * @return the lookup key {@code chrom:pos ref>alt} of this call.
     */
    public String getGenomicKey() {
        return contig + ":" + pos + " " + refAllele + ">" + altAllele;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final VariantCall that = (VariantCall) o;
        return pos == that.pos &&
                depth == that.depth &&
                passFilter == that.passFilter &&
                contig.equals(that.contig) &&
                refAllele.equals(that.refAllele) &&
                altAllele.equals(that.altAllele);
    }

    @Override
    public int hashCode() {
        return Objects.hash(contig, pos, refAllele, altAllele, depth, passFilter);
    }

    @Override
    public String toString() {
        return getGenomicKey() + " DP=" + depth + (passFilter ? " PASS" : " FILTERED");
    }
}

package org.mitoseeker.coding;

import org.mitoseeker.utils.Utils;

import java.util.Objects;

/**
 * One codon's worth of a variant: the reference codon at {@code codonIndex} of {@code gene} and what the variant
 * turns it into.
 * <p>
 * {@code refCodon} is always a full triplet.  For substitutions {@code altCodon} is too; for indels the last edit of a
 * variant carries every remaining edited base, so {@code altCodon} may be empty (a deleted codon) or longer or shorter
 * than three bases.  Concatenating the alt codons of a variant's edits reproduces its edited sequence exactly.
 * </p>
 */
public final class DecomposedEdit {

    private final String gene;
    private final int codonIndex;
    private final int codonStart;
    private final String refCodon;
    private final String altCodon;
    private final boolean frameshift;
    private final String variantKey;

    /**
     * @param gene the gene the codon belongs to.
     * @param codonIndex 0-based index of the codon within {@code gene}.
     * @param codonStart 1-based genomic position of the first base of the reference codon.
     * @param refCodon the reference triplet.
     * @param altCodon the edited bases replacing {@code refCodon}.
     * @param frameshift whether the originating variant shifts the reading frame.
     * @param variantKey genomic key of the originating variant.
     */
    public DecomposedEdit(final String gene,
                          final int codonIndex,
                          final int codonStart,
                          final String refCodon,
                          final String altCodon,
                          final boolean frameshift,
                          final String variantKey) {
        this.gene = Utils.nonNull(gene, "gene");
        Utils.validateArg(codonIndex >= 0, "codonIndex must be >= 0");
        this.codonIndex = codonIndex;
        this.codonStart = codonStart;
        this.refCodon = Utils.nonNull(refCodon, "refCodon");
        this.altCodon = Utils.nonNull(altCodon, "altCodon");
        this.frameshift = frameshift;
        this.variantKey = Utils.nonNull(variantKey, "variantKey");
    }

    public String getGene() {
        return gene;
    }

    public int getCodonIndex() {
        return codonIndex;
    }

    public int getCodonStart() {
        return codonStart;
    }

    public String getRefCodon() {
        return refCodon;
    }

    public String getAltCodon() {
        return altCodon;
    }

    public boolean isFrameshift() {
        return frameshift;
    }

    public String getVariantKey() {
        return variantKey;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final DecomposedEdit that = (DecomposedEdit) o;
        return codonIndex == that.codonIndex &&
                codonStart == that.codonStart &&
                frameshift == that.frameshift &&
                gene.equals(that.gene) &&
                refCodon.equals(that.refCodon) &&
                altCodon.equals(that.altCodon) &&
                variantKey.equals(that.variantKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(gene, codonIndex, codonStart, refCodon, altCodon, frameshift, variantKey);
    }

    @Override
    public String toString() {
        return gene + " codon " + codonIndex + ": " + refCodon + ">" + (altCodon.isEmpty() ? "-" : altCodon) + (frameshift ? " (frameshift)" : "");
    }
}

package org.mitoseeker.coding;

import org.mitoseeker.utils.Utils;

import java.util.Objects;

/**
 * The predicted amino acid change for one codon of a gene.
 * <p>
 * {@code refAA} and {@code altAA} are one-letter amino acid strings.  They are usually a single letter, but the alt
 * side of an in-frame indel may translate to zero or several residues.
 * </p>
 */
public final class ConsequenceAnnotation {

    private final String gene;
    private final int codonIndex;
    private final String refAA;
    private final String altAA;
    private final ConsequenceClass consequenceClass;
    private final String variantKey;

    public ConsequenceAnnotation(final String gene,
                                 final int codonIndex,
                                 final String refAA,
                                 final String altAA,
                                 final ConsequenceClass consequenceClass,
                                 final String variantKey) {
        this.gene = Utils.nonNull(gene, "gene");
        this.codonIndex = codonIndex;
        this.refAA = Utils.nonNull(refAA, "refAA");
        this.altAA = Utils.nonNull(altAA, "altAA");
        this.consequenceClass = Utils.nonNull(consequenceClass, "consequenceClass");
        this.variantKey = Utils.nonNull(variantKey, "variantKey");
    }

    public String getGene() {
        return gene;
    }

    public int getCodonIndex() {
        return codonIndex;
    }

    public String getRefAA() {
        return refAA;
    }

    public String getAltAA() {
        return altAA;
    }

    public ConsequenceClass getConsequenceClass() {
        return consequenceClass;
    }

    /**
     * @return genomic key ({@code chrom:pos ref>alt}) of the variant this consequence came from.
     */
    public String getVariantKey() {
        return variantKey;
    }

    /**
     * @return the protein change in the form {@code p.<refAA><codon number><altAA>}, with 1-based codon numbering
     * (e.g. {@code p.L11L}).  Deleted residues render as {@code -}.
     */
    public String getProteinChange() {
        return "p." + refAA + (codonIndex + 1) + (altAA.isEmpty() ? "-" : altAA);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final ConsequenceAnnotation that = (ConsequenceAnnotation) o;
        return codonIndex == that.codonIndex &&
                gene.equals(that.gene) &&
                refAA.equals(that.refAA) &&
                altAA.equals(that.altAA) &&
                consequenceClass == that.consequenceClass &&
                variantKey.equals(that.variantKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(gene, codonIndex, refAA, altAA, consequenceClass, variantKey);
    }

    @Override
    public String toString() {
        return gene + ":" + getProteinChange() + " " + consequenceClass;
    }
}

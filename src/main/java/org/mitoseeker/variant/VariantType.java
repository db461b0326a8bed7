package org.mitoseeker.variant;

/**
 * Coarse variant type: equal-length alleles are single (or multi) nucleotide substitutions, anything else is an indel.
 */
public enum VariantType {
    SNV,
    INDEL;

    public static VariantType of(final String refAllele, final String altAllele) {
        return refAllele.length() == altAllele.length() ? SNV : INDEL;
    }
}

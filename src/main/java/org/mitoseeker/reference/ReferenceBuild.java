package org.mitoseeker.reference;

/**
 * The mitochondrial reference assemblies that can be told apart from their sequence alone.
 */
public enum ReferenceBuild {
    /** Revised Cambridge Reference Sequence. */
    RCRS,
    /** Reconstructed Sapiens Reference Sequence. */
    RSRS,
    OTHER;

    /** Length of both the rCRS and the RSRS. */
    public static final int MITOCHONDRIAL_GENOME_LENGTH = 16569;

    /**
     * rCRS and RSRS have the same length; they differ at positions 523-524, which are {@code AC} in rCRS and
     * placeholder {@code NN} in RSRS.
     * @param bases the complete contig sequence.  Must not be {@code null}.
     * @return the detected build.
     */
    public static ReferenceBuild detect(final String bases) {
        if ( bases.length() != MITOCHONDRIAL_GENOME_LENGTH ) {
            return OTHER;
        }
        switch ( bases.substring(522, 524).toUpperCase() ) {
            case "AC":
                return RCRS;
            case "NN":
                return RSRS;
            default:
                return OTHER;
        }
    }
}

package org.mitoseeker.coding;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.mitoseeker.annotation.AnnotationContext;
import org.mitoseeker.annotation.GenomicInterval;
import org.mitoseeker.exceptions.UserException;
import org.mitoseeker.reference.MitochondrialReference;
import org.mitoseeker.utils.Utils;
import org.mitoseeker.variant.AnnotatedVariant;
import org.mitoseeker.variant.VariantCall;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits a located coding variant into codon-aligned {@link DecomposedEdit}s.
 * <p>
 * The codons {@code startCodon..endCodon} of the variant's coding interval are read from the reference, the
 * alternate allele is substituted for the reference allele within them, and the edited bases are cut back into
 * one edit per reference codon.  Codons are read in genome orientation from the interval start.
 * </p>
 */
public final class VariantDecomposer {

    private static final Logger logger = LogManager.getLogger(VariantDecomposer.class);

    private final AnnotationContext context;

    public VariantDecomposer(final AnnotationContext context) {
        this.context = Utils.nonNull(context, "context");
    }

    /**
     * @param variant a located variant.  Must not be {@code null}.
     * @return one edit per codon spanned by the reference allele, or an empty list if {@code variant} is not coding.
     * @throws UserException.MalformedVariant if the reference allele disagrees with the reference sequence.
     * @throws UserException.UnsupportedReference if the affected codons run past the end of the reference.
     * @throws UserException.BadConfiguration if the annotation context has no reference sequence.
     */
    public List<DecomposedEdit> decompose(final AnnotatedVariant variant) {
        Utils.nonNull(variant, "variant");
        if ( !variant.isCoding() || variant.getLocalInterval() == null ) {
            return Collections.emptyList();
        }

        final MitochondrialReference reference = context.getReference();
        final VariantCall call = variant.getCall();
        final GenomicInterval gene = variant.getLocalInterval();
        final int startCodon = variant.getStartCodon();
        final int endCodon = variant.getEndCodon();

        final int regionStart = gene.getStart() + startCodon * AminoAcid.CODON_LENGTH;
        final int regionEnd = gene.getStart() + (endCodon + 1) * AminoAcid.CODON_LENGTH - 1;
        final String referenceCodons = reference.getBases(regionStart, regionEnd);

        final String refAllele = call.getRefAllele().toUpperCase();
        final String altAllele = call.getAltAllele().toUpperCase();
        final int offset = call.getPos() - regionStart;

        if ( !referenceCodons.regionMatches(offset, refAllele, 0, refAllele.length()) ) {
            throw new UserException.MalformedVariant(call.getGenomicKey(),
                    "reference allele does not match reference bases " +
                    referenceCodons.substring(offset, Math.min(referenceCodons.length(), offset + refAllele.length())) +
                    " at " + reference.getContig() + ":" + call.getPos());
        }

        final String editedCodons = getEditedSequence(referenceCodons, offset, refAllele, altAllele);
        final boolean frameshift = isFrameshift(refAllele, altAllele);

        final int numCodons = endCodon - startCodon + 1;
        final List<DecomposedEdit> edits = new ArrayList<>(numCodons);
        for ( int i = 0; i < numCodons; ++i ) {
            final int codonOffset = i * AminoAcid.CODON_LENGTH;
            final String refCodon = referenceCodons.substring(codonOffset, codonOffset + AminoAcid.CODON_LENGTH);

            // The last codon takes whatever is left so indels never lose or duplicate bases:
            final int altStart = Math.min(codonOffset, editedCodons.length());
            final int altEnd = (i == numCodons - 1)
                    ? editedCodons.length()
                    : Math.min(codonOffset + AminoAcid.CODON_LENGTH, editedCodons.length());
            final String altCodon = editedCodons.substring(altStart, altEnd);

            edits.add(new DecomposedEdit(gene.getGene(), startCodon + i, regionStart + codonOffset, refCodon, altCodon, frameshift, call.getGenomicKey()));
        }

        if ( logger.isDebugEnabled() ) {
            logger.debug("Decomposed " + call.getGenomicKey() + " into " + edits);
        }
        return edits;
    }

    /**
     * Decompose a batch of variants, preserving input order.  Non-coding variants contribute nothing.
     */
    public List<DecomposedEdit> decomposeAll(final List<AnnotatedVariant> variants) {
        Utils.nonNull(variants, "variants");
        final List<DecomposedEdit> edits = new ArrayList<>();
        for ( final AnnotatedVariant variant : variants ) {
            edits.addAll(decompose(variant));
        }
        return edits;
    }

    /**
     * @param referenceBases reference sequence.
     * @param offset 0-based offset of the reference allele within {@code referenceBases}.
     * @param refAllele the reference allele.
     * @param altAllele the alternate allele.
     * @return {@code referenceBases} with {@code refAllele} replaced by {@code altAllele}.
     */
    public static String getEditedSequence(final String referenceBases, final int offset, final String refAllele, final String altAllele) {
        Utils.validateArg(offset >= 0 && offset + refAllele.length() <= referenceBases.length(),
                () -> "Allele at offset " + offset + " does not fit in " + referenceBases.length() + " reference bases");
        return referenceBases.substring(0, offset) + altAllele + referenceBases.substring(offset + refAllele.length());
    }

    /**
     * @return {@code true} iff replacing {@code refAllele} with {@code altAllele} changes the length of the sequence
     * by a number of bases that is not a multiple of {@link AminoAcid#CODON_LENGTH}.
     */
    public static boolean isFrameshift(final String refAllele, final String altAllele) {
        return (altAllele.length() - refAllele.length()) % AminoAcid.CODON_LENGTH != 0;
    }
}

package org.mitoseeker.reference;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.mitoseeker.exceptions.UserException;
import org.mitoseeker.utils.Utils;
import org.mitoseeker.variant.VariantCall;
import org.mitoseeker.variant.VariantSet;

/**
 * Builds a sample's mitochondrial consensus sequence by applying its passing single-nucleotide calls to the rCRS.
 * Indels and filtered calls are left out, so the consensus always has the length of the reference.
 */
public final class ConsensusSequenceBuilder {

    private static final Logger logger = LogManager.getLogger(ConsensusSequenceBuilder.class);

    private final MitochondrialReference reference;

    /**
     * @param reference the reference to apply calls to.
     * @throws UserException.UnsupportedReference if {@code reference} is not the rCRS.
     */
    public ConsensusSequenceBuilder(final MitochondrialReference reference) {
        this.reference = Utils.nonNull(reference, "reference");
        if ( reference.getBuild() != ReferenceBuild.RCRS ) {
            throw new UserException.UnsupportedReference(
                    "Consensus sequences can only be built against the rCRS, but " + reference.getContig() + " is " + reference.getBuild());
        }
    }

    /**
     * @param variantSet the sample's calls.
     * @return the reference with every passing SNV of {@code variantSet} substituted in.  Where calls overlap,
     * the later call wins.
     * @throws UserException.UnsupportedReference if a call lies past the end of the reference.
     */
    public String build(final VariantSet variantSet) {
        Utils.nonNull(variantSet, "variantSet");
        final StringBuilder consensus = new StringBuilder(reference.getBases());
        int applied = 0;
        for ( final VariantCall call : variantSet ) {
            if ( !call.isPassFilter() || !call.isSnv() ) {
                continue;
            }
            // Range check only; the reference bases themselves are replaced.
            reference.getBases(call.getStart(), call.getEnd());
            consensus.replace(call.getStart() - 1, call.getEnd(), call.getAltAllele().toUpperCase());
            ++applied;
        }
        logger.debug("Applied " + applied + " SNV(s) to the consensus of " + variantSet.getSampleName());
        return consensus.toString();
    }

    public MitochondrialReference getReference() {
        return reference;
    }
}

package org.mitoseeker.variant;

import org.mitoseeker.exceptions.UserException;
import org.mitoseeker.utils.Utils;
import org.mitoseeker.utils.param.ParamUtils;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether a {@link VariantCall} can be placed on the mitochondrial reference.
 * Record-level problems raise {@link UserException.MalformedVariant}; calls off the mitochondrial contig or past its
 * end raise {@link UserException.UnsupportedReference}.
 */
public final class VariantCallValidator {

    private static final Pattern ALLELE_PATTERN = Pattern.compile("[ACGTNacgtn]+");

    private final Set<String> contigNames;
    private final int referenceLength;

    /**
     * @param contigNames names under which the mitochondrial contig may appear in variant calls.  Must not be empty.
     * @param referenceLength length of the mitochondrial contig.  Must be &gt; 0.
     */
    public VariantCallValidator(final Collection<String> contigNames, final int referenceLength) {
        Utils.nonEmpty(contigNames, "contigNames");
        this.contigNames = Collections.unmodifiableSet(new LinkedHashSet<>(contigNames));
        this.referenceLength = ParamUtils.isPositive(referenceLength, "referenceLength must be > 0");
    }

    /**
     * @param call the call to check.  Must not be {@code null}.
     * @return the same call.
     * @throws UserException.MalformedVariant if the call itself is malformed.
     * @throws UserException.UnsupportedReference if the call does not lie on the mitochondrial reference.
     */
    public VariantCall validate(final VariantCall call) {
        Utils.nonNull(call, "call");
        final String record = call.getGenomicKey();

        if ( call.getPos() < 1 ) {
            throw new UserException.MalformedVariant(record, "position must be >= 1");
        }
        if ( !ALLELE_PATTERN.matcher(call.getRefAllele()).matches() ) {
            throw new UserException.MalformedVariant(record, "reference allele '" + call.getRefAllele() + "' is not a nucleotide sequence");
        }
        if ( !ALLELE_PATTERN.matcher(call.getAltAllele()).matches() ) {
            throw new UserException.MalformedVariant(record, "alternate allele '" + call.getAltAllele() + "' is not a nucleotide sequence");
        }
        if ( call.getRefAllele().equalsIgnoreCase(call.getAltAllele()) ) {
            throw new UserException.MalformedVariant(record, "reference and alternate alleles are identical");
        }
        if ( call.getDepth() < 0 ) {
            throw new UserException.MalformedVariant(record, "negative depth " + call.getDepth());
        }

        if ( !contigNames.contains(call.getContig()) ) {
            throw new UserException.UnsupportedReference(
                    "Variant " + record + " is on contig " + call.getContig() + ", which is not the mitochondrial contig " + contigNames);
        }
        if ( call.getEnd() > referenceLength ) {
            throw new UserException.UnsupportedReference(
                    "Variant " + record + " ends at " + call.getEnd() + ", past the end of the " + referenceLength + " bp mitochondrial reference");
        }
        return call;
    }

    public Set<String> getContigNames() {
        return contigNames;
    }

    public int getReferenceLength() {
        return referenceLength;
    }
}

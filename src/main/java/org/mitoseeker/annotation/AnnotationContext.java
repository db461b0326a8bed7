package org.mitoseeker.annotation;

import org.mitoseeker.exceptions.UserException;
import org.mitoseeker.reference.MitochondrialReference;
import org.mitoseeker.utils.Utils;
import org.mitoseeker.variant.VariantCallValidator;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Everything a run needs to know about the genome it annotates against: the annotation index, the reference
 * sequence used to build codons, and the contig names under which variant calls may refer to the mitochondrion.
 * <p>
 * Built once before a run and passed explicitly to every component; nothing is ever cached onto variants.
 * Immutable and safe to share between threads.
 * </p>
 */
public final class AnnotationContext {

    private final GenomeAnnotationIndex index;
    private final MitochondrialReference reference;
    private final Set<String> mitochondrialContigNames;

    /**
     * @param index annotation intervals.  Must not be {@code null}.
     * @param reference reference sequence.  May be {@code null} when no amino acid changes will be computed.
     * @param mitochondrialContigNames accepted contig names for variant calls, in addition to the contigs of
     *                                 {@code index} and {@code reference}.  Must not be {@code null}.
     * @throws UserException.BadConfiguration if the annotation extends past the end of the reference.
     */
    public AnnotationContext(final GenomeAnnotationIndex index,
                             final MitochondrialReference reference,
                             final Collection<String> mitochondrialContigNames) {
        this.index = Utils.nonNull(index, "index");
        this.reference = reference;
        Utils.nonNull(mitochondrialContigNames, "mitochondrialContigNames");

        if ( reference != null && index.getMaxEnd() > reference.length() ) {
            throw new UserException.BadConfiguration(String.format(
                    "Annotation intervals extend to position %d, past the end of the %d bp reference %s",
                    index.getMaxEnd(), reference.length(), reference.getContig()));
        }

        final Set<String> names = new LinkedHashSet<>(mitochondrialContigNames);
        names.add(index.getContig());
        if ( reference != null ) {
            names.add(reference.getContig());
        }
        this.mitochondrialContigNames = Collections.unmodifiableSet(names);
    }

    public static AnnotationContext of(final GenomeAnnotationIndex index, final MitochondrialReference reference) {
        return new AnnotationContext(index, reference, Collections.emptySet());
    }

    public GenomeAnnotationIndex getIndex() {
        return index;
    }

    public boolean hasReference() {
        return reference != null;
    }

    /**
     * @return the reference sequence.
     * @throws UserException.BadConfiguration if this context was built without one.
     */
    public MitochondrialReference getReference() {
        if ( reference == null ) {
            throw new UserException.BadConfiguration("A mitochondrial reference sequence is required to compute amino acid changes.");
        }
        return reference;
    }

    public Set<String> getMitochondrialContigNames() {
        return mitochondrialContigNames;
    }

    /**
     * @return the length of the reference, or the extent of the annotation when there is no reference.
     */
    public int getReferenceLength() {
        return reference != null ? reference.length() : index.getMaxEnd();
    }

    public VariantCallValidator createValidator() {
        return new VariantCallValidator(mitochondrialContigNames, getReferenceLength());
    }
}

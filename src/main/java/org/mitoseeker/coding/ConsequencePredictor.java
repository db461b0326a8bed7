package org.mitoseeker.coding;

import org.mitoseeker.utils.Utils;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifies {@link DecomposedEdit}s by translating their reference and alternate codons with the
 * {@link MitochondrialCodonTable}.
 * <p>
 * Rules, applied in order:
 * <ol>
 *     <li>a codon containing anything other than {@code A}, {@code C}, {@code G} or {@code T}: {@link ConsequenceClass#UNKNOWN}</li>
 *     <li>the edit shifts the reading frame: {@link ConsequenceClass#FRAMESHIFT}</li>
 *     <li>same amino acids: {@link ConsequenceClass#SYNONYMOUS}</li>
 *     <li>alt gains a stop codon the ref did not have: {@link ConsequenceClass#NONSENSE}</li>
 *     <li>ref loses its stop codon: {@link ConsequenceClass#READTHROUGH}</li>
 *     <li>otherwise {@link ConsequenceClass#MISSENSE}</li>
 * </ol>
 * Stateless.
 */
public final class ConsequencePredictor {

    private ConsequencePredictor() {}

    public static ConsequenceAnnotation predict(final DecomposedEdit edit) {
        Utils.nonNull(edit, "edit");

        final String refCodon = edit.getRefCodon();
        final String altCodon = edit.getAltCodon();
        final String refAA = MitochondrialCodonTable.translateToLetters(refCodon);
        final String altAA = MitochondrialCodonTable.translateToLetters(altCodon);

        return new ConsequenceAnnotation(edit.getGene(), edit.getCodonIndex(), refAA, altAA,
                classify(edit, refAA, altAA), edit.getVariantKey());
    }

    public static List<ConsequenceAnnotation> predictAll(final List<DecomposedEdit> edits) {
        Utils.nonNull(edits, "edits");
        final List<ConsequenceAnnotation> consequences = new ArrayList<>(edits.size());
        for ( final DecomposedEdit edit : edits ) {
            consequences.add(predict(edit));
        }
        return consequences;
    }

    private static ConsequenceClass classify(final DecomposedEdit edit, final String refAA, final String altAA) {
        if ( !MitochondrialCodonTable.isUnambiguous(edit.getRefCodon()) || !MitochondrialCodonTable.isUnambiguous(edit.getAltCodon()) ) {
            return ConsequenceClass.UNKNOWN;
        }
        if ( edit.isFrameshift() ) {
            return ConsequenceClass.FRAMESHIFT;
        }
        if ( refAA.equals(altAA) ) {
            return ConsequenceClass.SYNONYMOUS;
        }

        final boolean refHasStop = containsStop(refAA);
        final boolean altHasStop = containsStop(altAA);
        if ( altHasStop && !refHasStop ) {
            return ConsequenceClass.NONSENSE;
        }
        if ( refHasStop && !altHasStop ) {
            return ConsequenceClass.READTHROUGH;
        }
        return ConsequenceClass.MISSENSE;
    }

    private static boolean containsStop(final String aminoAcidLetters) {
        return aminoAcidLetters.indexOf(AminoAcid.STOP_CODON.getLetter().charAt(0)) >= 0;
    }
}

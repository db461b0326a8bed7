package org.mitoseeker.coding;

import org.mitoseeker.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The vertebrate mitochondrial genetic code.
 * <p>
 * It differs from the standard code in four codons: {@code ATA} codes for methionine, {@code TGA} for tryptophan,
 * and {@code AGA}/{@code AGG} are stop codons.
 * </p>
 */
public final class MitochondrialCodonTable {

    private static final Map<String, AminoAcid> tableByCodon;

    static {
        final Map<String, AminoAcid> mapByCodon = new HashMap<>();
        for ( final AminoAcid acid : AminoAcid.values() ) {
            for ( final String codon : acid.getCodons() ) {
                mapByCodon.put(codon, acid);
            }
        }

        // Codons that are different in the MT code:
        mapByCodon.put("ATA", AminoAcid.METHIONINE);
        mapByCodon.put("AGA", AminoAcid.STOP_CODON);
        mapByCodon.put("AGG", AminoAcid.STOP_CODON);
        mapByCodon.put("TGA", AminoAcid.TRYPTOPHAN);

        tableByCodon = Collections.unmodifiableMap(mapByCodon);
    }

    private MitochondrialCodonTable() {}

    /**
     * @param codon a three-letter codon.  Must not be {@code null}.  Case-insensitive.
     * @return the amino acid for {@code codon}, or {@link AminoAcid#UNDECODABLE} if {@code codon} is not a
     * triplet of unambiguous bases.
     */
    public static AminoAcid getAminoAcid(final String codon) {
        Utils.nonNull(codon, "codon");
        return tableByCodon.getOrDefault(codon.toUpperCase(), AminoAcid.UNDECODABLE);
    }

    /**
     * Translate every complete codon of {@code sequence}.  Trailing bases that do not make up a whole codon are ignored.
     * @param sequence coding sequence in frame at its first base.  Must not be {@code null}.
     * @return the amino acids, one per complete codon.
     */
    public static List<AminoAcid> translate(final String sequence) {
        Utils.nonNull(sequence, "sequence");
        final List<AminoAcid> aminoAcids = new ArrayList<>(sequence.length() / AminoAcid.CODON_LENGTH);
        for ( int i = 0; i + AminoAcid.CODON_LENGTH <= sequence.length(); i += AminoAcid.CODON_LENGTH ) {
            aminoAcids.add(getAminoAcid(sequence.substring(i, i + AminoAcid.CODON_LENGTH)));
        }
        return aminoAcids;
    }

    /**
     * @return the one-letter rendering of {@link #translate(String)}.
     */
    public static String translateToLetters(final String sequence) {
        final StringBuilder sb = new StringBuilder();
        for ( final AminoAcid acid : translate(sequence) ) {
            sb.append(acid.getLetter());
        }
        return sb.toString();
    }

    /**
     * @return {@code true} iff every character of {@code sequence} is one of {@code A}, {@code C}, {@code G} or {@code T}.
     */
    public static boolean isUnambiguous(final String sequence) {
        Utils.nonNull(sequence, "sequence");
        for ( int i = 0; i < sequence.length(); ++i ) {
            switch ( sequence.charAt(i) ) {
                case 'A':
                case 'C':
                case 'G':
                case 'T':
                    break;
                default:
                    return false;
            }
        }
        return true;
    }
}

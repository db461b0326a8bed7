package org.mitoseeker.coding;

/**
 * Enum to hold the amino acids and their codons in the standard genetic code.
 * Differences in the vertebrate mitochondrial code are applied by {@link MitochondrialCodonTable}.
 */
public enum AminoAcid {

    ALANINE("Alanine","Ala","A",new String[]{"GCA","GCC","GCG","GCT"}),
    ARGININE("Arginine","Arg","R",new String[]{"AGA","AGG","CGA","CGC","CGG","CGT"}),
    ASPARAGINE("Asparagine","Asn","N",new String[]{"AAC","AAT"}),
    ASPARTIC_ACID("Aspartic acid","Asp","D",new String[]{"GAT","GAC"}),
    CYSTEINE("Cysteine","Cys","C",new String[]{"TGC","TGT"}),
    GLUTAMIC_ACID("Glutamic acid","Glu","E",new String[]{"GAA","GAG"}),
    GLUTAMINE("Glutamine","Gln","Q",new String[]{"CAA","CAG"}),
    GLYCINE("Glycine","Gly","G",new String[]{"GGA","GGC","GGG","GGT"}),
    HISTIDINE("Histidine","His","H",new String[]{"CAC","CAT"}),
    ISOLEUCINE("Isoleucine","Ile","I",new String[]{"ATA","ATC","ATT"}),
    LEUCINE("Leucine","Leu","L",new String[]{"CTA","CTC","CTG","CTT","TTA","TTG"}),
    LYSINE("Lysine","Lys","K", new String[]{"AAA","AAG"}),
    METHIONINE("Methionine","Met","M",new String[]{"ATG"}),
    PHENYLALANINE("Phenylalanine","Phe","F",new String[]{"TTC","TTT"}),
    PROLINE("Proline","Pro","P",new String[]{"CCA","CCC","CCG","CCT"}),
    SERINE("Serine","Ser","S",new String[]{"AGC","AGT","TCA","TCC","TCG","TCT"}),
    STOP_CODON("Stop codon","Stop","*",new String[]{"TAA","TAG","TGA"}),
    THREONINE("Threonine","Thr","T",new String[]{"ACA","ACC","ACG","ACT"}),
    TRYPTOPHAN("Tryptophan","Trp","W",new String[]{"TGG"}),
    TYROSINE("Tyrosine","Tyr","Y",new String[]{"TAC","TAT"}),
    VALINE("Valine","Val","V",new String[]{"GTA","GTC","GTG","GTT"}),

    // Placeholder for codons containing an ambiguous base, which cannot be translated.
    UNDECODABLE("Undecodable Amino Acid", "UNDECODABLE", "?", new String[]{});

    /**
     * The length of a codon in bases.
     */
    public static final int CODON_LENGTH = 3;

    private final String[] codons;
    private final String fullName;
    private final String code;
    private final String letter;

    AminoAcid(final String name, final String shortName, final String abbrev, final String[] myCodons) {
        codons = myCodons;
        fullName = name;
        code = shortName;
        letter = abbrev;
    }

    public String getName() {
        return fullName;
    }

    public String getLetter() {
        return letter;
    }

    public String getCode() {
        return code;
    }

    public boolean isStop() {
        return this == STOP_CODON;
    }

    @Override
    public String toString() {
        return getName();
    }

    public String[] getCodons() {
        return codons.clone();
    }
}

package org.mitoseeker.coding;

import org.mitoseeker.MitoSeekerBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.List;

public class ConsequencePredictorUnitTest extends MitoSeekerBaseTest {

    private static final String KEY = "chrM:3340 C>T";

    private static DecomposedEdit edit(final String refCodon, final String altCodon, final boolean frameshift) {
        return new DecomposedEdit("ND1", 10, ND1_START + 30, refCodon, altCodon, frameshift, KEY);
    }

    @DataProvider
    public Object[][] provideEdits() {
        return new Object[][] {
                // Leucine to leucine:
                { edit("CTT", "CTC", false), ConsequenceClass.SYNONYMOUS, "L", "L" },
                // Isoleucine/methionine differ in the mitochondrial code:
                { edit("ATT", "ATA", false), ConsequenceClass.MISSENSE, "I", "M" },
                { edit("ATG", "ATA", false), ConsequenceClass.SYNONYMOUS, "M", "M" },
                // Sense to stop, including the mitochondrial AGA/AGG stops:
                { edit("TGG", "TAG", false), ConsequenceClass.NONSENSE, "W", "*" },
                { edit("CGA", "AGA", false), ConsequenceClass.NONSENSE, "R", "*" },
                // TGA is tryptophan, not stop:
                { edit("TGG", "TGA", false), ConsequenceClass.SYNONYMOUS, "W", "W" },
                // Stop to sense:
                { edit("TAA", "CAA", false), ConsequenceClass.READTHROUGH, "*", "Q" },
                { edit("AGG", "TGG", false), ConsequenceClass.READTHROUGH, "*", "W" },
                { edit("TAA", "TAG", false), ConsequenceClass.SYNONYMOUS, "*", "*" },
                { edit("CCC", "CTC", false), ConsequenceClass.MISSENSE, "P", "L" },
                // Frameshift overrides the amino acid comparison:
                { edit("CTT", "CTTA", true), ConsequenceClass.FRAMESHIFT, "L", "L" },
                { edit("CTT", "C", true), ConsequenceClass.FRAMESHIFT, "L", "" },
                // Ambiguous bases beat everything:
                { edit("CNT", "CTC", false), ConsequenceClass.UNKNOWN, "?", "L" },
                { edit("CTT", "CTN", true), ConsequenceClass.UNKNOWN, "L", "?" },
                { edit("CTT", "ctc", false), ConsequenceClass.UNKNOWN, "L", "L" },
                // In-frame indels compare whole translations:
                { edit("CCC", "", false), ConsequenceClass.MISSENSE, "P", "" },
                { edit("CCC", "CCCTAA", false), ConsequenceClass.NONSENSE, "P", "P*" },
                { edit("CCC", "CCCCCC", false), ConsequenceClass.MISSENSE, "P", "PP" },
        };
    }

    @Test(dataProvider = "provideEdits")
    public void testPredict(final DecomposedEdit edit, final ConsequenceClass expectedClass,
                            final String expectedRefAA, final String expectedAltAA) {
        final ConsequenceAnnotation consequence = ConsequencePredictor.predict(edit);

        Assert.assertEquals(consequence.getConsequenceClass(), expectedClass);
        Assert.assertEquals(consequence.getRefAA(), expectedRefAA);
        Assert.assertEquals(consequence.getAltAA(), expectedAltAA);
        Assert.assertEquals(consequence.getGene(), "ND1");
        Assert.assertEquals(consequence.getCodonIndex(), 10);
        Assert.assertEquals(consequence.getVariantKey(), KEY);
    }

    @Test
    public void testPredictIsTotalOverUnambiguousCodons() {
        final String bases = "ACGT";
        for ( final char a : bases.toCharArray() ) {
            for ( final char b : bases.toCharArray() ) {
                for ( final char c : bases.toCharArray() ) {
                    final String codon = "" + a + b + c;
                    final ConsequenceAnnotation consequence = ConsequencePredictor.predict(edit("CTT", codon, false));
                    Assert.assertNotEquals(consequence.getConsequenceClass(), ConsequenceClass.UNKNOWN, codon);
                    Assert.assertNotEquals(consequence.getConsequenceClass(), ConsequenceClass.FRAMESHIFT, codon);
                }
            }
        }
    }

    @Test
    public void testPredictAllPreservesOrder() {
        final List<ConsequenceAnnotation> consequences = ConsequencePredictor.predictAll(Arrays.asList(
                edit("CTT", "CTC", false), edit("TGG", "TAG", false), edit("CTT", "CTTA", true)));
        Assert.assertEquals(consequences.get(0).getConsequenceClass(), ConsequenceClass.SYNONYMOUS);
        Assert.assertEquals(consequences.get(1).getConsequenceClass(), ConsequenceClass.NONSENSE);
        Assert.assertEquals(consequences.get(2).getConsequenceClass(), ConsequenceClass.FRAMESHIFT);
    }

    @Test
    public void testProteinChange() {
        Assert.assertEquals(ConsequencePredictor.predict(edit("TGG", "TAG", false)).getProteinChange(), "p.W11*");
        Assert.assertEquals(ConsequencePredictor.predict(edit("CCC", "", false)).getProteinChange(), "p.P11-");
        Assert.assertEquals(ConsequenceClass.READTHROUGH.toString(), "readthrough");
    }
}

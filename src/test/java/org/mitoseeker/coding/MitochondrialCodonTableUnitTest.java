package org.mitoseeker.coding;

import org.mitoseeker.MitoSeekerBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;

public class MitochondrialCodonTableUnitTest extends MitoSeekerBaseTest {

    @DataProvider
    public Object[][] provideCodons() {
        return new Object[][] {
                // Differences from the standard code:
                { "ATA", AminoAcid.METHIONINE },
                { "TGA", AminoAcid.TRYPTOPHAN },
                { "AGA", AminoAcid.STOP_CODON },
                { "AGG", AminoAcid.STOP_CODON },

                { "ATG", AminoAcid.METHIONINE },
                { "TAA", AminoAcid.STOP_CODON },
                { "TAG", AminoAcid.STOP_CODON },
                { "CTT", AminoAcid.LEUCINE },
                { "CTC", AminoAcid.LEUCINE },
                { "CGA", AminoAcid.ARGININE },
                { "ccc", AminoAcid.PROLINE },
                { "CNC", AminoAcid.UNDECODABLE },
                { "CC", AminoAcid.UNDECODABLE },
                { "", AminoAcid.UNDECODABLE },
        };
    }

    @Test(dataProvider = "provideCodons")
    public void testGetAminoAcid(final String codon, final AminoAcid expected) {
        Assert.assertEquals(MitochondrialCodonTable.getAminoAcid(codon), expected);
    }

    @Test
    public void testEveryUnambiguousCodonTranslates() {
        final String bases = "ACGT";
        for ( final char a : bases.toCharArray() ) {
            for ( final char b : bases.toCharArray() ) {
                for ( final char c : bases.toCharArray() ) {
                    final String codon = "" + a + b + c;
                    Assert.assertNotEquals(MitochondrialCodonTable.getAminoAcid(codon), AminoAcid.UNDECODABLE, codon);
                }
            }
        }
    }

    @Test
    public void testTranslateIgnoresIncompleteCodons() {
        Assert.assertEquals(MitochondrialCodonTable.translate("ATGTGAAG"), Arrays.asList(AminoAcid.METHIONINE, AminoAcid.TRYPTOPHAN));
        Assert.assertEquals(MitochondrialCodonTable.translate("AT"), Collections.emptyList());
        Assert.assertEquals(MitochondrialCodonTable.translateToLetters("ATGAGACTT"), "M*L");
        Assert.assertEquals(MitochondrialCodonTable.translateToLetters(""), "");
    }

    @Test
    public void testIsUnambiguous() {
        Assert.assertTrue(MitochondrialCodonTable.isUnambiguous("ACGT"));
        Assert.assertTrue(MitochondrialCodonTable.isUnambiguous(""));
        Assert.assertFalse(MitochondrialCodonTable.isUnambiguous("ACN"));
        Assert.assertFalse(MitochondrialCodonTable.isUnambiguous("acg"));
        Assert.assertFalse(MitochondrialCodonTable.isUnambiguous("A-G"));
    }
}

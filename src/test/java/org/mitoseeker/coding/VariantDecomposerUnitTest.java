package org.mitoseeker.coding;

import htsjdk.tribble.annotation.Strand;
import org.mitoseeker.MitoSeekerBaseTest;
import org.mitoseeker.annotation.AnnotationContext;
import org.mitoseeker.annotation.GenomeAnnotationIndex;
import org.mitoseeker.annotation.GenomicInterval;
import org.mitoseeker.annotation.RegionClass;
import org.mitoseeker.exceptions.UserException;
import org.mitoseeker.locator.RegionLocator;
import org.mitoseeker.reference.MitochondrialReference;
import org.mitoseeker.variant.AnnotatedVariant;
import org.mitoseeker.variant.VariantCall;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class VariantDecomposerUnitTest extends MitoSeekerBaseTest {

    private static final int CODON_10_START = ND1_START + 30;
    private static final int CODON_11_START = ND1_START + 33;

    /** ND1 codon 10 is ATC and codon 11 is CAG; everything else is C. */
    private static StringBuilder createTestBases() {
        final StringBuilder bases = createReferenceBases();
        setCodon(bases, ND1_START, 10, "ATC");
        setCodon(bases, ND1_START, 11, "CAG");
        return bases;
    }

    private final StringBuilder referenceBases = createTestBases();
    private final AnnotationContext context = createRcrsContext(createReference(referenceBases));
    private final RegionLocator locator = new RegionLocator(context);
    private final VariantDecomposer decomposer = new VariantDecomposer(context);

    private List<DecomposedEdit> decompose(final VariantCall call) {
        return decomposer.decompose(locator.locate(call));
    }

    /**
     * Put each edit's alt codon back into the reference in place of its reference codon.
     */
    private static String applyEdits(final String reference, final List<DecomposedEdit> edits) {
        final StringBuilder edited = new StringBuilder();
        int cursor = 1;
        for ( final DecomposedEdit edit : edits ) {
            edited.append(reference, cursor - 1, edit.getCodonStart() - 1).append(edit.getAltCodon());
            cursor = edit.getCodonStart() + edit.getRefCodon().length();
        }
        return edited.append(reference.substring(cursor - 1)).toString();
    }

    @Test
    public void testSubstitutionWithinOneCodon() {
        final VariantCall call = call(CODON_10_START + 2, "C", "T");
        final List<DecomposedEdit> edits = decompose(call);

        Assert.assertEquals(edits, Collections.singletonList(
                new DecomposedEdit("ND1", 10, CODON_10_START, "ATC", "ATT", false, call.getGenomicKey())));
    }

    @Test
    public void testSubstitutionSpanningCodonBoundary() {
        final VariantCall call = call(CODON_10_START + 2, "CC", "TA");
        final List<DecomposedEdit> edits = decompose(call);

        Assert.assertEquals(edits.size(), 2);
        Assert.assertEquals(edits.get(0), new DecomposedEdit("ND1", 10, CODON_10_START, "ATC", "ATT", false, call.getGenomicKey()));
        Assert.assertEquals(edits.get(1), new DecomposedEdit("ND1", 11, CODON_11_START, "CAG", "AAG", false, call.getGenomicKey()));
        for ( final DecomposedEdit edit : edits ) {
            Assert.assertEquals(edit.getRefCodon().length(), 3);
            Assert.assertEquals(edit.getAltCodon().length(), 3);
        }
    }

    @Test
    public void testInFrameDeletion() {
        final VariantCall call = call(CODON_11_START + 2, "GCCC", "G");
        final List<DecomposedEdit> edits = decompose(call);

        Assert.assertEquals(edits.size(), 2);
        Assert.assertEquals(edits.get(0).getRefCodon(), "CAG");
        Assert.assertEquals(edits.get(0).getAltCodon(), "CAG");
        Assert.assertEquals(edits.get(1).getRefCodon(), "CCC");
        Assert.assertEquals(edits.get(1).getAltCodon(), "");
        Assert.assertFalse(edits.get(1).isFrameshift());
    }

    @Test
    public void testFrameshiftInsertion() {
        final VariantCall call = call(CODON_10_START, "A", "AG");
        final List<DecomposedEdit> edits = decompose(call);

        Assert.assertEquals(edits, Collections.singletonList(
                new DecomposedEdit("ND1", 10, CODON_10_START, "ATC", "AGTC", true, call.getGenomicKey())));
    }

    @DataProvider
    public Object[][] provideCodingVariants() {
        return new Object[][] {
                { call(ND1_START, "C", "A") },
                { call(CODON_10_START + 2, "C", "T") },
                { call(CODON_10_START + 2, "CC", "TA") },
                { call(CODON_10_START, "ATCCAG", "GGGGGG") },
                { call(CODON_10_START + 1, "TCCA", "T") },
                { call(CODON_10_START + 1, "T", "TAAAA") },
                { call(CODON_11_START + 2, "GCCC", "G") },
                { call(CODON_11_START + 2, "GC", "G") },
                { call(ND1_END - 1, "CC", "AT") },
                { call(ND6_START + 7, "CC", "C") },
        };
    }

    @Test(dataProvider = "provideCodingVariants")
    public void testDecompositionRoundTrip(final VariantCall call) {
        final AnnotatedVariant located = locator.locate(call);
        Assert.assertTrue(located.isCoding());
        final List<DecomposedEdit> edits = decomposer.decompose(located);

        Assert.assertEquals(edits.size(), located.getEndCodon() - located.getStartCodon() + 1);
        final String expected = VariantDecomposer.getEditedSequence(referenceBases.toString(), call.getPos() - 1, call.getRefAllele(), call.getAltAllele());
        Assert.assertEquals(applyEdits(referenceBases.toString(), edits), expected);

        for ( int i = 0; i < edits.size(); i++ ) {
            Assert.assertEquals(edits.get(i).getCodonIndex(), located.getStartCodon() + i);
            Assert.assertEquals(edits.get(i).getRefCodon().length(), 3);
            Assert.assertEquals(edits.get(i).isFrameshift(), VariantDecomposer.isFrameshift(call.getRefAllele(), call.getAltAllele()));
        }
    }

    @Test
    public void testNonCodingVariantsYieldNothing() {
        // D-loop, tRNA and no annotation at all.
        for ( final VariantCall call : Arrays.asList(call(73, "C", "T"), call(4300, "C", "T"), call(3305, "C", "T")) ) {
            final AnnotatedVariant located = locator.locate(call);
            Assert.assertFalse(located.isCoding());
            Assert.assertEquals(decomposer.decompose(located), Collections.emptyList());
        }
    }

    @Test
    public void testDecomposeAllPreservesOrder() {
        final List<AnnotatedVariant> located = locator.locateAll(Arrays.asList(
                call(CODON_11_START, "C", "A"), call(73, "C", "T"), call(CODON_10_START, "A", "G")), false);
        final List<DecomposedEdit> edits = decomposer.decomposeAll(located);
        Assert.assertEquals(edits.size(), 2);
        Assert.assertEquals(edits.get(0).getCodonIndex(), 11);
        Assert.assertEquals(edits.get(1).getCodonIndex(), 10);
    }

    @Test(expectedExceptions = UserException.MalformedVariant.class)
    public void testReferenceAlleleMismatch() {
        decompose(call(CODON_10_START, "G", "T"));
    }

    @Test(expectedExceptions = UserException.UnsupportedReference.class)
    public void testCodonsPastReferenceEnd() {
        final MitochondrialReference shortReference = MitochondrialReference.of(MT_CONTIG, "ATGCCCAAAGGGTTTCCCAA");
        final GenomeAnnotationIndex index = new GenomeAnnotationIndex(Collections.singletonList(
                new GenomicInterval(MT_CONTIG, 1, 20, Strand.POSITIVE, "G", RegionClass.CODING)));
        final AnnotationContext shortContext = AnnotationContext.of(index, shortReference);

        new VariantDecomposer(shortContext).decompose(new RegionLocator(shortContext).locate(call(19, "A", "G")));
    }

    @Test(expectedExceptions = UserException.BadConfiguration.class)
    public void testNoReference() {
        final AnnotationContext noReference = AnnotationContext.of(GenomeAnnotationIndex.getRcrsIndex(), null);
        new VariantDecomposer(noReference).decompose(new RegionLocator(noReference).locate(call(ND1_START, "C", "T")));
    }

    @Test
    public void testEditedSequenceAndFrameshift() {
        Assert.assertEquals(VariantDecomposer.getEditedSequence("ACGTAC", 2, "GT", "T"), "ACTAC");
        Assert.assertEquals(VariantDecomposer.getEditedSequence("ACG", 0, "A", "TTT"), "TTTCG");
        Assert.assertFalse(VariantDecomposer.isFrameshift("A", "G"));
        Assert.assertFalse(VariantDecomposer.isFrameshift("A", "AGGG"));
        Assert.assertTrue(VariantDecomposer.isFrameshift("AC", "A"));
        Assert.assertTrue(VariantDecomposer.isFrameshift("A", "AGGGG"));
    }
}

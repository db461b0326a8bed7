package org.mitoseeker.reference;

import org.mitoseeker.MitoSeekerBaseTest;
import org.mitoseeker.exceptions.UserException;
import org.mitoseeker.variant.VariantCall;
import org.mitoseeker.variant.VariantSet;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;

public class ConsensusSequenceBuilderUnitTest extends MitoSeekerBaseTest {

    @Test
    public void testAppliesPassingSnvsOnly() {
        final MitochondrialReference reference = createReference();
        final VariantSet calls = new VariantSet("sample", Arrays.asList(
                call(100, "C", "T"),
                call(200, "CC", "GA"),
                new VariantCall(MT_CONTIG, 300, "C", "A", 2, false),
                call(400, "CC", "C"),
                call(500, "C", "CAAA"),
                call(16569, "C", "g")));

        final String consensus = new ConsensusSequenceBuilder(reference).build(calls);

        Assert.assertEquals(consensus.length(), reference.length());
        Assert.assertEquals(consensus.charAt(99), 'T');
        Assert.assertEquals(consensus.substring(199, 201), "GA");
        Assert.assertEquals(consensus.charAt(299), 'C');
        Assert.assertEquals(consensus.substring(399, 401), "CC");
        Assert.assertEquals(consensus.charAt(16568), 'G');

        final StringBuilder expected = createReferenceBases();
        expected.setCharAt(99, 'T');
        expected.replace(199, 201, "GA");
        expected.setCharAt(16568, 'G');
        Assert.assertEquals(consensus, expected.toString());
    }

    @Test
    public void testEmptySetGivesReference() {
        final MitochondrialReference reference = createReference();
        Assert.assertEquals(new ConsensusSequenceBuilder(reference).build(new VariantSet("empty", Collections.emptyList())), reference.getBases());
    }

    @Test(expectedExceptions = UserException.UnsupportedReference.class)
    public void testNonRcrsReferenceIsRejected() {
        new ConsensusSequenceBuilder(MitochondrialReference.of(MT_CONTIG, "GATCACAGGT"));
    }

    @Test(expectedExceptions = UserException.UnsupportedReference.class)
    public void testRsrsReferenceIsRejected() {
        final StringBuilder bases = createReferenceBases();
        bases.replace(522, 524, "NN");
        new ConsensusSequenceBuilder(createReference(bases));
    }

    @Test(expectedExceptions = UserException.UnsupportedReference.class)
    public void testCallPastReferenceEnd() {
        new ConsensusSequenceBuilder(createReference()).build(new VariantSet("sample", Collections.singletonList(call(16570, "C", "T"))));
    }
}

package org.mitoseeker.tools;

import org.mitoseeker.MitoSeekerBaseTest;
import org.mitoseeker.enrichment.ImpactRecord;
import org.mitoseeker.pipeline.AnnotatedResult;
import org.mitoseeker.pipeline.PipelineOrchestrator;
import org.mitoseeker.variant.VariantCall;
import org.mitoseeker.variant.VariantSet;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class AnnotatedResultWriterUnitTest extends MitoSeekerBaseTest {

    private static final String HEADER = String.join("\t", AnnotatedResultWriter.COLUMNS);

    private static List<AnnotatedResult> annotate(final boolean computeAAChanges, final VariantCall... calls) {
        final ImpactRecord impact = new ImpactRecord("chrM:3308 C>T", "ND1", "p.P1L", Collections.emptyMap());
        final PipelineOrchestrator orchestrator = new PipelineOrchestrator(createRcrsContext(), false, computeAAChanges, false, 1,
                key -> key.equals(impact.getGenomicKey()) ? Collections.singletonList(impact) : Collections.emptyList());
        return orchestrator.run(Collections.singletonList(new VariantSet("s1", Arrays.asList(calls)))).getResults();
    }

    private static String[] write(final List<AnnotatedResult> results) throws IOException {
        final StringWriter out = new StringWriter();
        try ( final AnnotatedResultWriter writer = new AnnotatedResultWriter(out) ) {
            writer.writeAll(results);
        }
        return out.toString().split("\n");
    }

    @Test
    public void testRows() throws IOException {
        final String[] lines = write(annotate(true, call(73, "C", "T"), call(3308, "C", "T"), call(3340, "CC", "C")));

        Assert.assertEquals(lines.length, 4);
        Assert.assertEquals(lines[0], HEADER);
        Assert.assertEquals(lines[1], "s1\tchrM\t73\tC\tT\tSNV\t100\ttrue\tD-loop\t\tcontrol\t\t\t\t\t\t\t\t\t\t");
        Assert.assertEquals(lines[2], "s1\tchrM\t3308\tC\tT\tSNV\t100\ttrue\tND1\t\tcoding\t1\t1\t0\t0\t0\tP\tL\tmissense\tp.P1L\tND1 p.P1L");
        Assert.assertEquals(lines[3], "s1\tchrM\t3340_3341\tCC\tC\tINDEL\t100\ttrue\tND1\t\tcoding\t33\t34\t11\t11\t11\tP\t\tframeshift\tp.P12-\t");
    }

    @Test
    public void testOneRowPerConsequence() throws IOException {
        // CCC CCC > CCT ACC, spanning the last base of codon 1 and the first of codon 2
        final String[] lines = write(annotate(true, call(3312, "CC", "TA")));
        Assert.assertEquals(lines.length, 3);
        Assert.assertTrue(lines[1].contains("\t1\tP\tP\tsynonymous\tp.P2P\t"));
        Assert.assertTrue(lines[2].contains("\t2\tP\tT\tmissense\tp.P3T\t"));
    }

    @Test
    public void testWithoutConsequences() throws IOException {
        final String[] lines = write(annotate(false, call(3308, "C", "T")));
        Assert.assertEquals(lines.length, 2);
        Assert.assertEquals(lines[1], "s1\tchrM\t3308\tC\tT\tSNV\t100\ttrue\tND1\t\tcoding\t1\t1\t0\t0\t\t\t\t\t\tND1 p.P1L");
    }

    @Test
    public void testOverlappingGenes() throws IOException {
        final String[] lines = write(annotate(false, call(8530, "C", "T")));
        Assert.assertTrue(lines[1].startsWith("s1\tchrM\t8530\tC\tT\tSNV\t100\ttrue\tATP8\tATP8,ATP6\tcoding\t164\t164\t54\t54\t"), lines[1]);
    }

    @Test
    public void testHeaderOnlyForNoResults() throws IOException {
        final String[] lines = write(Collections.emptyList());
        Assert.assertEquals(lines, new String[] { HEADER });
    }
}

package org.mitoseeker.variant;

import org.mitoseeker.MitoSeekerBaseTest;
import org.mitoseeker.exceptions.UserException;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;

public class VcfVariantSetReaderUnitTest extends MitoSeekerBaseTest {

    private static Path fixture(final String name) {
        return Paths.get(packageRootTestDir, "variant", name);
    }

    @Test
    public void testRead() {
        final VariantSet variantSet = VcfVariantSetReader.read(fixture("sample1.vcf"));

        Assert.assertEquals(variantSet.getSampleName(), "SAMPLE1");
        Assert.assertEquals(variantSet.getCalls(), Arrays.asList(
                new VariantCall("chrM", 73, "C", "T", 100, true),
                new VariantCall("chrM", 3308, "C", "T", 120, true),
                new VariantCall("chrM", 3310, "C", "A", 5, false),
                new VariantCall("chrM", 3340, "CC", "C", 42, true),
                new VariantCall("chrM", 4300, "C", "G", 80, true),
                new VariantCall("chrM", 4300, "C", "T", 80, true)));
        Assert.assertTrue(variantSet.getMalformedRecords().isEmpty());
    }

    @Test
    public void testUnparseableRecordIsKeptAndReadingContinues() {
        final VariantSet variantSet = VcfVariantSetReader.read(fixture("malformed_record.vcf"));

        Assert.assertEquals(variantSet.getSampleName(), "SAMPLE3");
        Assert.assertEquals(variantSet.getCalls(), Arrays.asList(
                new VariantCall("chrM", 73, "C", "T", 90, true),
                new VariantCall("chrM", 3308, "C", "T", 70, true)));

        Assert.assertEquals(variantSet.getMalformedRecords().size(), 1);
        final UserException.MalformedVariant malformed = variantSet.getMalformedRecords().get(0);
        Assert.assertEquals(malformed.getRecord(), "chrM:abc");
        Assert.assertTrue(malformed.getMessage().contains("record 2 of malformed_record.vcf"), malformed.getMessage());
        Assert.assertTrue(malformed.getMessage().contains("abc"), malformed.getMessage());
    }

    @Test
    public void testSitesOnlyVcfIsNamedAfterFile() {
        final VariantSet variantSet = VcfVariantSetReader.read(fixture("sites_only.vcf"));
        Assert.assertEquals(variantSet.getSampleName(), "sites_only.vcf");
        Assert.assertEquals(variantSet.getCalls(), Arrays.asList(new VariantCall("chrM", 9000, "C", "A", 60, true)));
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testMissingFile() {
        VcfVariantSetReader.read(fixture("does_not_exist.vcf"));
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testMalformedFile() {
        VcfVariantSetReader.read(fixture("not_a_vcf.vcf"));
    }
}

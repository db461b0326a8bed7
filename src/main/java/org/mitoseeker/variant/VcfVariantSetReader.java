package org.mitoseeker.variant;

import htsjdk.samtools.util.IOUtil;
import htsjdk.samtools.util.RuntimeIOException;
import htsjdk.tribble.TribbleException;
import htsjdk.tribble.readers.LineIterator;
import htsjdk.tribble.readers.LineIteratorImpl;
import htsjdk.tribble.readers.SynchronousLineReader;
import htsjdk.variant.variantcontext.Allele;
import htsjdk.variant.variantcontext.Genotype;
import htsjdk.variant.variantcontext.VariantContext;
import htsjdk.variant.vcf.VCFCodec;
import htsjdk.variant.vcf.VCFConstants;
import htsjdk.variant.vcf.VCFHeader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.mitoseeker.exceptions.UserException;
import org.mitoseeker.utils.Utils;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts the VCF output of an upstream mitochondrial variant caller into {@link VariantSet}s.
 * <p>
 * Every alternate allele of every record becomes one {@link VariantCall}.  A record passes when it is unfiltered or
 * {@code PASS}.  Depth is taken from the {@code DP} INFO field, falling back to the first sample's {@code DP}.
 * Symbolic and spanning-deletion alleles cannot be annotated and are skipped.
 * </p>
 * <p>
 * Records are decoded one line at a time, so a record htsjdk cannot parse (a non-numeric position, too few columns)
 * is kept on the set as a {@link UserException.MalformedVariant} and the rest of the file is still read.
 * </p>
 */
public final class VcfVariantSetReader {

    private static final Logger logger = LogManager.getLogger(VcfVariantSetReader.class);

    private VcfVariantSetReader() {}

    /**
     * @param vcfPath a VCF file, optionally gzipped.
     * @return the calls of the file as a {@link VariantSet} named after its first sample, or after the file when it has no samples.
     * @throws UserException.CouldNotReadInputFile if the file cannot be opened or its header cannot be parsed.
     */
    public static VariantSet read(final Path vcfPath) {
        Utils.nonNull(vcfPath, "the VCF path cannot be null");
        if ( !Files.isReadable(vcfPath) ) {
            throw new UserException.CouldNotReadInputFile(vcfPath, "file does not exist or is not readable");
        }

        try ( final BufferedReader reader = IOUtil.openFileForBufferedReading(vcfPath) ) {
            final LineIterator lines = new LineIteratorImpl(new SynchronousLineReader(reader));
            final VCFCodec codec = new VCFCodec();
            final VCFHeader header = (VCFHeader) codec.readActualHeader(lines);
            final String sampleName = sampleNameOf(header, vcfPath);

            final List<VariantCall> calls = new ArrayList<>();
            final List<UserException.MalformedVariant> malformed = new ArrayList<>();
            int recordNumber = 0;
            while ( lines.hasNext() ) {
                final String line = lines.next();
                if ( line.trim().isEmpty() ) {
                    continue;
                }
                ++recordNumber;
                try {
                    final VariantContext vc = codec.decode(line);
                    if ( vc != null ) {
                        calls.addAll(toVariantCalls(vc));
                    }
                }
                catch ( final TribbleException | NumberFormatException ex ) {
                    final UserException.MalformedVariant bad = new UserException.MalformedVariant(recordKey(line),
                            "record " + recordNumber + " of " + vcfPath.getFileName() + " could not be parsed: " + ex.getMessage());
                    logger.warn(bad.getMessage());
                    malformed.add(bad);
                }
            }
            logger.info("Read " + calls.size() + " variant calls for sample " + sampleName + " from " + vcfPath +
                    (malformed.isEmpty() ? "" : "; " + malformed.size() + " record(s) could not be parsed"));
            return new VariantSet(sampleName, calls, malformed);
        }
        catch ( final IOException | RuntimeIOException | TribbleException ex ) {
            throw new UserException.CouldNotReadInputFile(vcfPath, ex);
        }
    }

    private static String sampleNameOf(final VCFHeader header, final Path vcfPath) {
        return header.getGenotypeSamples().isEmpty()
                ? vcfPath.getFileName().toString()
                : header.getGenotypeSamples().get(0);
    }

    // CHROM:POS as written, since the record itself could not be decoded
    private static String recordKey(final String line) {
        final String[] fields = line.split("\t", 3);
        return fields.length < 2 ? fields[0] : fields[0] + ":" + fields[1];
    }

    /**
     * @param vc a VCF record.
     * @return one call per annotatable alternate allele of {@code vc}.
     */
    public static List<VariantCall> toVariantCalls(final VariantContext vc) {
        Utils.nonNull(vc, "vc");
        final int depth = getDepth(vc);
        final List<VariantCall> calls = new ArrayList<>(vc.getNAlleles());
        for ( final Allele alt : vc.getAlternateAlleles() ) {
            if ( alt.isSymbolic() || alt.isNoCall() || Allele.SPAN_DEL.equals(alt) ) {
                logger.warn("Skipping non-annotatable allele " + alt + " at " + vc.getContig() + ":" + vc.getStart());
                continue;
            }
            calls.add(new VariantCall(vc.getContig(), vc.getStart(), vc.getReference().getBaseString(), alt.getBaseString(), depth, vc.isNotFiltered()));
        }
        return calls;
    }

    private static int getDepth(final VariantContext vc) {
        if ( vc.hasAttribute(VCFConstants.DEPTH_KEY) ) {
            return vc.getAttributeAsInt(VCFConstants.DEPTH_KEY, 0);
        }
        if ( vc.hasGenotypes() ) {
            final Genotype genotype = vc.getGenotype(0);
            if ( genotype.hasDP() ) {
                return genotype.getDP();
            }
        }
        return 0;
    }
}

package org.mitoseeker.reference;

import htsjdk.samtools.SAMException;
import htsjdk.samtools.reference.ReferenceSequence;
import htsjdk.samtools.reference.ReferenceSequenceFile;
import htsjdk.samtools.reference.ReferenceSequenceFileFactory;
import htsjdk.samtools.util.Locatable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.mitoseeker.exceptions.UserException;
import org.mitoseeker.utils.Utils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;

/**
 * The nucleotide sequence of a single mitochondrial contig, held in memory.
 * Immutable and safe to share between threads.
 */
public final class MitochondrialReference {

    private static final Logger logger = LogManager.getLogger(MitochondrialReference.class);

    private final String contig;
    private final String bases;
    private final ReferenceBuild build;

    private MitochondrialReference(final String contig, final String bases) {
        this.contig = Utils.nonEmpty(contig, "contig");
        this.bases = Utils.nonEmpty(bases, "reference bases").toUpperCase();
        this.build = ReferenceBuild.detect(this.bases);
    }

    /**
     * @param contig name of the mitochondrial contig.
     * @param bases the complete contig sequence.
     */
    public static MitochondrialReference of(final String contig, final String bases) {
        return new MitochondrialReference(contig, bases);
    }

    /**
     * Read the mitochondrial contig out of a FASTA file.
     * A FASTA holding a single sequence is taken as is; otherwise the first sequence whose name is one of
     * {@code mitochondrialContigNames} is used.
     *
     * @param fastaPath FASTA file.  Need not be indexed.
     * @param mitochondrialContigNames names under which the mitochondrial contig may appear.
     * @return the loaded reference.
     * @throws UserException.BadConfiguration if the file cannot be read or holds no mitochondrial contig.
     */
    public static MitochondrialReference fromFasta(final Path fastaPath, final Collection<String> mitochondrialContigNames) {
        Utils.nonNull(fastaPath, "the reference path cannot be null");
        Utils.nonNull(mitochondrialContigNames, "mitochondrialContigNames");
        if ( !Files.isReadable(fastaPath) ) {
            throw new UserException.BadConfiguration("Reference " + fastaPath.toAbsolutePath() + " does not exist or is not readable.");
        }

        ReferenceSequence firstSequence = null;
        int sequenceCount = 0;
        try ( final ReferenceSequenceFile referenceFile = ReferenceSequenceFileFactory.getReferenceSequenceFile(fastaPath) ) {
            ReferenceSequence sequence;
            while ( (sequence = referenceFile.nextSequence()) != null ) {
                ++sequenceCount;
                if ( mitochondrialContigNames.contains(sequence.getName()) ) {
                    logger.info("Using contig " + sequence.getName() + " (" + sequence.length() + " bp) of " + fastaPath + " as the mitochondrial reference");
                    return new MitochondrialReference(sequence.getName(), sequence.getBaseString());
                }
                if ( firstSequence == null ) {
                    firstSequence = sequence;
                }
            }
        }
        catch ( final IOException | SAMException ex ) {
            throw new UserException.BadConfiguration("Could not read reference " + fastaPath.toAbsolutePath(), ex);
        }

        if ( sequenceCount == 1 ) {
            logger.info("Using the only contig of " + fastaPath + " (" + firstSequence.getName() + ") as the mitochondrial reference");
            return new MitochondrialReference(firstSequence.getName(), firstSequence.getBaseString());
        }
        throw new UserException.BadConfiguration("Reference " + fastaPath.toAbsolutePath() + " has no contig named any of " + mitochondrialContigNames);
    }

    /**
     * @param start 1-based inclusive start.
     * @param end 1-based inclusive end.
     * @return the upper-case bases in {@code [start, end]}.
     * @throws UserException.UnsupportedReference if the span is not within the contig.
     */
    public String getBases(final int start, final int end) {
        if ( start < 1 || end > bases.length() || end < start ) {
            throw new UserException.UnsupportedReference(
                    String.format("Span %d-%d is outside the %d bp mitochondrial reference %s", start, end, bases.length(), contig));
        }
        return bases.substring(start - 1, end);
    }

    public String getBases(final Locatable span) {
        return getBases(span.getStart(), span.getEnd());
    }

    /**
     * @return the complete upper-case contig sequence.
     */
    public String getBases() {
        return bases;
    }

    public String getContig() {
        return contig;
    }

    public int length() {
        return bases.length();
    }

    public ReferenceBuild getBuild() {
        return build;
    }

    @Override
    public String toString() {
        return "MitochondrialReference{" + contig + ", " + bases.length() + " bp, " + build + "}";
    }
}

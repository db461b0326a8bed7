package org.mitoseeker.tools;

import htsjdk.samtools.reference.FastaReferenceWriter;
import htsjdk.samtools.reference.FastaReferenceWriterBuilder;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.ArgumentCollection;
import org.broadinstitute.barclay.argparser.CommandLineArgumentParser;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.barclay.argparser.CommandLineParser;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.barclay.argparser.SpecialArgumentsCollection;
import org.mitoseeker.annotation.AnnotationContext;
import org.mitoseeker.annotation.GenomeAnnotationIndex;
import org.mitoseeker.enrichment.ImpactLookup;
import org.mitoseeker.enrichment.TableImpactLookup;
import org.mitoseeker.exceptions.UserException;
import org.mitoseeker.pipeline.AnnotatedResult;
import org.mitoseeker.pipeline.PipelineOrchestrator;
import org.mitoseeker.pipeline.PipelineResult;
import org.mitoseeker.pipeline.SetFailure;
import org.mitoseeker.reference.ConsensusSequenceBuilder;
import org.mitoseeker.reference.MitochondrialReference;
import org.mitoseeker.utils.config.ConfigFactory;
import org.mitoseeker.utils.config.MitoSeekerConfig;
import org.mitoseeker.variant.VariantSet;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Annotates the mitochondrial variant calls of one or more samples with the gene and region they fall in, their
 * position within coding genes, and the amino acid consequence of each affected codon.
 *
 * <h3>Usage example</h3>
 * <pre>
 *   java -cp mitoseeker.jar org.mitoseeker.tools.AnnotateMitochondrialVariants \
 *     -V sample1.vcf -V sample2.vcf \
 *     -R rCRS.fasta \
 *     -O annotated.tsv
 * </pre>
 * Records that could not be parsed and variant sets that failed are listed in {@code annotated.tsv.skipped.tsv},
 * or in the file given with {@code --skipped-output}.
 */
@CommandLineProgramProperties(
        summary = AnnotateMitochondrialVariants.SUMMARY,
        oneLineSummary = AnnotateMitochondrialVariants.ONE_LINE_SUMMARY,
        programGroup = MitochondrialAnalysisProgramGroup.class
)
public final class AnnotateMitochondrialVariants {

    private static final Logger logger = LogManager.getLogger(AnnotateMitochondrialVariants.class);

    static final String ONE_LINE_SUMMARY = "Annotate mitochondrial variants with genes, regions and amino acid consequences";
    static final String SUMMARY = "Locates each mitochondrial variant call on the gene/region annotation, computes its " +
            "codon coordinates within coding genes, and predicts the amino acid consequence of every codon it changes " +
            "using the vertebrate mitochondrial genetic code.  Variant sets are processed independently; a set that " +
            "cannot be processed is reported without affecting the others.";

    /**
     * exit value when an issue with the commandline is detected, ie CommandLineException.
     */
    public static final int COMMANDLINE_EXCEPTION_EXIT_VALUE = 1;

    /**
     * exit value when an unrecoverable {@link UserException} occurs
     */
    public static final int USER_EXCEPTION_EXIT_VALUE = 2;

    /**
     * exit value when any unrecoverable exception other than {@link UserException} occurs
     */
    public static final int ANY_OTHER_EXCEPTION_EXIT_VALUE = 3;

    public static final String VARIANT_LONG_NAME = "variant";
    public static final String OUTPUT_LONG_NAME = "output";
    public static final String REFERENCE_LONG_NAME = "reference";
    public static final String ANNOTATION_TABLE_LONG_NAME = "annotation-table";
    public static final String IMPACT_TABLE_LONG_NAME = "impact-table";
    public static final String CONSENSUS_OUTPUT_LONG_NAME = "consensus-output";
    public static final String FILTER_LOW_QUALITY_LONG_NAME = "filter-low-quality";
    public static final String COMPUTE_AA_CHANGES_LONG_NAME = "compute-aa-changes";
    public static final String PARALLEL_LONG_NAME = "parallel";
    public static final String THREADS_LONG_NAME = "threads";
    public static final String CONFIG_FILE_LONG_NAME = "config-file";
    public static final String SKIPPED_OUTPUT_LONG_NAME = "skipped-output";

    public static final String SKIPPED_OUTPUT_SUFFIX = ".skipped.tsv";

    @ArgumentCollection
    public SpecialArgumentsCollection specialArgumentsCollection = new SpecialArgumentsCollection();

    @Argument(shortName = "V", fullName = VARIANT_LONG_NAME,
            doc = "VCF of mitochondrial variant calls.  Each file is one variant set.")
    public List<File> variants = new ArrayList<>();

    @Argument(shortName = "O", fullName = OUTPUT_LONG_NAME,
            doc = "Tab separated output table of annotated variants and consequences.")
    public File output;

    @Argument(shortName = "R", fullName = REFERENCE_LONG_NAME, optional = true,
            doc = "FASTA holding the mitochondrial reference sequence.  Required to compute amino acid changes.")
    public File reference;

    @Argument(fullName = ANNOTATION_TABLE_LONG_NAME, optional = true,
            doc = "Gene/region annotation table.  Defaults to the configured table, or the bundled rCRS table.")
    public File annotationTable;

    @Argument(fullName = IMPACT_TABLE_LONG_NAME, optional = true,
            doc = "Tab separated pathogenicity-impact table used to enrich coding variants.")
    public File impactTable;

    @Argument(fullName = SKIPPED_OUTPUT_LONG_NAME, optional = true,
            doc = "Tab separated list of skipped records and failed variant sets.  Defaults to the output path plus " + SKIPPED_OUTPUT_SUFFIX + ".")
    public File skippedOutput;

    @Argument(fullName = CONSENSUS_OUTPUT_LONG_NAME, optional = true,
            doc = "If given, write the consensus sequence of each sample to this FASTA.  Requires an rCRS reference.")
    public File consensusOutput;

    @Argument(fullName = FILTER_LOW_QUALITY_LONG_NAME, optional = true,
            doc = "Drop calls that did not pass the caller's filters.  Overrides the configuration.")
    public Boolean filterLowQuality;

    @Argument(fullName = COMPUTE_AA_CHANGES_LONG_NAME, optional = true,
            doc = "Predict amino acid consequences of coding variants.  Overrides the configuration.")
    public Boolean computeAAChanges;

    @Argument(fullName = PARALLEL_LONG_NAME, optional = true,
            doc = "Process variant sets in parallel.  Overrides the configuration.")
    public Boolean parallel;

    @Argument(fullName = THREADS_LONG_NAME, optional = true,
            doc = "Number of worker threads for parallel processing.  Overrides the configuration.")
    public Integer threads;

    @Argument(fullName = CONFIG_FILE_LONG_NAME, optional = true,
            doc = "Properties file with MitoSeeker configuration values.")
    public String configFile;

    public static void main(final String[] args) {
        final int exitValue = new AnnotateMitochondrialVariants().instanceMain(args);
        // no explicit System.exit(0), so that a caller embedding the tool keeps running
        if ( exitValue != 0 ) {
            System.exit(exitValue);
        }
    }

    /**
     * Parse {@code args}, run the tool and translate failures into exit values.
     * @return 0 on success (including runs in which some variant sets failed), otherwise one of the exit values above.
     */
    public int instanceMain(final String[] args) {
        final CommandLineParser parser = new CommandLineArgumentParser(this);
        try {
            if ( !parser.parseArguments(System.err, args) ) {
                // help or version was requested
                return 0;
            }
            final PipelineResult result = doWork();
            logger.info("Wrote " + result.getResults().size() + " annotated variant set(s) to " + output);
            return 0;
        }
        catch ( final CommandLineException e ) {
            System.err.println(parser.usage(false, false));
            logger.error(e.getMessage());
            return COMMANDLINE_EXCEPTION_EXIT_VALUE;
        }
        catch ( final UserException e ) {
            logger.error("A USER ERROR has occurred: " + e.getMessage());
            logger.debug("User error detail", e);
            return USER_EXCEPTION_EXIT_VALUE;
        }
        catch ( final RuntimeException e ) {
            logger.error("An unexpected error has occurred", e);
            return ANY_OTHER_EXCEPTION_EXIT_VALUE;
        }
    }

    PipelineResult doWork() {
        final MitoSeekerConfig config = ConfigFactory.getInstance().createConfigFromFile(configFile);
        ConfigFactory.logConfigFields(config, Level.DEBUG);

        final List<String> contigNames = config.mitochondrial_contig_names();
        final AnnotationContext context = new AnnotationContext(loadIndex(config), loadReference(contigNames), contigNames);
        final ImpactLookup impactLookup = impactTable == null ? null : TableImpactLookup.fromTable(impactTable.toPath());

        final PipelineOrchestrator orchestrator = new PipelineOrchestrator(context,
                filterLowQuality != null ? filterLowQuality : config.filter_low_quality(),
                computeAAChanges != null ? computeAAChanges : config.compute_aa_changes(),
                parallel != null ? parallel : config.parallel(),
                threads != null ? threads : config.parallel_threads(),
                impactLookup);

        final PipelineResult result = orchestrator.runFiles(variants.stream().map(File::toPath).collect(Collectors.toList()));

        for ( final SetFailure failure : result.getFailures() ) {
            logger.warn("Variant set " + failure.getIndex() + " (" + failure.getSampleName() + ") was not annotated: " + failure.getReason());
        }

        writeResults(result.getResults());
        writeSkipped(result);
        if ( consensusOutput != null ) {
            writeConsensus(context, result);
        }
        return result;
    }

    private GenomeAnnotationIndex loadIndex(final MitoSeekerConfig config) {
        if ( annotationTable != null ) {
            return GenomeAnnotationIndex.fromTable(annotationTable.toPath());
        }
        final String configuredTable = config.annotation_table();
        if ( configuredTable != null && !configuredTable.trim().isEmpty() ) {
            return GenomeAnnotationIndex.fromTable(new File(configuredTable.trim()).toPath());
        }
        return GenomeAnnotationIndex.getRcrsIndex();
    }

    private MitochondrialReference loadReference(final List<String> contigNames) {
        return reference == null ? null : MitochondrialReference.fromFasta(reference.toPath(), contigNames);
    }

    private void writeResults(final List<AnnotatedResult> results) {
        final Path outputPath = output.toPath();
        try ( final AnnotatedResultWriter writer = new AnnotatedResultWriter(outputPath) ) {
            writer.writeAll(results);
        }
        catch ( final IOException ex ) {
            throw new UserException.CouldNotCreateOutputFile(outputPath, "the annotation table could not be written", ex);
        }
    }

    private void writeSkipped(final PipelineResult result) {
        final Path skippedPath = skippedOutput != null ? skippedOutput.toPath() : new File(output.getPath() + SKIPPED_OUTPUT_SUFFIX).toPath();
        try ( final SkippedInputWriter writer = new SkippedInputWriter(skippedPath) ) {
            writer.write(result);
        }
        catch ( final IOException ex ) {
            throw new UserException.CouldNotCreateOutputFile(skippedPath, "the skipped input list could not be written", ex);
        }
        if ( result.hasFailures() || result.getSkippedRecordCount() > 0 ) {
            logger.warn(result.getFailures().size() + " variant set(s) failed and " + result.getSkippedRecordCount() +
                    " record(s) were skipped; see " + skippedPath);
        }
    }

    private void writeConsensus(final AnnotationContext context, final PipelineResult result) {
        final ConsensusSequenceBuilder builder = new ConsensusSequenceBuilder(context.getReference());
        final Path consensusPath = consensusOutput.toPath();
        try ( final FastaReferenceWriter writer = new FastaReferenceWriterBuilder()
                .setFastaFile(consensusPath)
                .setMakeFaiOutput(false)
                .setMakeDictOutput(false)
                .build() ) {
            for ( final AnnotatedResult annotated : result.getResults() ) {
                writer.startSequence(annotated.getSampleName());
                writer.appendBases(builder.build(new VariantSet(annotated.getSampleName(), annotated.getCalls())));
            }
        }
        catch ( final IOException ex ) {
            throw new UserException.CouldNotCreateOutputFile(consensusPath, "the consensus sequences could not be written", ex);
        }
    }
}

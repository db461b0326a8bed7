package org.mitoseeker.pipeline;

import com.google.common.collect.Iterators;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.mitoseeker.annotation.AnnotationContext;
import org.mitoseeker.coding.ConsequenceAnnotation;
import org.mitoseeker.coding.ConsequencePredictor;
import org.mitoseeker.coding.DecomposedEdit;
import org.mitoseeker.coding.VariantDecomposer;
import org.mitoseeker.enrichment.ImpactEnricher;
import org.mitoseeker.enrichment.ImpactLookup;
import org.mitoseeker.exceptions.UserException;
import org.mitoseeker.locator.RegionLocator;
import org.mitoseeker.utils.Utils;
import org.mitoseeker.utils.config.MitoSeekerConfig;
import org.mitoseeker.utils.param.ParamUtils;
import org.mitoseeker.variant.AnnotatedVariant;
import org.mitoseeker.variant.VariantCall;
import org.mitoseeker.variant.VariantCallValidator;
import org.mitoseeker.variant.VariantSet;
import org.mitoseeker.variant.VcfVariantSetReader;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;
import java.util.function.IntFunction;
import java.util.stream.IntStream;

/**
 * Drives quality filtering, {@link RegionLocator}, {@link VariantDecomposer} and {@link ConsequencePredictor} over
 * a collection of {@link VariantSet}s.
 * <p>
 * Each set is processed in isolation, sequentially or on a pool of worker threads; either way the results come back
 * in input order and are identical.  Failures are contained as narrowly as possible:
 * <ul>
 *     <li>{@link UserException.BadConfiguration} aborts the run, before any set is touched when it can be detected up front</li>
 *     <li>{@link UserException.MalformedVariant} skips the offending record and is reported in its set's result</li>
 *     <li>any other failure, such as {@link UserException.UnsupportedReference} or a VCF that cannot be read, fails
 *     only its own set</li>
 * </ul>
 * </p>
 */
public final class PipelineOrchestrator {

    private static final Logger logger = LogManager.getLogger(PipelineOrchestrator.class);

    private final AnnotationContext context;
    private final RegionLocator locator;
    private final VariantDecomposer decomposer;
    private final ImpactEnricher enricher;

    private final boolean filterLowQuality;
    private final boolean computeAAChanges;
    private final boolean parallel;
    private final int numThreads;

    /**
     * @param context annotation and reference shared by every set.
     * @param filterLowQuality drop calls that did not pass upstream filters.
     * @param computeAAChanges default for {@link #run(List)}.
     * @param parallel default for {@link #run(List)}.
     * @param numThreads worker threads used for parallel runs.  Must be &gt; 0.
     * @param impactLookup optional impact source; {@code null} disables enrichment.
     */
    public PipelineOrchestrator(final AnnotationContext context,
                                final boolean filterLowQuality,
                                final boolean computeAAChanges,
                                final boolean parallel,
                                final int numThreads,
                                final ImpactLookup impactLookup) {
        this.context = Utils.nonNull(context, "context");
        this.locator = new RegionLocator(context);
        this.decomposer = new VariantDecomposer(context);
        this.enricher = impactLookup == null ? null : new ImpactEnricher(impactLookup);
        this.filterLowQuality = filterLowQuality;
        this.computeAAChanges = computeAAChanges;
        this.parallel = parallel;
        this.numThreads = ParamUtils.isPositive(numThreads, "numThreads must be > 0");
    }

    public PipelineOrchestrator(final AnnotationContext context, final MitoSeekerConfig config, final ImpactLookup impactLookup) {
        this(context,
             Utils.nonNull(config, "config").filter_low_quality(),
             config.compute_aa_changes(),
             config.parallel(),
             config.parallel_threads(),
             impactLookup);
    }

    public PipelineOrchestrator(final AnnotationContext context, final MitoSeekerConfig config) {
        this(context, config, null);
    }

    /**
     * Run with the defaults this orchestrator was configured with.
     */
    public PipelineResult run(final List<VariantSet> variantSets) {
        return run(variantSets, computeAAChanges, parallel);
    }

    /**
     * @param variantSets sets to annotate.  Must not be {@code null}.
     * @param computeAAChanges decompose coding variants and predict their consequences.
     * @param parallel process sets on {@code numThreads} worker threads.
     * @return results of the completed sets in input order, and the failed sets.
     * @throws UserException.BadConfiguration if amino acid changes are requested without a reference sequence.
     */
    public PipelineResult run(final List<VariantSet> variantSets, final boolean computeAAChanges, final boolean parallel) {
        Utils.nonNull(variantSets, "variantSets");
        Utils.containsNoNull(variantSets, "variantSets must not contain null");
        return runAll(variantSets.size(), variantSets::get, i -> variantSets.get(i).getSampleName(), computeAAChanges, parallel);
    }

    /**
     * Run over VCF files with the defaults this orchestrator was configured with.
     */
    public PipelineResult runFiles(final List<Path> vcfPaths) {
        return runFiles(vcfPaths, computeAAChanges, parallel);
    }

    /**
     * Like {@link #run(List, boolean, boolean)}, but each set is read from its VCF as part of its own unit of work.
     * A file that cannot be read fails only its own set, which is then named after the file.
     * @param vcfPaths VCF files, one per sample.  Must not be {@code null}.
     */
    public PipelineResult runFiles(final List<Path> vcfPaths, final boolean computeAAChanges, final boolean parallel) {
        Utils.nonNull(vcfPaths, "vcfPaths");
        Utils.containsNoNull(vcfPaths, "vcfPaths must not contain null");
        return runAll(vcfPaths.size(), i -> VcfVariantSetReader.read(vcfPaths.get(i)),
                i -> String.valueOf(vcfPaths.get(i).getFileName()), computeAAChanges, parallel);
    }

    private PipelineResult runAll(final int numSets,
                                  final IntFunction<VariantSet> loader,
                                  final IntFunction<String> fallbackName,
                                  final boolean computeAAChanges,
                                  final boolean parallel) {
        if ( computeAAChanges && !context.hasReference() ) {
            throw new UserException.BadConfiguration("Computing amino acid changes requires a mitochondrial reference sequence, but none was provided.");
        }

        logger.info("Annotating " + numSets + " variant set(s)" + (parallel ? " using " + numThreads + " threads" : ""));

        final Function<Integer, SetOutcome> work = i -> process(i, loader, fallbackName, computeAAChanges);
        final Iterator<Integer> indices = IntStream.range(0, numSets).boxed().iterator();
        final Iterator<SetOutcome> outcomes = parallel
                ? Utils.transformParallel(indices, work, numThreads)
                : Iterators.transform(indices, work::apply);

        final List<AnnotatedResult> results = new ArrayList<>(numSets);
        final List<SetFailure> failures = new ArrayList<>();
        while ( outcomes.hasNext() ) {
            final SetOutcome outcome = outcomes.next();
            if ( outcome.result != null ) {
                results.add(outcome.result);
            }
            else {
                failures.add(outcome.failure);
            }
        }

        final PipelineResult pipelineResult = new PipelineResult(results, failures);
        logger.info("Annotated " + results.size() + " variant set(s); " + failures.size() + " failed, " +
                pipelineResult.getSkippedRecordCount() + " record(s) skipped");
        return pipelineResult;
    }

    /**
     * Annotate a single set.  Failures are not contained here; see {@link #run(List, boolean, boolean)}.
     * @param index position of {@code variantSet} in the run's input.
     * @param variantSet the set to annotate.
     * @param computeAAChanges decompose coding variants and predict their consequences.
     * @throws UserException.UnsupportedReference if a call lies off the mitochondrial reference.
     */
    public AnnotatedResult annotate(final int index, final VariantSet variantSet, final boolean computeAAChanges) {
        Utils.nonNull(variantSet, "variantSet");
        final long startTime = System.currentTimeMillis();

        final VariantCallValidator validator = context.createValidator();
        final List<AnnotatedVariant> annotated = new ArrayList<>(variantSet.size());
        final List<ConsequenceAnnotation> consequences = new ArrayList<>();
        final List<SkippedRecord> skipped = new ArrayList<>();
        for ( final UserException.MalformedVariant unparsed : variantSet.getMalformedRecords() ) {
            skipped.add(new SkippedRecord(unparsed.getRecord(), unparsed.getMessage()));
        }
        int filtered = 0;

        for ( final VariantCall call : variantSet ) {
            if ( filterLowQuality && !call.isPassFilter() ) {
                ++filtered;
                continue;
            }
            try {
                final AnnotatedVariant located = locator.locate(validator.validate(call));
                if ( computeAAChanges ) {
                    final List<DecomposedEdit> edits = decomposer.decompose(located);
                    consequences.addAll(ConsequencePredictor.predictAll(edits));
                }
                annotated.add(located);
            }
            catch ( final UserException.MalformedVariant ex ) {
                logger.warn("Skipping variant in " + variantSet.getSampleName() + ": " + ex.getMessage());
                skipped.add(new SkippedRecord(ex.getRecord(), ex.getMessage()));
            }
        }

        final ImpactEnricher.Enrichment enrichment = enricher == null ? ImpactEnricher.Enrichment.empty() : enricher.enrich(annotated);

        if ( logger.isDebugEnabled() ) {
            logger.debug(String.format("Set %d (%s): %d located, %d filtered, %d skipped, %d consequences in %d ms",
                    index, variantSet.getSampleName(), annotated.size(), filtered, skipped.size(), consequences.size(),
                    System.currentTimeMillis() - startTime));
        }
        return new AnnotatedResult(index, variantSet.getSampleName(), annotated, consequences, skipped, filtered, enrichment);
    }

    private SetOutcome process(final int index,
                               final IntFunction<VariantSet> loader,
                               final IntFunction<String> fallbackName,
                               final boolean computeAAChanges) {
        VariantSet variantSet = null;
        try {
            variantSet = loader.apply(index);
            return new SetOutcome(annotate(index, variantSet, computeAAChanges), null);
        }
        catch ( final UserException.BadConfiguration ex ) {
            throw ex;
        }
        catch ( final RuntimeException ex ) {
            final String sampleName = variantSet != null ? variantSet.getSampleName() : fallbackName.apply(index);
            logger.warn("Failed to annotate variant set " + index + " (" + sampleName + "): " + ex.getMessage());
            logger.debug("Failure detail for variant set " + index, ex);
            return new SetOutcome(null, new SetFailure(index, sampleName, describe(ex)));
        }
    }

    private static String describe(final RuntimeException ex) {
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }

    public boolean isFilterLowQuality() {
        return filterLowQuality;
    }

    public boolean isComputeAAChanges() {
        return computeAAChanges;
    }

    public boolean isParallel() {
        return parallel;
    }

    public int getNumThreads() {
        return numThreads;
    }

    private static final class SetOutcome {
        private final AnnotatedResult result;
        private final SetFailure failure;

        private SetOutcome(final AnnotatedResult result, final SetFailure failure) {
            this.result = result;
            this.failure = failure;
        }
    }
}

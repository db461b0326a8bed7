package org.mitoseeker.locator;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.mitoseeker.annotation.AnnotationContext;
import org.mitoseeker.annotation.GenomeAnnotationIndex;
import org.mitoseeker.annotation.GenomicInterval;
import org.mitoseeker.utils.Utils;
import org.mitoseeker.variant.AnnotatedVariant;
import org.mitoseeker.variant.VariantCall;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Places variant calls on the annotation: which gene and region class they fall in, and where they sit within
 * their coding gene.
 * <p>
 * When several intervals contain a variant, a single rule is applied: the primary hit is the first hit in index
 * order (interval start, then table order), and it supplies {@code gene} and {@code region}.  Local coordinates
 * come from the first <i>coding</i> hit in that same order, so whenever the primary hit is coding every derived
 * field refers to the same interval.  All hit names are kept in {@code overlapGenes}.
 * </p>
 * <p>
 * Local coordinates are offsets from the interval start in genome orientation, regardless of strand.
 * </p>
 */
public final class RegionLocator {

    private static final Logger logger = LogManager.getLogger(RegionLocator.class);

    private final GenomeAnnotationIndex index;

    public RegionLocator(final AnnotationContext context) {
        this.index = Utils.nonNull(context, "context").getIndex();
    }

    /**
     * Locate a single call without quality filtering.
     * @param variant the call to locate.  Must not be {@code null}.
     * @return the annotated call; a call overlapping nothing is returned with all derived fields {@code null}.
     */
    public AnnotatedVariant locate(final VariantCall variant) {
        Utils.nonNull(variant, "variant");

        final List<GenomicInterval> hits = index.overlaps(variant.getPos());
        if ( hits.isEmpty() ) {
            return AnnotatedVariant.unlocated(variant);
        }

        final GenomicInterval primary = hits.get(0);
        final List<String> hitGenes = hits.stream().map(GenomicInterval::getGene).collect(Collectors.toList());
        if ( hits.size() > 1 ) {
            logger.debug("Variant " + variant.getGenomicKey() + " overlaps " + hitGenes + "; using " + primary.getGene());
        }

        final Optional<GenomicInterval> codingHit = hits.stream().filter(GenomicInterval::isCoding).findFirst();
        if ( !codingHit.isPresent() ) {
            return new AnnotatedVariant(variant, primary.getGene(), hitGenes, primary.getRegion(), null, null, null);
        }

        final GenomicInterval localInterval = codingHit.get();
        final int localStart = variant.getPos() - localInterval.getStart();
        final int localEnd = (variant.getPos() + variant.getRefAllele().length() - 1) - localInterval.getStart();
        return new AnnotatedVariant(variant, primary.getGene(), hitGenes, primary.getRegion(), localInterval, localStart, localEnd);
    }

    /**
     * @param variant the call to locate.  Must not be {@code null}.
     * @param filterLowQuality if {@code true}, calls that did not pass the upstream filters are dropped.
     * @return the annotated call, or empty if it was dropped.
     */
    public Optional<AnnotatedVariant> locate(final VariantCall variant, final boolean filterLowQuality) {
        Utils.nonNull(variant, "variant");
        if ( filterLowQuality && !variant.isPassFilter() ) {
            return Optional.empty();
        }
        return Optional.of(locate(variant));
    }

    /**
     * Re-locating an already located variant is a no-op when all of its derived fields are present.
     * @param variant a previously located variant.  Must not be {@code null}.
     * @param filterLowQuality if {@code true}, calls that did not pass the upstream filters are dropped.
     * @return {@code variant} itself when it is fully annotated, otherwise a fresh annotation of its call.
     */
    public Optional<AnnotatedVariant> locate(final AnnotatedVariant variant, final boolean filterLowQuality) {
        Utils.nonNull(variant, "variant");
        if ( filterLowQuality && !variant.getCall().isPassFilter() ) {
            return Optional.empty();
        }
        if ( variant.isFullyAnnotated() ) {
            return Optional.of(variant);
        }
        return Optional.of(locate(variant.getCall()));
    }

    /**
     * Locate every call of a batch, preserving input order.
     * @param variants the calls to locate.  Must not be {@code null}.
     * @param filterLowQuality if {@code true}, calls that did not pass the upstream filters are left out of the result.
     * @return the located calls in input order.
     */
    public List<AnnotatedVariant> locateAll(final List<VariantCall> variants, final boolean filterLowQuality) {
        Utils.nonNull(variants, "variants");
        final List<AnnotatedVariant> located = new ArrayList<>(variants.size());
        for ( final VariantCall variant : variants ) {
            locate(variant, filterLowQuality).ifPresent(located::add);
        }
        return located;
    }
}

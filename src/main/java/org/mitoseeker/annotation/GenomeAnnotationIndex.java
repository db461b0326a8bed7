package org.mitoseeker.annotation;

import htsjdk.samtools.util.Interval;
import htsjdk.samtools.util.OverlapDetector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.mitoseeker.exceptions.UserException;
import org.mitoseeker.utils.Utils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only index of the annotated intervals of a single mitochondrial contig.
 * <p>
 * Mitochondrial genes legitimately overlap (ATP8/ATP6, ND4L/ND4, adjacent tRNAs), so every query
 * returns all of the intervals containing a position.  Hits are ordered by interval start, with ties
 * broken by the order in which the intervals appeared in the annotation table.
 * </p>
 * <p>
 * Instances never change after construction and may be shared freely between threads.
 * The bundled rCRS table is available through {@link #getRcrsIndex()}, which loads it the first time it is asked for.
 * </p>
 */
public final class GenomeAnnotationIndex {

    private static final Logger logger = LogManager.getLogger(GenomeAnnotationIndex.class);

    /** Class path location of the bundled rCRS gene/region table. */
    public static final String RCRS_ANNOTATION_RESOURCE = "org/mitoseeker/annotation/mtAnno.rCRS.tsv";

    private final String contig;

    /** Sorted by start; the sort is stable so table order breaks ties. */
    private final List<GenomicInterval> intervals;
    private final List<GenomicInterval> codingIntervals;

    /** Maps each interval to its index in {@link #intervals}. */
    private final OverlapDetector<Integer> overlapDetector;

    /**
     * @param tableOrderIntervals the annotation records in the order in which they appear in their source table.
     *                            Must be non-empty and all on one contig.
     */
    public GenomeAnnotationIndex(final List<GenomicInterval> tableOrderIntervals) {
        Utils.nonNull(tableOrderIntervals, "intervals");
        if ( tableOrderIntervals.isEmpty() ) {
            throw new UserException.BadConfiguration("The annotation table contains no intervals.");
        }
        Utils.containsNoNull(tableOrderIntervals, "intervals must not contain null");

        final Set<String> contigs = tableOrderIntervals.stream().map(GenomicInterval::getContig).collect(Collectors.toSet());
        if ( contigs.size() != 1 ) {
            throw new UserException.BadConfiguration("The annotation table must describe a single mitochondrial contig, but found: " + contigs);
        }
        this.contig = contigs.iterator().next();

        final List<GenomicInterval> sorted = new ArrayList<>(tableOrderIntervals);
        sorted.sort(Comparator.comparingInt(GenomicInterval::getStart));
        this.intervals = Collections.unmodifiableList(sorted);
        this.codingIntervals = Collections.unmodifiableList(
                sorted.stream().filter(GenomicInterval::isCoding).collect(Collectors.toList()));

        overlapDetector = new OverlapDetector<>(0, 0);
        for ( int i = 0; i < sorted.size(); ++i ) {
            overlapDetector.addLhs(i, sorted.get(i));
        }

        logger.debug("Indexed " + intervals.size() + " annotation intervals (" + codingIntervals.size() + " coding) on " + contig);
    }

    /**
     * @return the bundled rCRS annotation, loaded on first use.
     */
    public static GenomeAnnotationIndex getRcrsIndex() {
        return RcrsIndexHolder.INSTANCE;
    }

    /**
     * Load an index from a tab-separated annotation table on disk.
     * @param tablePath Path to the annotation table.  Must not be {@code null}.
     * @return the loaded index.
     * @throws UserException.BadConfiguration if the table is absent or malformed.
     */
    public static GenomeAnnotationIndex fromTable(final Path tablePath) {
        return new GenomeAnnotationIndex(GenomeAnnotationTableReader.readTable(tablePath));
    }

    /**
     * All intervals containing {@code position}, ordered by interval start (ties in table order).
     * @param position 1-based position on the mitochondrial contig.
     * @return an unmodifiable list of hits; empty if no interval contains {@code position}.
     */
    public List<GenomicInterval> overlaps(final int position) {
        if ( position < 1 ) {
            return Collections.emptyList();
        }
        final Set<Integer> hits = overlapDetector.getOverlaps(new Interval(contig, position, position));
        if ( hits.isEmpty() ) {
            return Collections.emptyList();
        }
        return hits.stream()
                .sorted()
                .map(intervals::get)
                .collect(Collectors.collectingAndThen(Collectors.toList(), Collections::unmodifiableList));
    }

    /**
     * The coding intervals containing {@code position}, in the same order as {@link #overlaps(int)}.
     */
    public List<GenomicInterval> codingOverlaps(final int position) {
        return overlaps(position).stream()
                .filter(GenomicInterval::isCoding)
                .collect(Collectors.collectingAndThen(Collectors.toList(), Collections::unmodifiableList));
    }

    /**
     * @return every interval whose region class is {@link RegionClass#CODING}, ordered by start.
     */
    public List<GenomicInterval> codingIntervals() {
        return codingIntervals;
    }

    /**
     * @return every interval in the index, ordered by start.
     */
    public List<GenomicInterval> getIntervals() {
        return intervals;
    }

    /**
     * @return the first interval (by start) annotated with the given gene name.
     */
    public Optional<GenomicInterval> getInterval(final String gene) {
        return intervals.stream().filter(i -> i.getGene().equals(gene)).findFirst();
    }

    /**
     * @return the contig all intervals in this index lie on.
     */
    public String getContig() {
        return contig;
    }

    /**
     * @return the largest end coordinate of any interval.
     */
    public int getMaxEnd() {
        return intervals.stream().mapToInt(GenomicInterval::getEnd).max().orElse(0);
    }

    private static final class RcrsIndexHolder {
        private static final GenomeAnnotationIndex INSTANCE =
                new GenomeAnnotationIndex(GenomeAnnotationTableReader.readResource(RCRS_ANNOTATION_RESOURCE));
    }
}

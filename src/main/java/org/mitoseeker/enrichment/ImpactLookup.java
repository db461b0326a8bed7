package org.mitoseeker.enrichment;

import java.util.List;

/**
 * Source of pathogenicity-impact data for mitochondrial variants.
 * <p>
 * Implementations are looked up by genomic key ({@code chrom:pos ref>alt}) and may answer with every record known at
 * that position, including ones for other alleles; {@link ImpactEnricher} narrows them down.
 * Implementations must be safe to call from several threads at once.
 * </p>
 */
public interface ImpactLookup {

    /**
     * @param genomicKey {@code chrom:pos ref>alt} key of the variant.
     * @return the impact records for the variant's position, possibly empty.  Never {@code null}.
     * @throws EnrichmentUnavailableException if the source cannot be consulted.
     */
    List<ImpactRecord> lookup(String genomicKey);
}

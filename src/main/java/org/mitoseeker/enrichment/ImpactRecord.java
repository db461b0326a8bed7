package org.mitoseeker.enrichment;

import org.mitoseeker.utils.Utils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One pathogenicity-impact entry for a mitochondrial variant, as returned by an {@link ImpactLookup}.
 */
public final class ImpactRecord {

    private final String genomicKey;
    private final String gene;
    private final String proteinChange;
    private final Map<String, String> fields;

    /**
     * @param genomicKey {@code chrom:pos ref>alt} of the variant this record describes.
     * @param gene gene symbol.
     * @param proteinChange protein change, e.g. {@code p.A12T}.
     * @param fields any further source-specific columns, in source order.
     */
    public ImpactRecord(final String genomicKey, final String gene, final String proteinChange, final Map<String, String> fields) {
        this.genomicKey = Utils.nonNull(genomicKey, "genomicKey");
        this.gene = Utils.nonNull(gene, "gene");
        this.proteinChange = Utils.nonNull(proteinChange, "proteinChange");
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(Utils.nonNull(fields, "fields")));
    }

    public String getGenomicKey() {
        return genomicKey;
    }

    public String getGene() {
        return gene;
    }

    public String getProteinChange() {
        return proteinChange;
    }

    public Map<String, String> getFields() {
        return fields;
    }

    /**
     * @return gene and protein change together, e.g. {@code ND1 p.A12T}.
     */
    public String getChange() {
        return gene + " " + proteinChange;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final ImpactRecord that = (ImpactRecord) o;
        return genomicKey.equals(that.genomicKey) &&
                gene.equals(that.gene) &&
                proteinChange.equals(that.proteinChange) &&
                fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(genomicKey, gene, proteinChange, fields);
    }

    @Override
    public String toString() {
        return genomicKey + " " + getChange();
    }
}

package org.mitoseeker.enrichment;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.mitoseeker.utils.Utils;
import org.mitoseeker.variant.AnnotatedVariant;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Attaches {@link ImpactRecord}s from an {@link ImpactLookup} to coding variants.
 * <p>
 * Enrichment is strictly additive: when the lookup is unavailable for a variant, the variant is recorded as having no
 * impact data and the run continues.
 * </p>
 */
public final class ImpactEnricher {

    private static final Logger logger = LogManager.getLogger(ImpactEnricher.class);

    private final ImpactLookup lookup;

    public ImpactEnricher(final ImpactLookup lookup) {
        this.lookup = Utils.nonNull(lookup, "lookup");
    }

    /**
     * Look up every coding variant in {@code variants}.  Non-coding variants are ignored.
     * @param variants located variants, in output order.
     * @return the impact records found (keyed by genomic key, in variant order) and the keys whose lookup failed.
     */
    public Enrichment enrich(final List<AnnotatedVariant> variants) {
        Utils.nonNull(variants, "variants");

        final Map<String, List<ImpactRecord>> impacts = new LinkedHashMap<>();
        final List<String> unavailable = new ArrayList<>();

        for ( final AnnotatedVariant variant : variants ) {
            if ( !variant.isCoding() ) {
                continue;
            }
            final String key = variant.getCall().getGenomicKey();
            if ( impacts.containsKey(key) || unavailable.contains(key) ) {
                continue;
            }
            try {
                final List<ImpactRecord> hits = selectRecords(key, lookup.lookup(key));
                if ( !hits.isEmpty() ) {
                    impacts.put(key, hits);
                }
            }
            catch ( final EnrichmentUnavailableException ex ) {
                logger.warn("No impact data for " + key + ": " + ex.getMessage());
                unavailable.add(key);
            }
        }
        return new Enrichment(impacts, unavailable);
    }

    /**
     * Records for exactly {@code genomicKey} when there are any, otherwise everything the lookup returned for
     * the position.
     */
    static List<ImpactRecord> selectRecords(final String genomicKey, final List<ImpactRecord> records) {
        if ( records == null || records.isEmpty() ) {
            return Collections.emptyList();
        }
        final List<ImpactRecord> exact = records.stream()
                .filter(r -> r.getGenomicKey().equals(genomicKey))
                .collect(Collectors.toList());
        return exact.isEmpty() ? Collections.unmodifiableList(new ArrayList<>(records)) : Collections.unmodifiableList(exact);
    }

    /**
     * Outcome of {@link #enrich(List)}.
     */
    public static final class Enrichment {
        private final Map<String, List<ImpactRecord>> impacts;
        private final List<String> unavailableKeys;

        public Enrichment(final Map<String, List<ImpactRecord>> impacts, final List<String> unavailableKeys) {
            this.impacts = Collections.unmodifiableMap(new LinkedHashMap<>(impacts));
            this.unavailableKeys = Collections.unmodifiableList(new ArrayList<>(unavailableKeys));
        }

        public static Enrichment empty() {
            return new Enrichment(Collections.emptyMap(), Collections.emptyList());
        }

        public Map<String, List<ImpactRecord>> getImpacts() {
            return impacts;
        }

        public List<String> getUnavailableKeys() {
            return unavailableKeys;
        }

        @Override
        public boolean equals(final Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            final Enrichment that = (Enrichment) o;
            return impacts.equals(that.impacts) && unavailableKeys.equals(that.unavailableKeys);
        }

        @Override
        public int hashCode() {
            return 31 * impacts.hashCode() + unavailableKeys.hashCode();
        }
    }
}

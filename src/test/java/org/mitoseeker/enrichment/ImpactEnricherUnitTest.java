package org.mitoseeker.enrichment;

import org.mitoseeker.MitoSeekerBaseTest;
import org.mitoseeker.locator.RegionLocator;
import org.mitoseeker.variant.AnnotatedVariant;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

public class ImpactEnricherUnitTest extends MitoSeekerBaseTest {

    private static final ImpactRecord P1L = new ImpactRecord("chrM:3308 C>T", "ND1", "p.P1L", Collections.emptyMap());
    private static final ImpactRecord P1H = new ImpactRecord("chrM:3308 C>A", "ND1", "p.P1H", Collections.emptyMap());

    private final RegionLocator locator = new RegionLocator(createRcrsContext());

    @Test
    public void testSelectRecordsPrefersExactMatch() {
        Assert.assertEquals(ImpactEnricher.selectRecords("chrM:3308 C>T", Arrays.asList(P1L, P1H)), Collections.singletonList(P1L));
    }

    @Test
    public void testSelectRecordsFallsBackToPosition() {
        Assert.assertEquals(ImpactEnricher.selectRecords("chrM:3308 C>G", Arrays.asList(P1L, P1H)), Arrays.asList(P1L, P1H));
        Assert.assertTrue(ImpactEnricher.selectRecords("chrM:3308 C>G", Collections.emptyList()).isEmpty());
        Assert.assertTrue(ImpactEnricher.selectRecords("chrM:3308 C>G", null).isEmpty());
    }

    @Test
    public void testOnlyCodingVariantsAreLookedUp() {
        final List<String> queried = new ArrayList<>();
        final ImpactEnricher enricher = new ImpactEnricher(key -> {
            queried.add(key);
            return Arrays.asList(P1L, P1H);
        });

        final List<AnnotatedVariant> variants = locator.locateAll(Arrays.asList(
                call(73, "C", "T"), call(3308, "C", "T"), call(4300, "C", "G"), call(3308, "C", "T")), false);
        final ImpactEnricher.Enrichment enrichment = enricher.enrich(variants);

        Assert.assertEquals(queried, Collections.singletonList("chrM:3308 C>T"));
        final Map<String, List<ImpactRecord>> impacts = enrichment.getImpacts();
        Assert.assertEquals(impacts, Collections.singletonMap("chrM:3308 C>T", Collections.singletonList(P1L)));
        Assert.assertTrue(enrichment.getUnavailableKeys().isEmpty());
    }

    @Test
    public void testUnavailableLookupIsRecorded() {
        final ImpactEnricher enricher = new ImpactEnricher(key -> {
            if ( key.startsWith("chrM:3308") ) {
                throw new EnrichmentUnavailableException("timed out");
            }
            return Collections.emptyList();
        });

        final ImpactEnricher.Enrichment enrichment = enricher.enrich(
                locator.locateAll(Arrays.asList(call(3308, "C", "T"), call(3311, "C", "A")), false));
        Assert.assertTrue(enrichment.getImpacts().isEmpty());
        Assert.assertEquals(enrichment.getUnavailableKeys(), Collections.singletonList("chrM:3308 C>T"));
    }

    @Test
    public void testEmpty() {
        Assert.assertEquals(new ImpactEnricher(key -> Collections.emptyList()).enrich(Collections.emptyList()), ImpactEnricher.Enrichment.empty());
    }
}

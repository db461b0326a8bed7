package org.mitoseeker.utils.config;

import org.apache.logging.log4j.Level;
import org.mitoseeker.MitoSeekerBaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

public class ConfigFactoryUnitTest extends MitoSeekerBaseTest {

    private final ConfigFactory configFactory = ConfigFactory.getInstance();

    @Test
    public void testDefaults() {
        final MitoSeekerConfig config = configFactory.createMitoSeekerConfig(Collections.emptyMap());
        Assert.assertFalse(config.filter_low_quality());
        Assert.assertTrue(config.compute_aa_changes());
        Assert.assertFalse(config.parallel());
        Assert.assertEquals(config.parallel_threads(), 4);
        Assert.assertEquals(config.mitochondrial_contig_names(), Arrays.asList("chrM", "MT", "M", "rCRS", "RSRS"));
        Assert.assertTrue(config.annotation_table().isEmpty());
    }

    @Test
    public void testOverrides() {
        final Map<String, String> overrides = new HashMap<>();
        overrides.put("parallel", "true");
        overrides.put("parallel_threads", "12");
        overrides.put("mitochondrial_contig_names", "chrMT");

        final MitoSeekerConfig config = configFactory.createMitoSeekerConfig(overrides);
        Assert.assertTrue(config.parallel());
        Assert.assertEquals(config.parallel_threads(), 12);
        Assert.assertEquals(config.mitochondrial_contig_names(), Collections.singletonList("chrMT"));
        Assert.assertTrue(config.compute_aa_changes());
    }

    @Test
    public void testConfigFromFile() throws IOException {
        final Path configFile = createTempPath("testConfig", ".properties");
        Files.write(configFile, ("parallel_threads = 7\n" + "filter_low_quality = true\n").getBytes(StandardCharsets.UTF_8));

        final MitoSeekerConfig config = configFactory.createConfigFromFile(configFile.toString());
        Assert.assertEquals(config.parallel_threads(), 7);
        Assert.assertTrue(config.filter_low_quality());
        Assert.assertTrue(config.compute_aa_changes());

        // the file must not leak into configurations created afterwards
        final MitoSeekerConfig later = configFactory.createConfigFromFile(null);
        Assert.assertEquals(later.parallel_threads(), 4);
        Assert.assertFalse(later.filter_low_quality());
    }

    @Test
    public void testCachedConfig() {
        Assert.assertSame(configFactory.getMitoSeekerConfig(), configFactory.getMitoSeekerConfig());
    }

    @Test
    public void testGetSourcesAnnotationPathVariables() {
        Assert.assertEquals(configFactory.getSourcesAnnotationPathVariables(MitoSeekerConfig.class),
                Collections.singletonList(MitoSeekerConfig.CONFIG_FILE_VARIABLE_FILE_NAME));
    }

    @Test
    public void testUnsetPathVariableFallsThrough() {
        final String property = "ConfigFactoryUnitTest.unsetPath";
        configFactory.checkFileNamePropertyExistenceAndSetConfigFactoryProperties(Collections.singletonList(property));
        Assert.assertEquals(org.aeonbits.owner.ConfigFactory.getProperty(property), ConfigFactory.NO_PATH_VARIABLE_VALUE);
        org.aeonbits.owner.ConfigFactory.clearProperty(property);
    }

    @Test
    public void testLogConfigFields() {
        ConfigFactory.logConfigFields(configFactory.createMitoSeekerConfig(Collections.emptyMap()), Level.INFO);
    }
}

package org.mitoseeker.utils.config;

import com.google.common.annotations.VisibleForTesting;
import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Config;
import org.aeonbits.owner.ConfigCache;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.mitoseeker.utils.Utils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A singleton class to act as a user interface for loading configuration files from {@link org.aeonbits.owner}.
 * Path variables in {@link org.aeonbits.owner.Config.Sources} annotations are resolved before a configuration is
 * created, so an unset variable falls through to the next source instead of being read as a literal path.
 */
public final class ConfigFactory {

    private static final Logger logger = LogManager.getLogger(ConfigFactory.class);

    //=======================================
    // Singleton members / methods:
    private static final ConfigFactory instance;

    static {
        instance = new ConfigFactory();
    }

    /**
     * @return An instance of this {@link ConfigFactory}, which can be used to create a configuration.
     */
    public static ConfigFactory getInstance() {
        return instance;
    }

    // This class is a singleton, so no public construction.
    private ConfigFactory() {}

    //=======================================

    /**
     * A regex to use to look for variables in the Sources annotation
     */
    private static final Pattern sourcesAnnotationPathVariablePattern = Pattern.compile("\\$\\{(.*)}");

    /**
     * Value to set each variable for configuration file paths when the variable
     * has not been set in either Java System properties or environment properties.
     */
    @VisibleForTesting
    static final String NO_PATH_VARIABLE_VALUE = "/dev/null";

    /**
     * A set to keep track of the classes we've already resolved for configuration path purposes:
     */
    private final Set<Class<? extends Config>> alreadyResolvedPathVariables = new HashSet<>();

    /**
     * Quick way to get the MitoSeeker configuration.
     * @return The cached MitoSeeker configuration.
     */
    public MitoSeekerConfig getMitoSeekerConfig() {
        return getOrCreate(MitoSeekerConfig.class);
    }

    /**
     * Creates a new, uncached MitoSeeker configuration and then sets the given properties on it, so that they take
     * precedence over every configuration source.
     * @param overrides property keys and values to set.  Must not be {@code null}.
     */
    public MitoSeekerConfig createMitoSeekerConfig(final Map<String, String> overrides) {
        Utils.nonNull(overrides, "overrides");
        final MitoSeekerConfig config = create(MitoSeekerConfig.class);
        for ( final Map.Entry<String, String> entry : overrides.entrySet() ) {
            config.setProperty(entry.getKey(), entry.getValue());
        }
        return config;
    }

    /**
     * Creates a new MitoSeeker configuration, reading {@code configFileName} ahead of the default sources.
     * @param configFileName path to a properties file, or {@code null} to use only the default sources.
     */
    public synchronized MitoSeekerConfig createConfigFromFile(final String configFileName) {
        if ( configFileName == null ) {
            return create(MitoSeekerConfig.class);
        }
        resolvePathVariables(MitoSeekerConfig.class);

        // The file only applies to this configuration, so the previous path is restored once it has been read:
        final String previousPath = org.aeonbits.owner.ConfigFactory.getProperty(MitoSeekerConfig.CONFIG_FILE_VARIABLE_FILE_NAME);
        org.aeonbits.owner.ConfigFactory.setProperty(MitoSeekerConfig.CONFIG_FILE_VARIABLE_FILE_NAME, configFileName);
        try {
            return create(MitoSeekerConfig.class);
        }
        finally {
            if ( previousPath == null ) {
                org.aeonbits.owner.ConfigFactory.clearProperty(MitoSeekerConfig.CONFIG_FILE_VARIABLE_FILE_NAME);
            }
            else {
                org.aeonbits.owner.ConfigFactory.setProperty(MitoSeekerConfig.CONFIG_FILE_VARIABLE_FILE_NAME, previousPath);
            }
        }
    }

    /**
     * Creates a new, uncached {@link Config} instance from the specified interface.
     *
     * @param clazz   the interface extending from {@link Config} that you want to instantiate.
     * @param imports additional variables to be used to resolve the properties.
     * @param <T>     type of the interface.
     * @return an object implementing the given interface, which maps methods to property values.
     */
    public <T extends Config> T create(final Class<? extends T> clazz, final Map<?, ?>... imports) {
        Utils.nonNull(clazz);
        resolvePathVariables(clazz);
        return org.aeonbits.owner.ConfigFactory.create(clazz, imports);
    }

    /**
     * Gets from the cache or creates an instance of the given class using the given imports.
     *
     * @param clazz     the interface extending from {@link Config} that you want to instantiate.
     * @param imports   additional variables to be used to resolve the properties.
     * @param <T>       type of the interface.
     * @return          an object implementing the given interface, that can be taken from the cache.
     */
    public <T extends Config> T getOrCreate(final Class<? extends T> clazz, final Map<?, ?>... imports) {
        Utils.nonNull(clazz);
        resolvePathVariables(clazz);
        return ConfigCache.getOrCreate(clazz, imports);
    }

    /**
     * Checks each of the given {@code filenameProperties} for if they are defined in system or environment properties.
     * If they are not, this method will set them in the {@link org.aeonbits.owner.ConfigFactory} to a path that
     * contains nothing so the source is skipped.
     */
    @VisibleForTesting
    void checkFileNamePropertyExistenceAndSetConfigFactoryProperties(final List<String> filenameProperties) {
        final Map<String, String> environmentProperties = System.getenv();

        for ( final String property : filenameProperties ) {
            if ( environmentProperties.containsKey(property) ) {
                logger.debug("Config path variable found in Environment Properties: " + property + "=" + environmentProperties.get(property) + " - will search for config here.");
            }
            else if ( System.getProperties().containsKey(property) ) {
                logger.debug("Config path variable found in System Properties: " + property + "=" + System.getProperty(property) + " - will search for config here.");
            }
            else if ( org.aeonbits.owner.ConfigFactory.getProperties().containsKey(property) ) {
                logger.debug("Config path variable found in Config Factory Properties: " + property + "=" + org.aeonbits.owner.ConfigFactory.getProperty(property) + " - will search for config here.");
            }
            else {
                logger.debug("Config path variable not found: " + property + " - setting value to default empty variable: " + NO_PATH_VARIABLE_VALUE);
                org.aeonbits.owner.ConfigFactory.setProperty(property, NO_PATH_VARIABLE_VALUE);
            }
        }
    }

    /**
     * Get a list of the config file variables from the given {@link Config} class.
     * @param configClass A configuration class from which to extract variable names in its {@link org.aeonbits.owner.Config.Sources}.
     * @return A list of variables in the {@link org.aeonbits.owner.Config.Sources} of the given {@code configClass}
     */
    @VisibleForTesting
    <T extends Config> List<String> getSourcesAnnotationPathVariables(final Class<? extends T> configClass) {
        final List<String> configPathVariableNames = new ArrayList<>();

        final Config.Sources annotation = configClass.getAnnotation(Config.Sources.class);
        if ( annotation != null ) {
            for ( final String val : annotation.value() ) {
                final Matcher m = sourcesAnnotationPathVariablePattern.matcher(val);
                if ( m.find() ) {
                    configPathVariableNames.add(m.group(1));
                }
            }
        }
        return configPathVariableNames;
    }

    private synchronized <T extends Config> void resolvePathVariables(final Class<? extends T> clazz) {
        if ( !alreadyResolvedPathVariables.contains(clazz) ) {
            checkFileNamePropertyExistenceAndSetConfigFactoryProperties(getSourcesAnnotationPathVariables(clazz));
            alreadyResolvedPathVariables.add(clazz);
        }
    }

    /**
     * Logs all the parameters in the given {@link Accessible} config at the given level, sorted by key.
     */
    public static void logConfigFields(final Accessible config, final Level level) {
        Utils.nonNull(config);
        Utils.nonNull(level);

        // Only continue in this method here if we would log the given level:
        if ( !logger.isEnabled(level) ) {
            return;
        }

        logger.log(level, "Configuration file values: ");
        for ( final String key : new TreeSet<>(config.propertyNames()) ) {
            logger.log(level, "\t" + key + " = " + config.getProperty(key));
        }
    }
}

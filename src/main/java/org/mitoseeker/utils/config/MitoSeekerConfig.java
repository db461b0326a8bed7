package org.mitoseeker.utils.config;

import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Config.LoadPolicy;
import org.aeonbits.owner.Config.LoadType;
import org.aeonbits.owner.Config.Sources;
import org.aeonbits.owner.Mutable;

import java.util.List;

/**
 * Configuration file for MitoSeeker options.
 * All specified {@code Sources} will be loaded.
 * The {@link LoadPolicy} is set to {@link LoadType#MERGE}, which specifies that if a configuration option is not found
 * in the first source, the option will be sought in all following sources until a definition is found.
 * If the option is not specified in any file, the coded default value will be used (as defined by @DefaultValue).
 *
 * The load order is always resolved "top-down" by declaration order in the @Sources annotation.
 *
 * In this case, the load order is:
 *        1)   "file:${" + MitoSeekerConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
 *        2)   "file:MitoSeekerConfig.properties",
 *        3)   "classpath:org/mitoseeker/utils/config/MitoSeekerConfig.properties"
 *        4)   hard-coded values specified by @DefaultValue
 *
 */
@LoadPolicy(LoadType.MERGE)
@Sources({
        "file:${" + MitoSeekerConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",          // Variable for file loading
        "file:MitoSeekerConfig.properties",                                         // Default path
        "classpath:org/mitoseeker/utils/config/MitoSeekerConfig.properties"         // Class path
})
public interface MitoSeekerConfig extends Mutable, Accessible {

    /**
     * Name of the configuration file variable to be used in the {@link Sources} annotation for {@link MitoSeekerConfig}
     * as a place to find the configuration file corresponding to this interface.
     */
    String CONFIG_FILE_VARIABLE_FILE_NAME = "MitoSeekerConfig.pathToConfig";

    // ----------------------------------------------------------
    // Pipeline Options:
    // ----------------------------------------------------------

    /**
     * Drop calls that did not pass the upstream caller's filters before locating them.
     */
    @Key("filter_low_quality")
    @DefaultValue("false")
    boolean filter_low_quality();

    /**
     * Decompose coding variants into codons and predict their amino acid consequences.
     * Requires a reference sequence.
     */
    @Key("compute_aa_changes")
    @DefaultValue("true")
    boolean compute_aa_changes();

    @Key("parallel")
    @DefaultValue("false")
    boolean parallel();

    @Key("parallel_threads")
    @DefaultValue("4")
    int parallel_threads();

    // ----------------------------------------------------------
    // Reference Options:
    // ----------------------------------------------------------

    /**
     * Contig names under which the mitochondrial genome may appear in inputs.
     */
    @Key("mitochondrial_contig_names")
    @DefaultValue("chrM,MT,M,rCRS,RSRS")
    List<String> mitochondrial_contig_names();

    /**
     * Gene/region annotation table.  Empty means the bundled rCRS table.
     */
    @Key("annotation_table")
    @DefaultValue("")
    String annotation_table();
}

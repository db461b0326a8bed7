package org.mitoseeker.tools;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;

/**
 * Tools that annotate mitochondrial variant calls.
 */
public class MitochondrialAnalysisProgramGroup implements CommandLineProgramGroup {

    @Override
    public String getName() { return "Mitochondrial Analysis"; }

    @Override
    public String getDescription() { return "Tools that annotate mitochondrial variant calls with genes, regions and amino acid consequences"; }
}

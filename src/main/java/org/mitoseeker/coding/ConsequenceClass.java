package org.mitoseeker.coding;

/**
 * Classification of the amino acid effect of a {@link DecomposedEdit}.
 */
public enum ConsequenceClass {
    SYNONYMOUS("synonymous"),
    MISSENSE("missense"),
    NONSENSE("nonsense"),
    READTHROUGH("readthrough"),
    FRAMESHIFT("frameshift"),
    UNKNOWN("unknown");

    private final String tag;

    ConsequenceClass(final String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    @Override
    public String toString() {
        return tag;
    }
}

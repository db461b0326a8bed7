package org.mitoseeker.annotation;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Categorical tag on a {@link GenomicInterval}.
 */
public enum RegionClass {
    CODING("coding"),
    TRNA("tRNA"),
    RRNA("rRNA"),
    CONTROL("control"),
    NONCODING("noncoding");

    private static final Map<String, RegionClass> BY_TAG =
            Arrays.stream(values()).collect(Collectors.toMap(RegionClass::getTag, Function.identity()));

    private final String tag;

    RegionClass(final String tag) {
        this.tag = tag;
    }

    /**
     * @return the tag used for this region class in annotation tables and output.
     */
    public String getTag() {
        return tag;
    }

    /**
     * @param tag a region tag exactly as it appears in an annotation table (case-sensitive).
     * @return the matching {@link RegionClass}, or {@code null} if {@code tag} is not a known region class.
     */
    public static RegionClass fromTag(final String tag) {
        return tag == null ? null : BY_TAG.get(tag);
    }

    @Override
    public String toString() {
        return tag;
    }
}

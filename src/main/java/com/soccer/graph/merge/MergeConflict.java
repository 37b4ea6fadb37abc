package com.soccer.graph.merge;

/**
 * A value rejected because the stored value may not change. The stored value is kept.
 *
 * @param element       node kind label or relationship kind name
 * @param key           identity key of the node or relationship
 * @param field         the field that disagreed
 * @param storedValue   the value kept
 * @param rejectedValue the value refused
 * @param source        adapter that supplied the rejected value
 */
public record MergeConflict(
        String element,
        String key,
        String field,
        Object storedValue,
        Object rejectedValue,
        String source
) {
    @Override
    public String toString() {
        return element + "[" + key + "]." + field + ": kept=" + storedValue
                + " rejected=" + rejectedValue + " (" + source + ")";
    }
}

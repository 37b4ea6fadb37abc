package com.soccer.graph.core.model;

/**
 * How a stored field reacts when a later record supplies a value for it.
 */
public enum FieldPolicy {
    /** Part of the identity key; never changes after creation. */
    IDENTITY,
    /** Set once. A later differing value is rejected and reported as a conflict. */
    IMMUTABLE,
    /** Written only while the stored value is absent. */
    FILL_IF_UNSET,
    /** Volatile: the latest writer wins. */
    OVERWRITE,
    /** Set-valued: incoming values are unioned into the stored set. */
    ACCUMULATE
}

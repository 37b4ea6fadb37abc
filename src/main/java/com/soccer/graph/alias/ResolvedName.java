package com.soccer.graph.alias;

import java.util.Objects;

/**
 * Outcome of resolving a raw name.
 *
 * @param canonicalName the canonical display form
 * @param region        region code taken from a {@code -XX} suffix, or null
 * @param input         the raw name as it appeared in the source
 * @param known         false when no alias matched and the input itself was used
 */
public record ResolvedName(String canonicalName, String region, String input, boolean known) {

    public ResolvedName {
        Objects.requireNonNull(canonicalName, "canonicalName is required");
    }

    public static ResolvedName of(String canonicalName) {
        return new ResolvedName(canonicalName, null, canonicalName, true);
    }

    public boolean hasRegion() {
        return region != null;
    }
}

package com.soccer.graph.alias;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Known two-letter region codes that may trail a name as {@code -XX}.
 */
public final class RegionCodes {

    private static final Pattern SUFFIX = Pattern.compile("^(.*\\S)\\s*-\\s*([A-Za-z]{2})$");

    private static final RegionCodes BRAZILIAN_STATES = new RegionCodes(Set.of(
            "AC", "AL", "AM", "AP", "BA", "CE", "DF", "ES", "GO", "MA", "MG", "MS", "MT", "PA",
            "PB", "PE", "PI", "PR", "RJ", "RN", "RO", "RR", "RS", "SC", "SE", "SP", "TO"));

    private final Set<String> codes;

    public RegionCodes(Set<String> codes) {
        this.codes = Set.copyOf(codes);
    }

    /**
     * The 27 federative units of Brazil.
     */
    public static RegionCodes brazilianStates() {
        return BRAZILIAN_STATES;
    }

    public boolean contains(String code) {
        return code != null && codes.contains(code.toUpperCase(Locale.ROOT));
    }

    public Set<String> codes() {
        return codes;
    }

    /**
     * Splits a trailing known region suffix off {@code name}. Unknown suffixes are left in place.
     */
    public Split split(String name) {
        String trimmed = name.trim();
        Matcher m = SUFFIX.matcher(trimmed);
        if (m.matches() && contains(m.group(2))) {
            return new Split(m.group(1).trim(), m.group(2).toUpperCase(Locale.ROOT));
        }
        return new Split(trimmed, null);
    }

    /**
     * A name with its region suffix removed. {@code region} is null when there was none.
     */
    public record Split(String base, String region) {

        public boolean hasRegion() {
            return region != null;
        }
    }
}

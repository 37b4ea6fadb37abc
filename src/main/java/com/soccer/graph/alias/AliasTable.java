package com.soccer.graph.alias;

import com.soccer.graph.core.model.EntityKind;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Static mapping from alias forms to canonical display names for one entity kind.
 *
 * <p>Aliases are stored under their folded form. An alias ending in a known region
 * suffix (for example {@code Atlético-MG}) is stored region-qualified, so that
 * {@code Atlético-MG} and {@code Atlético-PR} can point to different clubs. Every
 * canonical name is registered as an alias of itself.</p>
 */
public class AliasTable {

    private final EntityKind kind;
    private final NameNormalizer normalizer;
    private final Map<String, String> canonicalByKey;
    private final Map<String, Set<String>> aliasesByCanonical;

    private AliasTable(Builder builder) {
        this.kind = builder.kind;
        this.normalizer = builder.normalizer;
        this.canonicalByKey = Map.copyOf(builder.canonicalByKey);
        Map<String, Set<String>> aliases = new TreeMap<>();
        builder.aliasesByCanonical.forEach((canonical, forms) ->
                aliases.put(canonical, Collections.unmodifiableSet(new TreeSet<>(forms))));
        this.aliasesByCanonical = Collections.unmodifiableMap(aliases);
    }

    public EntityKind kind() {
        return kind;
    }

    /**
     * Looks up a name that has already had its region suffix removed.
     *
     * @param base   the name without suffix
     * @param region the region code, or null for an unqualified lookup
     */
    public Optional<String> lookup(String base, String region) {
        String folded = normalizer.fold(base, kind);
        if (folded.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(canonicalByKey.get(lookupKey(folded, region)));
    }

    /**
     * All alias forms registered for a canonical name, sorted. Empty for unknown names.
     */
    public Set<String> aliasesOf(String canonical) {
        return aliasesByCanonical.getOrDefault(canonical, Set.of());
    }

    public boolean isCanonical(String name) {
        return aliasesByCanonical.containsKey(name);
    }

    public Set<String> canonicalNames() {
        return aliasesByCanonical.keySet();
    }

    public int size() {
        return canonicalByKey.size();
    }

    static String lookupKey(String folded, String region) {
        return region == null ? folded : folded + "@" + region;
    }

    public static Builder builder(EntityKind kind, NameNormalizer normalizer, RegionCodes regions) {
        return new Builder(kind, normalizer, regions);
    }

    public static AliasTable empty(EntityKind kind) {
        return builder(kind, new NameNormalizer(), RegionCodes.brazilianStates()).build();
    }

    public static class Builder {
        private final EntityKind kind;
        private final NameNormalizer normalizer;
        private final RegionCodes regions;
        private final Map<String, String> canonicalByKey = new HashMap<>();
        private final Map<String, Set<String>> aliasesByCanonical = new HashMap<>();

        private Builder(EntityKind kind, NameNormalizer normalizer, RegionCodes regions) {
            this.kind = Objects.requireNonNull(kind, "kind is required");
            this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
            this.regions = Objects.requireNonNull(regions, "regions is required");
        }

        public Builder add(String canonical, String... aliases) {
            return add(canonical, List.of(aliases));
        }

        /**
         * Registers a canonical name and its aliases.
         *
         * @throws IllegalArgumentException if an alias already points to another canonical name
         */
        public Builder add(String canonical, Collection<String> aliases) {
            if (canonical == null || canonical.isBlank()) {
                throw new IllegalArgumentException("Canonical name must not be null or blank");
            }
            String display = canonical.trim();
            Set<String> forms = aliasesByCanonical.computeIfAbsent(display, k -> new TreeSet<>());
            register(display, display);
            for (String alias : aliases) {
                if (alias == null || alias.isBlank()) {
                    continue;
                }
                String trimmed = alias.trim();
                register(trimmed, display);
                forms.add(trimmed);
            }
            return this;
        }

        private void register(String alias, String canonical) {
            RegionCodes.Split split = regions.split(alias);
            String key = lookupKey(normalizer.fold(split.base(), kind), split.region());
            put(key, alias, canonical);
            if (split.hasRegion()) {
                // The unsplit form is the last lookup step
                put(normalizer.fold(alias, kind), alias, canonical);
            }
        }

        private void put(String key, String alias, String canonical) {
            String existing = canonicalByKey.putIfAbsent(key, canonical);
            if (existing != null && !existing.equals(canonical)) {
                throw new IllegalArgumentException("Alias '" + alias + "' maps to both '"
                        + existing + "' and '" + canonical + "'");
            }
        }

        public AliasTable build() {
            return new AliasTable(this);
        }
    }
}

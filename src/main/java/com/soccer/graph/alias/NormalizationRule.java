package com.soccer.graph.alias;

import com.soccer.graph.core.model.EntityKind;

import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A case-insensitive regex rewrite applied to names before comparison. Lower priorities
 * run first; a rule without kinds applies to every kind.
 */
public record NormalizationRule(String name, int priority, Pattern pattern, String replacement,
                                Set<EntityKind> kinds) {

    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
        kinds = kinds != null ? Set.copyOf(kinds) : Set.of();
    }

    public static NormalizationRule of(String name, int priority, String regex, String replacement,
                                       EntityKind... kinds) {
        return new NormalizationRule(name, priority, Pattern.compile(regex, Pattern.CASE_INSENSITIVE),
                replacement, Set.of(kinds));
    }

    public boolean appliesTo(EntityKind kind) {
        return kinds.isEmpty() || kinds.contains(kind);
    }

    public String apply(String input) {
        if (input == null) {
            return null;
        }
        return pattern.matcher(input).replaceAll(replacement);
    }
}

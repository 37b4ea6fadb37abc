package com.soccer.graph.alias;

import com.soccer.graph.core.model.EntityKind;

import java.util.List;

/**
 * Built-in rewrite rules for team and stadium names. They run after diacritics
 * have been removed, so patterns only need plain ASCII.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    public static List<NormalizationRule> all() {
        return List.of(
                // "S.C. Internacional" -> "SC Internacional"
                NormalizationRule.of("strip-dots", 10, "\\.", ""),
                NormalizationRule.of("strip-apostrophes", 15, "['`´]", ""),
                NormalizationRule.of("tight-hyphens", 20, "\\s*-\\s*", "-"),
                NormalizationRule.of("ampersand", 30, "\\s*&\\s*", " e "),
                // "Estadio do Maracana" -> "Maracana"
                NormalizationRule.of("stadium-prefix", 50, "^estadio\\s+(d[oae]s?\\s+)?", "",
                        EntityKind.STADIUM));
    }
}

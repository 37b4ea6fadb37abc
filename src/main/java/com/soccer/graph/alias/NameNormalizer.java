package com.soccer.graph.alias;

import com.soccer.graph.core.model.EntityKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Folds names to a comparison form: diacritics removed, rewrite rules applied
 * in priority order (lower number first), lower-cased, whitespace collapsed.
 * Folded forms are only ever compared, never stored as display values.
 */
public class NameNormalizer {
    private static final Logger log = LoggerFactory.getLogger(NameNormalizer.class);

    private final List<NormalizationRule> rules;

    public NameNormalizer() {
        this(DefaultNormalizationRules.all());
    }

    public NameNormalizer(List<NormalizationRule> rules) {
        this.rules = new ArrayList<>(rules);
        this.rules.sort(Comparator.comparingInt(NormalizationRule::priority));
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    public String fold(String name) {
        return fold(name, null);
    }

    /**
     * Folds a name using the rules that apply to {@code kind} (all rules when null).
     */
    public String fold(String name, EntityKind kind) {
        if (name == null || name.isBlank()) {
            return "";
        }

        String result = stripDiacritics(name);

        for (NormalizationRule rule : rules) {
            if (kind == null || rule.appliesTo(kind)) {
                String before = result;
                result = rule.apply(result);
                if (!before.equals(result)) {
                    log.debug("Rule '{}' transformed '{}' -> '{}'", rule.name(), before, result);
                }
            }
        }

        return result.toLowerCase(Locale.ROOT)
                .trim()
                .replaceAll("\\s+", " ");
    }

    /**
     * Checks if two names fold to the same comparison form.
     */
    public boolean areEquivalent(String name1, String name2, EntityKind kind) {
        return fold(name1, kind).equals(fold(name2, kind));
    }

    /**
     * True when either folded name contains the other.
     */
    public boolean contains(String name1, String name2, EntityKind kind) {
        String a = fold(name1, kind);
        String b = fold(name2, kind);
        if (a.isEmpty() || b.isEmpty()) {
            return false;
        }
        return a.contains(b) || b.contains(a);
    }

    static String stripDiacritics(String input) {
        return Normalizer.normalize(input, Normalizer.Form.NFD)
                .replaceAll("\\p{InCombiningDiacriticalMarks}+", "");
    }
}

package com.soccer.graph.merge;

import java.util.List;

/**
 * Result of merging one canonical record.
 *
 * @param steps       one outcome per node and relationship touched
 * @param conflicts   values rejected by immutable fields
 * @param skipReason  why the record was not merged, or null
 * @param message     detail for a skipped record
 * @param correlation how an enrichment record was joined, or null for primary records
 */
public record RecordMergeResult(
        List<MergeStep> steps,
        List<MergeConflict> conflicts,
        SkipReason skipReason,
        String message,
        Correlation correlation
) {
    public RecordMergeResult {
        steps = steps != null ? List.copyOf(steps) : List.of();
        conflicts = conflicts != null ? List.copyOf(conflicts) : List.of();
    }

    public static RecordMergeResult applied(List<MergeStep> steps, List<MergeConflict> conflicts,
                                            Correlation correlation) {
        return new RecordMergeResult(steps, conflicts, null, null, correlation);
    }

    public static RecordMergeResult skipped(SkipReason reason, String message) {
        return new RecordMergeResult(List.of(), List.of(), reason, message, null);
    }

    public boolean isSkipped() {
        return skipReason != null;
    }

    public long count(MergeOutcome outcome) {
        return steps.stream().filter(s -> s.outcome() == outcome).count();
    }

    /**
     * Outcome recorded for one element, e.g. {@code outcomeOf("Match", key)}.
     */
    public MergeOutcome outcomeOf(String element, String key) {
        return steps.stream()
                .filter(s -> s.element().equals(element) && s.key().equals(key))
                .map(MergeStep::outcome)
                .findFirst()
                .orElse(null);
    }
}

package com.soccer.graph.audit;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One change to the graph, or one record that could not be placed in it.
 *
 * @param sequence   position in the trail, starting at 1
 * @param subject    the node or relationship touched, e.g. {@code Team:Flamengo}, or the
 *                   {@code source:line} of a skipped record
 * @param source     adapter name, or the component that acted, e.g. {@code team-deduplicator}
 * @param details    action specific values such as the kept and rejected value of a conflict
 * @param recordedAt when the entry was appended
 */
public record AuditEntry(
        long sequence,
        AuditAction action,
        String subject,
        String source,
        Map<String, Object> details,
        Instant recordedAt
) {
    public AuditEntry {
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(subject, "subject is required");
        Objects.requireNonNull(recordedAt, "recordedAt is required");
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public boolean isConflict() {
        return action == AuditAction.MERGE_CONFLICT;
    }

    @Override
    public String toString() {
        return "#" + sequence + " " + action + " " + subject + " by " + source
                + (details.isEmpty() ? "" : " " + details);
    }
}

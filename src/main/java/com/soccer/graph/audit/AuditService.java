package com.soccer.graph.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Append-only trail of graph changes, conflicts and correlation misses. Entries are
 * numbered in append order, so a caller can take {@link #lastSequence()} before a run
 * and read back exactly what that run wrote.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;

    public AuditService() {
        this(Clock.systemUTC());
    }

    public AuditService(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public AuditEntry record(AuditAction action, String subject, String source, Map<String, Object> details) {
        AuditEntry entry;
        // numbering and append under one lock keep the list in sequence order
        synchronized (entries) {
            entry = new AuditEntry(sequence.incrementAndGet(), action, subject, source, details, clock.instant());
            entries.add(entry);
        }
        log.debug("audit.recorded {}", entry);
        return entry;
    }

    public AuditEntry record(AuditAction action, String subject, String source) {
        return record(action, subject, source, null);
    }

    public List<AuditEntry> getAllEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<AuditEntry> getEntriesForSubject(String subject) {
        return entries.stream()
                .filter(e -> subject.equals(e.subject()))
                .collect(Collectors.toList());
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return entries.stream()
                .filter(e -> e.action() == action)
                .collect(Collectors.toList());
    }

    /**
     * Entries appended after the one numbered {@code sequence}.
     */
    public List<AuditEntry> entriesAfter(long sequence) {
        return entries.stream()
                .filter(e -> e.sequence() > sequence)
                .collect(Collectors.toList());
    }

    /**
     * Number of the latest entry, 0 while the trail is empty.
     */
    public long lastSequence() {
        return sequence.get();
    }

    public int size() {
        return entries.size();
    }
}

package com.soccer.graph.merge;

import com.soccer.graph.audit.AuditAction;
import com.soccer.graph.audit.AuditService;
import com.soccer.graph.core.model.EntityKind;
import com.soccer.graph.core.model.EntitySchema;
import com.soccer.graph.core.model.FieldPolicy;
import com.soccer.graph.core.model.GraphNode;
import com.soccer.graph.core.model.Relationship;
import com.soccer.graph.core.model.RelationshipKey;
import com.soccer.graph.core.model.RelationshipKind;
import com.soccer.graph.graph.GraphStore;
import com.soccer.graph.lock.KeyLock;
import com.soccer.graph.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Identity-keyed upsert of single nodes and relationships under the field policies of
 * {@link EntitySchema}. Each upsert holds the lock of the key it writes.
 *
 * <ul>
 *   <li>absent: created with every supplied value</li>
 *   <li>present: each supplied value passes through its field policy</li>
 *   <li>null values are ignored; they never clear a stored value</li>
 * </ul>
 */
public class GraphUpserter {
    private static final Logger log = LoggerFactory.getLogger(GraphUpserter.class);

    private final GraphStore store;
    private final KeyLock lock;
    private final AuditService auditService;
    private final MetricsService metrics;

    public GraphUpserter(GraphStore store, KeyLock lock, AuditService auditService, MetricsService metrics) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.lock = Objects.requireNonNull(lock, "lock is required");
        this.auditService = Objects.requireNonNull(auditService, "auditService is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
    }

    public GraphStore store() {
        return store;
    }

    /**
     * Creates the node or merges {@code values} into it.
     *
     * @param source adapter or component supplying the values
     */
    public UpsertResult upsertNode(EntityKind kind, String key, Map<String, Object> values, String source) {
        return lock.withLock(kind.label() + ":" + key, () -> doUpsertNode(kind, key, values, source));
    }

    /**
     * Creates the relationship or merges {@code values} into it, honoring the multiplicity
     * of {@code kind}. Both endpoint nodes must exist.
     *
     * @param discriminator distinguishes parallel edges of {@code MANY} kinds, or null
     */
    public UpsertResult upsertRelationship(RelationshipKind kind, String sourceKey, String targetKey,
                                           String discriminator, Map<String, Object> values, String source) {
        RelationshipKey key = new RelationshipKey(kind, sourceKey, targetKey, discriminator);
        return lock.withLock(lockKey(key), () -> doUpsertRelationship(key, values, source));
    }

    private UpsertResult doUpsertNode(EntityKind kind, String key, Map<String, Object> values, String source) {
        String subject = kind.label() + ":" + key;
        Optional<GraphNode> existing = store.findNode(kind, key);
        if (existing.isEmpty()) {
            GraphNode node = GraphNode.builder(kind, key)
                    .properties(prepare(values, field -> EntitySchema.policyFor(kind, field)))
                    .createdBy(source)
                    .build();
            store.addNode(node);
            auditService.record(AuditAction.ENTITY_CREATED, subject, source);
            metrics.recordMergeOutcome(kind.label(), MergeOutcome.CREATED);
            log.debug("merge.node.created kind={} key='{}' source={}", kind, key, source);
            return UpsertResult.created();
        }

        GraphNode node = existing.get();
        List<MergeConflict> conflicts = new ArrayList<>();
        List<String> changed = applyValues(kind.label(), key, node.getProperties(), node::put,
                field -> EntitySchema.policyFor(kind, field), values, source, conflicts);
        MergeOutcome outcome = changed.isEmpty() ? MergeOutcome.UNCHANGED : MergeOutcome.UPDATED;
        if (outcome == MergeOutcome.UPDATED) {
            auditService.record(AuditAction.ENTITY_UPDATED, subject, source, Map.of("fields", List.copyOf(changed)));
            log.debug("merge.node.updated kind={} key='{}' fields={}", kind, key, changed);
        }
        metrics.recordMergeOutcome(kind.label(), outcome);
        return UpsertResult.of(outcome, conflicts);
    }

    private UpsertResult doUpsertRelationship(RelationshipKey key, Map<String, Object> values, String source) {
        RelationshipKind kind = key.kind();
        String element = kind.name();
        Optional<Relationship> existing = store.findRelationship(key);

        if (existing.isPresent()) {
            Relationship relationship = existing.get();
            List<MergeConflict> conflicts = new ArrayList<>();
            List<String> changed = applyValues(element, key.toString(), relationship.getProperties(),
                    relationship::put, field -> EntitySchema.policyFor(kind, field), values, source, conflicts);
            MergeOutcome outcome = changed.isEmpty() ? MergeOutcome.UNCHANGED : MergeOutcome.UPDATED;
            if (outcome == MergeOutcome.UPDATED) {
                auditService.record(AuditAction.RELATIONSHIP_UPDATED, key.toString(), source,
                        Map.of("fields", List.copyOf(changed)));
            }
            metrics.recordMergeOutcome(element, outcome);
            return UpsertResult.of(outcome, conflicts);
        }

        MergeOutcome outcome = MergeOutcome.CREATED;
        switch (kind.multiplicity()) {
            case ONE_PER_SOURCE -> {
                Optional<Relationship> other = store.outgoing(kind, key.sourceKey()).stream().findFirst();
                if (other.isPresent()) {
                    return rejectEndpoint(key, "target", other.get().getTargetKey(), key.targetKey(), source);
                }
            }
            case ONE_PER_TARGET -> {
                Optional<Relationship> other = store.incoming(kind, key.targetKey()).stream().findFirst();
                if (other.isPresent()) {
                    return rejectEndpoint(key, "source", other.get().getSourceKey(), key.sourceKey(), source);
                }
            }
            case ONE_PER_SOURCE_REPLACEABLE -> {
                for (Relationship old : store.outgoing(kind, key.sourceKey())) {
                    store.removeRelationship(old.getKey());
                    auditService.record(AuditAction.RELATIONSHIP_REPLACED, old.getKey().toString(), source,
                            Map.of("newTarget", key.targetKey()));
                    log.info("merge.relationship.replaced kind={} source='{}' oldTarget='{}' newTarget='{}'",
                            kind, key.sourceKey(), old.getTargetKey(), key.targetKey());
                    outcome = MergeOutcome.UPDATED;
                }
            }
            case MANY -> {
                // keyed by discriminator, no exclusivity
            }
        }

        Relationship relationship = Relationship.builder()
                .kind(kind)
                .sourceKey(key.sourceKey())
                .targetKey(key.targetKey())
                .discriminator(key.discriminator())
                .properties(prepare(values, field -> EntitySchema.policyFor(kind, field)))
                .createdBy(source)
                .build();
        store.addRelationship(relationship);
        auditService.record(AuditAction.RELATIONSHIP_CREATED, key.toString(), source);
        metrics.recordMergeOutcome(element, outcome);
        return UpsertResult.of(outcome, List.of());
    }

    private UpsertResult rejectEndpoint(RelationshipKey key, String field, String stored, String rejected,
                                        String source) {
        MergeConflict conflict = new MergeConflict(key.kind().name(), key.toString(), field, stored, rejected, source);
        reportConflict(conflict);
        metrics.recordMergeOutcome(key.kind().name(), MergeOutcome.UNCHANGED);
        return UpsertResult.of(MergeOutcome.UNCHANGED, List.of(conflict));
    }

    /**
     * Applies each incoming value through its policy.
     *
     * @return names of the fields that changed
     */
    private List<String> applyValues(String element, String key, Map<String, Object> current,
                                     BiConsumer<String, Object> writer, Function<String, FieldPolicy> policies,
                                     Map<String, Object> values, String source, List<MergeConflict> conflicts) {
        List<String> changed = new ArrayList<>();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            String field = entry.getKey();
            Object incoming = entry.getValue();
            if (incoming == null) {
                continue;
            }
            Object stored = current.get(field);
            switch (policies.apply(field)) {
                case IDENTITY -> {
                    // fixed by the key
                }
                case IMMUTABLE -> {
                    if (stored == null) {
                        writer.accept(field, incoming);
                        changed.add(field);
                    } else if (!stored.equals(incoming)) {
                        MergeConflict conflict = new MergeConflict(element, key, field, stored, incoming, source);
                        conflicts.add(conflict);
                        reportConflict(conflict);
                    }
                }
                case FILL_IF_UNSET -> {
                    if (stored == null) {
                        writer.accept(field, incoming);
                        changed.add(field);
                    }
                }
                case OVERWRITE -> {
                    if (!incoming.equals(stored)) {
                        writer.accept(field, incoming);
                        changed.add(field);
                    }
                }
                case ACCUMULATE -> {
                    TreeSet<String> union = new TreeSet<>(asStrings(stored));
                    if (union.addAll(asStrings(incoming))) {
                        writer.accept(field, Collections.unmodifiableSortedSet(union));
                        changed.add(field);
                    }
                }
            }
        }
        return changed;
    }

    private void reportConflict(MergeConflict conflict) {
        log.warn("merge.conflict element={} key='{}' field={} kept={} rejected={} source={}",
                conflict.element(), conflict.key(), conflict.field(),
                conflict.storedValue(), conflict.rejectedValue(), conflict.source());
        auditService.record(AuditAction.MERGE_CONFLICT, conflict.element() + ":" + conflict.key(),
                conflict.source(), Map.of(
                        "field", conflict.field(),
                        "kept", String.valueOf(conflict.storedValue()),
                        "rejected", String.valueOf(conflict.rejectedValue())));
        metrics.incrementConflict(conflict.element());
    }

    /**
     * Values for a new node or relationship: nulls dropped, set-valued fields as sorted sets.
     */
    private static Map<String, Object> prepare(Map<String, Object> values, Function<String, FieldPolicy> policies) {
        Map<String, Object> prepared = new HashMap<>();
        values.forEach((field, value) -> {
            if (value == null) {
                return;
            }
            if (policies.apply(field) == FieldPolicy.ACCUMULATE) {
                prepared.put(field, Collections.unmodifiableSortedSet(new TreeSet<>(asStrings(value))));
            } else {
                prepared.put(field, value);
            }
        });
        return prepared;
    }

    private static Collection<String> asStrings(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> collection) {
            List<String> strings = new ArrayList<>(collection.size());
            collection.forEach(item -> strings.add(String.valueOf(item)));
            return strings;
        }
        return List.of(value.toString());
    }

    /**
     * Lock that serializes every writer able to touch the same relationship slot.
     */
    private static String lockKey(RelationshipKey key) {
        return switch (key.kind().multiplicity()) {
            case ONE_PER_SOURCE, ONE_PER_SOURCE_REPLACEABLE -> key.kind() + ">" + key.sourceKey();
            case ONE_PER_TARGET -> key.kind() + "<" + key.targetKey();
            case MANY -> key.toString();
        };
    }
}

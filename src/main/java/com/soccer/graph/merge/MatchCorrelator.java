package com.soccer.graph.merge;

import com.soccer.graph.alias.NameNormalizer;
import com.soccer.graph.core.model.EntityKind;
import com.soccer.graph.core.model.EntitySchema;
import com.soccer.graph.core.model.GraphNode;
import com.soccer.graph.core.model.MatchKey;
import com.soccer.graph.graph.GraphStore;
import com.soccer.graph.source.MatchVenueRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Joins enrichment rows onto matches already in the store.
 *
 * <p>Statistics rows join by start time within a window and team-name containment on
 * both sides. Venue rows join by season, round and teams, falling back to the external
 * id. Several candidates are narrowed to the one nearest in time; a tie is ambiguous.</p>
 */
public class MatchCorrelator {
    private static final Logger log = LoggerFactory.getLogger(MatchCorrelator.class);

    public static final Duration DEFAULT_WINDOW = Duration.ofHours(24);

    private final GraphStore store;
    private final NameNormalizer normalizer;
    private final Duration window;

    private TreeMap<LocalDateTime, List<GraphNode>> byStartTime;
    private int indexedCount = -1;

    public MatchCorrelator(GraphStore store, NameNormalizer normalizer) {
        this(store, normalizer, DEFAULT_WINDOW);
    }

    public MatchCorrelator(GraphStore store, NameNormalizer normalizer, Duration window) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
        this.window = Objects.requireNonNull(window, "window is required");
        if (window.isNegative()) {
            throw new IllegalArgumentException("window must not be negative: " + window);
        }
    }

    /**
     * Finds the match a statistics row describes.
     */
    public Correlation correlate(LocalDateTime startTime, String homeTeam, String awayTeam) {
        if (!homeTeam.equals(awayTeam)) {
            String exactKey = new MatchKey(startTime, homeTeam, awayTeam).value();
            if (store.findNode(EntityKind.MATCH, exactKey).isPresent()) {
                return Correlation.matched(exactKey, Correlation.Confidence.EXACT, 1);
            }
        }

        List<GraphNode> candidates = new ArrayList<>();
        index().subMap(startTime.minus(window), true, startTime.plus(window), true)
                .values()
                .forEach(candidates::addAll);
        candidates = candidates.stream()
                .filter(match -> sameTeams(match, homeTeam, awayTeam))
                .collect(Collectors.toList());
        return choose(candidates, startTime);
    }

    /**
     * Finds the match an archive row describes.
     */
    public Correlation correlateVenue(MatchVenueRecord venue) {
        String home = venue.homeTeam().canonicalName();
        String away = venue.awayTeam().canonicalName();
        if (venue.startTime() != null && !home.equals(away)) {
            String exactKey = new MatchKey(venue.startTime(), home, away).value();
            if (store.findNode(EntityKind.MATCH, exactKey).isPresent()) {
                return Correlation.matched(exactKey, Correlation.Confidence.EXACT, 1);
            }
        }

        String round = venue.round() != null ? normalizer.fold(venue.round()) : null;
        List<GraphNode> candidates = store.nodes(EntityKind.MATCH).stream()
                .filter(match -> Objects.equals(match.getInt(EntitySchema.SEASON), venue.season()))
                .filter(match -> round == null || round.equals(foldedRound(match)))
                .filter(match -> sameTeams(match, home, away))
                .collect(Collectors.toList());

        if (candidates.isEmpty() && venue.externalId() != null) {
            candidates = store.nodes(EntityKind.MATCH).stream()
                    .filter(match -> externalIdMatches(match, venue.externalId()))
                    .collect(Collectors.toList());
            log.debug("correlate.venue.byExternalId id={} candidates={}", venue.externalId(), candidates.size());
        }
        return choose(candidates, venue.startTime());
    }

    /**
     * Drops the start-time index, e.g. after matches were re-keyed.
     */
    public synchronized void invalidate() {
        byStartTime = null;
        indexedCount = -1;
    }

    private Correlation choose(List<GraphNode> candidates, LocalDateTime reference) {
        if (candidates.isEmpty()) {
            return Correlation.miss();
        }
        if (candidates.size() == 1) {
            return Correlation.matched(candidates.get(0).getKey(), Correlation.Confidence.CONTAINMENT, 1);
        }
        if (reference == null) {
            return Correlation.ambiguous(candidates.size());
        }

        GraphNode nearest = null;
        Duration best = null;
        boolean tied = false;
        for (GraphNode candidate : candidates) {
            LocalDateTime start = candidate.getDateTime(EntitySchema.START_TIME);
            if (start == null) {
                continue;
            }
            Duration distance = Duration.between(start, reference).abs();
            int cmp = best == null ? -1 : distance.compareTo(best);
            if (cmp < 0) {
                nearest = candidate;
                best = distance;
                tied = false;
            } else if (cmp == 0) {
                tied = true;
            }
        }
        if (nearest == null || tied) {
            return Correlation.ambiguous(candidates.size());
        }
        return Correlation.matched(nearest.getKey(), Correlation.Confidence.NEAREST_TIME, candidates.size());
    }

    private boolean sameTeams(GraphNode match, String homeTeam, String awayTeam) {
        return normalizer.contains(match.getString(EntitySchema.HOME_TEAM), homeTeam, EntityKind.TEAM)
                && normalizer.contains(match.getString(EntitySchema.AWAY_TEAM), awayTeam, EntityKind.TEAM);
    }

    private String foldedRound(GraphNode match) {
        String round = match.getString(EntitySchema.ROUND);
        return round != null ? normalizer.fold(round) : null;
    }

    private static boolean externalIdMatches(GraphNode match, String externalId) {
        String stored = match.getString(EntitySchema.EXTERNAL_ID);
        if (stored != null && (stored.contains(externalId) || externalId.contains(stored))) {
            return true;
        }
        return match.getKey().contains(externalId);
    }

    private synchronized TreeMap<LocalDateTime, List<GraphNode>> index() {
        int count = store.count(EntityKind.MATCH);
        if (byStartTime == null || count != indexedCount) {
            TreeMap<LocalDateTime, List<GraphNode>> rebuilt = new TreeMap<>();
            for (GraphNode match : store.nodes(EntityKind.MATCH)) {
                Optional.ofNullable(match.getDateTime(EntitySchema.START_TIME))
                        .ifPresent(start -> rebuilt.computeIfAbsent(start, k -> new ArrayList<>()).add(match));
            }
            byStartTime = rebuilt;
            indexedCount = count;
            log.debug("correlate.index.rebuilt matches={}", count);
        }
        return byStartTime;
    }
}

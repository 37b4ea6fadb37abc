package com.soccer.graph.query;

import com.soccer.graph.alias.AliasResolver;
import com.soccer.graph.alias.NameNormalizer;
import com.soccer.graph.core.model.EntityKind;
import com.soccer.graph.core.model.EntitySchema;
import com.soccer.graph.core.model.GraphNode;
import com.soccer.graph.core.model.MatchOutcome;
import com.soccer.graph.core.model.Relationship;
import com.soccer.graph.core.model.RelationshipKind;
import com.soccer.graph.graph.GraphStore;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Read-only aggregations over the merged graph. Team names are passed through the
 * team alias resolver first, so any known spelling works.
 *
 * <p>Assumes ingestion has finished; results over a store that is still being written
 * are not consistent.</p>
 */
public class QueryEngine {

    private static final Comparator<GraphNode> BY_RATING = Comparator
            .comparing((GraphNode p) -> p.getInt(EntitySchema.OVERALL, 0)).reversed()
            .thenComparing(p -> Objects.toString(p.getString(EntitySchema.NAME), ""))
            .thenComparing(GraphNode::getKey);

    private static final Comparator<MatchSummary> OLDEST_FIRST = Comparator
            .comparing(MatchSummary::startTime)
            .thenComparing(MatchSummary::key);

    private static final Comparator<Appearance> NEWEST_FIRST = Comparator
            .comparing((Appearance a) -> a.match().getDateTime(EntitySchema.START_TIME)).reversed()
            .thenComparing(a -> a.match().getKey());

    private static final String BRAZIL = "brazil";

    private final GraphStore store;
    private final AliasResolver teams;
    private final NameNormalizer normalizer;

    public QueryEngine(GraphStore store, AliasResolver teams) {
        this(store, teams, new NameNormalizer());
    }

    public QueryEngine(GraphStore store, AliasResolver teams, NameNormalizer normalizer) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.teams = Objects.requireNonNull(teams, "teams is required");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
    }

    // ==================== TEAM QUERIES ====================

    /**
     * Played, won, drawn and lost matches with goals and points. All zero when the team
     * has no match in scope.
     */
    public TeamStatistics teamStatistics(String team, QueryScope scope) {
        String name = teams.canonicalName(team);
        return aggregate(name, appearances(name, scope != null ? scope : QueryScope.all()));
    }

    /**
     * Home matches only, optionally restricted to one season.
     */
    public TeamStatistics homeRecord(String team, Integer season) {
        String name = teams.canonicalName(team);
        List<Appearance> home = appearances(name, new QueryScope(season, null)).stream()
                .filter(Appearance::home)
                .collect(Collectors.toList());
        return aggregate(name, home);
    }

    /**
     * Matches between two teams with either one at home. Symmetric:
     * {@code headToHead(b, a)} is the mirror of {@code headToHead(a, b)}.
     */
    public HeadToHead headToHead(String teamA, String teamB) {
        String a = teams.canonicalName(teamA);
        String b = teams.canonicalName(teamB);
        if (a.equals(b)) {
            throw new IllegalArgumentException("Head-to-head needs two different teams, both resolve to " + a);
        }
        int matches = 0;
        int aWins = 0;
        int bWins = 0;
        int draws = 0;
        int aGoals = 0;
        int bGoals = 0;
        for (Appearance appearance : appearances(a, QueryScope.all())) {
            if (!b.equals(appearance.opponent())) {
                continue;
            }
            matches++;
            aGoals += appearance.goalsFor();
            bGoals += appearance.goalsAgainst();
            switch (appearance.result()) {
                case WIN -> aWins++;
                case LOSS -> bWins++;
                case DRAW -> draws++;
            }
        }
        return new HeadToHead(a, b, matches, aWins, bWins, draws, aGoals, bGoals);
    }

    public List<MatchSummary> matchesBetween(String teamA, String teamB) {
        String a = teams.canonicalName(teamA);
        String b = teams.canonicalName(teamB);
        return appearances(a, QueryScope.all()).stream()
                .filter(appearance -> b.equals(appearance.opponent()))
                .map(appearance -> MatchSummary.from(appearance.match()))
                .sorted(OLDEST_FIRST)
                .collect(Collectors.toList());
    }

    /**
     * Every match of a team, oldest first.
     *
     * @param venue home matches, away matches, or both
     */
    public List<MatchSummary> matchesOf(String team, Venue venue) {
        String name = teams.canonicalName(team);
        Venue side = venue != null ? venue : Venue.ANY;
        return appearances(name, QueryScope.all()).stream()
                .filter(appearance -> side.admits(appearance.home()))
                .map(appearance -> MatchSummary.from(appearance.match()))
                .sorted(OLDEST_FIRST)
                .collect(Collectors.toList());
    }

    /**
     * The {@code n} most recent matches, newest first. Fewer when the team has played less.
     *
     * @param competition competition name, or null for every competition
     */
    public List<FormEntry> recentForm(String team, String competition, int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must not be negative: " + n);
        }
        String name = teams.canonicalName(team);
        return appearances(name, new QueryScope(null, competition)).stream()
                .sorted(NEWEST_FIRST)
                .limit(n)
                .map(a -> new FormEntry(MatchSummary.from(a.match()), a.opponent(), a.home(),
                        a.goalsFor(), a.goalsAgainst(), a.result()))
                .collect(Collectors.toList());
    }

    /**
     * Matches and goals over every home and away appearance, plus a per-competition breakdown.
     */
    public CompetitionTotals crossCompetitionTotals(String team) {
        String name = teams.canonicalName(team);
        List<Appearance> all = appearances(name, QueryScope.all());
        Map<String, List<Appearance>> grouped = new TreeMap<>();
        for (Appearance appearance : all) {
            String competition = Objects.toString(appearance.match().getString(EntitySchema.COMPETITION), "");
            grouped.computeIfAbsent(competition, k -> new ArrayList<>()).add(appearance);
        }
        Map<String, TeamStatistics> byCompetition = new TreeMap<>();
        grouped.forEach((competition, appearances) -> byCompetition.put(competition, aggregate(name, appearances)));

        TeamStatistics total = aggregate(name, all);
        return new CompetitionTotals(name, total.played(), total.goalsFor(), total.goalsAgainst(), byCompetition);
    }

    /**
     * Opponents both teams have played, excluding each other, sorted by name.
     */
    public List<String> commonOpponents(String teamA, String teamB) {
        String a = teams.canonicalName(teamA);
        String b = teams.canonicalName(teamB);
        Set<String> opponentsOfA = opponents(a);
        Set<String> common = new TreeSet<>(opponents(b));
        common.retainAll(opponentsOfA);
        common.remove(a);
        common.remove(b);
        return new ArrayList<>(common);
    }

    // ==================== COMPETITION QUERIES ====================

    /**
     * League table of one competition season. Ordered by points, goal difference and goals
     * scored, all descending, then team name ascending.
     */
    public List<StandingRow> standings(String competition, int season) {
        QueryScope scope = QueryScope.of(competition, season);
        Map<String, Tally> tallies = new HashMap<>();
        for (GraphNode match : matches(scope)) {
            int homeGoals = match.getInt(EntitySchema.HOME_GOALS, 0);
            int awayGoals = match.getInt(EntitySchema.AWAY_GOALS, 0);
            tallies.computeIfAbsent(match.getString(EntitySchema.HOME_TEAM), Tally::new).add(homeGoals, awayGoals);
            tallies.computeIfAbsent(match.getString(EntitySchema.AWAY_TEAM), Tally::new).add(awayGoals, homeGoals);
        }
        List<StandingRow> rows = tallies.values().stream()
                .map(tally -> StandingRow.unranked(tally.toStatistics()))
                .sorted(StandingRow.ORDER)
                .collect(Collectors.toList());
        List<StandingRow> ranked = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            ranked.add(rows.get(i).at(i + 1));
        }
        return ranked;
    }

    /**
     * Teams ranked by goals scored, ties broken by name.
     *
     * @param season season year, or null for every season
     */
    public List<TeamGoals> topScoringTeams(Integer season, int limit) {
        Map<String, Tally> tallies = new HashMap<>();
        for (GraphNode match : matches(new QueryScope(season, null))) {
            int homeGoals = match.getInt(EntitySchema.HOME_GOALS, 0);
            int awayGoals = match.getInt(EntitySchema.AWAY_GOALS, 0);
            tallies.computeIfAbsent(match.getString(EntitySchema.HOME_TEAM), Tally::new).add(homeGoals, awayGoals);
            tallies.computeIfAbsent(match.getString(EntitySchema.AWAY_TEAM), Tally::new).add(awayGoals, homeGoals);
        }
        return tallies.values().stream()
                .map(tally -> new TeamGoals(tally.team, tally.goalsFor, tally.played, season))
                .sorted(Comparator.comparingInt(TeamGoals::goals).reversed().thenComparing(TeamGoals::team))
                .limit(limit)
                .collect(Collectors.toList());
    }

    /**
     * Matches with the largest goal margin, then most goals, then earliest.
     *
     * @param competition competition name, or null for every competition
     */
    public List<MatchSummary> biggestWins(String competition, int limit) {
        return matches(new QueryScope(null, competition)).stream()
                .map(MatchSummary::from)
                .sorted(Comparator.comparingInt(MatchSummary::margin).reversed()
                        .thenComparing(Comparator.comparingInt(MatchSummary::totalGoals).reversed())
                        .thenComparing(MatchSummary::key))
                .limit(limit)
                .collect(Collectors.toList());
    }

    /**
     * Matches in scope, oldest first.
     */
    public List<MatchSummary> matchesIn(QueryScope scope) {
        return matches(scope != null ? scope : QueryScope.all()).stream()
                .map(MatchSummary::from)
                .sorted(OLDEST_FIRST)
                .collect(Collectors.toList());
    }

    /**
     * Matches kicking off on any day from {@code from} to {@code to}, both inclusive.
     */
    public List<MatchSummary> matchesBetweenDates(LocalDate from, LocalDate to) {
        Objects.requireNonNull(from, "from is required");
        Objects.requireNonNull(to, "to is required");
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Date range ends before it starts: " + from + " to " + to);
        }
        return store.nodes(EntityKind.MATCH).stream()
                .map(MatchSummary::from)
                .filter(match -> match.startTime() != null)
                .filter(match -> {
                    LocalDate day = match.startTime().toLocalDate();
                    return !day.isBefore(from) && !day.isAfter(to);
                })
                .sorted(OLDEST_FIRST)
                .collect(Collectors.toList());
    }

    /**
     * Mean total goals per match in scope, 0 when there is none.
     */
    public double averageGoalsPerMatch(QueryScope scope) {
        List<GraphNode> matches = matches(scope != null ? scope : QueryScope.all());
        if (matches.isEmpty()) {
            return 0.0;
        }
        int goals = matches.stream()
                .mapToInt(m -> m.getInt(EntitySchema.HOME_GOALS, 0) + m.getInt(EntitySchema.AWAY_GOALS, 0))
                .sum();
        return (double) goals / matches.size();
    }

    // ==================== PLAYER QUERIES ====================

    /**
     * Players whose name contains {@code name}, ignoring case and accents.
     */
    public List<PlayerSummary> findPlayers(String name) {
        return findPlayers(name, null);
    }

    /**
     * Players whose name contains {@code name} rated at least {@code minRating}.
     * Players without a rating are dropped once a minimum is given.
     */
    public List<PlayerSummary> findPlayers(String name, Integer minRating) {
        return store.search(EntityKind.PLAYER, name).stream()
                .filter(player -> rated(player, minRating))
                .map(PlayerSummary::from)
                .collect(Collectors.toList());
    }

    /**
     * Players whose nationality contains {@code nationality}, ignoring case and accents.
     * Best rated first.
     */
    public List<PlayerSummary> playersByNationality(String nationality) {
        String wanted = normalizer.fold(nationality);
        if (wanted.isEmpty()) {
            return List.of();
        }
        return store.nodes(EntityKind.PLAYER).stream()
                .filter(player -> normalizer.fold(Objects.toString(player.getString(EntitySchema.NATIONALITY), ""))
                        .contains(wanted))
                .sorted(BY_RATING)
                .map(PlayerSummary::from)
                .collect(Collectors.toList());
    }

    /**
     * Brazilian players whose club has played at least one match in the graph.
     * Best rated first.
     */
    public List<PlayerSummary> brazilianPlayersAtBrazilianClubs() {
        return store.nodes(EntityKind.PLAYER).stream()
                .filter(player -> normalizer.fold(Objects.toString(player.getString(EntitySchema.NATIONALITY), ""))
                        .contains(BRAZIL))
                .filter(player -> store.outgoing(RelationshipKind.BELONGS_TO, player.getKey()).stream()
                        .map(Relationship::getTargetKey)
                        .anyMatch(this::hasPlayed))
                .sorted(BY_RATING)
                .map(PlayerSummary::from)
                .collect(Collectors.toList());
    }

    /**
     * Current members of a club, best rated first.
     */
    public List<PlayerSummary> playersByClub(String team) {
        String name = teams.canonicalName(team);
        return store.incoming(RelationshipKind.BELONGS_TO, name).stream()
                .map(Relationship::getSourceKey)
                .map(key -> store.findNode(EntityKind.PLAYER, key).orElse(null))
                .filter(Objects::nonNull)
                .sorted(BY_RATING)
                .map(PlayerSummary::from)
                .collect(Collectors.toList());
    }

    public List<PlayerSummary> topRatedPlayers(int limit) {
        return store.nodes(EntityKind.PLAYER).stream()
                .sorted(BY_RATING)
                .limit(limit)
                .map(PlayerSummary::from)
                .collect(Collectors.toList());
    }

    // ==================== LOOKUP ====================

    /**
     * Canonical names of teams whose name or aliases contain {@code text}.
     */
    public List<String> findTeams(String text) {
        return store.search(EntityKind.TEAM, text).stream()
                .map(GraphNode::getKey)
                .collect(Collectors.toList());
    }

    public List<String> findStadiums(String text) {
        return store.search(EntityKind.STADIUM, text).stream()
                .map(GraphNode::getKey)
                .collect(Collectors.toList());
    }

    public StoreSummary storeSummary() {
        Map<EntityKind, Integer> nodes = new EnumMap<>(EntityKind.class);
        for (EntityKind kind : EntityKind.values()) {
            nodes.put(kind, store.count(kind));
        }
        Map<RelationshipKind, Integer> relationships = new EnumMap<>(RelationshipKind.class);
        for (RelationshipKind kind : RelationshipKind.values()) {
            relationships.put(kind, store.count(kind));
        }
        return new StoreSummary(nodes, relationships);
    }

    // ==================== INTERNALS ====================

    private List<Appearance> appearances(String team, QueryScope scope) {
        List<Appearance> result = new ArrayList<>();
        collect(result, RelationshipKind.PLAYED_HOME, team, scope, true);
        collect(result, RelationshipKind.PLAYED_AWAY, team, scope, false);
        return result;
    }

    private void collect(List<Appearance> into, RelationshipKind kind, String team, QueryScope scope, boolean home) {
        for (Relationship played : store.outgoing(kind, team)) {
            GraphNode match = store.findNode(EntityKind.MATCH, played.getTargetKey()).orElse(null);
            if (match == null || !inScope(match, scope)) {
                continue;
            }
            Integer goalsFor = played.getInt(EntitySchema.GOALS_FOR);
            Integer goalsAgainst = played.getInt(EntitySchema.GOALS_AGAINST);
            int gf = goalsFor != null ? goalsFor
                    : match.getInt(home ? EntitySchema.HOME_GOALS : EntitySchema.AWAY_GOALS, 0);
            int ga = goalsAgainst != null ? goalsAgainst
                    : match.getInt(home ? EntitySchema.AWAY_GOALS : EntitySchema.HOME_GOALS, 0);
            String opponent = match.getString(home ? EntitySchema.AWAY_TEAM : EntitySchema.HOME_TEAM);
            into.add(new Appearance(match, home, opponent, gf, ga, MatchOutcome.of(gf, ga)));
        }
    }

    private List<GraphNode> matches(QueryScope scope) {
        return store.nodes(EntityKind.MATCH).stream()
                .filter(match -> inScope(match, scope))
                .collect(Collectors.toList());
    }

    private boolean inScope(GraphNode match, QueryScope scope) {
        if (scope.season() != null && !scope.season().equals(match.getInt(EntitySchema.SEASON))) {
            return false;
        }
        if (scope.competition() != null) {
            String competition = match.getString(EntitySchema.COMPETITION);
            return competition != null && normalizer.areEquivalent(competition, scope.competition(),
                    EntityKind.COMPETITION);
        }
        return true;
    }

    private boolean hasPlayed(String team) {
        return !store.outgoing(RelationshipKind.PLAYED_HOME, team).isEmpty()
                || !store.outgoing(RelationshipKind.PLAYED_AWAY, team).isEmpty();
    }

    private static boolean rated(GraphNode player, Integer minRating) {
        if (minRating == null) {
            return true;
        }
        Integer overall = player.getInt(EntitySchema.OVERALL);
        return overall != null && overall >= minRating;
    }

    private Set<String> opponents(String team) {
        return appearances(team, QueryScope.all()).stream()
                .map(Appearance::opponent)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
    }

    private static TeamStatistics aggregate(String team, List<Appearance> appearances) {
        Tally tally = new Tally(team);
        appearances.forEach(a -> tally.add(a.goalsFor(), a.goalsAgainst()));
        return tally.toStatistics();
    }

    private record Appearance(GraphNode match, boolean home, String opponent,
                              int goalsFor, int goalsAgainst, MatchOutcome result) {
    }

    private static final class Tally {
        private final String team;
        private int played;
        private int wins;
        private int draws;
        private int losses;
        private int goalsFor;
        private int goalsAgainst;
        private int cleanSheets;

        Tally(String team) {
            this.team = team;
        }

        void add(int scored, int conceded) {
            played++;
            goalsFor += scored;
            goalsAgainst += conceded;
            if (conceded == 0) {
                cleanSheets++;
            }
            switch (MatchOutcome.of(scored, conceded)) {
                case WIN -> wins++;
                case DRAW -> draws++;
                case LOSS -> losses++;
            }
        }

        TeamStatistics toStatistics() {
            return new TeamStatistics(team, played, wins, draws, losses, goalsFor, goalsAgainst, cleanSheets);
        }
    }
}

package com.soccer.graph.mcp;

import com.soccer.graph.query.HeadToHead;
import com.soccer.graph.query.MatchSummary;
import com.soccer.graph.query.PlayerSummary;
import com.soccer.graph.query.QueryEngine;
import com.soccer.graph.query.QueryScope;
import com.soccer.graph.query.StandingRow;
import com.soccer.graph.query.TeamGoals;
import com.soccer.graph.query.TeamStatistics;
import com.soccer.graph.query.Venue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * MCP tool definitions over the {@link QueryEngine}. Every tool only reads the graph.
 *
 * <p>Available tools:</p>
 * <ul>
 *   <li>{@code search_matches} -- matches by teams, venue, season, competition or dates</li>
 *   <li>{@code get_team_stats} -- a team's record, optionally for one season</li>
 *   <li>{@code search_players} -- players by name, nationality or club, with a rating floor</li>
 *   <li>{@code get_standings} -- league table of a competition season</li>
 *   <li>{@code get_head_to_head} -- record between two teams with their latest meetings</li>
 *   <li>{@code get_biggest_wins} -- matches with the widest margins</li>
 *   <li>{@code get_top_scorers} -- teams ranked by goals scored</li>
 * </ul>
 *
 * <p>Arguments arrive as decoded JSON, so numbers may be any {@link Number} or a numeric
 * string. A malformed or missing required argument raises {@link IllegalArgumentException}.</p>
 */
public final class SoccerGraphMcpTools {

    private static final Logger log = LoggerFactory.getLogger(SoccerGraphMcpTools.class);

    static final int DEFAULT_LIMIT = 20;
    static final int DEFAULT_RANKING_LIMIT = 10;
    static final int RECENT_MEETINGS = 5;

    private final QueryEngine queries;
    private final List<McpToolDefinition> tools;

    public SoccerGraphMcpTools(QueryEngine queries) {
        this.queries = Objects.requireNonNull(queries, "queries is required");
        this.tools = List.of(
                buildSearchMatchesTool(),
                buildTeamStatsTool(),
                buildSearchPlayersTool(),
                buildStandingsTool(),
                buildHeadToHeadTool(),
                buildBiggestWinsTool(),
                buildTopScorersTool());
    }

    public List<McpToolDefinition> getToolDefinitions() {
        return tools;
    }

    public Optional<McpToolDefinition> getTool(String name) {
        return tools.stream()
                .filter(t -> t.name().equals(name))
                .findFirst();
    }

    /**
     * Runs a tool by name.
     *
     * @throws IllegalArgumentException when no tool has that name or an argument is invalid
     */
    public Map<String, Object> call(String name, Map<String, Object> arguments) {
        McpToolDefinition tool = getTool(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown tool: " + name));
        log.debug("mcp.call tool={} arguments={}", name, arguments);
        return tool.call(arguments);
    }

    // ==================== MATCHES ====================

    private McpToolDefinition buildSearchMatchesTool() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of(
                        "team1", stringProperty("First team of a head-to-head search"),
                        "team2", stringProperty("Second team of a head-to-head search"),
                        "team", stringProperty("Single team whose matches to list"),
                        "venue", Map.of("type", "string", "enum", List.of("any", "home", "away"),
                                "description", "With team: home matches, away matches or both"),
                        "season", integerProperty("Season year"),
                        "competition", stringProperty("Competition name"),
                        "date_from", stringProperty("First day, yyyy-MM-dd"),
                        "date_to", stringProperty("Last day, yyyy-MM-dd"),
                        "limit", limitProperty(DEFAULT_LIMIT)
                )
        );

        return new McpToolDefinition(
                "search_matches",
                "Search matches between two teams, of one team, in a season, competition or date range. "
                        + "Results are oldest first.",
                schema,
                params -> {
                    String team1 = optionalString(params, "team1");
                    String team2 = optionalString(params, "team2");
                    String team = optionalString(params, "team");
                    Integer season = optionalInt(params, "season");
                    String competition = optionalString(params, "competition");
                    LocalDate from = optionalDate(params, "date_from");
                    LocalDate to = optionalDate(params, "date_to");
                    int limit = limit(params, DEFAULT_LIMIT);

                    List<MatchSummary> matches;
                    if (team1 != null && team2 != null) {
                        matches = queries.matchesBetween(team1, team2);
                    } else if (team != null) {
                        matches = queries.matchesOf(team, venue(params));
                    } else if (from != null || to != null) {
                        matches = queries.matchesBetweenDates(
                                from != null ? from : LocalDate.MIN, to != null ? to : LocalDate.MAX);
                    } else {
                        matches = queries.matchesIn(QueryScope.of(competition, season));
                    }
                    List<Map<String, Object>> page = matches.stream()
                            .limit(limit)
                            .map(SoccerGraphMcpTools::matchToMap)
                            .collect(Collectors.toList());
                    return Map.of("matches", page, "count", page.size(), "total_found", matches.size());
                }
        );
    }

    private McpToolDefinition buildHeadToHeadTool() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of(
                        "team1", stringProperty("First team"),
                        "team2", stringProperty("Second team")
                ),
                "required", List.of("team1", "team2")
        );

        return new McpToolDefinition(
                "get_head_to_head",
                "Wins, draws and goals between two teams, with their most recent meetings.",
                schema,
                params -> {
                    HeadToHead record = queries.headToHead(requiredString(params, "team1"),
                            requiredString(params, "team2"));
                    List<MatchSummary> meetings = new ArrayList<>(
                            queries.matchesBetween(record.teamA(), record.teamB()));
                    Collections.reverse(meetings);
                    Map<String, Object> result = new LinkedHashMap<>();
                    result.put("team1", record.teamA());
                    result.put("team2", record.teamB());
                    result.put("total_matches", record.matches());
                    result.put("team1_wins", record.aWins());
                    result.put("team2_wins", record.bWins());
                    result.put("draws", record.draws());
                    result.put("team1_goals", record.aGoals());
                    result.put("team2_goals", record.bGoals());
                    result.put("recent_matches", meetings.stream()
                            .limit(RECENT_MEETINGS)
                            .map(SoccerGraphMcpTools::matchToMap)
                            .collect(Collectors.toList()));
                    return result;
                }
        );
    }

    private McpToolDefinition buildBiggestWinsTool() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of(
                        "competition", stringProperty("Competition name, all competitions when absent"),
                        "limit", limitProperty(DEFAULT_RANKING_LIMIT)
                )
        );

        return new McpToolDefinition(
                "get_biggest_wins",
                "Matches with the largest goal margin, then the most goals.",
                schema,
                params -> {
                    List<Map<String, Object>> wins = queries.biggestWins(optionalString(params, "competition"),
                                    limit(params, DEFAULT_RANKING_LIMIT)).stream()
                            .map(match -> {
                                Map<String, Object> row = matchToMap(match);
                                row.put("goal_difference", match.margin());
                                return row;
                            })
                            .collect(Collectors.toList());
                    return Map.of("biggest_wins", wins);
                }
        );
    }

    // ==================== TEAMS AND COMPETITIONS ====================

    private McpToolDefinition buildTeamStatsTool() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of(
                        "team", stringProperty("Team name, any known spelling"),
                        "season", integerProperty("Season year, every season when absent")
                ),
                "required", List.of("team")
        );

        return new McpToolDefinition(
                "get_team_stats",
                "Played, won, drawn and lost matches of a team with goals, points and win percentage.",
                schema,
                params -> {
                    Integer season = optionalInt(params, "season");
                    TeamStatistics stats = queries.teamStatistics(requiredString(params, "team"),
                            new QueryScope(season, null));
                    Map<String, Object> result = new LinkedHashMap<>();
                    result.put("team", stats.team());
                    result.put("season", season);
                    result.put("matches", stats.played());
                    result.put("wins", stats.wins());
                    result.put("draws", stats.draws());
                    result.put("losses", stats.losses());
                    result.put("goals_for", stats.goalsFor());
                    result.put("goals_against", stats.goalsAgainst());
                    result.put("goal_difference", stats.goalDifference());
                    result.put("points", stats.points());
                    result.put("win_percentage", stats.winPercentage());
                    return result;
                }
        );
    }

    private McpToolDefinition buildStandingsTool() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of(
                        "competition", stringProperty("Competition name"),
                        "season", integerProperty("Season year")
                ),
                "required", List.of("competition", "season")
        );

        return new McpToolDefinition(
                "get_standings",
                "League table of a competition season, ranked by points, goal difference and goals scored.",
                schema,
                params -> {
                    String competition = requiredString(params, "competition");
                    Integer season = optionalInt(params, "season");
                    if (season == null) {
                        throw new IllegalArgumentException("season is required");
                    }
                    List<Map<String, Object>> rows = queries.standings(competition, season).stream()
                            .map(SoccerGraphMcpTools::standingToMap)
                            .collect(Collectors.toList());
                    return Map.of("competition", competition, "season", season, "standings", rows);
                }
        );
    }

    private McpToolDefinition buildTopScorersTool() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of(
                        "season", integerProperty("Season year, every season when absent"),
                        "limit", limitProperty(DEFAULT_RANKING_LIMIT)
                )
        );

        return new McpToolDefinition(
                "get_top_scorers",
                "Teams ranked by goals scored.",
                schema,
                params -> {
                    Integer season = optionalInt(params, "season");
                    List<TeamGoals> top = queries.topScoringTeams(season, limit(params, DEFAULT_RANKING_LIMIT));
                    List<Map<String, Object>> rows = top.stream()
                            .map(t -> Map.<String, Object>of(
                                    "team", t.team(),
                                    "goals", t.goals(),
                                    "matches", t.matches()))
                            .collect(Collectors.toList());
                    Map<String, Object> result = new LinkedHashMap<>();
                    result.put("season", season);
                    result.put("top_scorers", rows);
                    return result;
                }
        );
    }

    // ==================== PLAYERS ====================

    private McpToolDefinition buildSearchPlayersTool() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of(
                        "name", stringProperty("Part of the player name"),
                        "nationality", stringProperty("Nationality"),
                        "club", stringProperty("Club, any known spelling"),
                        "min_rating", integerProperty("Minimum overall rating"),
                        "limit", limitProperty(DEFAULT_LIMIT)
                )
        );

        return new McpToolDefinition(
                "search_players",
                "Search players by name, nationality or club, optionally with a minimum overall rating. "
                        + "Without criteria, returns the best rated players.",
                schema,
                params -> {
                    String name = optionalString(params, "name");
                    String nationality = optionalString(params, "nationality");
                    String club = optionalString(params, "club");
                    Integer minRating = optionalInt(params, "min_rating");
                    int limit = limit(params, DEFAULT_LIMIT);

                    List<PlayerSummary> players;
                    if (name != null) {
                        players = queries.findPlayers(name, minRating);
                    } else if (nationality != null) {
                        players = atLeast(queries.playersByNationality(nationality), minRating);
                    } else if (club != null) {
                        players = atLeast(queries.playersByClub(club), minRating);
                    } else {
                        players = atLeast(queries.topRatedPlayers(minRating != null ? Integer.MAX_VALUE : limit),
                                minRating);
                    }
                    List<Map<String, Object>> page = players.stream()
                            .limit(limit)
                            .map(SoccerGraphMcpTools::playerToMap)
                            .collect(Collectors.toList());
                    return Map.of("players", page, "count", page.size());
                }
        );
    }

    private static List<PlayerSummary> atLeast(List<PlayerSummary> players, Integer minRating) {
        if (minRating == null) {
            return players;
        }
        return players.stream()
                .filter(p -> p.overall() != null && p.overall() >= minRating)
                .collect(Collectors.toList());
    }

    // ==================== CONVERSION ====================

    private static Map<String, Object> matchToMap(MatchSummary match) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("date", match.startTime() != null ? match.startTime().toString() : null);
        row.put("home_team", match.homeTeam());
        row.put("away_team", match.awayTeam());
        row.put("home_goals", match.homeGoals());
        row.put("away_goals", match.awayGoals());
        row.put("score", match.homeGoals() + "-" + match.awayGoals());
        row.put("competition", match.competition());
        row.put("season", match.season());
        row.put("round", match.round());
        return row;
    }

    private static Map<String, Object> playerToMap(PlayerSummary player) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", player.id());
        row.put("name", player.name());
        row.put("nationality", player.nationality());
        row.put("age", player.age());
        row.put("position", player.position());
        row.put("overall", player.overall());
        row.put("potential", player.potential());
        row.put("club", player.club());
        return row;
    }

    private static Map<String, Object> standingToMap(StandingRow row) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("position", row.position());
        map.put("team", row.team());
        map.put("matches", row.played());
        map.put("wins", row.wins());
        map.put("draws", row.draws());
        map.put("losses", row.losses());
        map.put("goals_for", row.goalsFor());
        map.put("goals_against", row.goalsAgainst());
        map.put("goal_difference", row.goalDifference());
        map.put("points", row.points());
        return map;
    }

    // ==================== ARGUMENTS ====================

    private static Map<String, Object> stringProperty(String description) {
        return Map.of("type", "string", "description", description);
    }

    private static Map<String, Object> integerProperty(String description) {
        return Map.of("type", "integer", "description", description);
    }

    private static Map<String, Object> limitProperty(int defaultValue) {
        return Map.of("type", "integer", "description", "Max results", "default", defaultValue);
    }

    private static String optionalString(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    private static String requiredString(Map<String, Object> params, String key) {
        String value = optionalString(params, key);
        if (value == null) {
            throw new IllegalArgumentException(key + " is required");
        }
        return value;
    }

    private static Integer optionalInt(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + value, e);
        }
    }

    private static LocalDate optionalDate(Map<String, Object> params, String key) {
        String value = optionalString(params, key);
        if (value == null) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(key + " must be a yyyy-MM-dd date: " + value, e);
        }
    }

    private static int limit(Map<String, Object> params, int defaultValue) {
        Integer limit = optionalInt(params, "limit");
        if (limit == null) {
            return defaultValue;
        }
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
        return limit;
    }

    private static Venue venue(Map<String, Object> params) {
        String value = optionalString(params, "venue");
        if (value == null) {
            return Venue.ANY;
        }
        try {
            return Venue.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("venue must be any, home or away: " + value, e);
        }
    }
}

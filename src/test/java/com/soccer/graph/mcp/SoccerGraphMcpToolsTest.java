package com.soccer.graph.mcp;

import com.soccer.graph.alias.AliasCatalog;
import com.soccer.graph.alias.AliasResolver;
import com.soccer.graph.alias.NameNormalizer;
import com.soccer.graph.alias.ResolvedName;
import com.soccer.graph.audit.AuditService;
import com.soccer.graph.graph.InMemoryGraphStore;
import com.soccer.graph.lock.NoOpKeyLock;
import com.soccer.graph.merge.GraphUpserter;
import com.soccer.graph.merge.MatchCorrelator;
import com.soccer.graph.merge.MergeEngine;
import com.soccer.graph.metrics.NoOpMetricsService;
import com.soccer.graph.query.QueryEngine;
import com.soccer.graph.source.CompetitionRef;
import com.soccer.graph.source.MatchRecord;
import com.soccer.graph.source.PlayerRecord;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SoccerGraphMcpTools Tests")
class SoccerGraphMcpToolsTest {

    private static final String SERIE_A = CompetitionRef.BRASILEIRAO.name();

    private static SoccerGraphMcpTools tools;

    @BeforeAll
    static void setUp() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        AuditService auditService = new AuditService();
        NoOpMetricsService metrics = new NoOpMetricsService();
        GraphUpserter upserter = new GraphUpserter(store, new NoOpKeyLock(), auditService, metrics);
        MergeEngine engine = new MergeEngine(upserter, new MatchCorrelator(store, new NameNormalizer()),
                auditService, metrics);

        engine.merge(match("2023-05-01T16:00", "Flamengo", "Palmeiras", 2, 1, CompetitionRef.BRASILEIRAO));
        engine.merge(match("2023-05-08T16:00", "Palmeiras", "Flamengo", 0, 0, CompetitionRef.BRASILEIRAO));
        engine.merge(match("2023-05-15T16:00", "Santos", "Grêmio", 5, 0, CompetitionRef.BRASILEIRAO));
        engine.merge(match("2023-06-01T21:30", "Flamengo", "Santos", 1, 0, CompetitionRef.COPA_DO_BRASIL));
        engine.merge(match("2022-10-01T16:00", "Flamengo", "Palmeiras", 1, 2, CompetitionRef.BRASILEIRAO));

        engine.merge(player(1, "Gabriel Barbosa", 78, "Brazil", "Flamengo"));
        engine.merge(player(2, "Pedro", 80, "Brazil", "Flamengo"));
        engine.merge(player(3, "Lionel Messi", 91, "Argentina", "Inter Miami"));

        AliasResolver teams = AliasResolver.builder(AliasCatalog.loadDefault().teams()).build();
        tools = new SoccerGraphMcpTools(new QueryEngine(store, teams));
    }

    private static MatchRecord match(String start, String home, String away, int homeGoals, int awayGoals,
                                     CompetitionRef competition) {
        return MatchRecord.builder()
                .startTime(LocalDateTime.parse(start))
                .homeTeam(ResolvedName.of(home))
                .awayTeam(ResolvedName.of(away))
                .score(homeGoals, awayGoals)
                .competition(competition)
                .build();
    }

    private static PlayerRecord player(long id, String name, int overall, String nationality, String club) {
        return new PlayerRecord("player-roster", id + 1, id, name, nationality, 30, "ST", overall, overall,
                ResolvedName.of(club), 10_000, null, null, null);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> rows(Map<String, Object> result, String key) {
        return (List<Map<String, Object>>) result.get(key);
    }

    @Nested
    @DisplayName("Tool catalog")
    class CatalogTests {

        @Test
        @DisplayName("Should expose every read-only query tool")
        void testToolNames() {
            assertEquals(List.of("search_matches", "get_team_stats", "search_players", "get_standings",
                            "get_head_to_head", "get_biggest_wins", "get_top_scorers"),
                    tools.getToolDefinitions().stream().map(McpToolDefinition::name).collect(Collectors.toList()));
            assertTrue(tools.getTool("get_standings").isPresent());
            assertTrue(tools.getTool("merge_teams").isEmpty());
        }

        @Test
        @DisplayName("Should declare required arguments in the input schema")
        void testSchema() {
            Map<String, Object> schema = tools.getTool("get_standings").orElseThrow().inputSchema();

            assertEquals("object", schema.get("type"));
            assertEquals(List.of("competition", "season"), schema.get("required"));
        }

        @Test
        @DisplayName("Should reject an unknown tool or a missing argument")
        void testInvalidCalls() {
            assertThrows(IllegalArgumentException.class, () -> tools.call("drop_graph", Map.of()));
            assertThrows(IllegalArgumentException.class, () -> tools.call("get_team_stats", Map.of()));
            assertThrows(IllegalArgumentException.class,
                    () -> tools.call("get_standings", Map.of("competition", SERIE_A, "season", "last")));
            assertThrows(IllegalArgumentException.class,
                    () -> tools.call("search_matches", Map.of("team", "Flamengo", "venue", "neutral")));
        }
    }

    @Nested
    @DisplayName("Match tools")
    class MatchToolTests {

        @Test
        @DisplayName("Should search a head-to-head, oldest first")
        void testSearchHeadToHead() {
            Map<String, Object> result = tools.call("search_matches",
                    Map.of("team1", "Flamengo-RJ", "team2", "Palmeiras"));

            assertEquals(3, result.get("count"));
            assertEquals(3, result.get("total_found"));
            assertEquals("2022-10-01T16:00", rows(result, "matches").get(0).get("date"));
            assertEquals("1-2", rows(result, "matches").get(0).get("score"));
        }

        @Test
        @DisplayName("Should filter a team's matches by venue and apply the limit")
        void testSearchByTeam() {
            Map<String, Object> away = tools.call("search_matches", Map.of("team", "Flamengo", "venue", "away"));
            assertEquals(1, away.get("count"));
            assertEquals("Palmeiras", rows(away, "matches").get(0).get("home_team"));

            Map<String, Object> limited = tools.call("search_matches", Map.of("team", "Flamengo", "limit", 2));
            assertEquals(2, limited.get("count"));
            assertEquals(4, limited.get("total_found"));
        }

        @Test
        @DisplayName("Should search by season, competition and dates")
        void testSearchByScope() {
            assertEquals(4, tools.call("search_matches", Map.of("season", 2023)).get("count"));
            assertEquals(1, tools.call("search_matches", Map.of("competition", "Copa do Brasil")).get("count"));
            assertEquals(2, tools.call("search_matches",
                    Map.of("date_from", "2023-05-08", "date_to", "2023-05-15")).get("count"));
            assertEquals(5, tools.call("search_matches", Map.of()).get("count"));
        }

        @Test
        @DisplayName("Should report the head-to-head record with the latest meeting first")
        void testHeadToHead() {
            Map<String, Object> result = tools.call("get_head_to_head",
                    Map.of("team1", "Flamengo", "team2", "Palmeiras"));

            assertEquals(3, result.get("total_matches"));
            assertEquals(1, result.get("team1_wins"));
            assertEquals(1, result.get("team2_wins"));
            assertEquals(1, result.get("draws"));
            assertEquals("2023-05-08T16:00", rows(result, "recent_matches").get(0).get("date"));
        }

        @Test
        @DisplayName("Should rank the biggest wins by margin")
        void testBiggestWins() {
            List<Map<String, Object>> wins = rows(tools.call("get_biggest_wins", Map.of("limit", "1")), "biggest_wins");

            assertEquals(1, wins.size());
            assertEquals("Santos", wins.get(0).get("home_team"));
            assertEquals(5, wins.get(0).get("goal_difference"));
        }
    }

    @Nested
    @DisplayName("Team and player tools")
    class TeamAndPlayerToolTests {

        @Test
        @DisplayName("Should report a team's season record")
        void testTeamStats() {
            Map<String, Object> stats = tools.call("get_team_stats", Map.of("team", "CR Flamengo", "season", 2023L));

            assertEquals("Flamengo", stats.get("team"));
            assertEquals(2023, stats.get("season"));
            assertEquals(3, stats.get("matches"));
            assertEquals(7, stats.get("points"));
            assertNull(tools.call("get_team_stats", Map.of("team", "Flamengo")).get("season"));
        }

        @Test
        @DisplayName("Should rank a league table")
        void testStandings() {
            List<Map<String, Object>> table = rows(tools.call("get_standings",
                    Map.of("competition", SERIE_A, "season", 2023)), "standings");

            assertEquals(List.of("Flamengo", "Santos", "Palmeiras", "Grêmio"),
                    table.stream().map(row -> row.get("team")).collect(Collectors.toList()));
            assertEquals(1, table.get(0).get("position"));
            assertEquals(4, table.get(0).get("points"));
            assertEquals(-5, table.get(3).get("goal_difference"));
        }

        @Test
        @DisplayName("Should rank top scoring teams with or without a season")
        void testTopScorers() {
            List<Map<String, Object>> all = rows(tools.call("get_top_scorers", Map.of()), "top_scorers");
            assertEquals("Santos", all.get(0).get("team"));
            assertEquals(5, all.get(0).get("goals"));

            List<Map<String, Object>> season = rows(tools.call("get_top_scorers", Map.of("season", 2022)),
                    "top_scorers");
            assertEquals(List.of("Palmeiras", "Flamengo"),
                    season.stream().map(row -> row.get("team")).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("Should search players with a minimum rating")
        void testSearchPlayers() {
            assertEquals(1, tools.call("search_players", Map.of("name", "pedro")).get("count"));
            assertEquals(0, tools.call("search_players", Map.of("name", "gabriel", "min_rating", 80)).get("count"));
            assertEquals(2, tools.call("search_players", Map.of("nationality", "brazil")).get("count"));
            assertEquals(1, tools.call("search_players", Map.of("club", "Flamengo", "min_rating", 79)).get("count"));

            List<Map<String, Object>> best = rows(tools.call("search_players", Map.of("min_rating", 79)), "players");
            assertEquals(List.of("Lionel Messi", "Pedro"),
                    best.stream().map(row -> row.get("name")).collect(Collectors.toList()));
        }
    }
}

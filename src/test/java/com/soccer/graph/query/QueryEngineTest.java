package com.soccer.graph.query;

import com.soccer.graph.alias.AliasCatalog;
import com.soccer.graph.alias.AliasResolver;
import com.soccer.graph.alias.NameNormalizer;
import com.soccer.graph.alias.ResolvedName;
import com.soccer.graph.audit.AuditService;
import com.soccer.graph.core.model.EntityKind;
import com.soccer.graph.core.model.MatchOutcome;
import com.soccer.graph.core.model.RelationshipKind;
import com.soccer.graph.graph.InMemoryGraphStore;
import com.soccer.graph.lock.NoOpKeyLock;
import com.soccer.graph.merge.GraphUpserter;
import com.soccer.graph.merge.MatchCorrelator;
import com.soccer.graph.merge.MergeEngine;
import com.soccer.graph.metrics.NoOpMetricsService;
import com.soccer.graph.source.CompetitionRef;
import com.soccer.graph.source.MatchRecord;
import com.soccer.graph.source.PlayerRecord;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QueryEngine Tests")
class QueryEngineTest {

    private static final String SERIE_A = CompetitionRef.BRASILEIRAO.name();
    private static final String COPA = CompetitionRef.COPA_DO_BRASIL.name();

    private static QueryEngine queries;

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
        engine.merge(match("2023-05-15T16:00", "Santos", "Grêmio", 3, 0, CompetitionRef.BRASILEIRAO));
        engine.merge(match("2023-05-22T16:00", "Grêmio", "Palmeiras", 1, 0, CompetitionRef.BRASILEIRAO));
        engine.merge(match("2023-06-01T21:30", "Flamengo", "Santos", 4, 0, CompetitionRef.COPA_DO_BRASIL));
        engine.merge(match("2022-10-01T16:00", "Flamengo", "Palmeiras", 1, 2, CompetitionRef.BRASILEIRAO));
        engine.merge(match("2021-08-01T16:00", "Vitória", "Bahia", 1, 1, CompetitionRef.BRASILEIRAO));

        engine.merge(player(1, "Gabriel Barbosa", 78, "Flamengo"));
        engine.merge(player(2, "Pedro", 80, "Flamengo"));
        engine.merge(player(3, "Neymar Jr", 92, "Paris Saint-Germain"));
        engine.merge(player(4, "Lionel Messi", 91, "Argentina", "Inter Miami"));

        AliasResolver teams = AliasResolver.builder(AliasCatalog.loadDefault().teams()).build();
        queries = new QueryEngine(store, teams);
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

    private static PlayerRecord player(long id, String name, int overall, String club) {
        return player(id, name, overall, "Brazil", club);
    }

    private static PlayerRecord player(long id, String name, int overall, String nationality, String club) {
        return new PlayerRecord("player-roster", id + 1, id, name, nationality, 25, "ST", overall, overall + 2,
                ResolvedName.of(club), 10_000, null, null, null);
    }

    @Nested
    @DisplayName("Team queries")
    class TeamQueryTests {

        @Test
        @DisplayName("Should aggregate a team's league season")
        void testTeamStatistics() {
            TeamStatistics stats = queries.teamStatistics("Flamengo-RJ", QueryScope.of(SERIE_A, 2023));

            assertEquals("Flamengo", stats.team());
            assertEquals(2, stats.played());
            assertEquals(1, stats.wins());
            assertEquals(1, stats.draws());
            assertEquals(0, stats.losses());
            assertEquals(2, stats.goalsFor());
            assertEquals(1, stats.goalsAgainst());
            assertEquals(1, stats.cleanSheets());
            assertEquals(4, stats.points());
            assertEquals(50.0, stats.winPercentage(), 0.001);
            assertEquals(1.0, stats.averageGoalsScored(), 0.001);
            assertEquals(0.5, stats.averageGoalsConceded(), 0.001);
        }

        @Test
        @DisplayName("Should return zeros for a team without matches")
        void testUnknownTeam() {
            TeamStatistics stats = queries.teamStatistics("Cruzeiro", QueryScope.all());

            assertEquals(0, stats.played());
            assertEquals(0, stats.points());
            assertEquals(0.0, stats.winPercentage());
        }

        @Test
        @DisplayName("Should count home matches only")
        void testHomeRecord() {
            TeamStatistics home = queries.homeRecord("Flamengo", 2023);

            assertEquals(2, home.played());
            assertEquals(2, home.wins());
            assertEquals(6, home.goalsFor());
            assertEquals(3, queries.homeRecord("Flamengo", null).played());
        }

        @Test
        @DisplayName("Should be symmetric between the two teams")
        void testHeadToHead() {
            HeadToHead record = queries.headToHead("Flamengo", "Palmeiras");

            assertEquals(3, record.matches());
            assertEquals(1, record.aWins());
            assertEquals(1, record.bWins());
            assertEquals(1, record.draws());
            assertEquals(3, record.aGoals());
            assertEquals(3, record.bGoals());
            assertEquals(record.mirror(), queries.headToHead("Palmeiras", "Flamengo"));
            assertEquals(3, queries.matchesBetween("Palmeiras", "Flamengo").size());
        }

        @Test
        @DisplayName("Should reject a head-to-head of a team against itself")
        void testHeadToHeadSameTeam() {
            assertThrows(IllegalArgumentException.class, () -> queries.headToHead("Flamengo", "Flamengo-RJ"));
        }

        @Test
        @DisplayName("Should list the most recent matches first")
        void testRecentForm() {
            List<FormEntry> form = queries.recentForm("Flamengo", null, 2);

            assertEquals(2, form.size());
            assertEquals("Santos", form.get(0).opponent());
            assertTrue(form.get(0).home());
            assertEquals(MatchOutcome.WIN, form.get(0).result());
            assertEquals(MatchOutcome.DRAW, form.get(1).result());
            assertFalse(form.get(1).home());

            List<FormEntry> league = queries.recentForm("Flamengo", SERIE_A, 10);
            assertEquals(3, league.size());
            assertEquals(MatchOutcome.LOSS, league.get(2).result());
            assertTrue(queries.recentForm("Flamengo", null, 0).isEmpty());
        }

        @Test
        @DisplayName("Should total every competition with a breakdown")
        void testCrossCompetitionTotals() {
            CompetitionTotals totals = queries.crossCompetitionTotals("Flamengo");

            assertEquals(4, totals.matches());
            assertEquals(7, totals.goalsFor());
            assertEquals(3, totals.goalsAgainst());
            assertEquals(List.of(SERIE_A, COPA), List.copyOf(totals.byCompetition().keySet()));
            assertEquals(3, totals.byCompetition().get(SERIE_A).played());
        }

        @Test
        @DisplayName("Should list a team's matches oldest first, by venue")
        void testMatchesOf() {
            List<MatchSummary> all = queries.matchesOf("Flamengo-RJ", Venue.ANY);

            assertEquals(4, all.size());
            assertEquals(LocalDateTime.of(2022, 10, 1, 16, 0), all.get(0).startTime());
            assertEquals(COPA, all.get(3).competition());
            assertEquals(3, queries.matchesOf("Flamengo", Venue.HOME).size());
            assertEquals(List.of("Palmeiras"), queries.matchesOf("Flamengo", Venue.AWAY).stream()
                    .map(MatchSummary::homeTeam).collect(Collectors.toList()));
            assertEquals(4, queries.matchesOf("Flamengo", null).size());
            assertTrue(queries.matchesOf("Cruzeiro", Venue.ANY).isEmpty());
        }

        @Test
        @DisplayName("Should find opponents both teams have faced")
        void testCommonOpponents() {
            assertEquals(List.of("Palmeiras", "Santos"), queries.commonOpponents("Flamengo", "Grêmio"));
            assertTrue(queries.commonOpponents("Bahia", "Flamengo").isEmpty());
        }
    }

    @Nested
    @DisplayName("Competition queries")
    class CompetitionQueryTests {

        @Test
        @DisplayName("Should rank by points, goal difference and goals")
        void testStandings() {
            List<StandingRow> table = queries.standings(SERIE_A, 2023);

            assertEquals(List.of("Flamengo", "Santos", "Grêmio", "Palmeiras"),
                    table.stream().map(StandingRow::team).collect(Collectors.toList()));
            assertEquals(1, table.get(0).position());
            assertEquals(4, table.get(0).points());
            assertEquals(3, table.get(3).played());
            assertEquals(-2, table.get(3).goalDifference());
        }

        @Test
        @DisplayName("Should break a full tie by team name")
        void testStandingsTie() {
            List<StandingRow> table = queries.standings(SERIE_A, 2021);

            assertEquals("Bahia", table.get(0).team());
            assertEquals("Vitória", table.get(1).team());
            assertEquals(2, table.get(1).position());
        }

        @Test
        @DisplayName("Should be empty for a season without matches")
        void testEmptyStandings() {
            assertTrue(queries.standings(SERIE_A, 1999).isEmpty());
        }

        @Test
        @DisplayName("Should rank teams by goals across competitions")
        void testTopScoringTeams() {
            List<TeamGoals> top = queries.topScoringTeams(2023, 2);

            assertEquals(2, top.size());
            assertEquals("Flamengo", top.get(0).team());
            assertEquals(6, top.get(0).goals());
            assertEquals(3, top.get(0).matches());
            assertEquals(2.0, top.get(0).goalsPerMatch(), 0.001);
            assertEquals("Santos", top.get(1).team());
        }

        @Test
        @DisplayName("Should rank teams by goals over every season")
        void testTopScoringTeamsAllSeasons() {
            TeamGoals top = queries.topScoringTeams(null, 1).get(0);

            assertEquals("Flamengo", top.team());
            assertEquals(7, top.goals());
            assertEquals(4, top.matches());
            assertNull(top.season());
        }

        @ParameterizedTest
        @DisplayName("Should list matches by season and competition")
        @CsvSource({
                "2023, Brasileirão Série A, 4",
                "2023, , 5",
                ", Copa do Brasil, 1",
                "2021, , 1",
                "1999, , 0",
                ", , 7"
        })
        void testMatchesIn(Integer season, String competition, int expected) {
            List<MatchSummary> matches = queries.matchesIn(QueryScope.of(competition, season));

            assertEquals(expected, matches.size());
            for (int i = 1; i < matches.size(); i++) {
                assertFalse(matches.get(i).startTime().isBefore(matches.get(i - 1).startTime()));
            }
        }

        @Test
        @DisplayName("Should list matches in a date range, both ends included")
        void testMatchesBetweenDates() {
            List<MatchSummary> may = queries.matchesBetweenDates(LocalDate.of(2023, 5, 1), LocalDate.of(2023, 5, 15));

            assertEquals(List.of("Flamengo", "Palmeiras", "Santos"),
                    may.stream().map(MatchSummary::homeTeam).collect(Collectors.toList()));
            assertEquals(1, queries.matchesBetweenDates(LocalDate.of(2023, 6, 1), LocalDate.of(2023, 6, 1)).size());
            assertThrows(IllegalArgumentException.class,
                    () -> queries.matchesBetweenDates(LocalDate.of(2023, 6, 1), LocalDate.of(2023, 5, 1)));
        }

        @Test
        @DisplayName("Should order wins by margin")
        void testBiggestWins() {
            assertEquals("Santos", queries.biggestWins(null, 1).get(0).awayTeam());
            assertEquals("Santos", queries.biggestWins(SERIE_A, 1).get(0).homeTeam());
            assertEquals(3, queries.biggestWins(SERIE_A, 1).get(0).margin());
        }

        @Test
        @DisplayName("Should average goals per match in scope")
        void testAverageGoals() {
            assertEquals(2.2, queries.averageGoalsPerMatch(QueryScope.season(2023)), 0.0001);
            assertEquals(4.0, queries.averageGoalsPerMatch(QueryScope.competition(COPA)), 0.0001);
            assertEquals(0.0, queries.averageGoalsPerMatch(QueryScope.season(1999)));
            assertTrue(QueryScope.all().isAll());
            assertFalse(QueryScope.season(2023).isAll());
        }
    }

    @Nested
    @DisplayName("Player and lookup queries")
    class PlayerQueryTests {

        @Test
        @DisplayName("Should list club members best rated first")
        void testPlayersByClub() {
            List<PlayerSummary> players = queries.playersByClub("CR Flamengo");

            assertEquals(List.of("Pedro", "Gabriel Barbosa"),
                    players.stream().map(PlayerSummary::name).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("Should find players by name and rating")
        void testFindPlayers() {
            assertEquals("1", queries.findPlayers("gabriel").get(0).id());
            assertEquals("Neymar Jr", queries.topRatedPlayers(1).get(0).name());
            assertEquals(4, queries.topRatedPlayers(10).size());
        }

        @Test
        @DisplayName("Should apply a minimum rating to a name search")
        void testFindPlayersWithMinimumRating() {
            assertEquals(1, queries.findPlayers("pedro", 80).size());
            assertTrue(queries.findPlayers("gabriel", 80).isEmpty());
            assertEquals(1, queries.findPlayers("gabriel", null).size());
        }

        @Test
        @DisplayName("Should find players by nationality, ignoring case")
        void testPlayersByNationality() {
            assertEquals(List.of("Lionel Messi"), queries.playersByNationality("argentin").stream()
                    .map(PlayerSummary::name).collect(Collectors.toList()));
            assertEquals(List.of("Neymar Jr", "Pedro", "Gabriel Barbosa"), queries.playersByNationality("BRAZIL")
                    .stream().map(PlayerSummary::name).collect(Collectors.toList()));
            assertTrue(queries.playersByNationality("Uruguay").isEmpty());
        }

        @Test
        @DisplayName("Should keep Brazilians whose club has played in the graph")
        void testBrazilianPlayersAtBrazilianClubs() {
            assertEquals(List.of("Pedro", "Gabriel Barbosa"), queries.brazilianPlayersAtBrazilianClubs().stream()
                    .map(PlayerSummary::name).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("Should find teams and summarize the store")
        void testLookup() {
            assertEquals(List.of("Grêmio"), queries.findTeams("gre"));
            assertTrue(queries.findStadiums("maracana").isEmpty());

            StoreSummary summary = queries.storeSummary();
            assertEquals(7, summary.nodeCount(EntityKind.MATCH));
            assertEquals(7, summary.relationshipCount(RelationshipKind.PLAYED_HOME));
            assertEquals(4, summary.relationshipCount(RelationshipKind.BELONGS_TO));
            assertEquals(7, summary.relationshipCount(RelationshipKind.IN_COMPETITION));
            assertTrue(summary.totalRelationships() > summary.relationshipCount(RelationshipKind.PLAYED_HOME));
        }
    }
}

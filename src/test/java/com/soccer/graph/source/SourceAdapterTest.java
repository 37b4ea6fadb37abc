package com.soccer.graph.source;

import com.soccer.graph.alias.AliasCatalog;
import com.soccer.graph.alias.AliasResolver;
import com.soccer.graph.core.model.CompetitionType;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Source adapter Tests")
class SourceAdapterTest {

    private static AliasResolver teams;
    private static AliasResolver stadiums;

    @BeforeAll
    static void setUp() {
        AliasCatalog catalog = AliasCatalog.loadDefault();
        teams = AliasResolver.builder(catalog.teams()).build();
        stadiums = AliasResolver.builder(catalog.stadiums()).build();
    }

    private static <R extends CanonicalRecord> List<R> readAll(AdaptedRecords<R> records) {
        List<R> result = new ArrayList<>();
        records.forEach(result::add);
        return result;
    }

    @Nested
    @DisplayName("LeagueMatchAdapter")
    class LeagueTests {

        private static final String CSV = """
                datetime,home_team,home_team_state,away_team,away_team_state,home_goal,away_goal,season,round
                2023-05-01 16:00:00,Flamengo,RJ,Palmeiras,SP,2,1,2023,4
                2023-05-08 16:00:00,Atlético,MG,Atlético,PR,1,1,2023,5
                bad-date,Flamengo,RJ,Santos,SP,1,0,2023,6
                2023-05-15 16:00:00,Flamengo,RJ,Santos,SP,x,0,2023,6
                2023-05-15 16:00:00,Flamengo,RJ,Flamengo-RJ,RJ,1,0,2023,6
                2023-05-22 16:00:00,Grêmio,RS,Inter,RS,-1,0,2023,7
                """;

        private final LeagueMatchAdapter adapter = new LeagueMatchAdapter(teams, stadiums);

        @Test
        @DisplayName("Should map valid rows to canonical match records")
        void testMapsRows() {
            List<MatchRecord> records = readAll(adapter.adapt(CsvRowSource.fromString("league", CSV)));

            assertEquals(2, records.size());
            MatchRecord first = records.get(0);
            assertEquals(LocalDateTime.of(2023, 5, 1, 16, 0), first.startTime());
            assertEquals("Flamengo", first.homeTeam().canonicalName());
            assertEquals("RJ", first.homeTeam().region());
            assertEquals(2, first.homeGoals());
            assertEquals(1, first.awayGoals());
            assertEquals(2023, first.season());
            assertEquals("4", first.round());
            assertEquals(CompetitionRef.BRASILEIRAO, first.competition());
            assertEquals(LeagueMatchAdapter.NAME, first.source());
            assertEquals("2023-05-01T16:00|Flamengo|Palmeiras", first.key().value());
        }

        @Test
        @DisplayName("Should use the state columns to tell same-named clubs apart")
        void testStateColumns() {
            MatchRecord record = readAll(adapter.adapt(CsvRowSource.fromString("league", CSV))).get(1);

            assertEquals("Atlético Mineiro", record.homeTeam().canonicalName());
            assertEquals("Atlético Paranaense", record.awayTeam().canonicalName());
            assertEquals("Atlético", record.homeTeam().input());
            assertEquals("MG", record.homeTeam().region());
        }

        @Test
        @DisplayName("Should keep unknown clubs from different states as different teams")
        void testUnknownClubsByState() {
            String csv = """
                    datetime,home_team,home_team_state,away_team,away_team_state,home_goal,away_goal,season,round
                    2023-05-08 16:00:00,América,MG,América,RN,2,0,2023,5
                    """;

            List<MatchRecord> records = readAll(adapter.adapt(CsvRowSource.fromString("league", csv)));

            assertEquals(1, records.size());
            assertEquals("América-MG", records.get(0).homeTeam().canonicalName());
            assertEquals("América-RN", records.get(0).awayTeam().canonicalName());
            assertEquals("América", records.get(0).awayTeam().input());
        }

        @Test
        @DisplayName("Should skip and report invalid rows without aborting")
        void testRowIssues() {
            AdaptedRecords<MatchRecord> records = adapter.adapt(CsvRowSource.fromString("league", CSV));
            AdaptedRecords<MatchRecord>.RecordIterator iterator = records.iterator();
            while (iterator.hasNext()) {
                iterator.next();
            }

            List<RowIssue> issues = iterator.issues();
            assertEquals(4, issues.size());
            assertEquals(RowIssue.Kind.PARSE, issues.get(0).kind());
            assertEquals(4, issues.get(0).lineNumber());
            assertEquals(RowIssue.Kind.PARSE, issues.get(1).kind());
            assertEquals(RowIssue.Kind.VALIDATION, issues.get(2).kind());
            assertEquals(RowIssue.Kind.VALIDATION, issues.get(3).kind());
            assertEquals(issues, records.issues());
            assertEquals(LeagueMatchAdapter.NAME, issues.get(0).source());
        }

        @Test
        @DisplayName("Should yield the same records on every pass")
        void testRestartable() {
            AdaptedRecords<MatchRecord> records = adapter.adapt(CsvRowSource.fromString("league", CSV));

            assertEquals(readAll(records), readAll(records));
        }
    }

    @Nested
    @DisplayName("Cup adapters")
    class CupTests {

        @Test
        @DisplayName("Should keep free-text rounds and default the season to the match year")
        void testCupMatches() {
            String csv = """
                    datetime,home_team,away_team,home_goal,away_goal,season,round
                    2022-10-12 21:45:00,Corinthians-SP,Flamengo-RJ,0,0,,Final
                    """;

            List<MatchRecord> records = readAll(new CupMatchAdapter(teams, stadiums)
                    .adapt(CsvRowSource.fromString("cup", csv)));

            assertEquals(1, records.size());
            assertEquals("Final", records.get(0).round());
            assertEquals(2022, records.get(0).season());
            assertEquals(CompetitionType.CUP, records.get(0).competition().type());
            assertNull(records.get(0).stage());
        }

        @Test
        @DisplayName("Should read the stage of international matches")
        void testInternationalCup() {
            String csv = """
                    datetime,home_team,away_team,home_goal,away_goal,season,stage,round
                    2019-11-23 17:00:00,Flamengo,River Plate,2,1,2019,final,1
                    """;

            InternationalCupAdapter adapter = new InternationalCupAdapter(teams, stadiums);
            MatchRecord record = readAll(adapter.adapt(CsvRowSource.fromString("libertadores", csv))).get(0);

            assertEquals("final", record.stage());
            assertEquals("River Plate", record.awayTeam().canonicalName());
            assertFalse(record.awayTeam().known());
            assertEquals(CompetitionRef.LIBERTADORES, adapter.competition());
            assertEquals(RecordPhase.PRIMARY, adapter.phase());
        }
    }

    @Nested
    @DisplayName("ExtendedStatsAdapter")
    class StatsTests {

        @Test
        @DisplayName("Should map side statistics and skip rows without any")
        void testStats() {
            String csv = """
                    date,time,home_team,away_team,home_goal,away_goal,home_corner,away_corner,home_attack,away_attack,home_shots,away_shots
                    2023-05-01,16h00,Flamengo,Palmeiras,2,1,5,3,40,35,12,8
                    01/05/2023,,Santos,Grêmio,,,,,,,,
                    2023-05-02,19:30,Bahia,Vitória,,,-1,2,,,,
                    """;

            ExtendedStatsAdapter adapter = new ExtendedStatsAdapter(teams);
            AdaptedRecords<MatchStatsRecord> records = adapter.adapt(CsvRowSource.fromString("stats", csv));
            List<MatchStatsRecord> mapped = readAll(records);

            assertEquals(1, mapped.size());
            MatchStatsRecord stats = mapped.get(0);
            assertEquals(LocalDateTime.of(2023, 5, 1, 16, 0), stats.startTime());
            assertEquals(Integer.valueOf(12), stats.home().shots());
            assertEquals(Integer.valueOf(3), stats.away().corners());
            assertEquals(Integer.valueOf(35), stats.away().attacks());
            assertEquals(2, records.issues().size());
            assertEquals(RecordPhase.CORRELATED, adapter.phase());
        }
    }

    @Nested
    @DisplayName("HistoricalArchiveAdapter")
    class ArchiveTests {

        @Test
        @DisplayName("Should map venue rows and validate capacity")
        void testArchive() {
            String csv = """
                    id,date,season,round,home_team,away_team,arena,city,state,capacity
                    A-1,2023-05-01,2023,4,Flamengo,Palmeiras,Estádio do Maracanã,Rio de Janeiro,rj,78.838
                    A-2,,2023,5,Palmeiras,Flamengo,Allianz Parque,São Paulo,,0
                    """;

            AdaptedRecords<MatchVenueRecord> records = new HistoricalArchiveAdapter(teams, stadiums)
                    .adapt(CsvRowSource.fromString("archive", csv));
            List<MatchVenueRecord> mapped = readAll(records);

            assertEquals(1, mapped.size());
            MatchVenueRecord venue = mapped.get(0);
            assertEquals("A-1", venue.externalId());
            assertEquals(LocalDateTime.of(2023, 5, 1, 0, 0), venue.startTime());
            assertEquals("Maracanã", venue.stadium().canonicalName());
            assertEquals("RJ", venue.region());
            assertEquals(Integer.valueOf(78838), venue.capacity());
            assertEquals(1, records.issues().size());
            assertEquals(RowIssue.Kind.VALIDATION, records.issues().get(0).kind());
            assertEquals(3, records.issues().get(0).lineNumber());
        }
    }

    @Nested
    @DisplayName("PlayerRosterAdapter")
    class RosterTests {

        private static final String CSV = """
                ID,Name,Age,Nationality,Overall,Potential,Club,Wage,Position,Jersey Number,Joined,Contract Valid Until
                190871,Neymar Jr,26,Brazil,92,93,Paris Saint-Germain,€290K,LW,10,"Aug 3, 2017",2022
                20801,Cristiano Ronaldo,33,Portugal,94,94,Juventus,€405K,ST,7,"Jul 10, 2018",2022
                1,Gabriel Barbosa,21,Brazil,78,85,Flamengo,€20K,ST,9,2019-01-01,2023
                -5,Nobody,20,Brazil,,,,,,,,
                """;

        @Test
        @DisplayName("Should keep only the configured nationality")
        void testNationalityFilter() {
            AdaptedRecords<PlayerRecord> records = new PlayerRosterAdapter(teams)
                    .adapt(CsvRowSource.fromString("roster", CSV));
            AdaptedRecords<PlayerRecord>.RecordIterator iterator = records.iterator();
            List<PlayerRecord> players = new ArrayList<>();
            iterator.forEachRemaining(players::add);

            assertEquals(2, players.size());
            assertEquals(1, iterator.filteredCount());
            assertEquals(1, iterator.issues().size());

            PlayerRecord neymar = players.get(0);
            assertEquals(190871L, neymar.playerId());
            assertEquals(Integer.valueOf(290_000), neymar.wage());
            assertEquals(LocalDate.of(2017, 8, 3), neymar.joined());
            assertEquals(Integer.valueOf(2022), neymar.contractUntil());
            assertEquals(Integer.valueOf(10), neymar.jerseyNumber());
            assertEquals("Flamengo", players.get(1).club().canonicalName());
        }

        @Test
        @DisplayName("Should keep every player when no nationality is set")
        void testNoFilter() {
            List<PlayerRecord> players = readAll(new PlayerRosterAdapter(teams, null)
                    .adapt(CsvRowSource.fromString("roster", CSV)));

            assertEquals(3, players.size());
        }
    }
}

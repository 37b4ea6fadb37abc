package com.soccer.graph.api;

import com.soccer.graph.alias.AliasCatalog;
import com.soccer.graph.alias.AliasResolver;
import com.soccer.graph.alias.NameNormalizer;
import com.soccer.graph.audit.AuditService;
import com.soccer.graph.graph.GraphConnection;
import com.soccer.graph.graph.GraphExporter;
import com.soccer.graph.graph.GraphStore;
import com.soccer.graph.graph.InMemoryGraphStore;
import com.soccer.graph.ingest.IngestionOptions;
import com.soccer.graph.ingest.IngestionReport;
import com.soccer.graph.ingest.IngestionService;
import com.soccer.graph.ingest.IngestionSummary;
import com.soccer.graph.ingest.ProgressCallback;
import com.soccer.graph.lock.KeyLock;
import com.soccer.graph.lock.LocalKeyLock;
import com.soccer.graph.mcp.SoccerGraphMcpTools;
import com.soccer.graph.merge.DeduplicationResult;
import com.soccer.graph.merge.GraphUpserter;
import com.soccer.graph.merge.MatchCorrelator;
import com.soccer.graph.merge.MergeEngine;
import com.soccer.graph.merge.TeamDeduplicator;
import com.soccer.graph.metrics.MetricsService;
import com.soccer.graph.metrics.NoOpMetricsService;
import com.soccer.graph.query.QueryEngine;
import com.soccer.graph.source.AdaptedRecords;
import com.soccer.graph.source.CompetitionRef;
import com.soccer.graph.source.CupMatchAdapter;
import com.soccer.graph.source.ExtendedStatsAdapter;
import com.soccer.graph.source.HistoricalArchiveAdapter;
import com.soccer.graph.source.InternationalCupAdapter;
import com.soccer.graph.source.LeagueMatchAdapter;
import com.soccer.graph.source.PlayerRosterAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Main entry point: wires the resolvers, adapters, merge engine, ingestion service
 * and query engine around one in-memory graph.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (SoccerGraph graph = SoccerGraph.builder().build()) {
 *     graph.ingestAll(List.of(
 *             graph.leagueMatches().adapt(CsvRowSource.of(Path.of("brasileirao.csv"))),
 *             graph.extendedStats().adapt(CsvRowSource.of(Path.of("stats.csv")))));
 *
 *     TeamStatistics flamengo = graph.queries().teamStatistics("Flamengo-RJ", QueryScope.season(2023));
 *     List&lt;StandingRow&gt; table = graph.queries().standings("Brasileirão Série A", 2023);
 * }
 * </pre>
 */
public class SoccerGraph implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SoccerGraph.class);

    private final AliasResolver teamResolver;
    private final AliasResolver stadiumResolver;
    private final GraphStore store;
    private final AuditService auditService;
    private final MetricsService metrics;
    private final IngestionOptions options;
    private final MergeEngine mergeEngine;
    private final TeamDeduplicator deduplicator;
    private final IngestionService ingestionService;
    private final QueryEngine queryEngine;
    private final SoccerGraphMcpTools mcpTools;

    private SoccerGraph(Builder builder) {
        this.options = builder.options;
        this.metrics = builder.metrics;
        this.auditService = builder.auditService;
        NameNormalizer normalizer = builder.normalizer;
        AliasCatalog catalog = builder.catalog != null ? builder.catalog : AliasCatalog.loadDefault();

        this.teamResolver = AliasResolver.builder(catalog.teams())
                .cacheConfig(options.getCacheConfig())
                .metrics(metrics)
                .build();
        this.stadiumResolver = AliasResolver.builder(catalog.stadiums())
                .cacheConfig(options.getCacheConfig())
                .metrics(metrics)
                .build();
        this.store = builder.store != null ? builder.store : new InMemoryGraphStore(normalizer);

        KeyLock lock = builder.lock != null ? builder.lock : new LocalKeyLock(options.getLockConfig());
        GraphUpserter upserter = new GraphUpserter(store, lock, auditService, metrics);
        MatchCorrelator correlator = new MatchCorrelator(store, normalizer, options.getCorrelationWindow());
        this.mergeEngine = new MergeEngine(upserter, correlator, auditService, metrics);
        this.deduplicator = new TeamDeduplicator(upserter, correlator, auditService, metrics);
        this.ingestionService = new IngestionService(mergeEngine, metrics, options);
        this.queryEngine = new QueryEngine(store, teamResolver, normalizer);
        this.mcpTools = new SoccerGraphMcpTools(queryEngine);

        log.info("soccer-graph.initialized teams={} stadiums={} parallelism={}",
                catalog.teams().canonicalNames().size(), catalog.stadiums().canonicalNames().size(),
                options.getParallelism());
    }

    // ==================== ADAPTERS ====================

    public LeagueMatchAdapter leagueMatches() {
        return new LeagueMatchAdapter(teamResolver, stadiumResolver);
    }

    public LeagueMatchAdapter leagueMatches(CompetitionRef competition) {
        return new LeagueMatchAdapter(teamResolver, stadiumResolver, competition);
    }

    public CupMatchAdapter cupMatches() {
        return new CupMatchAdapter(teamResolver, stadiumResolver);
    }

    public InternationalCupAdapter internationalCup() {
        return new InternationalCupAdapter(teamResolver, stadiumResolver);
    }

    public ExtendedStatsAdapter extendedStats() {
        return new ExtendedStatsAdapter(teamResolver);
    }

    public HistoricalArchiveAdapter historicalArchive() {
        return new HistoricalArchiveAdapter(teamResolver, stadiumResolver);
    }

    public PlayerRosterAdapter playerRoster() {
        return new PlayerRosterAdapter(teamResolver, options.getRosterNationality());
    }

    // ==================== INGESTION ====================

    public IngestionSummary ingest(AdaptedRecords<?> records) {
        return ingestionService.ingest(records);
    }

    public IngestionSummary ingest(AdaptedRecords<?> records, ProgressCallback callback) {
        return ingestionService.ingest(records, callback);
    }

    /**
     * Ingests several sources; primary sources complete before correlated ones start.
     */
    public IngestionReport ingestAll(List<? extends AdaptedRecords<?>> sources) {
        return ingestionService.ingestAll(sources);
    }

    /**
     * Folds teams whose name now resolves to another stored team into that team.
     */
    public List<DeduplicationResult> deduplicate() {
        return deduplicator.deduplicate(teamResolver);
    }

    public DeduplicationResult mergeTeams(String sourceTeam, String targetTeam) {
        return deduplicator.merge(sourceTeam, targetTeam);
    }

    // ==================== ACCESSORS ====================

    public QueryEngine queries() {
        return queryEngine;
    }

    /**
     * Read-only query tools for an MCP server.
     */
    public SoccerGraphMcpTools mcpTools() {
        return mcpTools;
    }

    /**
     * An exporter writing this graph's store to a graph backend.
     */
    public GraphExporter exporter(GraphConnection connection) {
        return new GraphExporter(connection);
    }

    public AliasResolver teamResolver() {
        return teamResolver;
    }

    public AliasResolver stadiumResolver() {
        return stadiumResolver;
    }

    public MergeEngine mergeEngine() {
        return mergeEngine;
    }

    public GraphStore store() {
        return store;
    }

    public AuditService auditService() {
        return auditService;
    }

    public MetricsService metrics() {
        return metrics;
    }

    @Override
    public void close() {
        log.info("soccer-graph.closing");
        ingestionService.close();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private IngestionOptions options = IngestionOptions.defaults();
        private MetricsService metrics = new NoOpMetricsService();
        private AuditService auditService = new AuditService();
        private NameNormalizer normalizer = new NameNormalizer();
        private AliasCatalog catalog;
        private GraphStore store;
        private KeyLock lock;

        public Builder options(IngestionOptions options) {
            this.options = options;
            return this;
        }

        public Builder metricsService(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder normalizer(NameNormalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        /**
         * Alias tables to use instead of the bundled ones.
         */
        public Builder aliasCatalog(AliasCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder store(GraphStore store) {
            this.store = store;
            return this;
        }

        public Builder keyLock(KeyLock lock) {
            this.lock = lock;
            return this;
        }

        public SoccerGraph build() {
            if (options == null) {
                throw new IllegalStateException("options is required");
            }
            if (metrics == null) {
                throw new IllegalStateException("metricsService is required");
            }
            if (auditService == null) {
                throw new IllegalStateException("auditService is required");
            }
            if (normalizer == null) {
                throw new IllegalStateException("normalizer is required");
            }
            return new SoccerGraph(this);
        }
    }
}

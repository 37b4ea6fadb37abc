package com.soccer.graph.cdi;

import com.soccer.graph.api.SoccerGraph;
import com.soccer.graph.cache.CacheConfig;
import com.soccer.graph.graph.FalkorDBConnection;
import com.soccer.graph.graph.GraphConnection;
import com.soccer.graph.ingest.IngestionOptions;
import com.soccer.graph.lock.LockConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * CDI producer that wires {@link SoccerGraph} from MicroProfile Config properties.
 *
 * <pre>
 * soccer-graph:
 *   ingest:
 *     parallelism: 4
 *     correlation-window-hours: 24
 *     roster-nationality: Brazil
 *   falkordb:
 *     host: localhost
 *     port: 6379
 *     graph-name: soccer
 * </pre>
 */
@ApplicationScoped
public class SoccerGraphProducer {

    private static final Logger log = LoggerFactory.getLogger(SoccerGraphProducer.class);

    /** Roster nationality value that keeps every player. */
    static final String ALL_NATIONALITIES = "*";

    // ── FalkorDB ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "soccer-graph.falkordb.host", defaultValue = "localhost")
    String falkordbHost;

    @Inject
    @ConfigProperty(name = "soccer-graph.falkordb.port", defaultValue = "6379")
    int falkordbPort;

    @Inject
    @ConfigProperty(name = "soccer-graph.falkordb.graph-name", defaultValue = "soccer")
    String falkordbGraphName;

    // ── Ingestion ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "soccer-graph.ingest.parallelism", defaultValue = "4")
    int parallelism;

    @Inject
    @ConfigProperty(name = "soccer-graph.ingest.correlation-window-hours", defaultValue = "24")
    long correlationWindowHours;

    @Inject
    @ConfigProperty(name = "soccer-graph.ingest.roster-nationality", defaultValue = "Brazil")
    String rosterNationality;

    @Inject
    @ConfigProperty(name = "soccer-graph.lock.timeout-ms", defaultValue = "5000")
    long lockTimeoutMs;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "soccer-graph.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "soccer-graph.cache.max-size", defaultValue = "-1")
    long cacheMaxSize;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @Singleton
    public SoccerGraph soccerGraph() {
        IngestionOptions options = ingestionOptions();
        log.info("Producing SoccerGraph: parallelism={} correlationWindow={} nationality={}",
                options.getParallelism(), options.getCorrelationWindow(), options.getRosterNationality());
        return SoccerGraph.builder()
                .options(options)
                .build();
    }

    public void closeSoccerGraph(@Disposes SoccerGraph graph) {
        log.info("Closing SoccerGraph");
        graph.close();
    }

    @Produces
    @ApplicationScoped
    public GraphConnection graphConnection() {
        log.info("Producing GraphConnection: falkordb={}:{}/{}", falkordbHost, falkordbPort, falkordbGraphName);
        return new FalkorDBConnection(falkordbHost, falkordbPort, falkordbGraphName);
    }

    public void closeGraphConnection(@Disposes GraphConnection connection) {
        connection.close();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    IngestionOptions ingestionOptions() {
        CacheConfig cacheConfig = cacheEnabled ? new CacheConfig(cacheMaxSize, true) : CacheConfig.disabled();
        return IngestionOptions.builder()
                .parallelism(parallelism)
                .correlationWindow(Duration.ofHours(correlationWindowHours))
                .lockConfig(new LockConfig(lockTimeoutMs))
                .cacheConfig(cacheConfig)
                .rosterNationality(ALL_NATIONALITIES.equals(rosterNationality) ? null : rosterNationality)
                .build();
    }
}

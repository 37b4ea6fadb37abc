package com.soccer.graph.alias;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.soccer.graph.core.model.EntityKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Team and stadium alias tables read from a JSON document.
 *
 * <p>Format:</p>
 * <pre>
 * {
 *   "teams":    [ { "canonical": "Corinthians", "aliases": ["Sport Club Corinthians Paulista", "Corinthians-SP"] } ],
 *   "stadiums": [ { "canonical": "Maracanã", "aliases": ["Estádio Jornalista Mário Filho"] } ]
 * }
 * </pre>
 */
public record AliasCatalog(AliasTable teams, AliasTable stadiums) {
    private static final Logger log = LoggerFactory.getLogger(AliasCatalog.class);

    /** Classpath location of the bundled tables. */
    public static final String DEFAULT_RESOURCE = "/aliases.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Loads the tables bundled with the library.
     */
    public static AliasCatalog loadDefault() {
        try (InputStream in = AliasCatalog.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Alias resource not found: " + DEFAULT_RESOURCE);
            }
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    public static AliasCatalog load(InputStream in) throws IOException {
        return load(in, new NameNormalizer(), RegionCodes.brazilianStates());
    }

    public static AliasCatalog load(InputStream in, NameNormalizer normalizer, RegionCodes regions)
            throws IOException {
        AliasDocument document = MAPPER.readValue(in, AliasDocument.class);
        AliasTable teams = toTable(EntityKind.TEAM, document.teams(), normalizer, regions);
        AliasTable stadiums = toTable(EntityKind.STADIUM, document.stadiums(), normalizer, regions);
        log.info("aliases.loaded teams={} stadiums={} teamKeys={} stadiumKeys={}",
                teams.canonicalNames().size(), stadiums.canonicalNames().size(), teams.size(), stadiums.size());
        return new AliasCatalog(teams, stadiums);
    }

    private static AliasTable toTable(EntityKind kind, List<AliasEntry> entries,
                                      NameNormalizer normalizer, RegionCodes regions) {
        AliasTable.Builder builder = AliasTable.builder(kind, normalizer, regions);
        if (entries != null) {
            for (AliasEntry entry : entries) {
                builder.add(entry.canonical(), entry.aliases() != null ? entry.aliases() : List.of());
            }
        }
        return builder.build();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AliasDocument(List<AliasEntry> teams, List<AliasEntry> stadiums) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AliasEntry(String canonical, List<String> aliases) {}
}

package com.soccer.graph.source;

import com.soccer.graph.alias.AliasResolver;
import com.soccer.graph.alias.ResolvedName;

import java.util.Objects;
import java.util.Optional;

/**
 * Player ratings roster: {@code ID, Name, Age, Nationality, Overall, Potential, Club, Wage,
 * Position, Jersey Number, Joined, Contract Valid Until}. Rows of other nationalities
 * are left out.
 */
public class PlayerRosterAdapter implements SourceAdapter<PlayerRecord> {

    public static final String NAME = "player-roster";
    public static final String DEFAULT_NATIONALITY = "Brazil";

    private final AliasResolver teams;
    private final String nationality;

    public PlayerRosterAdapter(AliasResolver teams) {
        this(teams, DEFAULT_NATIONALITY);
    }

    /**
     * @param nationality nationality to keep, or null to keep every player
     */
    public PlayerRosterAdapter(AliasResolver teams, String nationality) {
        this.teams = Objects.requireNonNull(teams, "teams resolver is required");
        this.nationality = nationality;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RecordPhase phase() {
        return RecordPhase.PRIMARY;
    }

    @Override
    public Optional<PlayerRecord> map(SourceRow row) {
        String playerNationality = row.required("Nationality");
        if (nationality != null && !nationality.equalsIgnoreCase(playerNationality)) {
            return Optional.empty();
        }

        long id = ValueParsers.parseLong("ID", row.required("ID"));
        if (id <= 0) {
            throw new RowValidationException("ID", "Player id must be > 0, got " + id);
        }
        String club = row.optional("Club");
        ResolvedName resolvedClub = club != null ? teams.resolve(club) : null;

        return Optional.of(new PlayerRecord(
                NAME,
                row.lineNumber(),
                id,
                row.required("Name"),
                playerNationality,
                ValueParsers.parseOptionalInt("Age", row.optional("Age")),
                row.optional("Position"),
                ValueParsers.parseOptionalInt("Overall", row.optional("Overall")),
                ValueParsers.parseOptionalInt("Potential", row.optional("Potential")),
                resolvedClub,
                ValueParsers.parseOptionalMoney("Wage", row.optional("Wage")),
                ValueParsers.parseOptionalInt("Jersey Number", row.optional("Jersey Number")),
                ValueParsers.parseOptionalDate("Joined", row.optional("Joined")),
                ValueParsers.parseOptionalYear("Contract Valid Until", row.optional("Contract Valid Until"))));
    }
}

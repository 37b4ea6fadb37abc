package com.soccer.graph.source;

import com.soccer.graph.alias.AliasResolver;

/**
 * Continental cup results: the cup columns plus {@code stage} (group stage, round of 16, final).
 */
public class InternationalCupAdapter extends AbstractMatchAdapter {

    public static final String NAME = "international-cup";

    private static final String STAGE = "stage";

    public InternationalCupAdapter(AliasResolver teams, AliasResolver stadiums) {
        this(teams, stadiums, CompetitionRef.LIBERTADORES);
    }

    public InternationalCupAdapter(AliasResolver teams, AliasResolver stadiums, CompetitionRef competition) {
        super(NAME, competition, teams, stadiums);
    }

    @Override
    protected String stage(SourceRow row) {
        return row.optional(STAGE);
    }
}

package com.soccer.graph.query;

import com.soccer.graph.core.model.EntitySchema;
import com.soccer.graph.core.model.GraphNode;

import java.time.LocalDateTime;

/**
 * Read-only view of a stored match.
 */
public record MatchSummary(
        String key,
        LocalDateTime startTime,
        String homeTeam,
        String awayTeam,
        int homeGoals,
        int awayGoals,
        String competition,
        Integer season,
        String round
) {

    static MatchSummary from(GraphNode match) {
        return new MatchSummary(
                match.getKey(),
                match.getDateTime(EntitySchema.START_TIME),
                match.getString(EntitySchema.HOME_TEAM),
                match.getString(EntitySchema.AWAY_TEAM),
                match.getInt(EntitySchema.HOME_GOALS, 0),
                match.getInt(EntitySchema.AWAY_GOALS, 0),
                match.getString(EntitySchema.COMPETITION),
                match.getInt(EntitySchema.SEASON),
                match.getString(EntitySchema.ROUND));
    }

    public int totalGoals() {
        return homeGoals + awayGoals;
    }

    public int margin() {
        return Math.abs(homeGoals - awayGoals);
    }
}

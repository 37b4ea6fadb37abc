package com.soccer.graph.query;

import com.soccer.graph.core.model.EntitySchema;
import com.soccer.graph.core.model.GraphNode;

/**
 * Read-only view of a stored player. Numeric attributes are null when unknown.
 */
public record PlayerSummary(
        String id,
        String name,
        String nationality,
        Integer age,
        String position,
        Integer overall,
        Integer potential,
        String club
) {

    static PlayerSummary from(GraphNode player) {
        return new PlayerSummary(
                player.getKey(),
                player.getString(EntitySchema.NAME),
                player.getString(EntitySchema.NATIONALITY),
                player.getInt(EntitySchema.AGE),
                player.getString(EntitySchema.POSITION),
                player.getInt(EntitySchema.OVERALL),
                player.getInt(EntitySchema.POTENTIAL),
                player.getString(EntitySchema.CLUB));
    }
}

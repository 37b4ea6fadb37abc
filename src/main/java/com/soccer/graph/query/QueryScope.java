package com.soccer.graph.query;

/**
 * Optional season and competition filters for aggregate queries.
 *
 * @param season      season year, or null for every season
 * @param competition competition name, or null for every competition
 */
public record QueryScope(Integer season, String competition) {

    private static final QueryScope ALL = new QueryScope(null, null);

    public static QueryScope all() {
        return ALL;
    }

    public static QueryScope season(int season) {
        return new QueryScope(season, null);
    }

    public static QueryScope competition(String competition) {
        return new QueryScope(null, competition);
    }

    public static QueryScope of(String competition, Integer season) {
        return new QueryScope(season, competition);
    }

    public boolean isAll() {
        return season == null && competition == null;
    }
}

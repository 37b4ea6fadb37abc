package com.soccer.graph.graph;

/**
 * A Cypher statement the graph database rejected or could not run.
 */
public class GraphStatementException extends RuntimeException {

    private final String graphName;
    private final String statement;

    public GraphStatementException(String graphName, String statement, Throwable cause) {
        super("Statement failed on graph '" + graphName + "': " + cause.getMessage(), cause);
        this.graphName = graphName;
        this.statement = statement;
    }

    public String getGraphName() {
        return graphName;
    }

    public String getStatement() {
        return statement;
    }
}

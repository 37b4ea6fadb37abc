package com.soccer.graph.graph;

import com.falkordb.Driver;
import com.falkordb.GraphContextGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FalkorDBConnectionTest {

    private static final String MERGE_TEAM = "MERGE (n:Team {name: $key})";

    @Mock
    private Driver driver;

    @Mock
    private GraphContextGenerator graph;

    private FalkorDBConnection connection;

    @BeforeEach
    void setUp() {
        when(driver.graph("soccer")).thenReturn(graph);
        connection = new FalkorDBConnection(driver, "soccer");
    }

    @Test
    @DisplayName("Should send statements with their parameters")
    void testExecute() {
        connection.execute(MERGE_TEAM, Map.of("key", "Flamengo"));

        verify(graph).query(MERGE_TEAM, Map.of("key", "Flamengo"));
        assertEquals("soccer", connection.getGraphName());
    }

    @Test
    @DisplayName("Should wrap a rejected statement with the graph and statement")
    void testRejectedStatement() {
        when(graph.query(eq(MERGE_TEAM), anyMap())).thenThrow(new IllegalStateException("Invalid input"));

        GraphStatementException e = assertThrows(GraphStatementException.class,
                () -> connection.execute(MERGE_TEAM, Map.of("key", "Flamengo")));

        assertEquals("soccer", e.getGraphName());
        assertEquals(MERGE_TEAM, e.getStatement());
        assertTrue(e.getMessage().contains("Invalid input"));
    }

    @Test
    @DisplayName("Should report an unreachable server as disconnected")
    void testIsConnected() {
        assertTrue(connection.isConnected());

        when(graph.query("RETURN 1")).thenThrow(new IllegalStateException("Connection refused"));
        assertFalse(connection.isConnected());
    }

    @Test
    @DisplayName("Should close the driver")
    void testClose() throws Exception {
        connection.close();

        verify(driver).close();
    }

    @Test
    @DisplayName("Should narrow integers returned as Long")
    void testFromFalkor() {
        assertEquals(Integer.valueOf(3), FalkorDBConnection.fromFalkor(3L));
        assertEquals(Long.valueOf(5_000_000_000L), FalkorDBConnection.fromFalkor(5_000_000_000L));
        assertEquals(List.of(2023, 2024), FalkorDBConnection.fromFalkor(List.of(2023L, 2024L)));
        assertEquals("Flamengo", FalkorDBConnection.fromFalkor("Flamengo"));
        assertNull(FalkorDBConnection.fromFalkor(null));
    }
}

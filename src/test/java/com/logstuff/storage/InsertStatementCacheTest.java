package com.logstuff.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockingDetails;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class InsertStatementCacheTest {

    @Mock
    private PinnedConnection connection;

    @Mock
    private Connection jdbcConnection;

    private final List<PreparedStatement> prepared = new ArrayList<>();

    @BeforeEach
    void setUp() throws SQLException {
        when(connection.get()).thenReturn(jdbcConnection);
        when(jdbcConnection.prepareStatement(anyString())).thenAnswer(invocation -> {
            PreparedStatement statement = mock(PreparedStatement.class);
            when(statement.executeUpdate()).thenReturn(1);
            prepared.add(statement);
            return statement;
        });
    }

    @Test
    void testStatementsAreReusedPerTable() throws SQLException {
        InsertStatementCache cache = new InsertStatementCache(connection, 3, true);

        PreparedInsert first = cache.getOrPrepare("logs_2024_03");
        PreparedInsert again = cache.getOrPrepare("logs_2024_03");

        assertThat(again).isSameAs(first);
        assertThat(cache.getPrepareCount()).isEqualTo(1);
        verify(jdbcConnection).prepareStatement(
            "INSERT INTO logs_2024_03 (tstamp, doc, search) VALUES (?, ?::jsonb, to_tsvector(?))");
    }

    @Test
    void testInsertBindsParameters() throws SQLException {
        InsertStatementCache cache = new InsertStatementCache(connection, 3, true);
        Instant timestamp = Instant.parse("2024-03-15T10:20:30Z");

        int rows = cache.getOrPrepare("logs_2024_03").insert(timestamp, "{\"msg\":\"hi\"}", "hi");

        assertThat(rows).isEqualTo(1);
        PreparedStatement statement = prepared.get(0);
        verify(statement).setObject(1, OffsetDateTime.ofInstant(timestamp, ZoneOffset.UTC));
        verify(statement).setString(2, "{\"msg\":\"hi\"}");
        verify(statement).setString(3, "hi");
    }

    @Test
    void testSearchColumnOmittedWhenDisabled() throws SQLException {
        InsertStatementCache cache = new InsertStatementCache(connection, 3, false);

        cache.getOrPrepare("logs_2024_03");

        verify(jdbcConnection).prepareStatement("INSERT INTO logs_2024_03 (tstamp, doc) VALUES (?, ?::jsonb)");
    }

    @Test
    void testEvictedStatementsAreClosed() throws SQLException {
        // Given
        InsertStatementCache cache = new InsertStatementCache(connection, 2, true);

        // When
        cache.getOrPrepare("logs_2024_01");
        cache.getOrPrepare("logs_2024_02");
        cache.getOrPrepare("logs_2024_03");

        // Then
        assertThat(cache.size()).isEqualTo(2);
        int closed = 0;
        for (PreparedStatement statement : prepared) {
            if (mockingDetails(statement).getInvocations().stream()
                .anyMatch(i -> i.getMethod().getName().equals("close"))) {
                closed++;
            }
        }
        assertThat(closed).isEqualTo(1);
    }

    @Test
    void testInvalidateAllClosesEverything() throws SQLException {
        InsertStatementCache cache = new InsertStatementCache(connection, 3, true);
        cache.getOrPrepare("logs_2024_01");
        cache.getOrPrepare("logs_2024_02");

        cache.invalidateAll();

        assertThat(cache.size()).isZero();
        for (PreparedStatement statement : prepared) {
            verify(statement).close();
        }
    }

    @Test
    void testInvalidateOneTable() throws SQLException {
        InsertStatementCache cache = new InsertStatementCache(connection, 3, true);
        cache.getOrPrepare("logs_2024_01");

        cache.invalidate("logs_2024_01");
        cache.getOrPrepare("logs_2024_01");

        verify(prepared.get(0)).close();
        assertThat(cache.getPrepareCount()).isEqualTo(2);
    }

    @Test
    void testPrepareFailureIsTranslated() throws SQLException {
        when(jdbcConnection.prepareStatement(anyString()))
            .thenThrow(new SQLException("relation \"logs_2024_03\" does not exist", "42P01"));
        InsertStatementCache cache = new InsertStatementCache(connection, 3, true);

        assertThatThrownBy(() -> cache.getOrPrepare("logs_2024_03"))
            .isInstanceOf(DataAccessException.class)
            .satisfies(e -> assertThat(SqlStates.isUndefinedTable(e)).isTrue());
    }

    @Test
    void testCapacityMustBePositive() {
        assertThatIllegalArgumentException().isThrownBy(() -> new InsertStatementCache(connection, 0, true));
    }
}

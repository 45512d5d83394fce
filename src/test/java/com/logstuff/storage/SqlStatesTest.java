package com.logstuff.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.UncategorizedSQLException;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;

class SqlStatesTest {

    @Test
    void testSqlStateFoundInCauseChain() {
        SQLException root = new SQLException("relation \"logs_2024_03\" does not exist", "42P01");
        BadSqlGrammarException wrapped = new BadSqlGrammarException("insert", "INSERT ...", root);

        assertThat(SqlStates.sqlStateOf(wrapped)).isEqualTo("42P01");
        assertThat(SqlStates.isUndefinedTable(wrapped)).isTrue();
        assertThat(SqlStates.sqlStateOf(new IllegalStateException("no sql"))).isNull();
    }

    @ParameterizedTest
    @ValueSource(strings = {"42P07", "42710", "42723", "23505"})
    void testDuplicateObjectStates(String state) {
        assertThat(SqlStates.isDuplicateObject(failure(state))).isTrue();
        assertThat(SqlStates.isTransient(failure(state))).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"08006", "08001", "40001", "40P01", "57P01", "57P02", "57P03"})
    void testTransientStates(String state) {
        assertThat(SqlStates.isTransient(failure(state))).isTrue();
        assertThat(SqlStates.classify("insert failed", failure(state)))
            .isInstanceOf(TransientStoreException.class)
            .satisfies(e -> assertThat(e.isRetryable()).isTrue())
            .satisfies(e -> assertThat(e.getSqlState()).isEqualTo(state));
    }

    @Test
    void testTransientSpringExceptionWithoutState() {
        assertThat(SqlStates.isTransient(new QueryTimeoutException("timed out"))).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"42601", "42501", "23502", "22P02"})
    void testFatalStates(String state) {
        StoreException classified = SqlStates.classify("insert failed", failure(state));

        assertThat(classified).isInstanceOf(FatalStoreException.class);
        assertThat(classified.isRetryable()).isFalse();
        assertThat(classified.getBaseMessage()).isEqualTo("insert failed");
        assertThat(classified.getMessage())
            .startsWith("insert failed [SQLSTATE: " + state + "]: ");
    }

    @Test
    void testDataExceptionClass() {
        assertThat(SqlStates.isDataException(failure("22P05"))).isTrue();
        assertThat(SqlStates.isDataException(failure("22021"))).isTrue();
        assertThat(SqlStates.isDataException(failure("23505"))).isFalse();
        assertThat(SqlStates.isDataException(new RuntimeException())).isFalse();
    }

    // ========== Helper Methods ==========

    private static RuntimeException failure(String state) {
        SQLException cause = new SQLException("failed with " + state, state);
        if (state.startsWith("23")) {
            return new DataIntegrityViolationException("failed", cause);
        }
        return new UncategorizedSQLException("task", "SQL", cause);
    }
}

package com.logstuff.storage;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * A prepared {@code INSERT} into one leaf table.
 */
public class PreparedInsert implements AutoCloseable {

    private final String table;
    private final PreparedStatement statement;
    private final boolean searchEnabled;

    PreparedInsert(String table, PreparedStatement statement, boolean searchEnabled) {
        this.table = table;
        this.statement = statement;
        this.searchEnabled = searchEnabled;
    }

    static String insertSql(String table, boolean searchEnabled) {
        if (searchEnabled) {
            return "INSERT INTO " + table + " (tstamp, doc, search) VALUES (?, ?::jsonb, to_tsvector(?))";
        }
        return "INSERT INTO " + table + " (tstamp, doc) VALUES (?, ?::jsonb)";
    }

    /**
     * @return the number of rows inserted
     */
    public int insert(Instant timestamp, String docJson, String searchText) throws SQLException {
        statement.setObject(1, OffsetDateTime.ofInstant(timestamp, ZoneOffset.UTC));
        statement.setString(2, docJson);
        if (searchEnabled) {
            statement.setString(3, searchText);
        }
        return statement.executeUpdate();
    }

    public String getTable() {
        return table;
    }

    @Override
    public void close() throws SQLException {
        statement.close();
    }
}

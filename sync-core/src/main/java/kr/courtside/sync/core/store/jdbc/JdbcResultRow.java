package kr.courtside.sync.core.store.jdbc;

import kr.courtside.sync.api.store.StoreException;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

/**
 * JDBC {@link ResultSet}의 현재 행을 감싼다.
 */
final class JdbcResultRow implements ResultRow {

    private final ResultSet resultSet;

    JdbcResultRow(ResultSet resultSet) {
        this.resultSet = resultSet;
    }

    @Override
    public String getString(String columnLabel) {
        try {
            return resultSet.getString(columnLabel);
        } catch (SQLException e) {
            throw new StoreException("컬럼 " + columnLabel + " 읽기 실패", e);
        }
    }

    @Override
    public Long getLong(String columnLabel) {
        try {
            long value = resultSet.getLong(columnLabel);
            return resultSet.wasNull() ? null : value;
        } catch (SQLException e) {
            throw new StoreException("컬럼 " + columnLabel + " 읽기 실패", e);
        }
    }

    @Override
    public Instant getInstant(String columnLabel) {
        try {
            Timestamp ts = resultSet.getTimestamp(columnLabel);
            return ts == null ? null : ts.toInstant();
        } catch (SQLException e) {
            throw new StoreException("컬럼 " + columnLabel + " 읽기 실패", e);
        }
    }
}

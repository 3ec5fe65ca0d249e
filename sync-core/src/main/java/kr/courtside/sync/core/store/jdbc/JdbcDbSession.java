package kr.courtside.sync.core.store.jdbc;

import kr.courtside.sync.api.store.StoreException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

final class JdbcDbSession implements DbSession {

    private final Connection connection;

    JdbcDbSession(Connection connection) {
        this.connection = Objects.requireNonNull(connection, "connection");
    }

    @Override
    public int executeUpdate(String sql, Object... params) {
        try (PreparedStatement statement = prepare(sql, params)) {
            return statement.executeUpdate();
        } catch (SQLException e) {
            throw failure(sql, e);
        }
    }

    @Override
    public <T> Optional<T> queryOne(String sql, RowMapper<T> mapper, Object... params) {
        Objects.requireNonNull(mapper, "mapper");
        try (PreparedStatement statement = prepare(sql, params)) {
            statement.setMaxRows(1);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                return Optional.ofNullable(mapper.map(new JdbcResultRow(resultSet)));
            }
        } catch (SQLException e) {
            throw failure(sql, e);
        }
    }

    private PreparedStatement prepare(String sql, Object[] params) throws SQLException {
        PreparedStatement statement = connection.prepareStatement(Objects.requireNonNull(sql, "sql"));
        try {
            int index = 1;
            for (Object param : params == null ? new Object[0] : params) {
                bind(statement, index++, param);
            }
            return statement;
        } catch (SQLException e) {
            statement.close();
            throw e;
        }
    }

    private static void bind(PreparedStatement statement, int index, Object value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.NULL);
        } else if (value instanceof String text) {
            statement.setString(index, text);
        } else if (value instanceof Long number) {
            statement.setLong(index, number);
        } else if (value instanceof Instant instant) {
            statement.setTimestamp(index, Timestamp.from(instant));
        } else {
            statement.setObject(index, value);
        }
    }

    private static StoreException failure(String sql, SQLException e) {
        return new StoreException("SQL 실행 실패 [" + e.getSQLState() + "] " + sql, e);
    }
}

package kr.courtside.sync.core.store.jdbc;

import java.time.Instant;

/**
 * JDBC API에 묶이지 않은 결과 행 하나.
 */
public interface ResultRow {

    String getString(String columnLabel);

    Long getLong(String columnLabel);

    Instant getInstant(String columnLabel);
}

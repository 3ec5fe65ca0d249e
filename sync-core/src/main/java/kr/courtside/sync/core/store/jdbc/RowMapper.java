package kr.courtside.sync.core.store.jdbc;

@FunctionalInterface
public interface RowMapper<T> {

    T map(ResultRow row);
}

package kr.courtside.sync.core.store.jdbc;

import java.util.Optional;

/**
 * 열린 트랜잭션 안에서 버전 테이블에 문장을 보내는 창구.
 * <p>
 * 세션은 {@link DatabaseService#inTransaction} 콜백 안에서만 유효하다.
 */
public interface DbSession {

    /**
     * @return 영향을 받은 행 수. 조건부 UPDATE가 버전 불일치로 빗나가면 0이다.
     */
    int executeUpdate(String sql, Object... params);

    /**
     * 첫 행만 매핑한다. 행이 없으면 빈 값을 돌려준다.
     */
    <T> Optional<T> queryOne(String sql, RowMapper<T> mapper, Object... params);
}

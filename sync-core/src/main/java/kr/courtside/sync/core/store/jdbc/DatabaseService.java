package kr.courtside.sync.core.store.jdbc;

import kr.courtside.sync.api.lifecycle.ManagedLifecycle;

import java.util.function.Function;

/**
 * 버전 테이블 작업을 트랜잭션 하나로 묶어 실행한다.
 * <p>
 * 작업이 예외 없이 끝나면 커밋하고, 예외가 나면 롤백한 뒤 {@link kr.courtside.sync.api.store.StoreException}으로 전달한다.
 */
public interface DatabaseService extends ManagedLifecycle {

    <T> T inTransaction(Function<DbSession, T> work);

    PoolState state();

    default boolean isRunning() {
        return state().acceptsWork();
    }
}

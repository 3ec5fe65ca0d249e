package kr.courtside.sync.api.context;

import kr.courtside.sync.api.Preconditions;

/**
 * 환경 이름과 노드 식별자를 보관하는 변경 불가 컨텍스트.
 * <p>
 * Redis 키 네임스페이스와 프레즌스 키를 만들 때 사용되며,
 * 문자열이 비어 있지 않은지 초기화 시점에 검증한다.
 */
public record SyncContext(String environment, String nodeId) {

    public SyncContext {
        Preconditions.checkNotBlank(environment, "environment");
        Preconditions.checkNotBlank(nodeId, "nodeId");
    }

    public static SyncContext of(String environment, String nodeId) {
        return new SyncContext(environment, nodeId);
    }
}

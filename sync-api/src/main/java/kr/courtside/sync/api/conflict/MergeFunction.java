package kr.courtside.sync.api.conflict;

import java.util.Map;

@FunctionalInterface
public interface MergeFunction {

    /**
     * @param local  호출자의 변경분
     * @param remote 최신 레코드 필드
     * @return 최신 버전 위에 쓸 필드
     */
    Map<String, Object> merge(Map<String, Object> local, Map<String, Object> remote);
}

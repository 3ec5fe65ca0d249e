package kr.courtside.sync.api.realtime;

/**
 * 리스너 등록 해제 핸들. close()는 여러 번 호출해도 안전하다.
 */
@FunctionalInterface
public interface Registration extends AutoCloseable {

    @Override
    void close();
}

package kr.courtside.sync.api.realtime;

@FunctionalInterface
public interface ConnectionStateListener {

    /**
     * 등록 직후에는 previous와 current가 같은 값으로 한 번 호출된다.
     */
    void onStateChange(ConnectionState previous, ConnectionState current);
}

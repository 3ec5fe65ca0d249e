package kr.courtside.sync.core.realtime;

/**
 * 재연결 시 자신의 채널을 처음부터 다시 여는 구성 요소.
 */
public interface ReconnectParticipant {

    /**
     * 이전 핸들을 모두 버리고 새로 연다.
     *
     * @return 다시 연 채널 수
     */
    int reopen();
}

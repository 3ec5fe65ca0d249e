package kr.courtside.sync.api.transport;

/**
 * 채널 열기/구독 실패. 구독자에게 던져지지 않고 연결 상태 머신이 복구한다.
 */
public class TransportException extends RuntimeException {

    private final String code;

    public TransportException(String message) {
        this(message, null, null);
    }

    public TransportException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public TransportException(String message, String code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * 전송 구현이 제공한 오류 코드, 없으면 {@code null}.
     */
    public String code() {
        return code;
    }
}

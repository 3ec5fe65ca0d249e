package kr.courtside.sync.core.realtime;

import kr.courtside.sync.api.transport.TransportException;

import java.util.Locale;
import java.util.Set;

/**
 * 인증 계열 오류 판별. 원인 체인 전체를 확인한다.
 */
public final class AuthErrors {

    private static final Set<String> AUTH_CODES = Set.of("PGRST301", "NOAUTH", "WRONGPASS");
    private static final String[] AUTH_MARKERS = {"jwt", "token", "unauthorized", "noauth", "wrongpass"};

    private AuthErrors() {
    }

    public static boolean isAuthError(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 16) {
            if (current instanceof TransportException transportException
                    && transportException.code() != null
                    && AUTH_CODES.contains(transportException.code().toUpperCase(Locale.ROOT))) {
                return true;
            }
            String message = current.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                for (String marker : AUTH_MARKERS) {
                    if (lower.contains(marker)) {
                        return true;
                    }
                }
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}

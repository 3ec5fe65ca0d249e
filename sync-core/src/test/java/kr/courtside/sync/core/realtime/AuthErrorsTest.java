package kr.courtside.sync.core.realtime;

import kr.courtside.sync.api.transport.TransportException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AuthErrorsTest {

    @Test
    void isAuthError_matchesMessageMarkersCaseInsensitively() {
        assertTrue(AuthErrors.isAuthError(new TransportException("JWT expired")));
        assertTrue(AuthErrors.isAuthError(new RuntimeException("Unauthorized")));
        assertTrue(AuthErrors.isAuthError(new RuntimeException("invalid token supplied")));
    }

    @Test
    void isAuthError_matchesTransportCode() {
        assertTrue(AuthErrors.isAuthError(new TransportException("rejected", "PGRST301", null)));
        assertTrue(AuthErrors.isAuthError(new TransportException("rejected", "noauth", null)));
    }

    @Test
    void isAuthError_walksCauseChain() {
        RuntimeException wrapped = new RuntimeException("subscribe failed",
                new IllegalStateException("WRONGPASS invalid username-password pair"));

        assertTrue(AuthErrors.isAuthError(wrapped));
    }

    @Test
    void isAuthError_plainFailures_areNotAuth() {
        assertFalse(AuthErrors.isAuthError(new TransportException("connection reset")));
        assertFalse(AuthErrors.isAuthError(null));
        assertFalse(AuthErrors.isAuthError(new RuntimeException((String) null)));
    }
}

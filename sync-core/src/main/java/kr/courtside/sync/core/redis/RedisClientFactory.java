package kr.courtside.sync.core.redis;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;

import java.time.Duration;
import java.util.Objects;

/**
 * 실시간 전송용 Lettuce {@link RedisClient}를 만든다.
 * <p>
 * 끊김 감지와 재연결은 {@code ConnectionStateMachine}이 맡는다. 그래서 Lettuce 자동 재연결은 끄고,
 * 연결이 없는 동안 들어온 명령은 큐에 쌓지 않고 바로 실패시킨다.
 */
public final class RedisClientFactory {

    private static final String CLIENT_NAME = "courtside-sync";

    private final String host;
    private final int port;
    private final boolean ssl;
    private final String password;
    private final Duration timeout;
    private final int database;

    public RedisClientFactory(String host, int port, boolean ssl, String password, Duration timeout, int database) {
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.ssl = ssl;
        this.password = password;
        this.timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
        this.database = database;
    }

    public RedisClient createClient() {
        RedisClient client = RedisClient.create(uri());
        client.setOptions(ClientOptions.builder()
                .autoReconnect(false)
                .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
                .socketOptions(SocketOptions.builder().connectTimeout(timeout).build())
                .timeoutOptions(TimeoutOptions.enabled(timeout))
                .build());
        return client;
    }

    private RedisURI uri() {
        RedisURI.Builder builder = RedisURI.Builder.redis(host, port)
                .withDatabase(database)
                .withSsl(ssl)
                .withTimeout(timeout)
                .withClientName(CLIENT_NAME);
        if (password != null && !password.isEmpty()) {
            builder.withPassword(password.toCharArray());
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return "redis" + (ssl ? "s" : "") + "://" + host + ":" + port + "/" + database
                + (password == null || password.isEmpty() ? "" : " (auth)");
    }
}

package kr.courtside.sync.api.transport;

import java.util.concurrent.CompletableFuture;

/**
 * 채널 기반 발행/구독 전송 계층.
 */
public interface RealtimeTransport {

    TransportChannel openChannel(String name);

    CompletableFuture<Void> closeChannel(TransportChannel channel);
}

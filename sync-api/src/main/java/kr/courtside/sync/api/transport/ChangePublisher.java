package kr.courtside.sync.api.transport;

import kr.courtside.sync.api.realtime.ChangeEvent;

import java.util.concurrent.CompletableFuture;

@FunctionalInterface
public interface ChangePublisher {

    CompletableFuture<Void> publish(ChangeEvent event);
}

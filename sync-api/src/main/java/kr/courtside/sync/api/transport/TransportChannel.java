package kr.courtside.sync.api.transport;

import kr.courtside.sync.api.presence.PresenceRecord;
import kr.courtside.sync.api.realtime.ChangeEvent;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * One transport-level publish/subscribe session.
 * <p>
 * Listeners must be registered before {@link #subscribe(ChannelStatusListener)}. Callbacks may run on
 * transport threads.
 */
public interface TransportChannel {

    String name();

    void onChange(ChangeBinding binding, Consumer<ChangeEvent> listener);

    void onPresence(PresenceListener listener);

    /**
     * Starts the session. The returned future completes once the request was handed to the
     * transport; the acknowledgement itself arrives through the status listener.
     */
    CompletableFuture<Void> subscribe(ChannelStatusListener statusListener);

    CompletableFuture<Void> track(PresenceRecord record);

    CompletableFuture<Void> untrack();

    /**
     * Full current membership: presence key to every raw record published under it.
     */
    Map<String, List<PresenceRecord>> presenceState();
}

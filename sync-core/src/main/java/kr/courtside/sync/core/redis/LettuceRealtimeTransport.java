package kr.courtside.sync.core.redis;

import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisCommandExecutionException;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.event.connection.DisconnectedEvent;
import io.lettuce.core.pubsub.RedisPubSubAdapter;
import io.lettuce.core.pubsub.StatefulRedisPubSubConnection;
import kr.courtside.sync.api.context.SyncContext;
import kr.courtside.sync.api.lifecycle.ManagedLifecycle;
import kr.courtside.sync.api.presence.PresenceRecord;
import kr.courtside.sync.api.realtime.ChangeEvent;
import kr.courtside.sync.api.transport.ChangePublisher;
import kr.courtside.sync.api.transport.ChannelStatus;
import kr.courtside.sync.api.transport.RealtimeTransport;
import kr.courtside.sync.api.transport.TransportChannel;
import kr.courtside.sync.api.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Redis pub/sub 위의 {@link RealtimeTransport}.
 * <p>
 * 명령용 연결 하나와 구독용 연결 하나를 쓴다. 같은 Redis 채널을 여러 전송 채널이 공유하면
 * 첫 번째가 SUBSCRIBE를, 마지막이 UNSUBSCRIBE를 보낸다. 연결이 끊기면 살아 있는 채널에
 * CLOSED를 알리고, 복구는 다음 {@link #openChannel(String)}에서 연결을 새로 만드는 것으로 대신한다.
 */
public final class LettuceRealtimeTransport implements RealtimeTransport, ChangePublisher, ManagedLifecycle {

    private static final Logger LOGGER = LoggerFactory.getLogger(LettuceRealtimeTransport.class);
    private static final char KEY_SEPARATOR = '|';

    private final RedisClientFactory clientFactory;
    private final RedisKeys keys;
    private final RedisWireCodec codec;
    private final SyncContext context;
    private final Duration presenceTtl;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final Map<String, Set<LettuceTransportChannel>> routes = new ConcurrentHashMap<>();
    private final Set<LettuceTransportChannel> openChannels = new LinkedHashSet<>();

    private RedisClient client;
    private Disposable eventSubscription;
    private volatile StatefulRedisConnection<String, String> commandConnection;
    private volatile StatefulRedisPubSubConnection<String, String> pubSubConnection;
    private long epoch;

    public LettuceRealtimeTransport(RedisClientFactory clientFactory,
                                    RedisKeys keys,
                                    RedisWireCodec codec,
                                    SyncContext context,
                                    Duration presenceTtl) {
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
        this.keys = Objects.requireNonNull(keys, "keys");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.context = Objects.requireNonNull(context, "context");
        this.presenceTtl = presenceTtl == null || presenceTtl.isNegative() || presenceTtl.isZero()
                ? Duration.ofMinutes(5) : presenceTtl;
    }

    @Override
    public void start() {
        if (stopped.get()) {
            LOGGER.warn("Redis 전송이 완전히 중단된 상태여서 재시작할 수 없습니다");
            return;
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        client = clientFactory.createClient();
        eventSubscription = client.getResources().eventBus().get()
                .filter(DisconnectedEvent.class::isInstance)
                .subscribe(event -> onDisconnected());
        try {
            ensureConnected();
        } catch (TransportException e) {
            LOGGER.warn("Redis 초기 연결 실패 - 첫 구독 시 다시 시도합니다", e);
        }
    }

    @Override
    public void stop() {
        if (!started.getAndSet(false)) {
            return;
        }
        stopped.set(true);
        LOGGER.info("Redis 전송을 종료합니다");
        synchronized (this) {
            openChannels.forEach(LettuceTransportChannel::terminate);
            openChannels.clear();
            routes.clear();
            closeConnections();
        }
        if (eventSubscription != null) {
            eventSubscription.dispose();
        }
        if (client != null) {
            client.shutdown();
        }
    }

    @Override
    public TransportChannel openChannel(String name) {
        if (!started.get()) {
            throw new TransportException("Redis 전송이 시작되지 않았습니다");
        }
        return new LettuceTransportChannel(name, this);
    }

    @Override
    public CompletableFuture<Void> closeChannel(TransportChannel channel) {
        if (!(channel instanceof LettuceTransportChannel lettuceChannel)) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("foreign channel: " + channel));
        }
        List<String> released;
        synchronized (this) {
            lettuceChannel.terminate();
            openChannels.remove(lettuceChannel);
            released = removeRoutes(lettuceChannel);
        }
        StatefulRedisPubSubConnection<String, String> connection = pubSubConnection;
        if (released.isEmpty() || connection == null || !connection.isOpen()) {
            return CompletableFuture.completedFuture(null);
        }
        return connection.async().unsubscribe(released.toArray(new String[0])).toCompletableFuture()
                .thenApply(ignored -> null);
    }

    @Override
    public CompletableFuture<Void> publish(ChangeEvent event) {
        Objects.requireNonNull(event, "event");
        StatefulRedisConnection<String, String> connection;
        try {
            connection = ensureConnected().command();
        } catch (TransportException e) {
            return CompletableFuture.failedFuture(e);
        }
        return connection.async().publish(keys.changes(event.topic()), codec.encodeChange(event)).toCompletableFuture()
                .thenApply(receivers -> null);
    }

    CompletableFuture<Void> subscribeChannel(LettuceTransportChannel channel) {
        Connections connections;
        try {
            connections = ensureConnected();
        } catch (TransportException e) {
            return CompletableFuture.failedFuture(e);
        }
        List<String> redisChannels = new ArrayList<>();
        channel.topics().forEach(topic -> redisChannels.add(keys.changes(topic)));
        if (channel.tracksPresence()) {
            redisChannels.add(keys.presenceEvents(channel.name()));
        }
        List<String> fresh;
        synchronized (this) {
            if (channel.isTerminated()) {
                return CompletableFuture.completedFuture(null);
            }
            channel.bindEpoch(connections.epoch());
            openChannels.add(channel);
            fresh = addRoutes(channel, redisChannels);
        }
        CompletableFuture<Void> subscribed = fresh.isEmpty()
                ? CompletableFuture.completedFuture(null)
                : connections.pubSub().async().subscribe(fresh.toArray(new String[0])).toCompletableFuture();
        if (channel.tracksPresence()) {
            String hash = keys.presenceHash(channel.name());
            subscribed = subscribed.thenCompose(ignored -> connections.command().async().hgetall(hash).toCompletableFuture())
                    .thenAccept(raw -> channel.applySnapshot(decodeMembers(channel.name(), raw)));
        }
        subscribed.whenComplete((ignored, error) -> {
            if (error == null) {
                channel.notifyStatus(ChannelStatus.SUBSCRIBED, null);
            } else {
                channel.notifyStatus(ChannelStatus.CHANNEL_ERROR, toTransportException("채널 구독 실패: " + channel.name(), error));
            }
        });
        return CompletableFuture.completedFuture(null);
    }

    CompletableFuture<Void> track(LettuceTransportChannel channel, PresenceRecord record) {
        Objects.requireNonNull(record, "record");
        Connections connections;
        try {
            connections = ensureConnected();
        } catch (TransportException e) {
            return CompletableFuture.failedFuture(e);
        }
        String key = record.actorId() + KEY_SEPARATOR + context.nodeId();
        channel.trackedKey(key);
        String hash = keys.presenceHash(channel.name());
        return connections.command().async().hset(hash, key, codec.encodePresence(record)).toCompletableFuture()
                .thenCompose(ignored -> connections.command().async().pexpire(hash, presenceTtl.toMillis()).toCompletableFuture())
                .thenCompose(ignored -> connections.command().async()
                        .publish(keys.presenceEvents(channel.name()),
                                codec.encodePresenceMessage(RedisWireCodec.PresenceMessage.join(key, record)))
                        .toCompletableFuture())
                .thenApply(ignored -> null);
    }

    CompletableFuture<Void> untrack(LettuceTransportChannel channel) {
        String key = channel.trackedKey();
        if (key == null) {
            return CompletableFuture.completedFuture(null);
        }
        channel.trackedKey(null);
        StatefulRedisConnection<String, String> connection = commandConnection;
        if (connection == null || !connection.isOpen()) {
            return CompletableFuture.completedFuture(null);
        }
        String hash = keys.presenceHash(channel.name());
        return connection.async().hdel(hash, key).toCompletableFuture()
                .thenCompose(ignored -> connection.async()
                        .publish(keys.presenceEvents(channel.name()),
                                codec.encodePresenceMessage(RedisWireCodec.PresenceMessage.leave(key)))
                        .toCompletableFuture())
                .thenApply(ignored -> null);
    }

    private synchronized Connections ensureConnected() {
        if (stopped.get() || client == null) {
            throw new TransportException("Redis 전송이 실행 중이 아닙니다");
        }
        StatefulRedisConnection<String, String> command = commandConnection;
        StatefulRedisPubSubConnection<String, String> pubSub = pubSubConnection;
        if (command != null && pubSub != null && command.isOpen() && pubSub.isOpen()) {
            return new Connections(command, pubSub, epoch);
        }
        closeConnections();
        try {
            command = client.connect();
            pubSub = client.connectPubSub();
        } catch (RuntimeException e) {
            if (command != null) {
                command.closeAsync();
            }
            throw toTransportException("Redis 연결 실패", e);
        }
        pubSub.addListener(new RedisPubSubAdapter<>() {
            @Override
            public void message(String channel, String message) {
                route(channel, message);
            }
        });
        commandConnection = command;
        pubSubConnection = pubSub;
        epoch++;
        routes.clear();
        LOGGER.info("Redis 연결이 준비되었습니다 (세대 {})", epoch);
        return new Connections(command, pubSub, epoch);
    }

    private void onDisconnected() {
        if (stopped.get()) {
            return;
        }
        List<LettuceTransportChannel> affected = new ArrayList<>();
        synchronized (this) {
            StatefulRedisConnection<String, String> command = commandConnection;
            StatefulRedisPubSubConnection<String, String> pubSub = pubSubConnection;
            if (command != null && pubSub != null && command.isOpen() && pubSub.isOpen()) {
                return;
            }
            for (LettuceTransportChannel channel : openChannels) {
                if (channel.epoch() == epoch) {
                    affected.add(channel);
                }
            }
        }
        if (affected.isEmpty()) {
            return;
        }
        LOGGER.warn("Redis 연결이 끊어졌습니다 - 채널 {}개를 닫힘으로 표시합니다", affected.size());
        TransportException cause = new TransportException("Redis 연결 끊김");
        affected.forEach(channel -> channel.notifyStatus(ChannelStatus.CLOSED, cause));
    }

    private void route(String redisChannel, String message) {
        Set<LettuceTransportChannel> targets = routes.get(redisChannel);
        if (targets == null || targets.isEmpty()) {
            return;
        }
        try {
            if (redisChannel.endsWith(":events")) {
                RedisWireCodec.PresenceMessage presence = codec.decodePresenceMessage(message);
                for (LettuceTransportChannel target : targets) {
                    if (presence.announcesJoin()) {
                        target.applyJoin(presence.key(), presence.presenceRecord());
                    } else {
                        target.applyLeave(presence.key());
                    }
                }
                return;
            }
            ChangeEvent event = codec.decodeChange(message);
            targets.forEach(target -> target.deliverChange(event));
        } catch (RuntimeException e) {
            LOGGER.warn("채널 '{}'에서 받은 메시지를 처리하지 못했습니다", redisChannel, e);
        }
    }

    private Map<String, PresenceRecord> decodeMembers(String channelName, Map<String, String> raw) {
        Map<String, PresenceRecord> members = new LinkedHashMap<>();
        if (raw == null) {
            return members;
        }
        for (Map.Entry<String, String> entry : raw.entrySet()) {
            try {
                members.put(entry.getKey(), codec.decodePresence(entry.getValue()));
            } catch (RuntimeException e) {
                LOGGER.warn("프레즌스 '{}'의 항목 '{}'을 읽지 못해 건너뜁니다", channelName, entry.getKey(), e);
            }
        }
        return members;
    }

    private List<String> addRoutes(LettuceTransportChannel channel, List<String> redisChannels) {
        List<String> fresh = new ArrayList<>();
        for (String redisChannel : redisChannels) {
            Set<LettuceTransportChannel> routed = routes.computeIfAbsent(redisChannel, key -> new CopyOnWriteArraySet<>());
            if (routed.isEmpty()) {
                fresh.add(redisChannel);
            }
            routed.add(channel);
        }
        return fresh;
    }

    private List<String> removeRoutes(LettuceTransportChannel channel) {
        List<String> released = new ArrayList<>();
        routes.entrySet().removeIf(entry -> {
            if (!entry.getValue().remove(channel) || !entry.getValue().isEmpty()) {
                return false;
            }
            released.add(entry.getKey());
            return true;
        });
        return released;
    }

    private void closeConnections() {
        StatefulRedisConnection<String, String> command = commandConnection;
        StatefulRedisPubSubConnection<String, String> pubSub = pubSubConnection;
        commandConnection = null;
        pubSubConnection = null;
        try {
            if (command != null) {
                command.close();
            }
        } finally {
            if (pubSub != null) {
                pubSub.close();
            }
        }
    }

    static TransportException toTransportException(String message, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof TransportException transportException) {
            return transportException;
        }
        return new TransportException(message, errorCode(cause), cause);
    }

    static String errorCode(Throwable error) {
        if (!(error instanceof RedisCommandExecutionException) || error.getMessage() == null) {
            return null;
        }
        String text = error.getMessage().trim();
        int space = text.indexOf(' ');
        String head = space < 0 ? text : text.substring(0, space);
        return !head.isEmpty() && head.chars().allMatch(c -> Character.isUpperCase(c) || c == '_') ? head : null;
    }

    private record Connections(StatefulRedisConnection<String, String> command,
                               StatefulRedisPubSubConnection<String, String> pubSub,
                               long epoch) {
    }
}

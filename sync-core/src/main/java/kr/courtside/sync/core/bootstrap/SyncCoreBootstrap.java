package kr.courtside.sync.core.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import kr.courtside.sync.api.context.SyncContext;
import kr.courtside.sync.api.monitoring.Monitor;
import kr.courtside.sync.api.store.VersionedStore;
import kr.courtside.sync.core.config.DatabaseYamlConfig;
import kr.courtside.sync.core.config.SyncConfig;
import kr.courtside.sync.core.conflict.ConflictResolver;
import kr.courtside.sync.core.executor.NettyTaskExecutor;
import kr.courtside.sync.core.executor.ThreadFactories;
import kr.courtside.sync.core.monitoring.LoggingMonitor;
import kr.courtside.sync.core.presence.PresenceTracker;
import kr.courtside.sync.core.realtime.RealtimeManager;
import kr.courtside.sync.core.redis.LettuceRealtimeTransport;
import kr.courtside.sync.core.redis.RedisKeys;
import kr.courtside.sync.core.redis.RedisWireCodec;
import kr.courtside.sync.core.store.jdbc.HikariDatabaseService;
import kr.courtside.sync.core.store.jdbc.JdbcVersionedStore;
import kr.courtside.sync.core.store.memory.InMemoryVersionedStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * 설정으로부터 코어 구성 요소를 조립하고 역순으로 정리한다.
 * <pre>
 * 이벤트 루프 → Redis 전송 → 저장소 → 실시간 관리자 → 충돌 해결기 → 프레즌스 추적기
 * </pre>
 */
public final class SyncCoreBootstrap {

    private static final Logger LOGGER = LoggerFactory.getLogger(SyncCoreBootstrap.class);

    private final SyncConfig config;
    private final Monitor monitor;
    private final CloseableRegistry closeables = new CloseableRegistry();

    private SyncContext context;
    private VersionedStore store;
    private RealtimeManager realtime;
    private ConflictResolver conflicts;
    private PresenceTracker presence;
    private boolean started;

    public SyncCoreBootstrap(SyncConfig config) {
        this(config, new LoggingMonitor());
    }

    public SyncCoreBootstrap(SyncConfig config, Monitor monitor) {
        this.config = Objects.requireNonNull(config, "config");
        this.monitor = Objects.requireNonNull(monitor, "monitor");
    }

    public synchronized void start() {
        if (started) {
            return;
        }
        try {
            context = config.sync().toContext();
            NettyTaskExecutor executor = closeables.register(new NettyTaskExecutor("courtside-sync-loop"));
            executor.start();

            LettuceRealtimeTransport transport = closeables.register(new LettuceRealtimeTransport(
                    config.redis().toClientFactory(), new RedisKeys(context.environment()), new RedisWireCodec(),
                    context, config.redis().presenceTtl()));
            transport.start();

            store = createStore(transport);

            realtime = closeables.register(new RealtimeManager(transport, executor, monitor, config.realtime().toSettings()));
            realtime.start();

            conflicts = new ConflictResolver(store, executor, monitor, config.conflict().toSettings());

            presence = closeables.register(new PresenceTracker(transport, executor, monitor,
                    config.presence().toSettings(), realtime.connection()));
            presence.start();

            started = true;
            LOGGER.info("courtside-sync 코어가 시작되었습니다 ({}, store={})", context, config.sync().store());
        } catch (RuntimeException e) {
            LOGGER.error("courtside-sync 코어 시작에 실패했습니다", e);
            closeables.closeAll();
            throw e;
        }
    }

    public synchronized void stop() {
        if (!started) {
            return;
        }
        started = false;
        closeables.closeAll();
        LOGGER.info("courtside-sync 코어를 종료했습니다");
    }

    private VersionedStore createStore(LettuceRealtimeTransport transport) {
        DatabaseYamlConfig database = config.database();
        if (database == null) {
            LOGGER.info("메모리 저장소를 사용합니다");
            return new InMemoryVersionedStore();
        }
        HikariDatabaseService service = closeables.register(new HikariDatabaseService(database.toDatabaseConfig()));
        service.start();
        JdbcVersionedStore jdbcStore = closeables.register(new JdbcVersionedStore(service, database.table(), new ObjectMapper(),
                ThreadFactories.workerPool(database.workerThreads(), "courtside-store"), transport, Clock.systemUTC()));
        jdbcStore.start();
        return jdbcStore;
    }

    public SyncContext context() {
        return requireStarted(context);
    }

    public VersionedStore store() {
        return requireStarted(store);
    }

    public RealtimeManager realtime() {
        return requireStarted(realtime);
    }

    public ConflictResolver conflicts() {
        return requireStarted(conflicts);
    }

    public PresenceTracker presence() {
        return requireStarted(presence);
    }

    private <T> T requireStarted(T value) {
        if (value == null) {
            throw new IllegalStateException("SyncCoreBootstrap not started");
        }
        return value;
    }
}

package kr.courtside.sync.core.store.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import kr.courtside.sync.api.store.StoreException;
import kr.courtside.sync.core.executor.ThreadFactories;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * HikariCP 커넥션 풀 위에서 트랜잭션을 실행하는 MySQL {@link DatabaseService}.
 * <p>
 * 연속 실패가 임계치를 넘으면 DEGRADED로 내려가 요청을 거부하고, 백그라운드에서 풀을 다시 만든다.
 */
public class HikariDatabaseService implements DatabaseService {

    private static final Logger LOGGER = LoggerFactory.getLogger(HikariDatabaseService.class);
    private static final long CONNECTION_WAIT_WARN_MS = 1000;
    private static final long TRANSACTION_WARN_MS = 2000;
    private static final int FAILURE_THRESHOLD = 3;

    private final DatabaseConfig config;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicReference<PoolState> state = new AtomicReference<>(PoolState.STOPPED);
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final ScheduledExecutorService healthChecker;
    private volatile HikariDataSource dataSource;

    public HikariDatabaseService(DatabaseConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.healthChecker = Executors.newSingleThreadScheduledExecutor(ThreadFactories.daemon("courtside-db-health"));
    }

    @Override
    public <T> T inTransaction(Function<DbSession, T> work) {
        Objects.requireNonNull(work, "work");
        HikariDataSource source = ensureAvailable();
        long waitStart = System.nanoTime();
        try (Connection connection = source.getConnection()) {
            logConnectionWait(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - waitStart));
            connection.setAutoCommit(false);
            try {
                long txStart = System.nanoTime();
                T result = work.apply(new JdbcDbSession(connection));
                connection.commit();
                logTransactionDuration(txStart);
                consecutiveFailures.set(0);
                return result;
            } catch (RuntimeException e) {
                rollback(connection);
                markFailure("트랜잭션 실패", e);
                throw e instanceof StoreException storeException ? storeException : new StoreException("Transaction failed", e);
            }
        } catch (SQLException e) {
            markFailure("커넥션 획득 실패", e);
            throw new StoreException("Failed to obtain connection", e);
        }
    }

    @Override
    public PoolState state() {
        return state.get();
    }

    @Override
    public void start() {
        if (stopped.get()) {
            LOGGER.warn("DatabaseService가 완전히 중단되어 재시작할 수 없습니다");
            return;
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        transitionState(PoolState.CONNECTING, "데이터베이스 풀을 초기화합니다 (" + config + ")");
        if (initializeDataSource()) {
            transitionState(PoolState.RUNNING, "데이터베이스 연결이 준비되었습니다");
        } else {
            transitionState(PoolState.DEGRADED, "데이터베이스 초기화에 실패했습니다 - 자동 복구를 대기합니다");
        }
        healthChecker.scheduleWithFixedDelay(this::attemptRecovery, 2, 5, TimeUnit.SECONDS);
    }

    @Override
    public void stop() {
        if (!started.getAndSet(false)) {
            return;
        }
        stopped.set(true);
        transitionState(PoolState.STOPPED, "데이터베이스 서비스를 종료합니다");
        healthChecker.shutdownNow();
        HikariDataSource source = dataSource;
        dataSource = null;
        if (source != null) {
            source.close();
        }
    }

    private boolean initializeDataSource() {
        HikariDataSource previous = dataSource;
        dataSource = null;
        if (previous != null) {
            previous.close();
        }
        try {
            HikariConfig hikariConfig = new HikariConfig();
            int poolSize = config.poolSize();
            hikariConfig.setJdbcUrl(config.jdbcUrl());
            hikariConfig.setUsername(config.username());
            hikariConfig.setPassword(config.password());
            hikariConfig.setDriverClassName("com.mysql.cj.jdbc.Driver");
            hikariConfig.setMaximumPoolSize(poolSize);
            hikariConfig.setMinimumIdle(Math.min(2, poolSize));
            hikariConfig.setPoolName("CourtsideSyncPool");
            hikariConfig.setConnectionTimeout(Duration.ofSeconds(5).toMillis());
            hikariConfig.setValidationTimeout(Duration.ofSeconds(3).toMillis());
            hikariConfig.setMaxLifetime(Duration.ofMinutes(30).toMillis());
            hikariConfig.setLeakDetectionThreshold(Duration.ofSeconds(10).toMillis());
            hikariConfig.setAutoCommit(false);
            for (Map.Entry<String, String> entry : config.properties().entrySet()) {
                hikariConfig.addDataSourceProperty(entry.getKey(), entry.getValue());
            }
            dataSource = new HikariDataSource(hikariConfig);
            consecutiveFailures.set(0);
            return true;
        } catch (RuntimeException e) {
            LOGGER.warn("HikariDataSource 초기화 실패", e);
            return false;
        }
    }

    private HikariDataSource ensureAvailable() {
        HikariDataSource source = dataSource;
        if (!state.get().acceptsWork() || source == null) {
            throw new StoreException("데이터베이스가 " + state.get() + " 상태입니다");
        }
        return source;
    }

    private void attemptRecovery() {
        if (stopped.get() || state.get() == PoolState.RUNNING) {
            return;
        }
        if (initializeDataSource()) {
            transitionState(PoolState.RUNNING, "데이터베이스 연결이 복구되었습니다");
        }
    }

    private void markFailure(String message, Exception cause) {
        int failures = consecutiveFailures.incrementAndGet();
        LOGGER.warn("{} (연속 {}회)", message, failures, cause);
        if (failures >= FAILURE_THRESHOLD) {
            transitionState(PoolState.DEGRADED, "데이터베이스 장애 감지 - 요청을 거부합니다");
        }
    }

    private void logConnectionWait(long waitMs) {
        if (waitMs > CONNECTION_WAIT_WARN_MS) {
            LOGGER.warn("DB 커넥션 획득 지연 {}ms - 풀 설정을 점검하세요", waitMs);
        } else {
            LOGGER.debug("DB 커넥션 획득 {}ms", waitMs);
        }
    }

    private void logTransactionDuration(long txStart) {
        long txDuration = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - txStart);
        if (txDuration > TRANSACTION_WARN_MS) {
            LOGGER.warn("트랜잭션이 {}ms 소요되었습니다", txDuration);
        } else {
            LOGGER.debug("트랜잭션 완료 ({}ms)", txDuration);
        }
    }

    private void transitionState(PoolState newState, String message) {
        PoolState previous = state.getAndSet(newState);
        if (previous == newState) {
            return;
        }
        switch (newState) {
            case RUNNING, CONNECTING, STOPPED -> LOGGER.info(message);
            case DEGRADED -> LOGGER.warn(message);
        }
    }

    private void rollback(Connection connection) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            LOGGER.warn("롤백에 실패했습니다", e);
        }
    }
}

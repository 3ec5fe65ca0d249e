package kr.courtside.sync.core.conflict;

import kr.courtside.sync.api.Preconditions;
import kr.courtside.sync.api.conflict.Conflict;
import kr.courtside.sync.api.conflict.ConflictListener;
import kr.courtside.sync.api.conflict.ConflictResolutionException;
import kr.courtside.sync.api.conflict.ConflictService;
import kr.courtside.sync.api.conflict.MergeFunction;
import kr.courtside.sync.api.conflict.ResolutionStrategy;
import kr.courtside.sync.api.conflict.UpdateResult;
import kr.courtside.sync.api.executor.TaskExecutor;
import kr.courtside.sync.api.monitoring.Monitor;
import kr.courtside.sync.api.realtime.Registration;
import kr.courtside.sync.api.store.StoreException;
import kr.courtside.sync.api.store.VersionedRecord;
import kr.courtside.sync.api.store.VersionedStore;
import kr.courtside.sync.api.store.WriteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 버전 필드 기반 낙관적 동시성 제어.
 * <p>
 * 쓰기가 버전 불일치로 거부되면 최신 레코드를 다시 읽어 {@link Conflict}를 만들고, 기본 전략이 manual이
 * 아니면 즉시 한 번 해결을 시도한다. 해결 중 또 충돌하면 같은 충돌 기록의 원격 스냅샷만 갱신하고
 * 그 호출 안에서는 다시 시도하지 않는다. 같은 충돌에 대한 해결은 한 번에 하나만 진행되고, 진행 중에 들어온
 * 요청은 그 결과를 함께 받는다. 충돌 맵은 이벤트 루프에서만 바뀐다.
 */
public final class ConflictResolver implements ConflictService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConflictResolver.class);

    private record Resolution(boolean resolved, long version, Conflict conflict) {
    }

    private final VersionedStore store;
    private final TaskExecutor executor;
    private final Monitor monitor;
    private final int maxRetries;
    private final List<ConflictListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, Conflict> conflicts = new LinkedHashMap<>();
    private final Map<String, CompletableFuture<Resolution>> inFlight = new HashMap<>();
    private volatile List<Conflict> snapshot = List.of();
    private volatile ResolutionStrategy defaultStrategy;

    public ConflictResolver(VersionedStore store, TaskExecutor executor, Monitor monitor, ConflictSettings settings) {
        this.store = Objects.requireNonNull(store, "store");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        Objects.requireNonNull(settings, "settings");
        this.maxRetries = settings.maxRetries();
        this.defaultStrategy = settings.defaultStrategy();
    }

    public Registration addListener(ConflictListener listener) {
        Preconditions.checkNotNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void setDefaultStrategy(ResolutionStrategy strategy) {
        this.defaultStrategy = Preconditions.checkNotNull(strategy, "strategy");
    }

    public ResolutionStrategy defaultStrategy() {
        return defaultStrategy;
    }

    @Override
    public CompletableFuture<UpdateResult> updateWithConflictCheck(String entityId, Map<String, Object> changes) {
        Preconditions.checkNotBlank(entityId, "entityId");
        Preconditions.checkNotNull(changes, "changes");
        Map<String, Object> local = new LinkedHashMap<>(changes);
        return callOnLoop(() -> onLoop(() -> store.read(entityId))
                .thenCompose(current -> onLoop(() -> store.conditionalWrite(entityId, local, current.version()))
                        .thenCompose(result -> {
                            if (result.written()) {
                                LOGGER.debug("엔티티 '{}' 갱신 완료 (버전 {})", entityId, result.newVersion());
                                return CompletableFuture.completedFuture(UpdateResult.success(result.newVersion()));
                            }
                            return onLoop(() -> store.read(entityId))
                                    .thenCompose(latest -> onRejectedWrite(entityId, local, current.version(), latest));
                        })));
    }

    @Override
    public CompletableFuture<Boolean> resolveConflict(String conflictId, ResolutionStrategy strategy) {
        Preconditions.checkNotBlank(conflictId, "conflictId");
        Preconditions.checkNotNull(strategy, "strategy");
        return callOnLoop(() -> resolve(conflictId, strategy)).thenApply(Resolution::resolved);
    }

    @Override
    public void dismissConflict(String conflictId) {
        runOnLoop(() -> {
            if (conflicts.remove(conflictId) != null) {
                publishSnapshot();
                LOGGER.info("충돌 '{}'을 무시 처리했습니다", conflictId);
            }
        });
    }

    @Override
    public void clearConflicts() {
        runOnLoop(() -> {
            if (!conflicts.isEmpty()) {
                LOGGER.info("충돌 {}건을 모두 정리합니다", conflicts.size());
                conflicts.clear();
                publishSnapshot();
            }
        });
    }

    @Override
    public List<Conflict> conflicts() {
        return snapshot;
    }

    @Override
    public Optional<Conflict> conflict(String conflictId) {
        return snapshot.stream().filter(c -> c.conflictId().equals(conflictId)).findFirst();
    }

    private CompletableFuture<UpdateResult> onRejectedWrite(String entityId, Map<String, Object> local, long localVersion, VersionedRecord latest) {
        if (latest.version() <= localVersion) {
            return CompletableFuture.failedFuture(new StoreException(
                    "write to '" + entityId + "' was rejected but no newer version exists (" + latest.version() + ")"));
        }
        removeConflictsFor(entityId);
        Conflict conflict = new Conflict("conflict_" + UUID.randomUUID(), entityId, localVersion, latest.version(),
                local, latest.fields(), Instant.ofEpochMilli(executor.currentTimeMillis()), 0);
        conflicts.put(conflict.conflictId(), conflict);
        publishSnapshot();
        LOGGER.warn("엔티티 '{}' 버전 충돌 감지 (local {}, remote {})", entityId, localVersion, latest.version());
        monitor.recordMetric("conflict_detected", 1, Map.of("entity", entityId));
        notifyListeners(listener -> listener.onConflictDetected(conflict));

        ResolutionStrategy strategy = defaultStrategy;
        if (strategy.kind() == ResolutionStrategy.Kind.MANUAL) {
            return CompletableFuture.completedFuture(UpdateResult.conflicted(conflict));
        }
        return resolve(conflict.conflictId(), strategy).thenApply(resolution -> resolution.resolved()
                ? UpdateResult.success(resolution.version())
                : UpdateResult.conflicted(resolution.conflict()));
    }

    private CompletableFuture<Resolution> resolve(String conflictId, ResolutionStrategy strategy) {
        Conflict conflict = conflicts.get(conflictId);
        if (conflict == null) {
            LOGGER.warn("존재하지 않는 충돌 '{}'의 해결 요청을 무시합니다", conflictId);
            return CompletableFuture.completedFuture(new Resolution(false, -1L, null));
        }
        if (strategy.kind() == ResolutionStrategy.Kind.MANUAL) {
            LOGGER.info("충돌 '{}'은 manual 전략이라 자동 적용하지 않습니다", conflictId);
            return CompletableFuture.completedFuture(new Resolution(false, -1L, conflict));
        }
        CompletableFuture<Resolution> pending = inFlight.get(conflictId);
        if (pending != null) {
            LOGGER.debug("충돌 '{}'은 이미 해결 중입니다 - 진행 중인 결과를 공유합니다", conflictId);
            return pending;
        }
        if (conflict.retryCount() >= maxRetries) {
            LOGGER.warn("충돌 '{}' 해결 재시도 한도({}회)를 초과했습니다", conflictId, maxRetries);
            ConflictResolutionException error = new ConflictResolutionException("max resolution retries exceeded for " + conflictId);
            notifyListeners(listener -> listener.onResolutionFailed(conflict, error));
            return CompletableFuture.completedFuture(new Resolution(false, -1L, conflict));
        }

        Conflict attempt = conflict.withRetryCount(conflict.retryCount() + 1);
        conflicts.put(conflictId, attempt);
        publishSnapshot();

        Map<String, Object> payload;
        try {
            payload = candidate(attempt, strategy);
        } catch (Exception e) {
            return CompletableFuture.completedFuture(fail(attempt, e));
        }
        String entityId = attempt.entityId();
        Map<String, Object> writePayload = payload;
        LOGGER.info("충돌 '{}'을 {} 전략으로 해결합니다 (시도 {}/{})", conflictId, strategy.name(), attempt.retryCount(), maxRetries);
        CompletableFuture<Resolution> resolution = onLoop(() -> store.conditionalWrite(entityId, writePayload, attempt.remoteVersion()))
                .thenCompose(result -> afterResolutionWrite(attempt, strategy, result))
                .exceptionally(error -> fail(conflicts.getOrDefault(conflictId, attempt), unwrap(error)));
        inFlight.put(conflictId, resolution);
        resolution.whenComplete((ignored, error) -> inFlight.remove(conflictId, resolution));
        return resolution;
    }

    private CompletableFuture<Resolution> afterResolutionWrite(Conflict attempt, ResolutionStrategy strategy, WriteResult result) {
        String conflictId = attempt.conflictId();
        boolean stillLive = conflicts.containsKey(conflictId);
        if (result.written()) {
            if (stillLive) {
                conflicts.remove(conflictId);
                publishSnapshot();
                LOGGER.info("충돌 '{}' 해결 완료 (버전 {})", conflictId, result.newVersion());
                monitor.recordMetric("conflict_resolved", 1, Map.of("entity", attempt.entityId(), "strategy", strategy.name()));
                notifyListeners(listener -> listener.onConflictResolved(attempt, strategy));
            } else {
                LOGGER.debug("충돌 '{}'이 해결 도중 정리되었습니다 - 쓰기는 반영되었습니다", conflictId);
            }
            return CompletableFuture.completedFuture(new Resolution(true, result.newVersion(), null));
        }
        return onLoop(() -> store.read(attempt.entityId())).thenApply(latest -> {
            Conflict live = conflicts.get(conflictId);
            if (live == null) {
                return new Resolution(false, -1L, attempt);
            }
            Conflict updated = live.withRemote(Math.max(latest.version(), attempt.remoteVersion()), latest.fields());
            conflicts.put(conflictId, updated);
            publishSnapshot();
            LOGGER.warn("충돌 '{}' 해결 중 다른 쓰기가 끼어들었습니다 (remote {})", conflictId, updated.remoteVersion());
            notifyListeners(listener -> listener.onConflictUpdated(updated));
            return new Resolution(false, -1L, updated);
        });
    }

    private Resolution fail(Conflict conflict, Throwable cause) {
        LOGGER.warn("충돌 '{}' 해결에 실패했습니다", conflict.conflictId(), cause);
        monitor.recordError(cause, Map.of("component", "ConflictResolver", "conflict", conflict.conflictId()));
        notifyListeners(listener -> listener.onResolutionFailed(conflict, cause));
        return new Resolution(false, -1L, conflict);
    }

    private static Map<String, Object> candidate(Conflict conflict, ResolutionStrategy strategy) {
        return switch (strategy.kind()) {
            case LATEST_WINS -> conflict.remoteChanges();
            case USER_WINS -> conflict.localChanges();
            case MERGE -> {
                MergeFunction merge = strategy.mergeFunction();
                if (merge == null) {
                    yield conflict.remoteChanges();
                }
                Map<String, Object> merged = merge.merge(conflict.localChanges(), conflict.remoteChanges());
                if (merged == null) {
                    throw new ConflictResolutionException("merge function returned null for " + conflict.conflictId());
                }
                yield merged;
            }
            case MANUAL -> throw new IllegalStateException("manual strategy is never applied automatically");
        };
    }

    private void removeConflictsFor(String entityId) {
        List<String> stale = new ArrayList<>();
        for (Conflict existing : conflicts.values()) {
            if (existing.entityId().equals(entityId)) {
                stale.add(existing.conflictId());
            }
        }
        for (String id : stale) {
            conflicts.remove(id);
            LOGGER.debug("엔티티 '{}'의 이전 충돌 '{}'을 새 충돌로 교체합니다", entityId, id);
        }
    }

    private void publishSnapshot() {
        snapshot = List.copyOf(conflicts.values());
    }

    private void notifyListeners(Consumer<ConflictListener> action) {
        for (ConflictListener listener : listeners) {
            try {
                action.accept(listener);
            } catch (Exception e) {
                LOGGER.warn("충돌 리스너 실행 중 오류", e);
            }
        }
    }

    /**
     * 저장소 호출 결과를 이벤트 루프로 옮긴다. 동기 예외는 실패한 future로 바꾼다.
     */
    private <T> CompletableFuture<T> onLoop(Supplier<CompletableFuture<T>> call) {
        CompletableFuture<T> source;
        try {
            source = call.get();
        } catch (Exception e) {
            source = CompletableFuture.failedFuture(e);
        }
        CompletableFuture<T> hop = new CompletableFuture<>();
        source.whenComplete((value, error) -> executor.execute(() -> {
            if (error != null) {
                hop.completeExceptionally(unwrap(error));
            } else {
                hop.complete(value);
            }
        }));
        return hop;
    }

    private <T> CompletableFuture<T> callOnLoop(Supplier<CompletableFuture<T>> call) {
        if (executor.inEventLoop()) {
            return call.get();
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        executor.execute(() -> call.get().whenComplete((value, error) -> {
            if (error != null) {
                result.completeExceptionally(unwrap(error));
            } else {
                result.complete(value);
            }
        }));
        return result;
    }

    private void runOnLoop(Runnable task) {
        if (executor.inEventLoop()) {
            task.run();
        } else {
            executor.execute(task);
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}

package kr.courtside.sync.api.lifecycle;

/**
 * Standard lifecycle contract to start and stop resources.
 * <p>
 * {@link #stop()} must be idempotent; {@link #close()} delegates to it so instances can be
 * used with try-with-resources and registered in close stacks.
 */
public interface ManagedLifecycle extends AutoCloseable {

    void start();

    void stop();

    @Override
    default void close() {
        stop();
    }
}

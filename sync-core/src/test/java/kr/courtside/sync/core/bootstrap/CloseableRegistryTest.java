package kr.courtside.sync.core.bootstrap;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CloseableRegistryTest {

    @Test
    void closeAll_closesInReverseOrderAndSurvivesFailures() {
        List<String> closed = new ArrayList<>();
        CloseableRegistry registry = new CloseableRegistry();
        registry.register(() -> closed.add("executor"));
        registry.register(() -> {
            throw new IllegalStateException("transport close failed");
        });
        registry.register(() -> closed.add("store"));

        registry.closeAll();

        assertEquals(List.of("store", "executor"), closed);
        assertEquals(0, registry.size());
    }

    @Test
    void register_returnsArgument() {
        CloseableRegistry registry = new CloseableRegistry();
        AutoCloseable resource = () -> { };

        assertSame(resource, registry.register(resource));
        assertEquals(1, registry.size());
    }
}

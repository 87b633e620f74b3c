package com.ryuqq.retention.adapter.inmemory.store;

import com.ryuqq.retention.core.model.ExecutionResource;
import com.ryuqq.retention.core.model.Resource;
import com.ryuqq.retention.core.model.ResourceKind;
import com.ryuqq.retention.core.spi.ResourceStore;
import com.ryuqq.retention.core.statemachine.CompletionCondition;
import com.ryuqq.retention.testkit.contract.AbstractResourceStoreContractTest;
import com.ryuqq.retention.testkit.fixture.Resources;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract Test for InMemoryResourceStore adapter.
 *
 * <p>Runs the store contract from the testkit plus adapter-specific checks.</p>
 *
 * @author Retention Team
 * @since 1.0.0
 * @see AbstractResourceStoreContractTest
 */
class InMemoryResourceStoreContractTest extends AbstractResourceStoreContractTest {

    @Override
    protected ResourceStore<ExecutionResource> createStore(List<ExecutionResource> seed) {
        InMemoryResourceStore<ExecutionResource> store = new InMemoryResourceStore<>(ResourceKind.EXECUTION);
        seed.forEach(store::put);
        return store;
    }

    @Test
    void put_SameKey_ReplacesSnapshot() {
        // Given
        InMemoryResourceStore<ExecutionResource> store = new InMemoryResourceStore<>(ResourceKind.EXECUTION);
        ExecutionResource running = Resources.running("run-1");
        store.put(running);

        // When
        store.put(running.complete(CompletionCondition.TRUE, Instant.parse("2024-01-01T00:00:00Z")));

        // Then
        assertThat(store.size()).isEqualTo(1);
        assertThat(store.get(running.key()).orElseThrow().isCompleted()).isTrue();
    }

    @Test
    void put_OtherKind_ThrowsException() {
        // Given
        InMemoryResourceStore<Resource> store = new InMemoryResourceStore<>(ResourceKind.MANAGED);

        // When & Then
        assertThatThrownBy(() -> store.put(Resources.running("run-1")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("kind mismatch");
    }

    @Test
    void clear_RemovesEverything() {
        // Given
        InMemoryResourceStore<ExecutionResource> store = new InMemoryResourceStore<>(ResourceKind.EXECUTION);
        store.put(Resources.running("run-1"));
        store.put(Resources.running("run-2"));

        // When
        store.clear();

        // Then
        assertThat(store.size()).isZero();
        assertThat(store.contains(Resources.key("run-1"))).isFalse();
    }
}

package com.ryuqq.retention.adapter.inmemory.store;

import com.ryuqq.retention.core.exception.ResourceNotFoundException;
import com.ryuqq.retention.core.model.Resource;
import com.ryuqq.retention.core.model.ResourceKey;
import com.ryuqq.retention.core.model.ResourceKind;
import com.ryuqq.retention.core.spi.ResourceStore;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link ResourceStore} SPI for testing and reference purposes.
 *
 * <p>Holds the latest snapshot of each resource of a single kind in a {@link ConcurrentHashMap}.
 * The external system that owns the resources (or a test) writes snapshots through
 * {@link #put(Resource)}; the reconcilers only read and delete.</p>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>All operations are atomic per key</li>
 *   <li>Concurrent deletes of the same key: exactly one succeeds, the others see
 *       {@link ResourceNotFoundException}</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryResourceStore&lt;ExecutionResource&gt; store = new InMemoryResourceStore&lt;&gt;(ResourceKind.EXECUTION);
 * store.put(execution);
 *
 * Optional&lt;ExecutionResource&gt; latest = store.get(execution.key());
 * store.delete(execution.key());
 * </pre>
 *
 * @param <R> resource type
 *
 * @author Retention Team
 * @since 1.0.0
 */
public class InMemoryResourceStore<R extends Resource> implements ResourceStore<R> {

    private final ResourceKind kind;
    private final ConcurrentHashMap<ResourceKey, R> resources;

    /**
     * Creates an empty store for the given kind.
     *
     * @param kind the kind of resources held by this store
     * @throws IllegalArgumentException if kind is null
     */
    public InMemoryResourceStore(ResourceKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.kind = kind;
        this.resources = new ConcurrentHashMap<>();
    }

    @Override
    public ResourceKind kind() {
        return kind;
    }

    @Override
    public Optional<R> get(ResourceKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return Optional.ofNullable(resources.get(key));
    }

    @Override
    public void delete(ResourceKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (resources.remove(key) == null) {
            throw new ResourceNotFoundException(key);
        }
    }

    /**
     * Creates or replaces the snapshot of a resource.
     *
     * @param resource the latest snapshot
     * @throws IllegalArgumentException if resource is null or of another kind
     */
    public void put(R resource) {
        if (resource == null) {
            throw new IllegalArgumentException("resource cannot be null");
        }
        if (resource.kind() != kind) {
            throw new IllegalArgumentException(
                "resource kind mismatch (expected: " + kind + ", actual: " + resource.kind() + ")"
            );
        }
        resources.put(resource.key(), resource);
    }

    /**
     * Checks whether a resource exists.
     *
     * @param key the resource key
     * @return true if the resource exists
     */
    public boolean contains(ResourceKey key) {
        return key != null && resources.containsKey(key);
    }

    /**
     * Returns the number of stored resources.
     *
     * @return resource count
     */
    public int size() {
        return resources.size();
    }

    /**
     * Clears all resources. Used for test cleanup.
     */
    public void clear() {
        resources.clear();
    }
}

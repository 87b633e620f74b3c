package com.ryuqq.retention.core.spi;

import com.ryuqq.retention.core.exception.ResourceNotFoundException;
import com.ryuqq.retention.core.exception.StoreException;
import com.ryuqq.retention.core.model.Resource;
import com.ryuqq.retention.core.model.ResourceKey;
import com.ryuqq.retention.core.model.ResourceKind;

import java.util.Optional;

/**
 * Durable resource store SPI for a single resource kind.
 *
 * <p>This interface abstracts the authoritative store the controller reads from and
 * deletes through. How resources are retrieved or cached (direct API calls, informer caches)
 * is an implementation concern.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Loading the current snapshot of a resource by key</li>
 *   <li>Deleting a resource by key</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: All methods must be safely callable from multiple threads</li>
 *   <li>Serialized writes: Conflicting deletes for the same key must be serialized by the store</li>
 *   <li>Absence is not an error for {@link #get(ResourceKey)}: return {@link Optional#empty()}</li>
 * </ul>
 *
 * @param <R> resource type held by this store
 *
 * @author Retention Team
 * @since 1.0.0
 */
public interface ResourceStore<R extends Resource> {

    /**
     * Returns the kind of resources held by this store.
     *
     * @return the resource kind
     */
    ResourceKind kind();

    /**
     * Loads the current snapshot of a resource.
     *
     * @param key the resource key
     * @return the current snapshot, or empty if the resource does not exist
     * @throws IllegalArgumentException if key is null
     * @throws StoreException if the store cannot be read
     */
    Optional<R> get(ResourceKey key);

    /**
     * Deletes a resource.
     *
     * <p><strong>Outcomes:</strong></p>
     * <ul>
     *   <li>Normal return: the resource was deleted (Ack)</li>
     *   <li>{@link ResourceNotFoundException}: the resource did not exist (NotFound)</li>
     *   <li>{@link StoreException}: any other failure (Error)</li>
     * </ul>
     *
     * @param key the resource key
     * @throws IllegalArgumentException if key is null
     * @throws ResourceNotFoundException if no resource exists for key
     * @throws StoreException if the delete fails for any other reason
     */
    void delete(ResourceKey key);
}

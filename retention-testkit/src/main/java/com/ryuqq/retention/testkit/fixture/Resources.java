package com.ryuqq.retention.testkit.fixture;

import com.ryuqq.retention.core.model.ExecutionResource;
import com.ryuqq.retention.core.model.ManagedResource;
import com.ryuqq.retention.core.model.ResourceKey;
import com.ryuqq.retention.core.model.RetentionPolicy;
import com.ryuqq.retention.core.model.TtlRetention;
import com.ryuqq.retention.core.statemachine.CompletionCondition;

import java.time.Duration;
import java.time.Instant;

/**
 * Test fixtures for managed and execution resources.
 *
 * <p>All fixtures live in the {@value #NAMESPACE} namespace.</p>
 *
 * @author Retention Team
 * @since 1.0.0
 */
public final class Resources {

    /** Namespace used by every fixture. */
    public static final String NAMESPACE = "default";

    /** Owner name used by execution fixtures. */
    public static final String OWNER = "build-a";

    // Utility class - prevent instantiation
    private Resources() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Key in the fixture namespace.
     *
     * @param name resource name
     * @return ResourceKey
     */
    public static ResourceKey key(String name) {
        return ResourceKey.of(NAMESPACE, name);
    }

    /**
     * Managed resource with the given policy.
     *
     * @param name resource name
     * @param retention policy (null for none)
     * @return ManagedResource
     */
    public static ManagedResource managed(String name, RetentionPolicy retention) {
        return ManagedResource.of(key(name), retention);
    }

    /**
     * Running execution owned by {@value #OWNER} without any TTL.
     *
     * @param name resource name
     * @return ExecutionResource in UNKNOWN condition
     */
    public static ExecutionResource running(String name) {
        return ExecutionResource.running(key(name), OWNER, null, null);
    }

    /**
     * Running execution with its own TTL override and an inherited policy snapshot.
     *
     * @param name resource name
     * @param retention own TTL override (null for none)
     * @param embeddedPolicy inherited policy (null for none)
     * @return ExecutionResource in UNKNOWN condition
     */
    public static ExecutionResource running(String name, TtlRetention retention, RetentionPolicy embeddedPolicy) {
        return ExecutionResource.running(key(name), OWNER, retention, embeddedPolicy);
    }

    /**
     * Succeeded execution with a TTL after success.
     *
     * @param name resource name
     * @param completedAt completion time
     * @param ttlAfterSucceeded TTL (null for none)
     * @return ExecutionResource in TRUE condition
     */
    public static ExecutionResource succeeded(String name, Instant completedAt, Duration ttlAfterSucceeded) {
        return ExecutionResource.running(key(name), OWNER, TtlRetention.of(null, ttlAfterSucceeded), null)
            .complete(CompletionCondition.TRUE, completedAt);
    }

    /**
     * Failed execution with a TTL after failure.
     *
     * @param name resource name
     * @param completedAt completion time
     * @param ttlAfterFailed TTL (null for none)
     * @return ExecutionResource in FALSE condition
     */
    public static ExecutionResource failed(String name, Instant completedAt, Duration ttlAfterFailed) {
        return ExecutionResource.running(key(name), OWNER, TtlRetention.of(ttlAfterFailed, null), null)
            .complete(CompletionCondition.FALSE, completedAt);
    }
}

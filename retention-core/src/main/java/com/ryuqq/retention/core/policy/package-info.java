/**
 * TTL resolution and expiry evaluation (pure functions).
 *
 * @since 1.0.0
 * @author Retention Team
 */
package com.ryuqq.retention.core.policy;

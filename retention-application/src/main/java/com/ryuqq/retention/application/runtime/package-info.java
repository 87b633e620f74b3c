/**
 * Runtime contract for draining a controller's work queue.
 *
 * <p>Implementations live in adapter modules (see the runner adapter).</p>
 */
package com.ryuqq.retention.application.runtime;

/**
 * In-memory {@link com.ryuqq.retention.core.spi.WorkQueue} implementation backed by a DelayQueue.
 */
package com.ryuqq.retention.adapter.inmemory.queue;

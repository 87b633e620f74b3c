/**
 * In-memory {@link com.ryuqq.retention.core.spi.ResourceStore} implementation.
 */
package com.ryuqq.retention.adapter.inmemory.store;

/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces that must be implemented by infrastructure adapters
 * to provide storage and queueing for the controller core.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.retention.core.spi.ResourceStore} - Load and delete resources of one kind</li>
 *   <li>{@link com.ryuqq.retention.core.spi.WorkQueue} - Deduplicating, delay-capable request queue</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., retention-adapter-inmemory) are responsible for providing concrete
 * implementations of these SPIs.</p>
 *
 * @since 1.0.0
 * @author Retention Team
 */
package com.ryuqq.retention.core.spi;

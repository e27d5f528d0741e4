/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the storage seam that infrastructure adapters implement
 * to back the execution database.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.execdb.core.spi.RecordStore} - ordered logs, sets and hashes with atomic batches</li>
 *   <li>{@link com.ryuqq.execdb.core.spi.WriteBatch} / {@link com.ryuqq.execdb.core.spi.WriteOp} - the unit of atomic write</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (e.g., execdb-adapter-inmemory) provide concrete implementations.
 * A networked adapter maps each batch onto a single store transaction.</p>
 *
 * @since 1.0.0
 * @author Execution Team
 */
package com.ryuqq.execdb.core.spi;

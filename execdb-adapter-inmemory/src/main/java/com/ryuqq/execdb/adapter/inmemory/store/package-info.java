/**
 * In-memory RecordStore adapter implementation package.
 *
 * <p>This package provides the reference implementation of the RecordStore SPI
 * for testing and local runs.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.execdb.adapter.inmemory.store.InMemoryRecordStore}:
 *       Thread-safe in-memory implementation of {@link com.ryuqq.execdb.core.spi.RecordStore}</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 *   <li>Suitable for Contract Tests and reference implementation</li>
 * </ul>
 *
 * @see com.ryuqq.execdb.core.spi.RecordStore
 * @author Execution Team
 * @since 1.0.0
 */
package com.ryuqq.execdb.adapter.inmemory.store;

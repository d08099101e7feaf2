/**
 * In-memory store adapters.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.audioedit.adapter.inmemory.store.InMemoryRequestStore}:
 *       Thread-safe implementation of {@link com.ryuqq.audioedit.core.spi.RequestStore}</li>
 *   <li>{@link com.ryuqq.audioedit.adapter.inmemory.store.InMemoryAudioStore}:
 *       Blob store for source and result audio</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Suitable for contract tests, demos and single-process deployments</li>
 * </ul>
 *
 * @see com.ryuqq.audioedit.core.spi.RequestStore
 * @see com.ryuqq.audioedit.core.spi.AudioStore
 * @author AudioEdit Team
 * @since 1.0.0
 */
package com.ryuqq.audioedit.adapter.inmemory.store;

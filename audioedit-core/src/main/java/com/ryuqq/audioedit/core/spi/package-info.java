/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces that must be implemented by infrastructure adapters
 * to provide concrete functionality for the engine.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.audioedit.core.spi.RequestStore} - request state, the serialization point for transitions</li>
 *   <li>{@link com.ryuqq.audioedit.core.spi.AudioStore} - source and result audio blobs</li>
 *   <li>{@link com.ryuqq.audioedit.core.spi.StatusChannel} - per-request status notifications</li>
 *   <li>{@link com.ryuqq.audioedit.core.spi.MessageBus} - topic transport used by the intake channel</li>
 *   <li>{@link com.ryuqq.audioedit.core.spi.RequestIdGenerator} - id assignment</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., audioedit-adapter-inmemory, audioedit-adapter-intake)
 * are responsible for providing concrete implementations of these SPIs.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 * </ul>
 *
 * @since 1.0.0
 * @author AudioEdit Team
 */
package com.ryuqq.audioedit.core.spi;

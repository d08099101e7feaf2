/**
 * In-memory pub/sub transport adapter.
 *
 * @see com.ryuqq.audioedit.core.spi.MessageBus
 * @since 1.0.0
 */
package com.ryuqq.audioedit.adapter.inmemory.bus;

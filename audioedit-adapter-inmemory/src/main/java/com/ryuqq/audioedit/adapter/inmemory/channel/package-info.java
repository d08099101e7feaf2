/**
 * In-memory status channel adapter.
 *
 * @since 1.0.0
 */
package com.ryuqq.audioedit.adapter.inmemory.channel;

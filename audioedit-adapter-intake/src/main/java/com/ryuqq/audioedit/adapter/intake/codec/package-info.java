/**
 * Jackson codecs for intake payloads, status snapshots and rejections. All JSON is snake_case.
 *
 * @since 1.0.0
 */
package com.ryuqq.audioedit.adapter.intake.codec;

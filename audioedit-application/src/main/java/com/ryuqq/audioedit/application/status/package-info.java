/**
 * Status Publisher: 요청 상태 스냅샷을 상태 채널로 전달.
 *
 * @since 1.0.0
 */
package com.ryuqq.audioedit.application.status;

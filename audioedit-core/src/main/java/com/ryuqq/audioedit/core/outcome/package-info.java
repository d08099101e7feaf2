/**
 * 연산 실행 결과 타입 (Ok, Retry, Fail).
 *
 * @since 1.0.0
 */
package com.ryuqq.audioedit.core.outcome;

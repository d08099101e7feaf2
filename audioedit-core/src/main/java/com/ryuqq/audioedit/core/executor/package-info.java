/**
 * 연산 실행자 계약.
 *
 * @since 1.0.0
 */
package com.ryuqq.audioedit.core.executor;

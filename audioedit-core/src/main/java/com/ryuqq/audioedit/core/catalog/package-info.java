/**
 * Operation Catalog: 연산 종류별 파라미터 선언, 정규화, 실행자 바인딩.
 *
 * @since 1.0.0
 */
package com.ryuqq.audioedit.core.catalog;

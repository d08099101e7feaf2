/**
 * Request API: 외부 협력자가 쓰는 제출, 조회, 취소, 삭제, 목록 경계.
 *
 * <h2>핵심 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.audioedit.application.api.EditRequestService} - API 포트</li>
 *   <li>{@link com.ryuqq.audioedit.application.api.DefaultEditRequestService} - 기본 구현</li>
 *   <li>{@link com.ryuqq.audioedit.application.api.SubmitReceipt} - 접수 결과</li>
 *   <li>{@link com.ryuqq.audioedit.application.api.RequestStatistics} - 통계</li>
 * </ul>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
package com.ryuqq.audioedit.application.api;

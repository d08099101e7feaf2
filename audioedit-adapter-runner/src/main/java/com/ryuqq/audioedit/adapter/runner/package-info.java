/**
 * Runner Adapter Layer - 요청 실행 런타임.
 *
 * <p>claim된 편집 요청의 operation chain을 실행하고 종료 상태로 옮기는 구현체들을 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.audioedit.adapter.runner.PipelineExecutor} - operation chain 실행 (timeout, 재시도, 취소)</li>
 *   <li>{@link com.ryuqq.audioedit.adapter.runner.WorkerPool} - Runtime 구현, 워커 스레드 풀</li>
 *   <li>{@link com.ryuqq.audioedit.adapter.runner.BackoffCalculator} - 재시도 대기 시간 계산</li>
 *   <li>{@link com.ryuqq.audioedit.adapter.runner.AudioEditEngine} - 구성 요소 조립</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (WorkerPool, PipelineExecutor)
 *   ↓ implements
 * application (Runtime, PriorityScheduler, StatusPublisher)
 *   ↓ depends on
 * core (EditRequest, Outcome, RequestStatus, OperationCatalog)
 *   ↓ depends on
 * core/spi (RequestStore, AudioStore, StatusChannel)
 * </pre>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
package com.ryuqq.audioedit.adapter.runner;

package com.ryuqq.audioedit.application.api;

import com.ryuqq.audioedit.application.interpreter.EditPayload;
import com.ryuqq.audioedit.core.catalog.OperationDescriptor;
import com.ryuqq.audioedit.core.model.EditRequest;
import com.ryuqq.audioedit.core.model.RequestFilter;
import com.ryuqq.audioedit.core.model.RequestId;
import com.ryuqq.audioedit.core.model.StatusEvent;
import com.ryuqq.audioedit.core.spi.Subscription;

import java.util.List;
import java.util.function.Consumer;

/**
 * 편집 요청 API (제출, 조회, 취소, 삭제, 목록).
 *
 * <p>외부 협력자(인테이크 채널, HTTP 게이트웨이 등)가 사용하는 경계입니다.
 * 동기 오류(검증, 입장 거부, 미존재)는 호출자에게 바로 던지고, 실행 오류는
 * 상태 채널과 조회 API로만 관찰됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * EditPayload payload = EditPayload.builder()
 *     .source("audio/in.wav")
 *     .operation("trim", Map.of("start_ms", 0, "end_ms", 5000))
 *     .build();
 * SubmitReceipt receipt = service.submit(payload);
 * service.subscribe(receipt.id(), event -&gt; log.info("{}", event.status()));
 * </pre>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public interface EditRequestService {

    /**
     * 요청 제출.
     *
     * @param payload 요청 원문
     * @return 접수 결과 (요청은 queued 상태)
     * @throws com.ryuqq.audioedit.core.exception.ValidationException 요청이 유효하지 않은 경우
     * @throws com.ryuqq.audioedit.core.exception.AdmissionException 클라이언트 동시 요청 상한 초과
     */
    SubmitReceipt submit(EditPayload payload);

    /**
     * 요청 전체 레코드 조회.
     *
     * @throws com.ryuqq.audioedit.core.exception.RequestNotFoundException 없는 id
     */
    EditRequest get(RequestId id);

    /**
     * 최신순 목록 (client_id, status 필터).
     */
    List<EditRequest> list(RequestFilter filter);

    /**
     * 요청 취소.
     *
     * <p>queued/processing이면 cancelled로 전이합니다. 이미 종료된 요청이면
     * 아무것도 바꾸지 않고 현재 레코드를 돌려줍니다.</p>
     *
     * @return 취소 후 (또는 변경 없는) 레코드
     * @throws com.ryuqq.audioedit.core.exception.RequestNotFoundException 없는 id
     */
    EditRequest cancel(RequestId id);

    /**
     * 종료된 요청의 레코드를 지우고 저장된 결과를 해제.
     *
     * @return 삭제된 레코드
     * @throws com.ryuqq.audioedit.core.exception.RequestNotFoundException 없는 id
     * @throws IllegalStateException 아직 종료되지 않은 요청
     */
    EditRequest delete(RequestId id);

    /**
     * 지원 연산 목록 (설명과 파라미터 선언 포함).
     */
    List<OperationDescriptor> supportedOperations();

    RequestStatistics statistics();

    /**
     * 요청 하나의 상태 채널 구독.
     *
     * <p>구독 직후 현재 스냅샷을 한 번 전달합니다.</p>
     *
     * @throws com.ryuqq.audioedit.core.exception.RequestNotFoundException 없는 id
     */
    Subscription subscribe(RequestId id, Consumer<StatusEvent> listener);
}

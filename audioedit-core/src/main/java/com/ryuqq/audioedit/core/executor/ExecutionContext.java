package com.ryuqq.audioedit.core.executor;

import com.ryuqq.audioedit.core.model.AudioBuffer;
import com.ryuqq.audioedit.core.model.AudioRef;
import com.ryuqq.audioedit.core.model.RequestId;

/**
 * 실행자에게 제공되는 요청 단위 문맥.
 *
 * <p>merge처럼 주 입력 외의 오디오가 필요한 연산은 이 문맥으로 추가 소스를 읽습니다.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public interface ExecutionContext {

    RequestId requestId();

    /**
     * 오디오 저장소에서 소스 로드.
     *
     * @param ref 오디오 참조
     * @return 디코딩된 버퍼
     * @throws com.ryuqq.audioedit.core.exception.AudioNotFoundException 참조가 없는 경우
     */
    AudioBuffer loadSource(AudioRef ref);
}

package com.ryuqq.audioedit.application.status;

import com.ryuqq.audioedit.core.model.EditRequest;
import com.ryuqq.audioedit.core.model.StatusEvent;
import com.ryuqq.audioedit.core.spi.StatusChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Request Store의 전이와 진행 표시를 상태 채널 이벤트로 내보냄.
 *
 * <p>이벤트는 항상 요청의 현재 전체 상태 스냅샷이므로 중복 전달되어도 무해합니다.
 * 채널이 거부하면 고정 횟수만큼 즉시 재시도하고, 그래도 실패하면 로그만 남깁니다.
 * 상태 통지 실패가 요청 처리를 막지 않습니다.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class StatusPublisher {

    private static final Logger log = LoggerFactory.getLogger(StatusPublisher.class);

    /** 기본 전달 시도 횟수. */
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    private final StatusChannel channel;
    private final int maxAttempts;

    public StatusPublisher(StatusChannel channel) {
        this(channel, DEFAULT_MAX_ATTEMPTS);
    }

    /**
     * 생성자.
     *
     * @param channel 상태 채널
     * @param maxAttempts 이벤트당 최대 전달 시도 횟수 (1 이상)
     * @throws IllegalArgumentException channel이 null이거나 maxAttempts가 1 미만인 경우
     */
    public StatusPublisher(StatusChannel channel, int maxAttempts) {
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive (current: " + maxAttempts + ")");
        }
        this.channel = channel;
        this.maxAttempts = maxAttempts;
    }

    /**
     * 요청의 현재 상태를 스냅샷으로 발행.
     *
     * @param request 발행할 요청
     * @return 채널이 이벤트를 받았으면 true
     */
    public boolean publish(EditRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        return publish(StatusEvent.snapshotOf(request));
    }

    /**
     * 이벤트 발행 (at-least-once 전달 시도).
     *
     * @param event 상태 스냅샷
     * @return 채널이 이벤트를 받았으면 true
     */
    public boolean publish(StatusEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                channel.publish(event);
                return true;
            } catch (RuntimeException e) {
                if (attempt < maxAttempts) {
                    log.warn("Status publish failed for {} ({}), attempt {}/{}: {}",
                        event.requestId(), event.status(), attempt, maxAttempts, e.getMessage());
                } else {
                    log.error("Status event for {} ({}) dropped after {} attempts",
                        event.requestId(), event.status(), maxAttempts, e);
                }
            }
        }
        return false;
    }
}

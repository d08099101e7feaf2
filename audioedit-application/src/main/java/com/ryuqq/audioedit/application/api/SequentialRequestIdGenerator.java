package com.ryuqq.audioedit.application.api;

import com.ryuqq.audioedit.core.model.RequestId;
import com.ryuqq.audioedit.core.spi.RequestIdGenerator;

import java.util.concurrent.atomic.AtomicLong;

/**
 * {@code REQ-000001}부터 1씩 증가하는 id 생성기.
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class SequentialRequestIdGenerator implements RequestIdGenerator {

    private final AtomicLong sequence;

    public SequentialRequestIdGenerator() {
        this(0L);
    }

    /**
     * @param lastIssued 마지막으로 발급된 순번 (다음 id는 lastIssued + 1)
     */
    public SequentialRequestIdGenerator(long lastIssued) {
        if (lastIssued < 0) {
            throw new IllegalArgumentException("lastIssued must be non-negative (current: " + lastIssued + ")");
        }
        this.sequence = new AtomicLong(lastIssued);
    }

    @Override
    public RequestId next() {
        return RequestId.sequential(sequence.incrementAndGet());
    }
}

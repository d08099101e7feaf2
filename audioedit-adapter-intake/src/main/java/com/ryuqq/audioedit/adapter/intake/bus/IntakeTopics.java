package com.ryuqq.audioedit.adapter.intake.bus;

import com.ryuqq.audioedit.core.model.RequestId;

/**
 * Topic names used on the message bus.
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class IntakeTopics {

    /** Edit submissions (JSON). */
    public static final String EDIT = "audio/edit";

    /** Refused submissions (JSON). */
    public static final String REJECTIONS = "audio/rejections";

    public static final String STATUS_PREFIX = "audio/status/";

    private IntakeTopics() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Per-request status topic, e.g. {@code audio/status/REQ-000001}.
     */
    public static String status(RequestId requestId) {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        return STATUS_PREFIX + requestId.getValue();
    }
}

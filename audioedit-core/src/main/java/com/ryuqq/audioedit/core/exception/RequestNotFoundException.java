package com.ryuqq.audioedit.core.exception;

import com.ryuqq.audioedit.core.model.RequestId;

/**
 * Query, cancel or delete on an unknown request id.
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public class RequestNotFoundException extends EditEngineException {

    public static final String ERROR_CODE = "NOT_FOUND";

    private final RequestId requestId;

    public RequestNotFoundException(RequestId requestId) {
        super(ERROR_CODE, "Request not found: " + requestId);
        this.requestId = requestId;
    }

    public RequestId getRequestId() {
        return requestId;
    }
}

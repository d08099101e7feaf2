package com.ryuqq.audioedit.core.exception;

import com.ryuqq.audioedit.core.model.ClientId;

/**
 * Backpressure signal: the client already has the maximum number of
 * {@code queued}+{@code processing} requests.
 *
 * <p>Distinct from {@link ValidationException} so callers can tell
 * "fix your request" from "retry later".</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public class AdmissionException extends EditEngineException {

    public static final String ERROR_CODE = "ADMISSION_REJECTED";

    private final ClientId clientId;
    private final int activeRequests;
    private final int limit;

    public AdmissionException(ClientId clientId, int activeRequests, int limit) {
        super(ERROR_CODE, String.format(
            "Client %s has %d active requests (limit: %d), retry later",
            clientId.getValue(), activeRequests, limit));
        this.clientId = clientId;
        this.activeRequests = activeRequests;
        this.limit = limit;
    }

    public ClientId getClientId() {
        return clientId;
    }

    public int getActiveRequests() {
        return activeRequests;
    }

    public int getLimit() {
        return limit;
    }
}

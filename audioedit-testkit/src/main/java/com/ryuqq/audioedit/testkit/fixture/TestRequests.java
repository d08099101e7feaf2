package com.ryuqq.audioedit.testkit.fixture;

import com.ryuqq.audioedit.core.model.AudioRef;
import com.ryuqq.audioedit.core.model.ClientId;
import com.ryuqq.audioedit.core.model.EditRequest;
import com.ryuqq.audioedit.core.model.OperationKind;
import com.ryuqq.audioedit.core.model.OperationSpec;
import com.ryuqq.audioedit.core.model.Priority;
import com.ryuqq.audioedit.core.model.RequestId;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Factory for {@link EditRequest} fixtures.
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class TestRequests {

    public static final Instant EPOCH = Instant.parse("2024-01-01T00:00:00Z");
    public static final AudioRef SOURCE = AudioRef.of("audio/source.wav");

    private TestRequests() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Queued request with a single trim operation.
     */
    public static EditRequest queued(String id, String clientId, int priority) {
        return queued(id, clientId, priority, EPOCH);
    }

    public static EditRequest queued(String id, String clientId, int priority, Instant createdAt) {
        return EditRequest.queued(
            RequestId.of(id),
            ClientId.of(clientId),
            List.of(SOURCE),
            List.of(trim(0, 500)),
            Priority.of(priority),
            null,
            createdAt
        );
    }

    /**
     * Queued request with the given (already normalized) chain.
     */
    public static EditRequest queued(String id, List<OperationSpec> operations) {
        return EditRequest.queued(RequestId.of(id), ClientId.of("client-test"), List.of(SOURCE),
            operations, Priority.DEFAULT, null, EPOCH);
    }

    public static OperationSpec trim(long startMs, long endMs) {
        return OperationSpec.of(OperationKind.TRIM, Map.of("start_ms", startMs, "end_ms", endMs));
    }

    public static OperationSpec normalize(double targetDb) {
        return OperationSpec.of(OperationKind.NORMALIZE, Map.of("target_db", targetDb));
    }

    public static OperationSpec convert(String format) {
        return OperationSpec.of(OperationKind.CONVERT_FORMAT, Map.of(
            "target_format", format, "bitrate", "192k", "sample_rate", 44_100L, "channels", 2L));
    }
}

package com.ryuqq.audioedit.adapter.intake.codec;

import com.ryuqq.audioedit.core.model.AudioRef;
import com.ryuqq.audioedit.core.model.OperationKind;
import com.ryuqq.audioedit.core.model.RequestError;
import com.ryuqq.audioedit.core.model.RequestId;
import com.ryuqq.audioedit.core.model.StatusEvent;
import com.ryuqq.audioedit.core.statemachine.RequestStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StatusEventCodecTest {

    private static final Instant AT = Instant.parse("2024-01-01T00:00:05Z");

    private final StatusEventCodec codec = new StatusEventCodec();

    @Test
    void encode_WritesSnakeCaseFieldsAndWireNames() {
        StatusEvent event = new StatusEvent(RequestId.of("REQ-000001"), RequestStatus.PROCESSING,
            1, 3, OperationKind.FADE_OUT, null, null, AT);

        String json = codec.encode(event);

        assertThat(json)
            .contains("\"request_id\":\"REQ-000001\"")
            .contains("\"status\":\"processing\"")
            .contains("\"current_step\":1")
            .contains("\"total_steps\":3")
            .contains("\"current_operation\":\"fade_out\"")
            .contains("\"updated_at\":\"2024-01-01T00:00:05Z\"")
            .doesNotContain("result_ref")
            .doesNotContain("\"error\"");
    }

    @Test
    void decode_RestoresCompletedEvent() {
        StatusEvent completed = new StatusEvent(RequestId.of("REQ-000002"), RequestStatus.COMPLETED,
            2, 2, null, AudioRef.of("results/REQ-000002"), null, AT);

        assertThat(codec.decode(codec.encode(completed))).isEqualTo(completed);
    }

    @Test
    void decode_RestoresErrorWithOperationPosition() {
        RequestError error = RequestError.atOperation(RequestError.EXECUTION_FAILED,
            "RANGE_OUT_OF_BOUNDS: start_ms 5000 is beyond the audio length (1000ms)", 1, OperationKind.TRIM);
        StatusEvent failed = new StatusEvent(RequestId.of("REQ-000003"), RequestStatus.ERROR,
            1, 2, null, null, error, AT);

        String json = codec.encode(failed);

        assertThat(json).contains("\"operation_index\":1").contains("\"operation_kind\":\"trim\"");
        assertThat(codec.decode(json).error()).isEqualTo(error);
    }

    @Test
    void decode_RejectsUnknownStatusAndMalformedJson() {
        assertThatThrownBy(() -> codec.decode(
            "{\"request_id\":\"REQ-1\",\"status\":\"paused\",\"updated_at\":\"2024-01-01T00:00:00Z\"}"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("unknown status");
        assertThatThrownBy(() -> codec.decode("{"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("malformed");
    }
}

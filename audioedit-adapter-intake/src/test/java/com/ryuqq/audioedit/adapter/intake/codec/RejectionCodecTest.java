package com.ryuqq.audioedit.adapter.intake.codec;

import com.ryuqq.audioedit.core.exception.AdmissionException;
import com.ryuqq.audioedit.core.exception.ValidationException;
import com.ryuqq.audioedit.core.model.ClientId;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RejectionCodecTest {

    private static final Instant AT = Instant.parse("2024-01-01T00:00:00Z");

    private final RejectionCodec codec = new RejectionCodec();

    @Test
    void of_CarriesValidationPosition() {
        ValidationException cause = ValidationException
            .forParameter("normalize", "target_db", "must be at most 0.0 (current: 3.0)")
            .atIndex(2);

        Rejection rejection = Rejection.of("job-1", "studio-1", cause, AT);

        assertThat(rejection.errorCode()).isEqualTo("VALIDATION_ERROR");
        assertThat(rejection.operationIndex()).isEqualTo(2);
        assertThat(rejection.operationKind()).isEqualTo("normalize");
        assertThat(rejection.parameter()).isEqualTo("target_db");
    }

    @Test
    void of_RequestLevelValidationHasNoIndex() {
        Rejection rejection = Rejection.of(null, null, ValidationException.forRequest("payload is empty"), AT);

        assertThat(rejection.operationIndex()).isNull();
        assertThat(codec.encode(rejection)).doesNotContain("operation_index").doesNotContain("request_id");
    }

    @Test
    void encodeDecode_AdmissionRejection() {
        Rejection rejection = Rejection.of("job-2", "studio-1",
            new AdmissionException(ClientId.of("studio-1"), 2, 2), AT);

        String json = codec.encode(rejection);

        assertThat(json).contains("\"error_code\":\"ADMISSION_REJECTED\"").contains("\"rejected_at\"");
        assertThat(codec.decode(json)).isEqualTo(rejection);
    }
}

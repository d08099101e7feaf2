package com.ryuqq.audioedit.application.interpreter;

import com.ryuqq.audioedit.core.catalog.OperationCatalog;
import com.ryuqq.audioedit.core.exception.ValidationException;
import com.ryuqq.audioedit.core.model.AudioRef;
import com.ryuqq.audioedit.core.model.ClientId;
import com.ryuqq.audioedit.core.model.OperationKind;
import com.ryuqq.audioedit.core.model.OperationSpec;
import com.ryuqq.audioedit.core.model.Priority;
import com.ryuqq.audioedit.testkit.executor.TestCatalogs;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InstructionInterpreter 유닛 테스트.
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
class InstructionInterpreterTest {

    private final OperationCatalog catalog = TestCatalogs.passThrough();
    private final InstructionInterpreter interpreter = new InstructionInterpreter(catalog);

    // ========== 정규 순서 ==========

    @Test
    void interpret_정규화가_트림보다_먼저_와도_트림이_앞선다() {
        // given
        EditPayload payload = EditPayload.builder()
            .source("audio/in.wav")
            .operation("normalize", Map.of("target_db", -3))
            .operation("trim", Map.of("start_ms", 1000, "end_ms", 5000))
            .build();

        // when
        InterpretedRequest interpreted = interpreter.interpret(payload);

        // then
        assertThat(kinds(interpreted)).containsExactly(OperationKind.TRIM, OperationKind.NORMALIZE);
    }

    @Test
    void interpret_포맷_변환은_항상_마지막이고_같은_단계는_입력_순서를_유지한다() {
        // given
        EditPayload payload = EditPayload.builder()
            .source("audio/in.wav")
            .operation("convert_format", Map.of("target_format", "MP3"))
            .operation("reverb", Map.of())
            .operation("fade_in", Map.of("duration_ms", 500))
            .operation("speed_change", Map.of("factor", 1.25))
            .operation("equalize", Map.of("bands", Map.of("3000", 3, "100", -2)))
            .build();

        // when
        InterpretedRequest interpreted = interpreter.interpret(payload);

        // then
        assertThat(kinds(interpreted)).containsExactly(
            OperationKind.SPEED_CHANGE,
            OperationKind.REVERB,
            OperationKind.FADE_IN,
            OperationKind.EQUALIZE,
            OperationKind.CONVERT_FORMAT
        );
    }

    // ========== 파라미터 정규화 ==========

    @Test
    void interpret_기본값과_타입_변환이_적용된다() {
        // given
        EditPayload payload = EditPayload.builder()
            .source("audio/in.wav")
            .operation("trim", Map.of("start_ms", "1000", "end_ms", 5000.0))
            .operation("convert_format", Map.of("target_format", "Flac"))
            .build();

        // when
        InterpretedRequest interpreted = interpreter.interpret(payload);

        // then
        OperationSpec trim = interpreted.operations().get(0);
        assertThat(trim.parameters().getLong("start_ms")).isEqualTo(1000L);
        assertThat(trim.parameters().getLong("end_ms")).isEqualTo(5000L);
        OperationSpec convert = interpreted.operations().get(1);
        assertThat(convert.parameters().getString("target_format")).isEqualTo("flac");
        assertThat(convert.parameters().getString("bitrate")).isEqualTo("192k");
        assertThat(convert.parameters().getLong("sample_rate")).isEqualTo(44_100L);
    }

    @Test
    void interpret_클라이언트와_우선순위와_설명이_전달된다() {
        // given
        EditPayload payload = EditPayload.builder()
            .clientId("studio-7")
            .source(" audio/in.wav ")
            .operation("normalize", Map.of())
            .instruction("make it louder")
            .priority("urgent")
            .build();

        // when
        InterpretedRequest interpreted = interpreter.interpret(payload);

        // then
        assertThat(interpreted.clientId()).isEqualTo(ClientId.of("studio-7"));
        assertThat(interpreted.sources()).containsExactly(AudioRef.of("audio/in.wav"));
        assertThat(interpreted.priority()).isEqualTo(Priority.HIGHEST);
        assertThat(interpreted.description()).isEqualTo("make it louder");
        assertThat(interpreted.requestedIdOptional()).isEmpty();
    }

    @Test
    void interpret_클라이언트가_없으면_익명이고_우선순위는_기본값() {
        EditPayload payload = EditPayload.builder()
            .source("audio/in.wav")
            .operation("normalize", Map.of())
            .build();

        InterpretedRequest interpreted = interpreter.interpret(payload);

        assertThat(interpreted.clientId()).isEqualTo(ClientId.ANONYMOUS);
        assertThat(interpreted.priority()).isEqualTo(Priority.DEFAULT);
    }

    @Test
    void interpret_병합_소스가_없으면_추가_입력으로_채운다() {
        // given
        EditPayload payload = EditPayload.builder()
            .sources(List.of("audio/a.wav", "audio/b.wav", "audio/c.wav"))
            .operation("merge", Map.of())
            .build();

        // when
        InterpretedRequest interpreted = interpreter.interpret(payload);

        // then
        assertThat(interpreted.operations().get(0).parameters().getSources("sources"))
            .containsExactly(AudioRef.of("audio/b.wav"), AudioRef.of("audio/c.wav"));
    }

    // ========== 추측 경로 ==========

    @Test
    void interpret_연산이_없으면_추측_연산을_사용한다() {
        EditPayload payload = EditPayload.builder()
            .source("audio/in.wav")
            .guess(RawOperation.of("speed_change", Map.of("factor", 2)))
            .build();

        InterpretedRequest interpreted = interpreter.interpret(payload);

        assertThat(kinds(interpreted)).containsExactly(OperationKind.SPEED_CHANGE);
    }

    @Test
    void interpret_자유_텍스트는_추측기로_해석된다() {
        // given
        OperationGuesser guesser = instruction -> List.of(RawOperation.of("fade_out"));
        InstructionInterpreter guessing = new InstructionInterpreter(catalog, guesser);
        EditPayload payload = EditPayload.builder()
            .source("audio/in.wav")
            .instruction("fade it out at the end")
            .build();

        // when
        InterpretedRequest interpreted = guessing.interpret(payload);

        // then
        assertThat(kinds(interpreted)).containsExactly(OperationKind.FADE_OUT);
        assertThat(interpreted.operations().get(0).parameters().getLong("duration_ms")).isEqualTo(1_000L);
    }

    @Test
    void interpret_추측기가_없으면_자유_텍스트는_거부된다() {
        EditPayload payload = EditPayload.builder()
            .source("audio/in.wav")
            .instruction("make it sound better")
            .build();

        assertThatThrownBy(() -> interpreter.interpret(payload))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void interpret_추측기가_아무것도_찾지_못하면_거부된다() {
        InstructionInterpreter guessing = new InstructionInterpreter(catalog, instruction -> List.of());
        EditPayload payload = EditPayload.builder()
            .source("audio/in.wav")
            .instruction("hmm")
            .build();

        assertThatThrownBy(() -> guessing.interpret(payload))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("hmm");
    }

    // ========== 거부 ==========

    @Test
    void interpret_소스가_없으면_거부된다() {
        EditPayload payload = EditPayload.builder()
            .operation("normalize", Map.of())
            .build();

        assertThatThrownBy(() -> interpreter.interpret(payload))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("audio_source");
    }

    @Test
    void interpret_연산도_지시문도_없으면_거부된다() {
        EditPayload payload = EditPayload.builder().source("audio/in.wav").build();

        assertThatThrownBy(() -> interpreter.interpret(payload))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void interpret_첫_번째_잘못된_연산의_위치를_보고한다() {
        // given
        EditPayload payload = EditPayload.builder()
            .source("audio/in.wav")
            .operation("trim", Map.of("start_ms", 0, "end_ms", 1000))
            .operation("equalize", Map.of())
            .operation("speed_change", Map.of("factor", 9))
            .build();

        // when / then
        assertThatThrownBy(() -> interpreter.interpret(payload))
            .isInstanceOfSatisfying(ValidationException.class, e -> {
                assertThat(e.getOperationIndex()).isEqualTo(1);
                assertThat(e.getOperationKind()).isEqualTo("equalize");
                assertThat(e.getParameter()).isEqualTo("bands");
            });
    }

    @Test
    void interpret_알_수_없는_연산_종류는_위치와_함께_거부된다() {
        EditPayload payload = EditPayload.builder()
            .source("audio/in.wav")
            .operation("normalize", Map.of())
            .operation("autotune", Map.of())
            .build();

        assertThatThrownBy(() -> interpreter.interpret(payload))
            .isInstanceOfSatisfying(ValidationException.class, e -> {
                assertThat(e.getOperationIndex()).isEqualTo(1);
                assertThat(e.getOperationKind()).isEqualTo("autotune");
            });
    }

    @Test
    void interpret_잘못된_우선순위는_거부된다() {
        EditPayload payload = EditPayload.builder()
            .source("audio/in.wav")
            .operation("normalize", Map.of())
            .priority("7")
            .build();

        assertThatThrownBy(() -> interpreter.interpret(payload))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("priority");
    }

    private static List<OperationKind> kinds(InterpretedRequest interpreted) {
        return interpreted.operations().stream().map(OperationSpec::kind).toList();
    }
}

package com.ryuqq.audioedit.testkit.executor;

import com.ryuqq.audioedit.core.catalog.OperationCatalog;
import com.ryuqq.audioedit.core.exception.TransientOperationException;
import com.ryuqq.audioedit.core.model.AudioBuffer;
import com.ryuqq.audioedit.core.model.OperationKind;
import com.ryuqq.audioedit.core.model.OperationParameters;
import com.ryuqq.audioedit.core.outcome.Fail;
import com.ryuqq.audioedit.core.outcome.Ok;
import com.ryuqq.audioedit.core.outcome.Outcome;
import com.ryuqq.audioedit.testkit.fixture.TestAudio;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScriptedOperationExecutorTest {

    private final AudioBuffer input = TestAudio.tone();

    @Test
    void script_ConsumedInOrderThenPassesThrough() {
        ScriptedOperationExecutor executor = ScriptedOperationExecutor.passThrough(OperationKind.NORMALIZE)
            .thenFailTransiently(1)
            .thenReturn(Fail.of("CLIPPING", "clipped"));

        assertThrows(TransientOperationException.class,
            () -> executor.execute(input, OperationParameters.empty(), null));
        Outcome second = executor.execute(input, OperationParameters.empty(), null);
        Outcome third = executor.execute(input, OperationParameters.empty(), null);

        assertTrue(second.isFail());
        assertTrue(third.isOk());
        assertSame(input, ((Ok) third).output());
        assertEquals(3, executor.invocations());
    }

    @Test
    void passThroughCatalog_RegistersEveryKindWithOverrides() {
        ScriptedOperationExecutor trim = ScriptedOperationExecutor.passThrough(OperationKind.TRIM);

        OperationCatalog catalog = TestCatalogs.passThrough(trim);

        for (OperationKind kind : OperationKind.values()) {
            assertTrue(catalog.isRegistered(kind), kind + " should be registered");
        }
        assertSame(trim, catalog.executorFor(OperationKind.TRIM));
    }
}

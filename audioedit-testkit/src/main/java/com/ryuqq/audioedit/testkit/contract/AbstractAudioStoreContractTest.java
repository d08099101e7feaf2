package com.ryuqq.audioedit.testkit.contract;

import com.ryuqq.audioedit.core.exception.AudioNotFoundException;
import com.ryuqq.audioedit.core.model.AudioBuffer;
import com.ryuqq.audioedit.core.model.AudioRef;
import com.ryuqq.audioedit.core.spi.AudioStore;
import com.ryuqq.audioedit.testkit.fixture.TestAudio;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract every {@link AudioStore} implementation must satisfy.
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public abstract class AbstractAudioStoreContractTest {

    protected AudioStore audioStore;

    protected abstract AudioStore createAudioStore();

    @BeforeEach
    void setUpAudioStore() {
        audioStore = createAudioStore();
    }

    @Test
    void put_ThenGet_ReturnsStoredAudio() {
        AudioBuffer tone = TestAudio.tone();

        AudioRef ref = audioStore.put("REQ-000001", tone);

        assertTrue(audioStore.exists(ref));
        AudioBuffer loaded = audioStore.get(ref);
        assertEquals(tone.frameCount(), loaded.frameCount());
        assertEquals(tone.sampleRate(), loaded.sampleRate());
    }

    @Test
    void put_Twice_IssuesDistinctRefs() {
        AudioRef first = audioStore.put("REQ-000001", TestAudio.tone());
        AudioRef second = audioStore.put("REQ-000001", TestAudio.tone());

        assertNotEquals(first, second);
    }

    @Test
    void get_Unknown_ThrowsAudioNotFound() {
        assertThrows(AudioNotFoundException.class, () -> audioStore.get(AudioRef.of("missing/audio.wav")));
    }

    @Test
    void delete_RemovesOnlyOnce() {
        AudioRef ref = audioStore.put("REQ-000001", TestAudio.tone());

        assertTrue(audioStore.delete(ref));
        assertFalse(audioStore.delete(ref), "Second delete must report nothing removed");
        assertFalse(audioStore.exists(ref));
    }
}

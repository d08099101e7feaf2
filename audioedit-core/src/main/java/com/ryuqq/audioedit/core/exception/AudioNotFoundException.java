package com.ryuqq.audioedit.core.exception;

import com.ryuqq.audioedit.core.model.AudioRef;

/**
 * The audio store holds nothing under the given reference.
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public class AudioNotFoundException extends EditEngineException {

    public static final String ERROR_CODE = "AUDIO_NOT_FOUND";

    private final AudioRef audioRef;

    public AudioNotFoundException(AudioRef audioRef) {
        super(ERROR_CODE, "Audio not found: " + audioRef);
        this.audioRef = audioRef;
    }

    public AudioRef getAudioRef() {
        return audioRef;
    }
}

package com.ryuqq.audioedit.core.spi;

import com.ryuqq.audioedit.core.model.AudioBuffer;
import com.ryuqq.audioedit.core.model.AudioRef;

/**
 * Blob store SPI for source and result audio.
 *
 * <p>The engine reads sources and writes final artifacts through this interface only;
 * intermediate buffers never leave the pipeline.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe</li>
 *   <li>References returned by {@link #put} stay redeemable until {@link #delete}</li>
 * </ul>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public interface AudioStore {

    /**
     * Loads audio.
     *
     * @param ref the reference
     * @return the stored buffer
     * @throws com.ryuqq.audioedit.core.exception.AudioNotFoundException if nothing is stored under ref
     */
    AudioBuffer get(AudioRef ref);

    /**
     * Stores audio under a new reference.
     *
     * @param owner name used to derive the reference (e.g. the request id)
     * @param buffer the audio
     * @return the new reference
     */
    AudioRef put(String owner, AudioBuffer buffer);

    /**
     * Releases stored audio.
     *
     * @param ref the reference
     * @return true if something was removed
     */
    boolean delete(AudioRef ref);

    boolean exists(AudioRef ref);
}

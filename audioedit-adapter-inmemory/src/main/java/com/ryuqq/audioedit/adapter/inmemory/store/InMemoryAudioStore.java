package com.ryuqq.audioedit.adapter.inmemory.store;

import com.ryuqq.audioedit.core.exception.AudioNotFoundException;
import com.ryuqq.audioedit.core.model.AudioBuffer;
import com.ryuqq.audioedit.core.model.AudioRef;
import com.ryuqq.audioedit.core.spi.AudioStore;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link AudioStore} SPI.
 *
 * <p>Buffers are immutable, so they are stored and returned as-is. References handed out
 * by {@link #put} have the form {@code mem://{owner}/{n}}.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public class InMemoryAudioStore implements AudioStore {

    private static final String SCHEME = "mem://";

    private final ConcurrentHashMap<AudioRef, AudioBuffer> blobs = new ConcurrentHashMap<>();
    private final AtomicLong counter = new AtomicLong();

    @Override
    public AudioBuffer get(AudioRef ref) {
        if (ref == null) {
            throw new IllegalArgumentException("ref cannot be null");
        }
        AudioBuffer buffer = blobs.get(ref);
        if (buffer == null) {
            throw new AudioNotFoundException(ref);
        }
        return buffer;
    }

    @Override
    public AudioRef put(String owner, AudioBuffer buffer) {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner cannot be null or blank");
        }
        if (buffer == null) {
            throw new IllegalArgumentException("buffer cannot be null");
        }
        AudioRef ref = AudioRef.of(SCHEME + owner + "/" + counter.incrementAndGet());
        blobs.put(ref, buffer);
        return ref;
    }

    /**
     * Stores audio under a caller-chosen reference (used to seed uploaded sources).
     *
     * @param ref the reference
     * @param buffer the audio
     */
    public void save(AudioRef ref, AudioBuffer buffer) {
        if (ref == null) {
            throw new IllegalArgumentException("ref cannot be null");
        }
        if (buffer == null) {
            throw new IllegalArgumentException("buffer cannot be null");
        }
        blobs.put(ref, buffer);
    }

    @Override
    public boolean delete(AudioRef ref) {
        return ref != null && blobs.remove(ref) != null;
    }

    @Override
    public boolean exists(AudioRef ref) {
        return ref != null && blobs.containsKey(ref);
    }

    public int size() {
        return blobs.size();
    }
}

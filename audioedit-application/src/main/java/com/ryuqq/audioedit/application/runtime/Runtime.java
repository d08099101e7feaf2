package com.ryuqq.audioedit.application.runtime;

/**
 * Edit request processing runtime.
 *
 * <p>This interface defines one dispatch cycle of the worker loop: take the next
 * admissible request from the scheduler and run its operation chain to a terminal state.</p>
 *
 * <p><strong>Runtime Operation Flow:</strong></p>
 * <pre>
 * pump() starts
 *   ↓
 * 1. scheduler.next(pollTimeout)     → queued → processing (claimed through the Request Store)
 * 2. pipeline.run(request)
 *      for each operation, in chain order:
 *        a. cancellation check at the boundary
 *        b. bound executor with per-operation timeout
 *        c. Ok → next buffer, progress marker
 *           Retry / transient fault → backoff, retry up to maxRetries
 *           Fail / permanent fault → abort, processing → error
 * 3. persist final buffer → processing → completed (result_ref)
 * </pre>
 *
 * <p><strong>Execution Context:</strong></p>
 * <ul>
 *   <li>A worker pool calls pump() in a loop on each of its threads</li>
 *   <li>Implementations must be thread-safe: many pumps run concurrently, one request each</li>
 *   <li>A worker blocks only while waiting for a request and inside executor I/O</li>
 * </ul>
 *
 * <p><strong>Error Handling Strategy:</strong></p>
 * <ul>
 *   <li>Transient executor faults → retried locally, never surfaced unless retries are exhausted</li>
 *   <li>Permanent faults → request ends in {@code error} with the failing operation's index and kind</li>
 *   <li>Unexpected exceptions → logged; the request is moved to {@code error} when still processing</li>
 * </ul>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public interface Runtime {

    /**
     * Executes a single dispatch cycle.
     *
     * @return true if a request was taken and processed, false if none became available in time
     * @throws InterruptedException if the calling worker is interrupted while waiting
     */
    boolean pump() throws InterruptedException;
}

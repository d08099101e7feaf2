package com.ryuqq.audioedit.core.spi;

import com.ryuqq.audioedit.core.model.ClientId;
import com.ryuqq.audioedit.core.model.EditRequest;
import com.ryuqq.audioedit.core.model.RequestFilter;
import com.ryuqq.audioedit.core.model.RequestId;
import com.ryuqq.audioedit.core.statemachine.RequestStatus;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Request Store SPI: the single source of truth for request state.
 *
 * <p>Every read and write of an {@link EditRequest} goes through this interface,
 * which makes it the one authority for the state machine.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Persisting new requests in {@code queued}</li>
 *   <li>Atomic, validated state transitions (the serialization point per request id)</li>
 *   <li>Progress markers that are not state transitions</li>
 *   <li>Filtered listing, newest first</li>
 *   <li>Explicit deletion of terminal requests</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods callable from many workers at once</li>
 *   <li>Atomic per id: {@link #transition} reads, validates, mutates and writes as one step;
 *       two concurrent transitions of the same id never both succeed from the same source state</li>
 *   <li>Fail closed: a rejected transition leaves the stored record untouched, including {@code updatedAt}</li>
 * </ul>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public interface RequestStore {

    /**
     * Persists a new request.
     *
     * @param request a request in {@code queued}
     * @throws IllegalArgumentException if request is null or not queued
     * @throws IllegalStateException if a request with the same id already exists
     */
    void create(EditRequest request);

    /**
     * Returns the current record.
     *
     * @param id the request id
     * @return the stored request
     * @throws com.ryuqq.audioedit.core.exception.RequestNotFoundException if the id is unknown
     */
    EditRequest get(RequestId id);

    /**
     * Returns the current record if present.
     *
     * @param id the request id
     * @return the stored request, or empty
     */
    Optional<EditRequest> find(RequestId id);

    /**
     * Atomically moves a request to {@code target}.
     *
     * <p>The store validates {@code current.status -> target} against
     * {@link com.ryuqq.audioedit.core.statemachine.StateTransition}, applies {@code mutation}
     * to the current record and stores the result. The mutation must produce a record in
     * {@code target}; it runs while the id is locked and must not block.</p>
     *
     * @param id the request id
     * @param target the target status
     * @param mutation builds the new record from the current one
     * @return the stored record after the transition
     * @throws com.ryuqq.audioedit.core.exception.RequestNotFoundException if the id is unknown
     * @throws com.ryuqq.audioedit.core.statemachine.IllegalTransitionException if the edge is not allowed
     */
    EditRequest transition(RequestId id, RequestStatus target, UnaryOperator<EditRequest> mutation);

    /**
     * Updates the in-memory progress marker of a {@code processing} request.
     *
     * <p>Not a state transition: {@code updatedAt} and status are unchanged. Ignored
     * (the current record is returned unchanged) when the request is no longer processing.</p>
     *
     * @param id the request id
     * @param completedSteps number of finished operations
     * @return the stored record
     * @throws com.ryuqq.audioedit.core.exception.RequestNotFoundException if the id is unknown
     */
    EditRequest recordProgress(RequestId id, int completedSteps);

    /**
     * Lists requests matching the filter, newest first, at most {@code filter.limit()} entries.
     *
     * @param filter client/status filter and limit
     * @return matching requests (may be empty)
     */
    List<EditRequest> list(RequestFilter filter);

    /**
     * Removes a terminal request.
     *
     * @param id the request id
     * @return the removed record
     * @throws com.ryuqq.audioedit.core.exception.RequestNotFoundException if the id is unknown
     * @throws IllegalStateException if the request is not terminal
     */
    EditRequest delete(RequestId id);

    /**
     * Counts {@code queued}+{@code processing} requests of one client.
     *
     * @param clientId the client
     * @return active request count
     */
    int countActive(ClientId clientId);
}

/**
 * Edit request state machine package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.audioedit.core.statemachine.RequestStatus} - request lifecycle states</li>
 *   <li>{@link com.ryuqq.audioedit.core.statemachine.StateTransition} - transition validation</li>
 *   <li>{@link com.ryuqq.audioedit.core.statemachine.IllegalTransitionException} - invariant violation</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * queued → processing      (scheduler dispatch)
 * processing → completed   (pipeline finished)
 * processing → error       (unrecoverable failure)
 * queued/processing → cancelled (explicit cancel)
 *
 * Forbidden:
 * - completed/error/cancelled → * (terminal)
 * </pre>
 *
 * @since 1.0.0
 * @author AudioEdit Team
 */
package com.ryuqq.audioedit.core.statemachine;

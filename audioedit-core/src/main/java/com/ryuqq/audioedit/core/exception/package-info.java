/**
 * Error taxonomy of the edit engine.
 *
 * <ul>
 *   <li>{@link com.ryuqq.audioedit.core.exception.ValidationException} - synchronous, fix the request</li>
 *   <li>{@link com.ryuqq.audioedit.core.exception.AdmissionException} - synchronous, retry later</li>
 *   <li>{@link com.ryuqq.audioedit.core.exception.RequestNotFoundException} - synchronous, unknown id</li>
 *   <li>{@link com.ryuqq.audioedit.core.exception.TransientOperationException} - executor signal, retried locally</li>
 * </ul>
 *
 * <p>Execution failures are asynchronous and only visible as the {@code error}
 * terminal state; state-machine violations raise
 * {@link com.ryuqq.audioedit.core.statemachine.IllegalTransitionException}.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.audioedit.core.exception;

/**
 * Edit request domain model.
 *
 * <p>Value objects ({@link com.ryuqq.audioedit.core.model.RequestId},
 * {@link com.ryuqq.audioedit.core.model.ClientId}, {@link com.ryuqq.audioedit.core.model.Priority},
 * {@link com.ryuqq.audioedit.core.model.AudioRef}), the operation chain
 * ({@link com.ryuqq.audioedit.core.model.OperationSpec}) and the request snapshot
 * ({@link com.ryuqq.audioedit.core.model.EditRequest}) with its status notification
 * ({@link com.ryuqq.audioedit.core.model.StatusEvent}).</p>
 *
 * <p>All types are immutable; state changes produce new instances that the
 * Request Store applies atomically.</p>
 *
 * @since 1.0.0
 * @author AudioEdit Team
 */
package com.ryuqq.audioedit.core.model;

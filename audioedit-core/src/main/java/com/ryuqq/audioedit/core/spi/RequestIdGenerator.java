package com.ryuqq.audioedit.core.spi;

import com.ryuqq.audioedit.core.model.RequestId;

/**
 * Assigns ids to submissions that do not carry one.
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RequestIdGenerator {

    /**
     * @return a fresh id, never returned before by this generator
     */
    RequestId next();
}

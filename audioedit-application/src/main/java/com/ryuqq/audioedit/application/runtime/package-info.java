/**
 * Runtime contract implemented by the worker runner.
 *
 * @since 1.0.0
 */
package com.ryuqq.audioedit.application.runtime;

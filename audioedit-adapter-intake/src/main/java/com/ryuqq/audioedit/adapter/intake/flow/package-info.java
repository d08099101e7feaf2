/**
 * Reusable edit chains ("flows") stored as JSON or YAML files.
 *
 * @since 1.0.0
 */
package com.ryuqq.audioedit.adapter.intake.flow;

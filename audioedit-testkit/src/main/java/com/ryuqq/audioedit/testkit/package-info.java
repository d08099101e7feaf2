/**
 * Test support for adapters and embedders of the audio edit engine.
 *
 * <p><strong>Packages:</strong></p>
 * <ul>
 *   <li>{@code contract}: abstract contract tests for store and channel adapters</li>
 *   <li>{@code executor}: scripted operation executors and ready-made catalogs</li>
 *   <li>{@code fixture}: request and audio fixtures</li>
 * </ul>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
package com.ryuqq.audioedit.testkit;

/**
 * Message-bus intake adapter.
 *
 * <h2>Topics</h2>
 * <ul>
 *   <li>{@code audio/edit} - JSON submissions consumed by {@link com.ryuqq.audioedit.adapter.intake.bus.IntakeListener}</li>
 *   <li>{@code audio/rejections} - refused submissions</li>
 *   <li>{@code audio/status/{id}} - status snapshots published by
 *       {@link com.ryuqq.audioedit.adapter.intake.bus.MessageBusStatusChannel}</li>
 * </ul>
 *
 * <h2>Wiring</h2>
 * <pre>
 * MessageBus bus = ...;
 * AudioEditEngine engine = AudioEditEngine.builder()
 *     .statusChannel(new MessageBusStatusChannel(bus))
 *     .guesser(new KeywordOperationGuesser())
 *     .build();
 * IntakeListener intake = new IntakeListener(bus, engine.service(), Clock.systemUTC());
 * intake.start();
 * engine.start();
 * </pre>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
package com.ryuqq.audioedit.adapter.intake.bus;

package com.ryuqq.audioedit.adapter.intake.bus;

import com.ryuqq.audioedit.adapter.intake.codec.EditPayloadCodec;
import com.ryuqq.audioedit.adapter.intake.codec.Rejection;
import com.ryuqq.audioedit.adapter.intake.codec.RejectionCodec;
import com.ryuqq.audioedit.application.api.EditRequestService;
import com.ryuqq.audioedit.application.api.SubmitReceipt;
import com.ryuqq.audioedit.application.interpreter.EditPayload;
import com.ryuqq.audioedit.core.exception.EditEngineException;
import com.ryuqq.audioedit.core.spi.MessageBus;
import com.ryuqq.audioedit.core.spi.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Consumes edit submissions from {@link IntakeTopics#EDIT} and hands them to the Request API.
 *
 * <p>Every message is decoded, interpreted and admitted synchronously on the delivering
 * thread. A message that cannot be accepted produces a {@link Rejection} on
 * {@link IntakeTopics#REJECTIONS} and never reaches the Request Store.</p>
 *
 * <p><strong>Rejection causes:</strong></p>
 * <ul>
 *   <li>Malformed JSON or structure: {@code VALIDATION_ERROR}</li>
 *   <li>Unknown operation, bad parameter, bad priority: {@code VALIDATION_ERROR} with the offending index</li>
 *   <li>Client over its active-request limit: {@code ADMISSION_REJECTED}</li>
 *   <li>Anything unexpected: {@code INTERNAL_ERROR} (also logged at ERROR)</li>
 * </ul>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class IntakeListener implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(IntakeListener.class);

    private final MessageBus bus;
    private final EditRequestService service;
    private final EditPayloadCodec payloadCodec;
    private final RejectionCodec rejectionCodec;
    private final Clock clock;
    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private volatile Subscription subscription;

    public IntakeListener(MessageBus bus, EditRequestService service, Clock clock) {
        this(bus, service, new EditPayloadCodec(), new RejectionCodec(), clock);
    }

    public IntakeListener(MessageBus bus,
                          EditRequestService service,
                          EditPayloadCodec payloadCodec,
                          RejectionCodec rejectionCodec,
                          Clock clock) {
        if (bus == null) {
            throw new IllegalArgumentException("bus cannot be null");
        }
        if (service == null) {
            throw new IllegalArgumentException("service cannot be null");
        }
        if (payloadCodec == null) {
            throw new IllegalArgumentException("payloadCodec cannot be null");
        }
        if (rejectionCodec == null) {
            throw new IllegalArgumentException("rejectionCodec cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.bus = bus;
        this.service = service;
        this.payloadCodec = payloadCodec;
        this.rejectionCodec = rejectionCodec;
        this.clock = clock;
    }

    /**
     * Subscribes to the intake topic.
     *
     * @throws IllegalStateException if already started
     */
    public synchronized void start() {
        if (subscription != null) {
            throw new IllegalStateException("intake listener is already started");
        }
        subscription = bus.subscribe(IntakeTopics.EDIT, this::onMessage);
        log.info("Listening for edit requests on {}", IntakeTopics.EDIT);
    }

    @Override
    public synchronized void close() {
        if (subscription != null) {
            subscription.cancel();
            subscription = null;
        }
    }

    /**
     * Handles one raw submission.
     *
     * @param json message body
     */
    public void onMessage(String json) {
        EditPayload payload = null;
        try {
            payload = payloadCodec.decode(json);
            SubmitReceipt receipt = service.submit(payload);
            accepted.incrementAndGet();
            log.debug("Intake accepted {} ({} operation(s))", receipt.id(), receipt.operations().size());
        } catch (EditEngineException e) {
            log.info("Intake rejected submission: {} {}", e.getErrorCode(), e.getMessage());
            reject(Rejection.of(idOf(payload), clientOf(payload), e, clock.instant()));
        } catch (RuntimeException e) {
            log.error("Intake failed on submission", e);
            reject(Rejection.internal(idOf(payload), clientOf(payload), e.toString(), clock.instant()));
        }
    }

    public long acceptedCount() {
        return accepted.get();
    }

    public long rejectedCount() {
        return rejected.get();
    }

    private void reject(Rejection rejection) {
        rejected.incrementAndGet();
        bus.publish(IntakeTopics.REJECTIONS, rejectionCodec.encode(rejection));
    }

    private static String idOf(EditPayload payload) {
        return payload == null ? null : payload.id();
    }

    private static String clientOf(EditPayload payload) {
        return payload == null ? null : payload.clientId();
    }
}

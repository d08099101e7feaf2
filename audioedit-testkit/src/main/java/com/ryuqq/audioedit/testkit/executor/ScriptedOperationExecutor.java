package com.ryuqq.audioedit.testkit.executor;

import com.ryuqq.audioedit.core.exception.TransientOperationException;
import com.ryuqq.audioedit.core.executor.ExecutionContext;
import com.ryuqq.audioedit.core.executor.OperationExecutor;
import com.ryuqq.audioedit.core.model.AudioBuffer;
import com.ryuqq.audioedit.core.model.OperationKind;
import com.ryuqq.audioedit.core.model.OperationParameters;
import com.ryuqq.audioedit.core.outcome.Ok;
import com.ryuqq.audioedit.core.outcome.Outcome;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Operation executor whose behaviour is scripted per invocation.
 *
 * <p>Each call consumes the next scripted step; once the script is exhausted the executor
 * passes its input through unchanged.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ScriptedOperationExecutor normalize = ScriptedOperationExecutor.passThrough(OperationKind.NORMALIZE)
 *     .thenThrow(new TransientOperationException("busy"))
 *     .thenReturn(Fail.of("CLIPPING", "clipped"));
 * </pre>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class ScriptedOperationExecutor implements OperationExecutor {

    private final OperationKind kind;
    private final Deque<Function<AudioBuffer, Outcome>> script = new ArrayDeque<>();
    private final AtomicInteger invocations = new AtomicInteger();
    private volatile CountDownLatch entered;
    private volatile CountDownLatch gate;

    private ScriptedOperationExecutor(OperationKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.kind = kind;
    }

    /**
     * Executor that returns its input untouched.
     */
    public static ScriptedOperationExecutor passThrough(OperationKind kind) {
        return new ScriptedOperationExecutor(kind);
    }

    /**
     * Queues a fixed outcome for the next invocation.
     */
    public synchronized ScriptedOperationExecutor thenReturn(Outcome outcome) {
        script.addLast(input -> outcome);
        return this;
    }

    /**
     * Queues an exception for the next invocation.
     */
    public synchronized ScriptedOperationExecutor thenThrow(RuntimeException exception) {
        script.addLast(input -> {
            throw exception;
        });
        return this;
    }

    /**
     * Queues {@code times} transient faults.
     */
    public synchronized ScriptedOperationExecutor thenFailTransiently(int times) {
        for (int i = 0; i < times; i++) {
            int attempt = i + 1;
            script.addLast(input -> {
                throw new TransientOperationException("scripted transient fault #" + attempt);
            });
        }
        return this;
    }

    /**
     * Queues an invocation that sleeps before passing through.
     */
    public synchronized ScriptedOperationExecutor thenSleep(long millis) {
        script.addLast(input -> {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted while sleeping", e);
            }
            return Ok.of(input);
        });
        return this;
    }

    /**
     * Makes every subsequent invocation block until {@link #release()} is called.
     *
     * @return latch counted down when an invocation enters the executor
     */
    public CountDownLatch blockUntilReleased() {
        CountDownLatch enteredLatch = new CountDownLatch(1);
        this.entered = enteredLatch;
        this.gate = new CountDownLatch(1);
        return enteredLatch;
    }

    public void release() {
        CountDownLatch current = gate;
        if (current != null) {
            current.countDown();
        }
    }

    public int invocations() {
        return invocations.get();
    }

    @Override
    public OperationKind kind() {
        return kind;
    }

    @Override
    public Outcome execute(AudioBuffer input, OperationParameters parameters, ExecutionContext context) {
        invocations.incrementAndGet();
        awaitGate();
        Function<AudioBuffer, Outcome> step;
        synchronized (this) {
            step = script.pollFirst();
        }
        return step == null ? Ok.of(input) : step.apply(input);
    }

    private void awaitGate() {
        CountDownLatch currentGate = gate;
        if (currentGate == null) {
            return;
        }
        CountDownLatch currentEntered = entered;
        if (currentEntered != null) {
            currentEntered.countDown();
        }
        try {
            if (!currentGate.await(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("executor gate was never released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while blocked", e);
        }
    }
}

package com.ryuqq.dispatcher.testkit.host;

import com.ryuqq.dispatcher.core.support.MainThreadCall;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Simulated host main thread for testing.
 *
 * <p>A dedicated thread services a FIFO queue of posted tasks, the way a host
 * application's event loop services deferred calls. Test doubles of host SDK
 * bindings post their callbacks here.</p>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>{@link #post(Runnable)}: queue a task (callable from any thread)</li>
 *   <li>{@link #invoke(Callable)}: run a task on the loop and wait for its result</li>
 *   <li>{@link #pause()} / {@link #resume()}: simulate a host that is busy and not
 *       servicing deferred work</li>
 *   <li>{@link #uncaughtErrors()}: exceptions that escaped a task into the loop</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * try (SimulatedMainThread host = new SimulatedMainThread("maya-main")) {
 *     MayaUtils utils = new LoopMayaUtils(host);
 *     ...
 * }
 * </pre>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class SimulatedMainThread implements AutoCloseable {

    private static final Runnable POISON = () -> { };

    private final BlockingQueue<Runnable> queue = new LinkedBlockingQueue<>();
    private final List<Throwable> uncaughtErrors = new CopyOnWriteArrayList<>();
    private final AtomicInteger executedCount = new AtomicInteger();
    private final AtomicReference<CountDownLatch> pauseGate = new AtomicReference<>();
    private final Thread thread;

    /**
     * Creates and starts the loop thread.
     *
     * @param name the loop thread name
     */
    public SimulatedMainThread(String name) {
        this.thread = new Thread(this::loop, name);
        this.thread.setDaemon(true);
        this.thread.start();
    }

    /**
     * Queues a task for execution on the loop thread.
     *
     * @param task the task to run
     * @throws IllegalArgumentException if task is null
     */
    public void post(Runnable task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        queue.add(task);
    }

    /**
     * Runs a task on the loop thread and waits for its result.
     *
     * @param task the task to run
     * @param <T> result type
     * @return the task result
     * @throws Exception the task's exception, or a timeout after 10 seconds
     */
    public <T> T invoke(Callable<T> task) throws Exception {
        if (isCurrent()) {
            return task.call();
        }
        MainThreadCall<T> call = new MainThreadCall<>();
        post(() -> call.run(task));
        return call.await(Duration.ofSeconds(10));
    }

    /**
     * Blocks the loop until {@link #resume()} is called.
     *
     * <p>Tasks posted while paused stay queued.</p>
     */
    public void pause() {
        CountDownLatch gate = new CountDownLatch(1);
        if (pauseGate.compareAndSet(null, gate)) {
            post(() -> awaitQuietly(gate));
        }
    }

    /**
     * Releases a previous {@link #pause()}.
     */
    public void resume() {
        CountDownLatch gate = pauseGate.getAndSet(null);
        if (gate != null) {
            gate.countDown();
        }
    }

    /**
     * Waits until every task posted before this call has run.
     *
     * @param timeout maximum wait
     * @return true if the loop drained in time
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        CountDownLatch marker = new CountDownLatch(1);
        post(marker::countDown);
        return marker.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isCurrent() {
        return Thread.currentThread() == thread;
    }

    public Thread thread() {
        return thread;
    }

    public int executedCount() {
        return executedCount.get();
    }

    public List<Throwable> uncaughtErrors() {
        return List.copyOf(uncaughtErrors);
    }

    @Override
    public void close() {
        resume();
        queue.add(POISON);
        try {
            thread.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void loop() {
        while (true) {
            Runnable task;
            try {
                task = queue.take();
            } catch (InterruptedException e) {
                return;
            }
            if (task == POISON) {
                return;
            }
            try {
                task.run();
            } catch (Throwable t) {
                uncaughtErrors.add(t);
            } finally {
                executedCount.incrementAndGet();
            }
        }
    }

    private static void awaitQuietly(CountDownLatch gate) {
        try {
            gate.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

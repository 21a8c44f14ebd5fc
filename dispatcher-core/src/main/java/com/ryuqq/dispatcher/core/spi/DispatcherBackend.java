package com.ryuqq.dispatcher.core.spi;

import java.util.concurrent.Callable;

/**
 * Main-thread dispatcher backend SPI.
 *
 * <p>This interface is implemented once per host application (Maya, Houdini, Nuke,
 * Blender, 3ds Max, Unreal, a generic GUI toolkit, and a last-resort fallback).
 * Each implementation translates the uniform dispatch contract into the host's native
 * deferred/blocking primitive.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Detecting whether the host SDK is present ({@link #isAvailable()})</li>
 *   <li>Fire-and-forget scheduling onto the host main thread ({@link #runDeferred(Runnable)})</li>
 *   <li>Blocking execution with result on the host main thread ({@link #runSync(Callable)})</li>
 *   <li>Answering whether the current thread is the host main thread ({@link #isMainThread()})</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: every method may be called from any thread</li>
 *   <li>{@code isAvailable()} never throws and never blocks</li>
 *   <li>{@code runSync()} executes inline when already on the main thread; marshaling a
 *       main-thread call back through the host event loop while that loop waits for the
 *       result would deadlock</li>
 *   <li>No exception normalization: host-layer failures propagate as raised. The
 *       {@code ThreadSafetyException} hierarchy is raised by the dispatch facade only</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * DispatcherBackend backend = registry.resolve();
 *
 * // fire-and-forget
 * backend.runDeferred(() -> scene.refresh());
 *
 * // blocking with result
 * String name = backend.runSync(() -> scene.selectedNodeName());
 * }</pre>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public interface DispatcherBackend {

    /**
     * Checks whether this backend can be used in the current process.
     *
     * <p>Must not throw and must not block. Any detection failure yields {@code false}.</p>
     *
     * @return true if the host SDK is present and responsive
     */
    boolean isAvailable();

    /**
     * Schedules a task to run later, exactly once, on the host main thread.
     *
     * <p>Returns immediately. The caller has no channel for completion or result.
     * Exceptions thrown by the task are logged by the backend.</p>
     *
     * @param task the task to run on the main thread
     * @throws IllegalArgumentException if task is null
     */
    void runDeferred(Runnable task);

    /**
     * Executes a task on the host main thread and blocks until it finishes.
     *
     * @param task the task to run on the main thread
     * @param <T> result type
     * @return the value returned by the task
     * @throws Exception any exception thrown by the task, unchanged, or whatever the host
     *                   layer raises
     * @throws IllegalArgumentException if task is null
     */
    <T> T runSync(Callable<T> task) throws Exception;

    /**
     * Checks whether the current thread is the host main thread.
     *
     * @return true if running on the main thread
     */
    boolean isMainThread();

    /**
     * Backend name used in logs.
     *
     * @return display name of this backend
     */
    String getName();

    /**
     * Whether {@link #runSync(Callable)} actually hands work to another thread when called
     * off the main thread.
     *
     * <p>The fallback backend runs everything on the caller's thread and returns
     * {@code false}.</p>
     *
     * @return true if this backend marshals off-thread calls to the main thread
     */
    default boolean enforcesThreadAffinity() {
        return true;
    }
}

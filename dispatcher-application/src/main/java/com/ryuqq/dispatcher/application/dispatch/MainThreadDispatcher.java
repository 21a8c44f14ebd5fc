package com.ryuqq.dispatcher.application.dispatch;

import com.ryuqq.dispatcher.application.config.DispatcherConfig;
import com.ryuqq.dispatcher.application.registry.BackendRegistry;
import com.ryuqq.dispatcher.core.exception.DeadlockDetectedException;
import com.ryuqq.dispatcher.core.exception.ShutdownInProgressException;
import com.ryuqq.dispatcher.core.exception.ThreadDispatchTimeoutException;
import com.ryuqq.dispatcher.core.exception.ThreadSafetyException;
import com.ryuqq.dispatcher.core.spi.DispatcherBackend;
import com.ryuqq.dispatcher.core.support.MainThreadCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * 메인 스레드 디스패치 Facade.
 *
 * <p>레지스트리가 해석한 백엔드에 작업을 위임하고, 백엔드가 다루지 않는 실패 모드
 * (제한 시간, 교착, 종료)를 이 계층에서 감지하여 {@link ThreadSafetyException} 계열로 알립니다.</p>
 *
 * <p><strong>호출 방식:</strong></p>
 * <ul>
 *   <li>{@link #runOnMainThread(Runnable)}: 예약 후 즉시 반환</li>
 *   <li>{@link #runOnMainThreadSync(Callable)}: 완료까지 대기, 메인 스레드에서는 인라인 실행</li>
 *   <li>{@link #runOnMainThreadSyncWithTimeout(Callable, Duration)}: 제한 시간 대기</li>
 *   <li>{@link #runAsyncOnMainThread(AsyncTask)}: 비동기 본문을 메인 스레드에서 끝까지 구동</li>
 * </ul>
 *
 * <p><strong>교착 감지:</strong> 마샬링된 콜백이 실행되는 동안 해당 스레드의 재진입 깊이를
 * 스레드 로컬로 추적합니다. 깊이가 0보다 큰 스레드에서 블로킹 디스패치를 요청했는데 백엔드가
 * 그 스레드를 메인 스레드로 보지 않고 스레드 친화성을 강제한다면, 자기 자신을 기다리게 되므로
 * 대기하지 않고 {@link DeadlockDetectedException}을 던집니다.</p>
 *
 * <p><strong>종료:</strong> {@link #shutdown()} 이후의 모든 디스패치는
 * {@link ShutdownInProgressException}으로 즉시 실패하며, 제한 시간 대기 중인 호출자도
 * 같은 예외로 해제됩니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class MainThreadDispatcher {

    private static final Logger log = LoggerFactory.getLogger(MainThreadDispatcher.class);
    private static final ThreadLocal<int[]> DEPTH = ThreadLocal.withInitial(() -> new int[1]);

    private final BackendRegistry registry;
    private final DispatcherConfig config;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    private final Set<MainThreadCall<?>> pendingCalls = ConcurrentHashMap.newKeySet();

    public MainThreadDispatcher(BackendRegistry registry) {
        this(registry, new DispatcherConfig());
    }

    public MainThreadDispatcher(BackendRegistry registry, DispatcherConfig config) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.registry = registry;
        this.config = config;
    }

    /**
     * 메인 스레드에서 실행하도록 예약 (fire-and-forget).
     *
     * @param task 실행할 작업
     * @throws ShutdownInProgressException 종료 중인 경우
     */
    public void runOnMainThread(Runnable task) {
        requireTask(task);
        ensureRunning();
        DispatcherBackend backend = registry.resolve();
        backend.runDeferred(tracked(task));
    }

    /**
     * 메인 스레드에서 실행하고 결과를 대기.
     *
     * <p>메인 스레드에서 호출되면 마샬링 없이 인라인으로 실행합니다.
     * 작업이 던진 예외는 변경 없이 전파됩니다.</p>
     *
     * @param task 실행할 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws DeadlockDetectedException 마샬링된 콜백 내부에서 자기 자신을 기다리게 되는 경우
     * @throws ShutdownInProgressException 종료 중인 경우
     * @throws Exception 작업이 던진 예외
     */
    public <T> T runOnMainThreadSync(Callable<T> task) throws Exception {
        requireTask(task);
        ensureRunning();
        DispatcherBackend backend = registry.resolve();
        if (backend.isMainThread()) {
            return task.call();
        }
        checkReentrancy(backend);
        return backend.runSync(tracked(task));
    }

    /**
     * 기본 제한 시간({@link DispatcherConfig#defaultTimeout()})으로 실행하고 결과를 대기.
     *
     * @see #runOnMainThreadSyncWithTimeout(Callable, Duration)
     */
    public <T> T runOnMainThreadSyncWithTimeout(Callable<T> task) throws Exception {
        return runOnMainThreadSyncWithTimeout(task, config.defaultTimeout());
    }

    /**
     * 메인 스레드에서 실행하고 제한 시간 동안 결과를 대기.
     *
     * <p>제한 시간이 지나면 호출자만 해제됩니다. 이미 예약된 작업은 나중에 실행될 수 있으며,
     * 그 결과는 버려집니다.</p>
     *
     * @param task 실행할 작업
     * @param timeout 최대 대기 시간
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws ThreadDispatchTimeoutException 제한 시간 내에 완료되지 않은 경우
     * @throws DeadlockDetectedException 마샬링된 콜백 내부에서 자기 자신을 기다리게 되는 경우
     * @throws ShutdownInProgressException 종료 중이거나 대기 중 종료된 경우
     * @throws Exception 작업이 던진 예외
     */
    public <T> T runOnMainThreadSyncWithTimeout(Callable<T> task, Duration timeout) throws Exception {
        requireTask(task);
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative (current: " + timeout + ")");
        }
        ensureRunning();
        DispatcherBackend backend = registry.resolve();
        if (backend.isMainThread()) {
            return task.call();
        }
        checkReentrancy(backend);

        MainThreadCall<T> call = new MainThreadCall<>();
        pendingCalls.add(call);
        try {
            if (shuttingDown.get()) {
                throw shutdownException();
            }
            Callable<T> marshaled = tracked(task);
            backend.runDeferred(() -> call.run(marshaled));
            if (!awaitCompletion(call, timeout)) {
                ThreadDispatchTimeoutException timedOut = new ThreadDispatchTimeoutException(
                    "Main thread execution timed out after " + timeout.toMillis() + "ms. Task: " + task, timeout);
                if (call.fail(timedOut)) {
                    throw timedOut;
                }
            }
            return call.join();
        } finally {
            pendingCalls.remove(call);
        }
    }

    /**
     * 현재 스레드가 메인 스레드인지 확인.
     *
     * <p>종료 중에도 동작합니다.</p>
     *
     * @return 활성 백엔드 기준 메인 스레드이면 true
     */
    public boolean isMainThread() {
        return registry.resolve().isMainThread();
    }

    /**
     * 비동기 작업을 메인 스레드에서 끝까지 구동.
     *
     * <p>작업은 하나의 예약된 메인 스레드 호출 안에서 시작되고, 메인 스레드에 고정된 실행기가
     * 완료될 때까지 그 호출 안에서 구동됩니다. 반환된 future는 그 호출이 완료합니다.</p>
     *
     * @param task 비동기 작업
     * @param <T> 결과 타입
     * @return 작업 결과 future
     * @throws ShutdownInProgressException 종료 중인 경우
     */
    public <T> CompletableFuture<T> runAsyncOnMainThread(AsyncTask<T> task) {
        requireTask(task);
        CompletableFuture<T> result = new CompletableFuture<>();
        runOnMainThread(() -> driveToCompletion(task, result));
        return result;
    }

    /**
     * 결과를 기다리는 메인 스레드 실행 데코레이터.
     *
     * @param task 원본 작업
     * @param <T> 결과 타입
     * @return 호출 시 항상 메인 스레드에서 실행되는 작업
     */
    public <T> Callable<T> ensureMainThread(Callable<T> task) {
        requireTask(task);
        return () -> runOnMainThreadSync(task);
    }

    /**
     * 예약만 하는 메인 스레드 실행 데코레이터.
     *
     * @param task 원본 작업
     * @return 호출 시 항상 메인 스레드로 예약되는 작업
     */
    public Runnable deferToMainThread(Runnable task) {
        requireTask(task);
        return () -> runOnMainThread(task);
    }

    /**
     * 스레드 안전 데코레이터 (블로킹).
     *
     * <p>메인 스레드에서는 바로 실행하고, 그 외 스레드에서는 마샬링하여 결과를 대기합니다.</p>
     *
     * @param task 원본 작업
     * @param <T> 결과 타입
     * @return 스레드 안전 작업
     */
    public <T> Callable<T> threadSafe(Callable<T> task) {
        requireTask(task);
        return () -> {
            if (isMainThread()) {
                return task.call();
            }
            log.debug("Marshaling {} to main thread", task);
            return runOnMainThreadSync(task);
        };
    }

    /**
     * 스레드 안전 데코레이터 (fire-and-forget).
     *
     * <p>메인 스레드에서는 바로 실행하고, 그 외 스레드에서는 예약 후 즉시 반환합니다.</p>
     *
     * @param task 원본 작업
     * @return 스레드 안전 작업
     */
    public Runnable threadSafeAsync(Runnable task) {
        requireTask(task);
        return () -> {
            if (isMainThread()) {
                task.run();
                return;
            }
            log.debug("Queueing {} for main thread", task);
            runOnMainThread(task);
        };
    }

    /**
     * 콜백 래핑.
     *
     * <p>블로킹 모드에서 콜백이 던진 unchecked 예외는 그대로 전파됩니다.</p>
     *
     * @param callback 원본 콜백
     * @param asyncMode true이면 fire-and-forget, false이면 블로킹
     * @return 스레드 안전 콜백
     */
    public Runnable wrapCallback(Runnable callback, boolean asyncMode) {
        requireTask(callback);
        if (asyncMode) {
            return threadSafeAsync(callback);
        }
        Callable<Void> blocking = threadSafe(() -> {
            callback.run();
            return null;
        });
        return () -> {
            try {
                blocking.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new ThreadSafetyException("Main thread callback failed: " + callback, e);
            }
        };
    }

    /**
     * 비동기 작업 데코레이터.
     *
     * @param task 비동기 작업
     * @param <T> 결과 타입
     * @return 호출할 때마다 메인 스레드에서 작업을 구동하는 공급자
     */
    public <T> Supplier<CompletableFuture<T>> ensureMainThreadAsync(AsyncTask<T> task) {
        requireTask(task);
        return () -> runAsyncOnMainThread(task);
    }

    /**
     * 객체의 모든 인터페이스 메서드를 메인 스레드로 마샬링하는 프록시 생성.
     *
     * <p>메서드별 동작은 {@link Deferred}, {@link AnyThread} 어노테이션으로 조정합니다.
     * {@link Object} 메서드는 마샬링하지 않습니다.</p>
     *
     * @param api 프록시가 구현할 인터페이스
     * @param target 실제 대상
     * @param <T> 인터페이스 타입
     * @return 스레드 안전 프록시
     * @throws IllegalArgumentException api가 인터페이스가 아니거나, {@link Deferred} 메서드가
     *                                  void를 반환하지 않는 경우
     */
    public <T> T wrap(Class<T> api, T target) {
        if (api == null) {
            throw new IllegalArgumentException("api cannot be null");
        }
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (!api.isInterface()) {
            throw new IllegalArgumentException("api must be an interface (current: " + api.getName() + ")");
        }
        for (Method method : api.getMethods()) {
            if (method.isAnnotationPresent(Deferred.class) && method.getReturnType() != void.class) {
                throw new IllegalArgumentException("@Deferred method must return void: " + method);
            }
        }
        Object proxy = Proxy.newProxyInstance(
            api.getClassLoader(), new Class<?>[] {api}, new ThreadSafeInvocationHandler(this, target));
        log.debug("Created main thread proxy for {}", api.getSimpleName());
        return api.cast(proxy);
    }

    /**
     * 종료 신호.
     *
     * <p>이후의 모든 디스패치는 즉시 실패하고, 제한 시간 대기 중인 호출자는 해제됩니다.
     * 반복 호출해도 안전합니다.</p>
     */
    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        int released = 0;
        for (MainThreadCall<?> call : pendingCalls) {
            if (call.fail(shutdownException())) {
                released++;
            }
        }
        log.info("Main thread dispatcher shutting down (released {} pending call(s))", released);
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    /**
     * 활성 백엔드 이름.
     *
     * @return 표시 이름
     */
    public String resolvedBackendName() {
        return registry.resolve().getName();
    }

    public BackendRegistry registry() {
        return registry;
    }

    public DispatcherConfig config() {
        return config;
    }

    private <T> void driveToCompletion(AsyncTask<T> task, CompletableFuture<T> result) {
        PinnedTaskRunner runner = new PinnedTaskRunner();
        try {
            CompletableFuture<T> body = task.start(runner).toCompletableFuture();
            runner.drainUntil(body);
            result.complete(body.join());
        } catch (CompletionException e) {
            result.completeExceptionally(e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result.completeExceptionally(new ThreadSafetyException("Async main thread task interrupted", e));
        } catch (Exception | Error e) {
            result.completeExceptionally(e);
        }
    }

    private boolean awaitCompletion(MainThreadCall<?> call, Duration timeout) {
        try {
            return call.awaitCompletion(timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ThreadSafetyException("Waiting for main thread execution interrupted", e);
        }
    }

    private void checkReentrancy(DispatcherBackend backend) {
        int depth = DEPTH.get()[0];
        if (depth > 0 && backend.enforcesThreadAffinity()) {
            throw new DeadlockDetectedException(
                "Blocking dispatch from thread '" + Thread.currentThread().getName()
                    + "' while it is executing a marshaled callback (depth=" + depth
                    + ") would block on itself", depth);
        }
    }

    private <T> Callable<T> tracked(Callable<T> task) {
        return () -> {
            int[] depth = DEPTH.get();
            depth[0]++;
            try {
                return task.call();
            } finally {
                depth[0]--;
            }
        };
    }

    private Runnable tracked(Runnable task) {
        return () -> {
            int[] depth = DEPTH.get();
            depth[0]++;
            try {
                task.run();
            } finally {
                depth[0]--;
            }
        };
    }

    private void ensureRunning() {
        if (shuttingDown.get()) {
            throw shutdownException();
        }
    }

    private static ShutdownInProgressException shutdownException() {
        return new ShutdownInProgressException("Main thread dispatcher is shutting down; dispatch rejected");
    }

    private static void requireTask(Object task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
    }
}

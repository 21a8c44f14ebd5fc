package com.ryuqq.dispatcher.application.dispatch;

import com.ryuqq.dispatcher.application.config.DispatcherConfig;
import com.ryuqq.dispatcher.application.registry.BackendRegistry;
import com.ryuqq.dispatcher.application.registry.BackendStatus;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * 프로세스 기본 디스패처에 대한 정적 진입점.
 *
 * <p>기본 디스패처는 {@link BackendRegistry#global()}과 {@link DispatcherConfig#fromSystem()}으로
 * 처음 사용될 때 생성됩니다.</p>
 *
 * <pre>{@code
 * MainThread.runOnMainThread(() -> viewport.refresh());
 * String name = MainThread.runOnMainThreadSync(() -> scene.currentName());
 * }</pre>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class MainThread {

    private MainThread() {
    }

    private static final class Holder {
        private static final MainThreadDispatcher DEFAULT =
            new MainThreadDispatcher(BackendRegistry.global(), DispatcherConfig.fromSystem());
    }

    /**
     * 프로세스 기본 디스패처.
     *
     * @return 기본 디스패처
     */
    public static MainThreadDispatcher dispatcher() {
        return Holder.DEFAULT;
    }

    public static void runOnMainThread(Runnable task) {
        dispatcher().runOnMainThread(task);
    }

    public static <T> T runOnMainThreadSync(Callable<T> task) throws Exception {
        return dispatcher().runOnMainThreadSync(task);
    }

    public static <T> T runOnMainThreadSyncWithTimeout(Callable<T> task) throws Exception {
        return dispatcher().runOnMainThreadSyncWithTimeout(task);
    }

    public static <T> T runOnMainThreadSyncWithTimeout(Callable<T> task, Duration timeout) throws Exception {
        return dispatcher().runOnMainThreadSyncWithTimeout(task, timeout);
    }

    public static boolean isMainThread() {
        return dispatcher().isMainThread();
    }

    public static boolean isHostEnvironment() {
        return dispatcher().registry().isHostEnvironment();
    }

    public static Optional<String> currentHostName() {
        return dispatcher().registry().currentHostName();
    }

    public static List<BackendStatus> listBackends() {
        return dispatcher().registry().list();
    }
}

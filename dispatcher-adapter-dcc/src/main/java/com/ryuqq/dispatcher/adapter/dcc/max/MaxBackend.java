package com.ryuqq.dispatcher.adapter.dcc.max;

import com.ryuqq.dispatcher.adapter.dcc.HostBindings;
import com.ryuqq.dispatcher.core.spi.AbstractDispatcherBackend;
import com.ryuqq.dispatcher.core.support.MainThreadCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * 3ds Max 디스패처 백엔드.
 *
 * <p>3ds Max는 내부적으로 Qt를 사용하므로 Qt 프리미티브로 스케줄링합니다:</p>
 * <ul>
 *   <li>runDeferred → {@code QTimer.singleShot(0, ...)}</li>
 *   <li>runSync → single-shot + 로컬 {@code QEventLoop} (콜백이 {@code quit()} 호출)</li>
 *   <li>isMainThread → Qt GUI 스레드 비교 (Qt 부재 시 프로세스 메인 스레드)</li>
 * </ul>
 *
 * <p>Qt가 없는 Max 런타임에서는 경고를 남기고 직접 호출합니다. 스레드 안전성은 보장되지
 * 않습니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class MaxBackend extends AbstractDispatcherBackend {

    private static final Logger log = LoggerFactory.getLogger(MaxBackend.class);

    private final HostBindings bindings;

    public MaxBackend() {
        this(HostBindings.global());
    }

    public MaxBackend(HostBindings bindings) {
        if (bindings == null) {
            throw new IllegalArgumentException("bindings cannot be null");
        }
        this.bindings = bindings;
    }

    @Override
    public boolean isAvailable() {
        return bindings.isBound(MaxRuntime.class);
    }

    @Override
    public void runDeferred(Runnable task) {
        requireTask(task);
        MaxRuntime runtime = bindings.require(MaxRuntime.class);
        if (!runtime.hasQt()) {
            warnNoQt();
            guarded(task).run();
            return;
        }
        runtime.singleShot(0, guarded(task));
    }

    @Override
    public <T> T runSync(Callable<T> task) throws Exception {
        requireTask(task);
        if (isMainThread()) {
            return task.call();
        }
        MaxRuntime runtime = bindings.require(MaxRuntime.class);
        if (!runtime.hasQt()) {
            warnNoQt();
            return task.call();
        }

        MainThreadCall<T> call = new MainThreadCall<>();
        MaxRuntime.QtEventLoop eventLoop = runtime.createEventLoop();
        runtime.singleShot(0, () -> {
            try {
                call.run(task);
            } finally {
                eventLoop.quit();
            }
        });
        eventLoop.exec();
        return call.await();
    }

    @Override
    public boolean isMainThread() {
        Optional<MaxRuntime> runtime = bindings.find(MaxRuntime.class);
        if (runtime.isPresent() && runtime.get().hasQt()) {
            return runtime.get().isGuiThread();
        }
        return super.isMainThread();
    }

    /**
     * Qt가 있을 때만 GUI 스레드 친화성을 강제.
     *
     * <p>Qt가 없으면 두 경로 모두 호출자 스레드에서 직접 실행하므로 중첩 블로킹 호출이
     * 스스로를 기다릴 일이 없습니다.</p>
     *
     * @return Qt 런타임이 바인딩되어 있으면 true
     */
    @Override
    public boolean enforcesThreadAffinity() {
        return bindings.find(MaxRuntime.class).map(MaxRuntime::hasQt).orElse(false);
    }

    private static void warnNoQt() {
        log.warn("Qt not available in 3ds Max - executing function directly. This may cause thread safety issues.");
    }
}

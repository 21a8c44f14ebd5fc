package com.ryuqq.dispatcher.adapter.dcc.blender;

import com.ryuqq.dispatcher.adapter.dcc.HostBindings;
import com.ryuqq.dispatcher.core.spi.AbstractDispatcherBackend;

import java.util.concurrent.Callable;

/**
 * Blender 디스패처 백엔드.
 *
 * <p>one-shot 타이머(첫 호출 후 null 반환으로 해제)를 스케줄링 프리미티브로 사용하고,
 * 블로킹 호출은 타이머 + 결과 홀더 + 대기로 구성합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class BlenderBackend extends AbstractDispatcherBackend {

    private static final double IMMEDIATELY = 0.0;

    private final HostBindings bindings;

    public BlenderBackend() {
        this(HostBindings.global());
    }

    public BlenderBackend(HostBindings bindings) {
        if (bindings == null) {
            throw new IllegalArgumentException("bindings cannot be null");
        }
        this.bindings = bindings;
    }

    @Override
    public boolean isAvailable() {
        return bindings.isBound(BlenderTimers.class);
    }

    @Override
    public void runDeferred(Runnable task) {
        requireTask(task);
        registerOnce(guarded(task));
    }

    @Override
    public <T> T runSync(Callable<T> task) throws Exception {
        return awaitOnMainThread(task, this::registerOnce);
    }

    private void registerOnce(Runnable task) {
        bindings.require(BlenderTimers.class).register(() -> {
            task.run();
            return null; // unregister after first call
        }, IMMEDIATELY);
    }
}

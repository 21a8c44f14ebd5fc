package com.ryuqq.dispatcher.adapter.dcc.houdini;

import com.ryuqq.dispatcher.adapter.dcc.HostBindings;
import com.ryuqq.dispatcher.core.spi.AbstractDispatcherBackend;

import java.util.concurrent.Callable;

/**
 * Houdini 디스패처 백엔드.
 *
 * <p>{@code hdefereval}의 deferred 평가 큐와 블로킹 평가에 위임합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class HoudiniBackend extends AbstractDispatcherBackend {

    private final HostBindings bindings;

    public HoudiniBackend() {
        this(HostBindings.global());
    }

    public HoudiniBackend(HostBindings bindings) {
        if (bindings == null) {
            throw new IllegalArgumentException("bindings cannot be null");
        }
        this.bindings = bindings;
    }

    @Override
    public boolean isAvailable() {
        return bindings.isBound(HouDeferEval.class);
    }

    @Override
    public void runDeferred(Runnable task) {
        requireTask(task);
        bindings.require(HouDeferEval.class).executeDeferred(guarded(task));
    }

    @Override
    public <T> T runSync(Callable<T> task) throws Exception {
        requireTask(task);
        if (isMainThread()) {
            return task.call();
        }
        return bindings.require(HouDeferEval.class).executeInMainThreadWithResult(task);
    }
}

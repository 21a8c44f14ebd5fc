package com.ryuqq.dispatcher.adapter.dcc.nuke;

import com.ryuqq.dispatcher.adapter.dcc.HostBindings;
import com.ryuqq.dispatcher.core.spi.AbstractDispatcherBackend;

import java.util.concurrent.Callable;

/**
 * Nuke 디스패처 백엔드.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class NukeBackend extends AbstractDispatcherBackend {

    private final HostBindings bindings;

    public NukeBackend() {
        this(HostBindings.global());
    }

    public NukeBackend(HostBindings bindings) {
        if (bindings == null) {
            throw new IllegalArgumentException("bindings cannot be null");
        }
        this.bindings = bindings;
    }

    @Override
    public boolean isAvailable() {
        return bindings.isBound(NukeMainThread.class);
    }

    @Override
    public void runDeferred(Runnable task) {
        requireTask(task);
        bindings.require(NukeMainThread.class).executeInMainThread(guarded(task));
    }

    @Override
    public <T> T runSync(Callable<T> task) throws Exception {
        requireTask(task);
        if (isMainThread()) {
            return task.call();
        }
        return bindings.require(NukeMainThread.class).executeInMainThreadWithResult(task);
    }
}

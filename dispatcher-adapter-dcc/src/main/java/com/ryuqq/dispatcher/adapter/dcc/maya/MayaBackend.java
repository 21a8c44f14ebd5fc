package com.ryuqq.dispatcher.adapter.dcc.maya;

import com.ryuqq.dispatcher.adapter.dcc.HostBindings;
import com.ryuqq.dispatcher.core.spi.AbstractDispatcherBackend;

import java.util.concurrent.Callable;

/**
 * Maya 디스패처 백엔드.
 *
 * <p>Maya는 deferred 큐와 결과를 반환하는 블로킹 호출을 모두 네이티브로 제공하므로
 * 별도의 결과 홀더 없이 위임합니다.</p>
 *
 * <ul>
 *   <li>runDeferred → {@code executeDeferred}</li>
 *   <li>runSync → {@code executeInMainThreadWithResult} (메인 스레드면 인라인)</li>
 *   <li>isMainThread → 프로세스 메인 스레드 (기본 구현)</li>
 * </ul>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class MayaBackend extends AbstractDispatcherBackend {

    private final HostBindings bindings;

    public MayaBackend() {
        this(HostBindings.global());
    }

    /**
     * 생성자.
     *
     * @param bindings 호스트 바인딩 저장소
     * @throws IllegalArgumentException bindings가 null인 경우
     */
    public MayaBackend(HostBindings bindings) {
        if (bindings == null) {
            throw new IllegalArgumentException("bindings cannot be null");
        }
        this.bindings = bindings;
    }

    @Override
    public boolean isAvailable() {
        return bindings.isBound(MayaUtils.class);
    }

    @Override
    public void runDeferred(Runnable task) {
        requireTask(task);
        bindings.require(MayaUtils.class).executeDeferred(guarded(task));
    }

    @Override
    public <T> T runSync(Callable<T> task) throws Exception {
        requireTask(task);
        if (isMainThread()) {
            return task.call();
        }
        return bindings.require(MayaUtils.class).executeInMainThreadWithResult(task);
    }
}

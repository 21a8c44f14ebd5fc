package com.ryuqq.dispatcher.adapter.dcc.unreal;

import com.ryuqq.dispatcher.adapter.dcc.HostBindings;
import com.ryuqq.dispatcher.core.spi.AbstractDispatcherBackend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Unreal Engine 디스패처 백엔드.
 *
 * <p>Slate post-tick 콜백을 one-shot으로 등록(첫 호출에서 false 반환)하여 게임 스레드에서
 * 실행합니다. 블로킹 호출은 틱 콜백 + 결과 홀더 + 대기로 구성합니다.</p>
 *
 * <p>Slate 틱이 멈추면(PIE 일시정지, 모달 대화상자 등) 블로킹 호출이 돌아오지 않으므로,
 * 호출자는 제한 시간이 있는 디스패치를 사용하는 것이 안전합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class UnrealBackend extends AbstractDispatcherBackend {

    private static final Logger log = LoggerFactory.getLogger(UnrealBackend.class);

    private final HostBindings bindings;

    public UnrealBackend() {
        this(HostBindings.global());
    }

    public UnrealBackend(HostBindings bindings) {
        if (bindings == null) {
            throw new IllegalArgumentException("bindings cannot be null");
        }
        this.bindings = bindings;
    }

    @Override
    public boolean isAvailable() {
        return bindings.isBound(UnrealSlate.class);
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

    @Override
    public boolean isMainThread() {
        Optional<UnrealSlate> slate = bindings.find(UnrealSlate.class);
        if (slate.isPresent()) {
            try {
                return slate.get().isInGameThread();
            } catch (UnsupportedOperationException e) {
                log.debug("Game thread query unavailable, using process main thread: {}", e.getMessage());
            }
        }
        return super.isMainThread();
    }

    private void registerOnce(Runnable task) {
        bindings.require(UnrealSlate.class).registerSlatePostTickCallback(deltaSeconds -> {
            task.run();
            return false;
        });
    }
}

package com.ryuqq.dispatcher.adapter.toolkit.fallback;

import com.ryuqq.dispatcher.core.spi.AbstractDispatcherBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

/**
 * 최후 수단 백엔드.
 *
 * <p>호스트도 GUI 툴킷도 없는 환경(독립 실행, 테스트)에서 사용됩니다. 작업을 호출자 스레드에서
 * 바로 실행하며, 메인 스레드가 아닌 곳에서 호출되면 WARN 로그를 남깁니다.</p>
 *
 * <p><strong>주의:</strong></p>
 * <ul>
 *   <li>{@link #runDeferred(Runnable)}도 동기적으로 실행됩니다 (반환 전에 작업 완료)</li>
 *   <li>스레드 친화성을 강제하지 않으므로 교착 탐지 대상이 아닙니다</li>
 *   <li>항상 사용 가능합니다</li>
 * </ul>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class FallbackBackend extends AbstractDispatcherBackend {

    private static final Logger log = LoggerFactory.getLogger(FallbackBackend.class);

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public void runDeferred(Runnable task) {
        requireTask(task);
        warnIfOffMainThread("runDeferred");
        guarded(task).run();
    }

    @Override
    public <T> T runSync(Callable<T> task) throws Exception {
        requireTask(task);
        warnIfOffMainThread("runSync");
        return task.call();
    }

    @Override
    public boolean enforcesThreadAffinity() {
        return false;
    }

    private void warnIfOffMainThread(String operation) {
        if (!isMainThread()) {
            log.warn("Fallback {} called from non-main thread '{}'; executing directly. "
                + "This may cause issues if the task touches thread-affine state.",
                operation, Thread.currentThread().getName());
        }
    }
}

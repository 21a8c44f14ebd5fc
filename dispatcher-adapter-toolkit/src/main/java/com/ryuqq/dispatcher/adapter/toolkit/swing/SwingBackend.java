package com.ryuqq.dispatcher.adapter.toolkit.swing;

import com.ryuqq.dispatcher.core.spi.AbstractDispatcherBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.SwingUtilities;
import javax.swing.Timer;
import java.awt.GraphicsEnvironment;
import java.util.concurrent.Callable;

/**
 * 범용 GUI 툴킷(Swing/AWT) 디스패처 백엔드.
 *
 * <p>메인 스레드는 AWT 이벤트 디스패치 스레드(EDT)입니다. 0ms 단발 {@link Timer}를
 * 스케줄링 프리미티브로 사용하고, 블로킹 호출은 타이머 + 결과 홀더 + 대기로 구성합니다.</p>
 *
 * <p><strong>가용성:</strong> 헤드리스 환경이 아닐 때만 사용 가능합니다. 헤드리스 JVM에서는
 * EDT가 화면을 가질 수 없으므로 레지스트리가 다음 후보로 넘어갑니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class SwingBackend extends AbstractDispatcherBackend {

    private static final Logger log = LoggerFactory.getLogger(SwingBackend.class);
    private static final int IMMEDIATELY = 0;

    @Override
    public boolean isAvailable() {
        try {
            return !GraphicsEnvironment.isHeadless();
        } catch (RuntimeException | LinkageError e) {
            log.debug("AWT probe failed: {}", e.toString());
            return false;
        }
    }

    @Override
    public void runDeferred(Runnable task) {
        requireTask(task);
        singleShot(guarded(task));
    }

    @Override
    public <T> T runSync(Callable<T> task) throws Exception {
        return awaitOnMainThread(task, this::singleShot);
    }

    @Override
    public boolean isMainThread() {
        return SwingUtilities.isEventDispatchThread();
    }

    /**
     * Timer 생성/시작은 어느 스레드에서나 가능하며, 액션은 EDT에서 실행됩니다.
     */
    private void singleShot(Runnable task) {
        Timer timer = new Timer(IMMEDIATELY, event -> task.run());
        timer.setRepeats(false);
        timer.start();
    }
}

package com.ryuqq.dispatcher.adapter.dcc.max;

import com.ryuqq.dispatcher.adapter.dcc.HostBinding;

/**
 * 3ds Max 런타임 바인딩 포트.
 *
 * <p>3ds Max 2020 이후 MaxPlus는 폐기되었고, 메인 스레드는 Qt 이벤트 루프를 실행합니다.
 * 따라서 스케줄링은 Qt의 {@code QTimer.singleShot}과 {@code QEventLoop}로 이루어집니다.</p>
 *
 * <p>{@link #isAlive()}는 {@code pymxs} 런타임 존재 여부에 대응합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public interface MaxRuntime extends HostBinding {

    /**
     * Qt 바인딩 사용 가능 여부.
     *
     * @return {@code QtCore}를 사용할 수 있으면 true
     */
    boolean hasQt();

    /**
     * {@code QTimer.singleShot(msec, callback)}: GUI 스레드 이벤트 루프에서 한 번 실행.
     *
     * @param msec 지연 (밀리초)
     * @param task 실행할 작업
     */
    void singleShot(int msec, Runnable task);

    /**
     * 호출 스레드에 로컬 {@code QEventLoop} 생성.
     *
     * @return 새 이벤트 루프
     */
    QtEventLoop createEventLoop();

    /**
     * {@code QThread.currentThread() == QCoreApplication.instance().thread()}.
     *
     * @return 현재 스레드가 Qt GUI 스레드이면 true
     */
    boolean isGuiThread();

    /**
     * 로컬 Qt 이벤트 루프.
     *
     * <p>{@link #exec()} 이전에 {@link #quit()}이 호출되었다면 {@code exec()}는 즉시 반환해야
     * 합니다. GUI 스레드의 single-shot이 대기 스레드보다 먼저 실행될 수 있습니다.</p>
     */
    interface QtEventLoop {

        /**
         * {@code quit()}이 호출될 때까지 이벤트를 처리하며 블로킹.
         */
        void exec();

        /**
         * {@code exec()} 해제 (임의 스레드에서 호출 가능).
         */
        void quit();
    }
}

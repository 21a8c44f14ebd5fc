package com.ryuqq.dispatcher.adapter.dcc.houdini;

import com.ryuqq.dispatcher.adapter.dcc.HostBinding;

import java.util.concurrent.Callable;

/**
 * Houdini {@code hdefereval} 바인딩 포트.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public interface HouDeferEval extends HostBinding {

    /**
     * {@code hdefereval.executeDeferred}: UI 이벤트 루프가 idle일 때 실행.
     *
     * @param task 실행할 작업
     */
    void executeDeferred(Runnable task);

    /**
     * {@code hdefereval.executeInMainThreadWithResult}: 메인 스레드에서 평가하고 결과 대기.
     *
     * @param task 실행할 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws Exception 작업이 던진 예외
     */
    <T> T executeInMainThreadWithResult(Callable<T> task) throws Exception;
}

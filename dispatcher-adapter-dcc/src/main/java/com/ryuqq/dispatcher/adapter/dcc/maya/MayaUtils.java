package com.ryuqq.dispatcher.adapter.dcc.maya;

import com.ryuqq.dispatcher.adapter.dcc.HostBinding;

import java.util.concurrent.Callable;

/**
 * Maya {@code maya.utils} 바인딩 포트.
 *
 * <p>Maya의 idle 큐와 블로킹 실행 API를 그대로 노출합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public interface MayaUtils extends HostBinding {

    /**
     * {@code maya.utils.executeDeferred}: 다음 idle 시점에 메인 스레드에서 실행.
     *
     * @param task 실행할 작업
     */
    void executeDeferred(Runnable task);

    /**
     * {@code maya.utils.executeInMainThreadWithResult}: 메인 스레드에서 실행하고 결과 대기.
     *
     * @param task 실행할 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws Exception 작업이 던진 예외
     */
    <T> T executeInMainThreadWithResult(Callable<T> task) throws Exception;
}

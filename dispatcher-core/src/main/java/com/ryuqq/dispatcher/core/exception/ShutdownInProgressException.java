package com.ryuqq.dispatcher.core.exception;

/**
 * 호스트 종료 신호 이후 디스패치를 요청한 경우.
 *
 * <p>종료 중인 메인 스레드는 더 이상 deferred 작업을 처리하지 않으므로 대기하지 않고
 * 즉시 실패합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class ShutdownInProgressException extends ThreadSafetyException {

    public ShutdownInProgressException(String message) {
        super(message);
    }
}

package com.ryuqq.dispatcher.core.exception;

import java.time.Duration;

/**
 * 제한 시간 내에 메인 스레드 실행이 완료되지 않은 경우.
 *
 * <p>메인 스레드가 다른 작업으로 막혀 있거나 호스트 이벤트 루프가 멈춘 상태일 수 있습니다.
 * 타임아웃은 호출자의 대기만 해제하며, 이미 예약된 작업은 나중에 실행될 수 있습니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class ThreadDispatchTimeoutException extends ThreadSafetyException {

    private final Duration timeout;

    public ThreadDispatchTimeoutException(String message, Duration timeout) {
        super(message);
        this.timeout = timeout;
    }

    /**
     * 초과된 제한 시간.
     *
     * @return 제한 시간
     */
    public Duration getTimeout() {
        return timeout;
    }
}

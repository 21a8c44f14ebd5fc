package com.ryuqq.dispatcher.core.exception;

/**
 * 메인 스레드 디스패치 실패의 기반 예외.
 *
 * <p>디스패치 파사드만 이 계층의 예외를 던집니다. 개별 백엔드는 호스트 계층의 예외를
 * 그대로 전파하며, 사용자 작업이 던진 예외는 이 계층으로 래핑되지 않습니다.</p>
 *
 * <p><strong>하위 타입:</strong></p>
 * <ul>
 *   <li>{@link ThreadDispatchTimeoutException}: 제한 시간 초과</li>
 *   <li>{@link DeadlockDetectedException}: 자기 자신을 기다리는 재진입 호출</li>
 *   <li>{@link ShutdownInProgressException}: 호스트 종료 신호 이후의 디스패치</li>
 * </ul>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class ThreadSafetyException extends RuntimeException {

    public ThreadSafetyException(String message) {
        super(message);
    }

    public ThreadSafetyException(String message, Throwable cause) {
        super(message, cause);
    }
}

/**
 * 디스패치 파사드 예외 계층.
 *
 * <pre>
 * ThreadSafetyException (RuntimeException)
 *   ├─ ThreadDispatchTimeoutException  제한 시간 초과
 *   ├─ DeadlockDetectedException       자기 자신을 기다리는 재진입
 *   └─ ShutdownInProgressException     종료 신호 이후 디스패치
 * </pre>
 *
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.core.exception;

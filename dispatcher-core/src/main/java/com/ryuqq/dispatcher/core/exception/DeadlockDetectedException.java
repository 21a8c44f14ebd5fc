package com.ryuqq.dispatcher.core.exception;

/**
 * 블로킹 디스패치가 자기 자신을 기다리게 되는 경우.
 *
 * <p>현재 스레드가 이미 이전 블로킹 디스패치의 콜백을 실행 중인데, 백엔드가 이 스레드를
 * 메인 스레드로 인식하지 않아 다시 마샬링하려는 상황에서 발생합니다. 무한 대기 대신
 * 즉시 실패합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class DeadlockDetectedException extends ThreadSafetyException {

    private final int depth;

    public DeadlockDetectedException(String message, int depth) {
        super(message);
        this.depth = depth;
    }

    /**
     * 감지 시점의 재진입 깊이.
     *
     * @return 현재 스레드에서 실행 중인 마샬링된 콜백 수
     */
    public int getDepth() {
        return depth;
    }
}

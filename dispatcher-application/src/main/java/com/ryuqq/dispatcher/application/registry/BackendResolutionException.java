package com.ryuqq.dispatcher.application.registry;

/**
 * 사용 가능한 백엔드가 하나도 없는 경우 (Fallback 포함).
 *
 * <p>런타임 상황이 아니라 빌드/등록 구성의 결함입니다. 복구를 시도하지 말고 등록 구성을
 * 수정해야 합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class BackendResolutionException extends IllegalStateException {

    public BackendResolutionException(String message) {
        super(message);
    }
}

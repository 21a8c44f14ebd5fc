package com.ryuqq.dispatcher.adapter.dcc;

/**
 * 호스트 SDK 바인딩 마커 인터페이스.
 *
 * <p>각 호스트 어댑터는 호스트의 네이티브 스케줄링 API를 이 인터페이스의 하위 타입(포트)으로
 * 정의하고, 호스트 통합 코드가 그 구현을 {@link HostBindings}에 설치합니다.</p>
 *
 * <p><strong>핸드셰이크:</strong> {@link #isAlive()}는 호스트가 실제로 응답 가능한지 확인합니다.
 * 블로킹하지 않아야 하며, 예외를 던지면 백엔드는 사용 불가로 판단합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public interface HostBinding {

    /**
     * 호스트 핸드셰이크.
     *
     * @return 호스트 SDK가 로드되어 호출 가능한 경우 true
     */
    default boolean isAlive() {
        return true;
    }
}

package com.ryuqq.dispatcher.application.registry;

import com.ryuqq.dispatcher.core.spi.DispatcherBackend;

/**
 * 동적 백엔드 확장 지점.
 *
 * <p>빌트인 목록에 없는 호스트를 위한 서드파티 백엔드는 이 인터페이스를 구현하고
 * {@link BackendSpec#of(BackendProvider)}로 레지스트리에 등록합니다.</p>
 *
 * <pre>{@code
 * registry.register(BackendSpec.of(new BackendProvider() {
 *     public String name() { return "Katana"; }
 *     public DispatcherBackend create() { return new KatanaBackend(session); }
 * }), 175);
 * }</pre>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public interface BackendProvider {

    /**
     * 표시 이름 (환경 변수/프로퍼티 강제 지정 시 대소문자 무시 비교 대상).
     *
     * @return 표시 이름
     */
    String name();

    /**
     * 백엔드 인스턴스 생성.
     *
     * <p>해석이 시도될 때만 호출됩니다. 여기서 던진 예외는 레지스트리가 WARN 로그로 남기고
     * 다음 후보로 넘어갑니다.</p>
     *
     * @return 새 백엔드 인스턴스
     * @throws Exception 생성 실패 시
     */
    DispatcherBackend create() throws Exception;
}

package com.ryuqq.dispatcher.adapter.dcc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 호스트 SDK 바인딩 저장소.
 *
 * <p>호스트 어댑터의 가용성 탐지(feature probe)는 이 저장소를 통해 이루어집니다:</p>
 * <ol>
 *   <li>호스트 통합 코드가 {@link #install(Class, HostBinding)}로 등록한 바인딩</li>
 *   <li>등록된 바인딩이 없으면 {@link ServiceLoader}로 클래스패스에서 탐색</li>
 * </ol>
 *
 * <p>탐지는 매번 새로 수행됩니다. 호스트 SDK가 자체 시작 절차를 마친 뒤에야 바인딩을
 * 설치하는 경우에도 다음 해석에서 감지됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * // Maya 플러그인 초기화 시
 * HostBindings.global().install(MayaUtils.class, new JepMayaUtils(interpreter));
 * }</pre>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class HostBindings {

    private static final Logger log = LoggerFactory.getLogger(HostBindings.class);
    private static final HostBindings GLOBAL = new HostBindings();

    private final Map<Class<? extends HostBinding>, HostBinding> installed = new ConcurrentHashMap<>();
    private final boolean serviceLookup;

    /**
     * ServiceLoader 탐색을 포함한 저장소 생성.
     */
    public HostBindings() {
        this(true);
    }

    /**
     * 저장소 생성.
     *
     * @param serviceLookup 등록된 바인딩이 없을 때 ServiceLoader 탐색 여부
     */
    public HostBindings(boolean serviceLookup) {
        this.serviceLookup = serviceLookup;
    }

    /**
     * 프로세스 전역 저장소.
     *
     * @return 전역 인스턴스
     */
    public static HostBindings global() {
        return GLOBAL;
    }

    /**
     * 호스트 바인딩 설치.
     *
     * @param port 포트 인터페이스
     * @param binding 호스트 구현
     * @param <T> 포트 타입
     * @throws IllegalArgumentException port 또는 binding이 null인 경우
     */
    public <T extends HostBinding> void install(Class<T> port, T binding) {
        if (port == null) {
            throw new IllegalArgumentException("port cannot be null");
        }
        if (binding == null) {
            throw new IllegalArgumentException("binding cannot be null");
        }
        installed.put(port, binding);
        log.debug("Installed host binding for {}: {}", port.getSimpleName(), binding);
    }

    /**
     * 호스트 바인딩 제거.
     *
     * @param port 포트 인터페이스
     * @return 제거된 바인딩이 있으면 true
     */
    public boolean uninstall(Class<? extends HostBinding> port) {
        return installed.remove(port) != null;
    }

    /**
     * 호스트 바인딩 조회.
     *
     * @param port 포트 인터페이스
     * @param <T> 포트 타입
     * @return 바인딩 (없으면 empty)
     */
    public <T extends HostBinding> Optional<T> find(Class<T> port) {
        HostBinding binding = installed.get(port);
        if (binding != null) {
            return Optional.of(port.cast(binding));
        }
        if (!serviceLookup) {
            return Optional.empty();
        }
        try {
            return ServiceLoader.load(port).findFirst();
        } catch (ServiceConfigurationError e) {
            log.debug("Service lookup failed for {}: {}", port.getSimpleName(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * 호스트 바인딩 필수 조회.
     *
     * @param port 포트 인터페이스
     * @param <T> 포트 타입
     * @return 바인딩
     * @throws IllegalStateException 바인딩이 없는 경우
     */
    public <T extends HostBinding> T require(Class<T> port) {
        return find(port).orElseThrow(() ->
            new IllegalStateException("No host binding installed for " + port.getSimpleName()));
    }

    /**
     * 가용성 탐지 (feature probe).
     *
     * <p>예외를 던지지 않습니다. 바인딩이 없거나 핸드셰이크가 실패하면 false입니다.</p>
     *
     * @param port 포트 인터페이스
     * @return 바인딩이 있고 호스트가 응답하는 경우 true
     */
    public boolean isBound(Class<? extends HostBinding> port) {
        try {
            return find(port).map(HostBinding::isAlive).orElse(false);
        } catch (RuntimeException | LinkageError e) {
            log.debug("Host probe failed for {}: {}", port.getSimpleName(), e.toString());
            return false;
        }
    }
}

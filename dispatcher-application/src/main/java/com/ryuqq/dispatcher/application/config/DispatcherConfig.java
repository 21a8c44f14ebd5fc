package com.ryuqq.dispatcher.application.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * 디스패처 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>defaultTimeout: 제한 시간을 지정하지 않은 타임아웃 변형 호출의 대기 시간 (기본 30초)</li>
 *   <li>backendProperty: 백엔드 강제 지정 JVM 시스템 프로퍼티 이름
 *       (기본 {@value #DEFAULT_BACKEND_PROPERTY})</li>
 *   <li>backendEnvVar: 백엔드 강제 지정 환경 변수 이름 (기본 {@value #DEFAULT_BACKEND_ENV_VAR})</li>
 * </ul>
 *
 * <p>시스템 프로퍼티와 환경 변수가 모두 설정되어 있으면 시스템 프로퍼티가 우선합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 * @param defaultTimeout 기본 제한 시간 (양수여야 함)
 * @param backendProperty 백엔드 지정 시스템 프로퍼티 이름 (비어 있으면 안 됨)
 * @param backendEnvVar 백엔드 지정 환경 변수 이름 (비어 있으면 안 됨)
 */
public record DispatcherConfig(
    Duration defaultTimeout,
    String backendProperty,
    String backendEnvVar
) {

    public static final String DEFAULT_BACKEND_PROPERTY = "mainthread.dispatcher";
    public static final String DEFAULT_BACKEND_ENV_VAR = "MAIN_THREAD_DISPATCHER";
    public static final String TIMEOUT_PROPERTY = "mainthread.dispatcher.timeout-ms";

    private static final Logger log = LoggerFactory.getLogger(DispatcherConfig.class);
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: defaultTimeout=30s, backendProperty={@value #DEFAULT_BACKEND_PROPERTY},
     * backendEnvVar={@value #DEFAULT_BACKEND_ENV_VAR}</p>
     */
    public DispatcherConfig() {
        this(DEFAULT_TIMEOUT, DEFAULT_BACKEND_PROPERTY, DEFAULT_BACKEND_ENV_VAR);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public DispatcherConfig {
        if (defaultTimeout == null || defaultTimeout.isZero() || defaultTimeout.isNegative()) {
            throw new IllegalArgumentException(
                "defaultTimeout must be positive (current: " + defaultTimeout + ")"
            );
        }
        if (backendProperty == null || backendProperty.isBlank()) {
            throw new IllegalArgumentException("backendProperty cannot be null or blank");
        }
        if (backendEnvVar == null || backendEnvVar.isBlank()) {
            throw new IllegalArgumentException("backendEnvVar cannot be null or blank");
        }
    }

    /**
     * 시스템 프로퍼티 기반 설정.
     *
     * <p>{@value #TIMEOUT_PROPERTY}가 양의 정수이면 기본 제한 시간으로 사용합니다.
     * 형식이 잘못된 값은 WARN 로그를 남기고 기본값을 유지합니다.</p>
     *
     * @return 설정
     */
    public static DispatcherConfig fromSystem() {
        DispatcherConfig config = new DispatcherConfig();
        String timeoutMs = System.getProperty(TIMEOUT_PROPERTY);
        if (timeoutMs == null || timeoutMs.isBlank()) {
            return config;
        }
        try {
            long millis = Long.parseLong(timeoutMs.trim());
            return config.withDefaultTimeout(Duration.ofMillis(millis));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring invalid {}='{}': {}", TIMEOUT_PROPERTY, timeoutMs, e.getMessage());
            return config;
        }
    }

    /**
     * defaultTimeout만 변경한 새 인스턴스 생성.
     */
    public DispatcherConfig withDefaultTimeout(Duration defaultTimeout) {
        return new DispatcherConfig(defaultTimeout, backendProperty, backendEnvVar);
    }

    /**
     * backendProperty만 변경한 새 인스턴스 생성.
     */
    public DispatcherConfig withBackendProperty(String backendProperty) {
        return new DispatcherConfig(defaultTimeout, backendProperty, backendEnvVar);
    }

    /**
     * backendEnvVar만 변경한 새 인스턴스 생성.
     */
    public DispatcherConfig withBackendEnvVar(String backendEnvVar) {
        return new DispatcherConfig(defaultTimeout, backendProperty, backendEnvVar);
    }
}

package com.ryuqq.dispatcher.application.registry;

/**
 * 등록된 백엔드의 조회 시점 상태.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 * @param priority 우선순위
 * @param name 표시 이름
 * @param available 조회 시점의 가용성 탐지 결과
 */
public record BackendStatus(int priority, String name, boolean available) {

    public BackendStatus {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
    }
}

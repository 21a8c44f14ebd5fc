package com.ryuqq.dispatcher.adapter.dcc.blender;

import com.ryuqq.dispatcher.adapter.dcc.HostBinding;

/**
 * Blender {@code bpy.app.timers} 바인딩 포트.
 *
 * <p>Blender는 메인 스레드 블로킹 실행 API가 없으므로 타이머만 노출합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public interface BlenderTimers extends HostBinding {

    /**
     * 타이머 함수.
     *
     * <p>반환값이 null이면 타이머가 해제되고, 값이 있으면 그 초 뒤에 다시 호출됩니다.</p>
     */
    @FunctionalInterface
    interface TimerFunction {
        Double call();
    }

    /**
     * {@code bpy.app.timers.register(function, first_interval=...)}.
     *
     * @param function 타이머 함수
     * @param firstInterval 첫 호출까지의 지연 (초)
     */
    void register(TimerFunction function, double firstInterval);
}

package com.ryuqq.dispatcher.adapter.dcc.unreal;

import com.ryuqq.dispatcher.adapter.dcc.HostBinding;

/**
 * Unreal Engine Slate 틱 바인딩 포트.
 *
 * <p>UE5에서는 많은 에디터 API가 게임 스레드에서만 호출 가능하며, 외부 스크립트는
 * Slate post-tick 콜백 등록을 통해서만 게임 스레드에 진입할 수 있습니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public interface UnrealSlate extends HostBinding {

    /**
     * Slate post-tick 콜백.
     */
    @FunctionalInterface
    interface TickCallback {

        /**
         * 게임 스레드에서 매 Slate 틱 이후 호출.
         *
         * @param deltaSeconds 이전 틱 이후 경과 시간
         * @return 계속 호출받으려면 true, 해제하려면 false
         */
        boolean onTick(float deltaSeconds);
    }

    void registerSlatePostTickCallback(TickCallback callback);

    /**
     * {@code unreal.is_in_game_thread()}.
     *
     * <p>엔진 버전에 따라 노출되지 않을 수 있습니다.</p>
     *
     * @return 현재 스레드가 게임 스레드이면 true
     * @throws UnsupportedOperationException 엔진이 게임 스레드 조회를 노출하지 않는 경우
     */
    default boolean isInGameThread() {
        throw new UnsupportedOperationException("Game thread query is not exposed by this engine version");
    }
}

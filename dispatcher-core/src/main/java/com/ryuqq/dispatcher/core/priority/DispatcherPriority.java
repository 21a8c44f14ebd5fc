package com.ryuqq.dispatcher.core.priority;

/**
 * 디스패처 백엔드 우선순위 상수.
 *
 * <p>높은 우선순위의 백엔드가 먼저 시도됩니다. 호스트 전용 백엔드는 범용 GUI 툴킷보다,
 * 범용 툴킷은 Fallback보다 높습니다.</p>
 *
 * <pre>
 * MAYA 200 ─ HOUDINI 190 ─ NUKE 180 ─ BLENDER 170 ─ MAX 160 ─ UNREAL 150   (호스트 전용)
 *                                                              HOST_THRESHOLD 150
 * TOOLKIT 100                                                             (범용 GUI 툴킷)
 * FALLBACK 0                                                              (최후 수단)
 * </pre>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class DispatcherPriority {

    public static final int MAYA = 200;
    public static final int HOUDINI = 190;
    public static final int NUKE = 180;
    public static final int BLENDER = 170;
    public static final int MAX = 160;
    public static final int UNREAL = 150;

    /**
     * 이 값 이상의 우선순위는 호스트 전용 백엔드로 간주.
     */
    public static final int HOST_THRESHOLD = 150;

    public static final int TOOLKIT = 100;
    public static final int FALLBACK = 0;

    private DispatcherPriority() {
    }

    /**
     * 호스트 전용 티어 여부.
     *
     * @param priority 우선순위
     * @return {@link #HOST_THRESHOLD} 이상이면 true
     */
    public static boolean isHostTier(int priority) {
        return priority >= HOST_THRESHOLD;
    }
}

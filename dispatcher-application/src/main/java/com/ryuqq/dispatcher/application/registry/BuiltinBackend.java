package com.ryuqq.dispatcher.application.registry;

import com.ryuqq.dispatcher.adapter.dcc.blender.BlenderBackend;
import com.ryuqq.dispatcher.adapter.dcc.houdini.HoudiniBackend;
import com.ryuqq.dispatcher.adapter.dcc.max.MaxBackend;
import com.ryuqq.dispatcher.adapter.dcc.maya.MayaBackend;
import com.ryuqq.dispatcher.adapter.dcc.nuke.NukeBackend;
import com.ryuqq.dispatcher.adapter.dcc.unreal.UnrealBackend;
import com.ryuqq.dispatcher.adapter.toolkit.fallback.FallbackBackend;
import com.ryuqq.dispatcher.adapter.toolkit.swing.SwingBackend;
import com.ryuqq.dispatcher.core.priority.DispatcherPriority;
import com.ryuqq.dispatcher.core.spi.DispatcherBackend;

import java.util.function.Supplier;

/**
 * 빌트인 백엔드 목록.
 *
 * <p>레지스트리가 처음 해석/조회될 때 선언 순서대로 기본 우선순위와 함께 등록됩니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public enum BuiltinBackend {

    MAYA("Maya", DispatcherPriority.MAYA, MayaBackend::new),
    HOUDINI("Houdini", DispatcherPriority.HOUDINI, HoudiniBackend::new),
    NUKE("Nuke", DispatcherPriority.NUKE, NukeBackend::new),
    BLENDER("Blender", DispatcherPriority.BLENDER, BlenderBackend::new),
    MAX("Max", DispatcherPriority.MAX, MaxBackend::new),
    UNREAL("Unreal", DispatcherPriority.UNREAL, UnrealBackend::new),
    SWING("Swing", DispatcherPriority.TOOLKIT, SwingBackend::new),
    FALLBACK("Fallback", DispatcherPriority.FALLBACK, FallbackBackend::new);

    private final String displayName;
    private final int defaultPriority;
    private final Supplier<DispatcherBackend> factory;

    BuiltinBackend(String displayName, int defaultPriority, Supplier<DispatcherBackend> factory) {
        this.displayName = displayName;
        this.defaultPriority = defaultPriority;
        this.factory = factory;
    }

    public String displayName() {
        return displayName;
    }

    public int defaultPriority() {
        return defaultPriority;
    }

    /**
     * 새 백엔드 인스턴스 생성.
     *
     * @return 백엔드
     */
    public DispatcherBackend create() {
        return factory.get();
    }
}

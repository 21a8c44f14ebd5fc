/**
 * 디스패처 백엔드 레지스트리.
 *
 * <p>빌트인/동적 백엔드를 우선순위와 함께 등록하고, 강제 지정과 가용성 탐지를 거쳐
 * 현재 프로세스의 백엔드를 해석합니다.</p>
 *
 * <pre>
 * Maya(200) → Houdini(190) → Nuke(180) → Blender(170) → Max(160) → Unreal(150)
 *   → Swing(100) → Fallback(0)
 * </pre>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.application.registry;

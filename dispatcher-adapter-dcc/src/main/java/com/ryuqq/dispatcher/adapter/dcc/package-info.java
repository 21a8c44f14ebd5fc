/**
 * DCC 호스트 어댑터.
 *
 * <p>이 패키지와 하위 패키지는 {@link com.ryuqq.dispatcher.core.spi.DispatcherBackend} SPI의
 * 호스트별 구현을 제공합니다. 각 하위 패키지는 호스트 SDK를 표현하는 포트 인터페이스와
 * 그 포트에 위임하는 백엔드로 구성됩니다.</p>
 *
 * <h2>호스트 카탈로그</h2>
 * <table border="1">
 *   <caption>Host primitives</caption>
 *   <tr><th>호스트</th><th>포트</th><th>deferred</th><th>sync</th><th>네이티브 블로킹</th></tr>
 *   <tr><td>Maya</td><td>MayaUtils</td><td>executeDeferred</td><td>executeInMainThreadWithResult</td><td>O</td></tr>
 *   <tr><td>Houdini</td><td>HouDeferEval</td><td>executeDeferred</td><td>executeInMainThreadWithResult</td><td>O</td></tr>
 *   <tr><td>Nuke</td><td>NukeMainThread</td><td>executeInMainThread</td><td>executeInMainThreadWithResult</td><td>O</td></tr>
 *   <tr><td>Blender</td><td>BlenderTimers</td><td>one-shot timer</td><td>timer + 결과 홀더</td><td>X</td></tr>
 *   <tr><td>3ds Max</td><td>MaxRuntime</td><td>QTimer.singleShot</td><td>singleShot + QEventLoop</td><td>X</td></tr>
 *   <tr><td>Unreal</td><td>UnrealSlate</td><td>post-tick callback</td><td>tick + 결과 홀더</td><td>X</td></tr>
 * </table>
 *
 * <h2>호스트 통합</h2>
 * <p>호스트 통합 코드(플러그인 초기화 등)는 포트 구현을
 * {@link com.ryuqq.dispatcher.adapter.dcc.HostBindings#install(Class, HostBinding)}로 설치합니다.
 * 설치되지 않은 포트는 {@link java.util.ServiceLoader}로 탐색합니다.</p>
 *
 * @since 1.0.0
 * @author Dispatcher Team
 */
package com.ryuqq.dispatcher.adapter.dcc;

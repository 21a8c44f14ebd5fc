/**
 * 메인 스레드 디스패치 Facade.
 *
 * <p>{@link com.ryuqq.dispatcher.application.dispatch.MainThreadDispatcher}가 공개 호출 표면이며,
 * 데코레이터와 객체 래퍼({@link com.ryuqq.dispatcher.application.dispatch.Deferred},
 * {@link com.ryuqq.dispatcher.application.dispatch.AnyThread})로 호출 지점의 반복 코드를 없앱니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.application.dispatch;

package com.ryuqq.dispatcher.application.dispatch;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * {@link MainThreadDispatcher#wrap(Class, Object)} 프록시에서 메인 스레드로 예약만 하고
 * 즉시 반환하는 메서드 (fire-and-forget).
 *
 * <p>반환 타입은 {@code void}여야 합니다.</p>
 *
 * <pre>
 * public interface SceneApi {
 *     {@literal @}Deferred
 *     void refreshViewport();
 * }
 * </pre>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface Deferred {
}

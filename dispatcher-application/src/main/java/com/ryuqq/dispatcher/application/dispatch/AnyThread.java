package com.ryuqq.dispatcher.application.dispatch;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * {@link MainThreadDispatcher#wrap(Class, Object)} 프록시에서 마샬링하지 않고 호출자 스레드에서
 * 바로 실행하는 메서드.
 *
 * <p>스레드 친화성이 없는 조회(캐시된 값, 불변 상태)에 사용합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface AnyThread {
}

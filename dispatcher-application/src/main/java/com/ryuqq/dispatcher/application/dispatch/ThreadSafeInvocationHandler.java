package com.ryuqq.dispatcher.application.dispatch;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.UndeclaredThrowableException;

/**
 * 객체 래퍼의 메서드 호출 마샬링.
 *
 * <ul>
 *   <li>{@link Object} 메서드: 마샬링 없이 대상에 위임</li>
 *   <li>{@link AnyThread}: 호출자 스레드에서 실행</li>
 *   <li>{@link Deferred}: 메인 스레드로 예약 후 즉시 반환</li>
 *   <li>그 외: 메인 스레드에서 동기 실행</li>
 * </ul>
 *
 * <p>대상이 던진 예외는 {@link InvocationTargetException}에서 꺼내어 그대로 전파합니다.
 * 인터페이스에 선언되지 않은 checked 예외만 {@link UndeclaredThrowableException}으로 감쌉니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
final class ThreadSafeInvocationHandler implements InvocationHandler {

    private final MainThreadDispatcher dispatcher;
    private final Object target;

    ThreadSafeInvocationHandler(MainThreadDispatcher dispatcher, Object target) {
        this.dispatcher = dispatcher;
        this.target = target;
    }

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
        if (method.getDeclaringClass() == Object.class) {
            return invokeObjectMethod(proxy, method, args);
        }
        if (method.isAnnotationPresent(AnyThread.class)) {
            return invokeTarget(method, args);
        }
        if (method.isAnnotationPresent(Deferred.class)) {
            dispatcher.runOnMainThread(() -> {
                try {
                    invokeTarget(method, args);
                } catch (RuntimeException | Error e) {
                    throw e;
                } catch (Throwable t) {
                    throw new UndeclaredThrowableException(t);
                }
            });
            return null;
        }

        try {
            return dispatcher.runOnMainThreadSync(() -> {
                try {
                    return invokeTarget(method, args);
                } catch (Exception | Error e) {
                    throw e;
                } catch (Throwable t) {
                    throw new UndeclaredThrowableException(t);
                }
            });
        } catch (RuntimeException | Error e) {
            throw e;
        } catch (Exception e) {
            if (isDeclared(method, e)) {
                throw e;
            }
            throw new UndeclaredThrowableException(e);
        }
    }

    private Object invokeObjectMethod(Object proxy, Method method, Object[] args) throws Throwable {
        switch (method.getName()) {
            case "equals":
                return proxy == args[0];
            case "hashCode":
                return System.identityHashCode(proxy);
            case "toString":
                return "MainThreadProxy{" + target + '}';
            default:
                return invokeTarget(method, args);
        }
    }

    private Object invokeTarget(Method method, Object[] args) throws Throwable {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw e.getCause();
        }
    }

    private static boolean isDeclared(Method method, Exception e) {
        for (Class<?> declared : method.getExceptionTypes()) {
            if (declared.isInstance(e)) {
                return true;
            }
        }
        return false;
    }
}

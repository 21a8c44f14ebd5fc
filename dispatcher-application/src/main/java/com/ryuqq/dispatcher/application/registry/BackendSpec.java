package com.ryuqq.dispatcher.application.registry;

import com.ryuqq.dispatcher.core.spi.AbstractDispatcherBackend;
import com.ryuqq.dispatcher.core.spi.DispatcherBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.util.Optional;

/**
 * 백엔드 구현에 대한 참조.
 *
 * <p>해석이 시도되기 전까지는 인스턴스를 만들지 않습니다. 네 가지 형태가 있습니다:</p>
 * <ul>
 *   <li>{@link Builtin}: 빌트인 백엔드 ({@link BuiltinBackend})</li>
 *   <li>{@link Provided}: 서드파티 확장 ({@link BackendProvider})</li>
 *   <li>{@link Type}: 백엔드 클래스 (public 무인자 생성자로 생성)</li>
 *   <li>{@link ClassName}: FQCN 문자열 (지연 로딩, 로딩 실패 시 DEBUG 로그 후 건너뜀)</li>
 * </ul>
 *
 * <p>동등성: 같은 형태이고 대상이 같으면 같은 스펙입니다. 레지스트리는 이 동등성으로
 * 재등록(우선순위/이름 갱신)을 판단합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public sealed interface BackendSpec
    permits BackendSpec.Builtin, BackendSpec.Provided, BackendSpec.Type, BackendSpec.ClassName {

    /**
     * 스펙으로부터 파생된 표시 이름.
     *
     * @return 표시 이름
     */
    String displayName();

    /**
     * 백엔드 인스턴스 생성.
     *
     * @return 백엔드 (구현을 로딩할 수 없으면 empty)
     * @throws Exception 생성 중 실패 시
     */
    Optional<DispatcherBackend> instantiate() throws Exception;

    static BackendSpec of(BuiltinBackend builtin) {
        return new Builtin(builtin);
    }

    static BackendSpec of(BackendProvider provider) {
        return new Provided(provider);
    }

    static BackendSpec of(Class<? extends DispatcherBackend> type) {
        return new Type(type);
    }

    static BackendSpec ofClassName(String className) {
        return new ClassName(className);
    }

    /**
     * 빌트인 백엔드 참조.
     *
     * @param backend 빌트인 백엔드 (null 불가)
     */
    record Builtin(BuiltinBackend backend) implements BackendSpec {

        public Builtin {
            if (backend == null) {
                throw new IllegalArgumentException("backend cannot be null");
            }
        }

        @Override
        public String displayName() {
            return backend.displayName();
        }

        @Override
        public Optional<DispatcherBackend> instantiate() {
            return Optional.of(backend.create());
        }
    }

    /**
     * 서드파티 확장 참조.
     *
     * @param provider 확장 (null 불가)
     */
    record Provided(BackendProvider provider) implements BackendSpec {

        public Provided {
            if (provider == null) {
                throw new IllegalArgumentException("provider cannot be null");
            }
        }

        @Override
        public String displayName() {
            return provider.name();
        }

        @Override
        public Optional<DispatcherBackend> instantiate() throws Exception {
            return Optional.ofNullable(provider.create());
        }
    }

    /**
     * 백엔드 클래스 참조.
     *
     * @param type 백엔드 클래스 (null 불가)
     */
    record Type(Class<? extends DispatcherBackend> type) implements BackendSpec {

        public Type {
            if (type == null) {
                throw new IllegalArgumentException("type cannot be null");
            }
        }

        @Override
        public String displayName() {
            return AbstractDispatcherBackend.displayNameOf(type);
        }

        @Override
        public Optional<DispatcherBackend> instantiate() throws Exception {
            return Optional.of(newInstance(type));
        }
    }

    /**
     * FQCN 문자열 참조 (지연 로딩).
     *
     * @param className 백엔드 클래스의 FQCN (비어 있으면 안 됨)
     */
    record ClassName(String className) implements BackendSpec {

        private static final Logger log = LoggerFactory.getLogger(ClassName.class);

        public ClassName {
            if (className == null || className.isBlank()) {
                throw new IllegalArgumentException("className cannot be null or blank");
            }
        }

        @Override
        public String displayName() {
            String simpleName = className.substring(Math.max(className.lastIndexOf('.'), className.lastIndexOf('$')) + 1);
            return AbstractDispatcherBackend.displayNameOf(simpleName);
        }

        @Override
        public Optional<DispatcherBackend> instantiate() throws Exception {
            Class<?> loaded;
            try {
                loaded = Class.forName(className, true, classLoader());
            } catch (ClassNotFoundException | LinkageError e) {
                log.debug("Could not load backend class {}: {}", className, e.toString());
                return Optional.empty();
            }
            if (!DispatcherBackend.class.isAssignableFrom(loaded)) {
                log.debug("{} is not a DispatcherBackend implementation", className);
                return Optional.empty();
            }
            return Optional.of(newInstance(loaded.asSubclass(DispatcherBackend.class)));
        }

        private static ClassLoader classLoader() {
            ClassLoader context = Thread.currentThread().getContextClassLoader();
            return context != null ? context : BackendSpec.class.getClassLoader();
        }
    }

    private static DispatcherBackend newInstance(Class<? extends DispatcherBackend> type) throws Exception {
        try {
            return type.getConstructor().newInstance();
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}

package com.ryuqq.dispatcher.core.spi;

import com.ryuqq.dispatcher.core.support.MainThreadCall;
import com.ryuqq.dispatcher.core.support.ProcessMainThread;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

/**
 * DispatcherBackend 공통 기반 클래스.
 *
 * <p>모든 백엔드가 공유하는 동작을 제공합니다:</p>
 * <ul>
 *   <li>{@link #isMainThread()}: 프로세스 메인 스레드와 현재 스레드 비교 (기본 구현)</li>
 *   <li>{@link #getName()}: 클래스 이름에서 {@code Backend}, {@code Dispatcher} 접미사 제거</li>
 *   <li>{@link #guarded(Runnable)}: deferred 작업의 예외를 로그로 남기는 래퍼</li>
 *   <li>{@link #awaitOnMainThread(Callable, Scheduler)}: 네이티브 블로킹 프리미티브가 없는
 *       호스트를 위한 one-shot 스케줄링 + 결과 홀더 + 대기 조합</li>
 * </ul>
 *
 * <p><strong>서브클래스 규칙:</strong></p>
 * <ul>
 *   <li>호스트가 자체 스레드 식별 API를 제공하면 {@code isMainThread()}를 오버라이드</li>
 *   <li>{@code runSync()}는 반드시 메인 스레드 인라인 실행을 먼저 확인</li>
 * </ul>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public abstract class AbstractDispatcherBackend implements DispatcherBackend {

    private static final Logger log = LoggerFactory.getLogger(AbstractDispatcherBackend.class);

    /**
     * one-shot 스케줄링 프리미티브.
     *
     * <p>전달된 작업을 호스트 메인 스레드에서 정확히 한 번 실행하도록 예약합니다.</p>
     */
    @FunctionalInterface
    protected interface Scheduler {
        void schedule(Runnable task) throws Exception;
    }

    @Override
    public boolean isMainThread() {
        return ProcessMainThread.isCurrent();
    }

    @Override
    public String getName() {
        return displayNameOf(getClass());
    }

    /**
     * 클래스 이름으로부터 표시 이름 생성.
     *
     * @param type 백엔드 클래스
     * @return 접미사가 제거된 이름 (예: MayaBackend → Maya)
     */
    public static String displayNameOf(Class<?> type) {
        return displayNameOf(type.getSimpleName());
    }

    /**
     * 클래스 단순 이름으로부터 표시 이름 생성.
     *
     * @param simpleName 클래스 단순 이름
     * @return 접미사가 제거된 이름
     */
    public static String displayNameOf(String simpleName) {
        String name = simpleName;
        if (name.endsWith("Backend")) {
            name = name.substring(0, name.length() - "Backend".length());
        }
        if (name.endsWith("Dispatcher")) {
            name = name.substring(0, name.length() - "Dispatcher".length());
        }
        return name;
    }

    /**
     * deferred 작업 래핑.
     *
     * <p>호출자는 deferred 작업의 예외를 관찰할 수 없으므로, 예외를 ERROR 로그로 남기고
     * 호스트 이벤트 루프로 전파하지 않습니다.</p>
     *
     * @param task 원본 작업
     * @return 예외를 로그로 남기는 작업
     */
    protected final Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException | Error e) {
                log.error("Error in deferred main thread call on {}: {}", getName(), task, e);
            }
        };
    }

    /**
     * one-shot 스케줄러와 결과 홀더로 블로킹 호출 구성.
     *
     * <p>네이티브 블로킹 프리미티브가 없는 호스트(Blender, Unreal, 툴킷)에서 사용합니다.
     * 메인 스레드에서 호출된 경우 인라인으로 실행합니다.</p>
     *
     * @param task 메인 스레드에서 실행할 작업
     * @param scheduler one-shot 스케줄링 프리미티브
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws Exception 작업이 던진 예외 (변경 없이 전파)
     */
    protected final <T> T awaitOnMainThread(Callable<T> task, Scheduler scheduler) throws Exception {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (isMainThread()) {
            return task.call();
        }

        MainThreadCall<T> call = new MainThreadCall<>();
        scheduler.schedule(() -> call.run(task));
        return call.await();
    }

    /**
     * null 작업 검증.
     *
     * @param task 작업
     * @throws IllegalArgumentException task가 null인 경우
     */
    protected static void requireTask(Object task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
    }

    @Override
    public String toString() {
        return "DispatcherBackend{" + getName() + '}';
    }
}

package com.ryuqq.dispatcher.core.support;

/**
 * 프로세스 기본 메인 스레드 식별.
 *
 * <p>JVM에는 "프로세스 메인 스레드"를 직접 조회하는 API가 없으므로 다음 순서로
 * 메인 스레드를 결정합니다:</p>
 * <ol>
 *   <li>호스트가 {@link #install(Thread)}로 등록한 스레드</li>
 *   <li>살아있는 JVM 스레드 중 이름이 {@code main}인 스레드 (최초 조회 시 한 번 탐색)</li>
 *   <li>위 둘 다 없으면 최초로 조회한 스레드</li>
 * </ol>
 *
 * <p>JVM이 호스트 프로세스에 임베드된 경우 호스트 UI 스레드가 JVM의 {@code main} 스레드가
 * 아닐 수 있으므로, 호스트 통합 코드는 시작 시 {@link #install(Thread)}를 호출해야 합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class ProcessMainThread {

    private static final String MAIN_THREAD_NAME = "main";

    private static volatile Thread installed;
    private static volatile Thread discovered;

    private ProcessMainThread() {
    }

    /**
     * 호스트 메인 스레드 등록.
     *
     * @param thread 메인 스레드
     * @throws IllegalArgumentException thread가 null인 경우
     */
    public static void install(Thread thread) {
        if (thread == null) {
            throw new IllegalArgumentException("thread cannot be null");
        }
        installed = thread;
    }

    /**
     * 등록된 메인 스레드 해제 (탐색 결과로 복귀).
     */
    public static void uninstall() {
        installed = null;
    }

    /**
     * 현재 메인 스레드 조회.
     *
     * @return 메인 스레드 (non-null)
     */
    public static Thread get() {
        Thread thread = installed;
        if (thread != null) {
            return thread;
        }
        thread = discovered;
        if (thread == null) {
            thread = discover();
        }
        return thread;
    }

    /**
     * 현재 스레드가 메인 스레드인지 확인.
     *
     * @return 메인 스레드인 경우 true
     */
    public static boolean isCurrent() {
        return Thread.currentThread() == get();
    }

    private static synchronized Thread discover() {
        if (discovered != null) {
            return discovered;
        }
        Thread found = null;
        for (Thread thread : Thread.getAllStackTraces().keySet()) {
            if (MAIN_THREAD_NAME.equals(thread.getName()) && thread.getThreadGroup() != null
                && (found == null || thread.getId() < found.getId())) {
                found = thread;
            }
        }
        discovered = found != null ? found : Thread.currentThread();
        return discovered;
    }
}

package com.ryuqq.dispatcher.application.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * 하나의 스레드에 고정된 실행기.
 *
 * <p>{@link #execute(Runnable)}는 어느 스레드에서든 호출할 수 있으며 작업을 큐에 넣기만 합니다.
 * 실제 실행은 {@link #drainUntil(CompletionStage)}를 호출한 스레드(메인 스레드)에서만 일어납니다.</p>
 *
 * <p>호스트의 네이티브 프리미티브는 일시 중단/재개를 이해하지 못하므로, 비동기 본문 전체를
 * 하나의 마샬링된 호출 안에서 이 실행기로 끝까지 구동합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
final class PinnedTaskRunner implements Executor {

    private static final Logger log = LoggerFactory.getLogger(PinnedTaskRunner.class);
    private static final Runnable WAKE = () -> { };

    private final BlockingQueue<Runnable> queue = new LinkedBlockingQueue<>();

    @Override
    public void execute(Runnable command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        queue.add(command);
    }

    /**
     * 완료될 때까지 큐의 작업을 현재 스레드에서 실행.
     *
     * <p>완료 시 큐에 깨우기 표식을 넣으므로 주기적으로 폴링하지 않고 작업 또는 완료가 있을
     * 때만 깨어납니다. 완료 이전에 들어온 작업은 모두 실행하고, 완료 이후에 들어온 작업은
     * 실행하지 않고 버립니다.</p>
     *
     * @param completion 완료 신호
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    void drainUntil(CompletionStage<?> completion) throws InterruptedException {
        if (completion == null) {
            throw new IllegalArgumentException("completion cannot be null");
        }
        completion.whenComplete((result, error) -> queue.add(WAKE));
        for (Runnable next = queue.take(); next != WAKE; next = queue.take()) {
            runSafely(next);
        }
        if (!queue.isEmpty()) {
            log.debug("Discarding {} task(s) scheduled after async completion", queue.size());
            queue.clear();
        }
    }

    int pendingCount() {
        return queue.size();
    }

    private void runSafely(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Error in pinned main thread task: {}", task, e);
        }
    }
}

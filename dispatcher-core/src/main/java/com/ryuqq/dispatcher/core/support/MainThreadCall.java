package com.ryuqq.dispatcher.core.support;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 스레드 경계를 넘는 블로킹 호출의 one-shot 결과 홀더.
 *
 * <p>작업 스레드는 {@link #await()} 또는 {@link #await(Duration)}로 대기하고,
 * 메인 스레드는 {@link #run(Callable)}로 작업을 실행하여 결과 또는 예외를 기록합니다.</p>
 *
 * <p><strong>동시성 보장:</strong></p>
 * <ul>
 *   <li>첫 번째 기록만 유효 (compareAndSet): 이후 기록은 무시됨</li>
 *   <li>타임아웃으로 대기자가 떠난 뒤 메인 스레드가 늦게 기록해도 안전</li>
 *   <li>{@link #fail(Throwable)}로 외부에서 대기자를 해제 가능 (예: 종료 신호)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * MainThreadCall<String> call = new MainThreadCall<>();
 * host.scheduleOnce(() -> call.run(() -> scene.name()));
 * String name = call.await(Duration.ofSeconds(5));
 * }</pre>
 *
 * @param <T> 결과 타입
 * @author Dispatcher Team
 * @since 1.0.0
 */
public final class MainThreadCall<T> {

    private final AtomicReference<Settled<T>> settled = new AtomicReference<>();
    private final CountDownLatch done = new CountDownLatch(1);

    /**
     * 작업을 실행하고 결과 또는 예외를 기록.
     *
     * <p>작업이 던진 예외는 여기서 전파되지 않고 대기 스레드에서 다시 던져집니다.</p>
     *
     * @param task 실행할 작업
     */
    public void run(Callable<T> task) {
        try {
            complete(task.call());
        } catch (Throwable t) {
            fail(t);
        }
    }

    /**
     * 성공 결과 기록.
     *
     * @param value 결과 값 (null 허용)
     * @return 이 호출이 첫 번째 기록인 경우 true
     */
    public boolean complete(T value) {
        return settle(new Settled<>(value, null));
    }

    /**
     * 실패 기록.
     *
     * @param error 실패 원인
     * @return 이 호출이 첫 번째 기록인 경우 true
     * @throws IllegalArgumentException error가 null인 경우
     */
    public boolean fail(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return settle(new Settled<>(null, error));
    }

    /**
     * 완료 여부.
     *
     * @return 결과 또는 예외가 기록된 경우 true
     */
    public boolean isDone() {
        return settled.get() != null;
    }

    /**
     * 결과가 기록될 때까지 무기한 대기.
     *
     * @return 작업 결과
     * @throws Exception 작업이 던진 예외 (변경 없이)
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public T await() throws Exception {
        done.await();
        return unwrap();
    }

    /**
     * 결과가 기록될 때까지 제한 시간 동안 대기.
     *
     * @param timeout 최대 대기 시간
     * @return 작업 결과
     * @throws TimeoutException 제한 시간 내에 기록되지 않은 경우
     * @throws Exception 작업이 던진 예외 (변경 없이)
     */
    public T await(Duration timeout) throws Exception {
        if (!awaitCompletion(timeout)) {
            throw new TimeoutException("Main thread call not completed within " + timeout.toMillis() + "ms");
        }
        return join();
    }

    /**
     * 결과 기록 여부만 제한 시간 동안 대기.
     *
     * <p>결과를 꺼내지 않으므로, 호출자는 타임아웃 시 {@link #fail(Throwable)}로 먼저 기록을
     * 선점할지 결정한 뒤 {@link #join()}으로 결과를 꺼낼 수 있습니다.</p>
     *
     * @param timeout 최대 대기 시간
     * @return 제한 시간 내에 기록된 경우 true
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     * @throws IllegalArgumentException timeout이 null이거나 음수인 경우
     */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative (current: " + timeout + ")");
        }
        return done.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * 기록된 결과 반환.
     *
     * @return 작업 결과
     * @throws Exception 기록된 예외 (변경 없이)
     * @throws IllegalStateException 아직 기록되지 않은 경우
     */
    public T join() throws Exception {
        if (!isDone()) {
            throw new IllegalStateException("Main thread call not completed yet");
        }
        return unwrap();
    }

    private boolean settle(Settled<T> value) {
        if (settled.compareAndSet(null, value)) {
            done.countDown();
            return true;
        }
        return false;
    }

    private T unwrap() throws Exception {
        Settled<T> result = settled.get();
        Throwable error = result.error();
        if (error == null) {
            return result.value();
        }
        if (error instanceof Exception exception) {
            throw exception;
        }
        if (error instanceof Error e) {
            throw e;
        }
        throw new IllegalStateException("Main thread call failed", error);
    }

    private record Settled<T>(T value, Throwable error) {
    }
}

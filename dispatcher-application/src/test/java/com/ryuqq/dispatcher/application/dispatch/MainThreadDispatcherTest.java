package com.ryuqq.dispatcher.application.dispatch;

import com.ryuqq.dispatcher.adapter.dcc.HostBindings;
import com.ryuqq.dispatcher.adapter.dcc.max.MaxBackend;
import com.ryuqq.dispatcher.adapter.dcc.max.MaxRuntime;
import com.ryuqq.dispatcher.adapter.toolkit.fallback.FallbackBackend;
import com.ryuqq.dispatcher.application.config.DispatcherConfig;
import com.ryuqq.dispatcher.application.registry.BackendProvider;
import com.ryuqq.dispatcher.application.registry.BackendRegistry;
import com.ryuqq.dispatcher.application.registry.BackendSpec;
import com.ryuqq.dispatcher.core.exception.DeadlockDetectedException;
import com.ryuqq.dispatcher.core.exception.ShutdownInProgressException;
import com.ryuqq.dispatcher.core.exception.ThreadDispatchTimeoutException;
import com.ryuqq.dispatcher.core.exception.ThreadSafetyException;
import com.ryuqq.dispatcher.core.spi.DispatcherBackend;
import com.ryuqq.dispatcher.core.support.ProcessMainThread;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * MainThreadDispatcher 테스트.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
@DisplayName("MainThreadDispatcher 테스트")
class MainThreadDispatcherTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private LoopHost host;
    private MainThreadDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        host = new LoopHost();
        dispatcher = host.dispatcher;
    }

    @AfterEach
    void tearDown() {
        host.close();
    }

    @Nested
    @DisplayName("동기 디스패치")
    class Sync {

        @Test
        void runOnMainThreadSync_작업자_스레드에서_메인_스레드로_마샬링() throws Exception {
            // when
            Thread executedOn = dispatcher.runOnMainThreadSync(Thread::currentThread);

            // then
            assertThat(executedOn).isSameAs(host.mainThread.thread());
        }

        @Test
        void runOnMainThreadSync_메인_스레드에서는_인라인_실행() throws Exception {
            // when
            Integer result = host.mainThread.invoke(() -> dispatcher.runOnMainThreadSync(() -> 1 + 1));

            // then
            assertThat(result).isEqualTo(2);
            assertThat(host.backend.scheduledCount()).isZero();
        }

        @Test
        void runOnMainThreadSync_예외_타입과_메시지_보존() {
            assertThatThrownBy(() -> dispatcher.runOnMainThreadSync(() -> {
                throw new IOException("scene locked");
            }))
                .isExactlyInstanceOf(IOException.class)
                .hasMessage("scene locked");
        }

        @Test
        void runOnMainThreadSync_null_결과_전달() throws Exception {
            assertThat(dispatcher.<String>runOnMainThreadSync(() -> null)).isNull();
        }

        @Test
        void runOnMainThread_메인_스레드에서_한번_실행() throws Exception {
            // given
            CountDownLatch executed = new CountDownLatch(1);
            AtomicInteger count = new AtomicInteger();
            AtomicReference<Thread> thread = new AtomicReference<>();

            // when
            dispatcher.runOnMainThread(() -> {
                count.incrementAndGet();
                thread.set(Thread.currentThread());
                executed.countDown();
            });

            // then
            assertThat(executed.await(5, TimeUnit.SECONDS)).isTrue();
            host.mainThread.awaitIdle(WAIT);
            assertThat(count.get()).isEqualTo(1);
            assertThat(thread.get()).isSameAs(host.mainThread.thread());
        }

        @Test
        void runOnMainThread_메인_스레드가_막혀_있어도_즉시_반환() throws Exception {
            // given
            host.mainThread.pause();
            CountDownLatch executed = new CountDownLatch(1);

            // when
            dispatcher.runOnMainThread(executed::countDown);

            // then
            assertThat(executed.getCount()).isEqualTo(1);
            host.mainThread.resume();
            assertThat(executed.await(5, TimeUnit.SECONDS)).isTrue();
        }

        @Test
        void isMainThread_활성_백엔드_기준() throws Exception {
            assertThat(dispatcher.isMainThread()).isFalse();
            assertThat(host.mainThread.invoke(dispatcher::isMainThread)).isTrue();
            assertThat(dispatcher.resolvedBackendName()).isEqualTo("Loop");
        }

        @Test
        void null_작업은_거부() {
            assertThatThrownBy(() -> dispatcher.runOnMainThread(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("task cannot be null");
            assertThatThrownBy(() -> dispatcher.runOnMainThreadSync(null))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("제한 시간 디스패치")
    class Timeout {

        @Test
        void runOnMainThreadSyncWithTimeout_제한_시간_내_완료되면_결과_반환() throws Exception {
            assertThat(dispatcher.runOnMainThreadSyncWithTimeout(() -> "done", WAIT)).isEqualTo("done");
        }

        @Test
        void runOnMainThreadSyncWithTimeout_제한_시간_초과_시_예외() {
            // given
            host.mainThread.pause();
            Duration timeout = Duration.ofMillis(100);
            long started = System.nanoTime();

            // when & then
            assertThatThrownBy(() -> dispatcher.runOnMainThreadSyncWithTimeout(() -> "never", timeout))
                .isInstanceOf(ThreadDispatchTimeoutException.class)
                .isInstanceOf(ThreadSafetyException.class)
                .hasMessageContaining("timed out after 100ms")
                .satisfies(e -> assertThat(((ThreadDispatchTimeoutException) e).getTimeout()).isEqualTo(timeout));
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            assertThat(elapsedMs).isBetween(90L, 2_000L);
        }

        @Test
        void runOnMainThreadSyncWithTimeout_타임아웃_후_늦은_실행은_무해() throws Exception {
            // given
            host.mainThread.pause();
            AtomicInteger lateRuns = new AtomicInteger();

            // when
            assertThatThrownBy(() -> dispatcher.runOnMainThreadSyncWithTimeout(
                lateRuns::incrementAndGet, Duration.ofMillis(50)))
                .isInstanceOf(ThreadDispatchTimeoutException.class);
            host.mainThread.resume();
            host.mainThread.awaitIdle(WAIT);

            // then
            assertThat(lateRuns.get()).isEqualTo(1);
            assertThat(host.mainThread.uncaughtErrors()).isEmpty();
        }

        @Test
        void runOnMainThreadSyncWithTimeout_예외_타입과_메시지_보존() {
            assertThatThrownBy(() -> dispatcher.runOnMainThreadSyncWithTimeout(() -> {
                throw new IOException("scene locked");
            }, WAIT))
                .isExactlyInstanceOf(IOException.class)
                .hasMessage("scene locked");
        }

        @Test
        void runOnMainThreadSyncWithTimeout_메인_스레드에서는_인라인_실행() throws Exception {
            // when
            Integer result = host.mainThread.invoke(() ->
                dispatcher.runOnMainThreadSyncWithTimeout(() -> 1 + 1, Duration.ZERO));

            // then
            assertThat(result).isEqualTo(2);
            assertThat(host.backend.scheduledCount()).isZero();
        }

        @Test
        void runOnMainThreadSyncWithTimeout_기본_제한_시간_사용() throws Exception {
            // given
            MainThreadDispatcher shortWait = new MainThreadDispatcher(
                host.registry, new DispatcherConfig().withDefaultTimeout(Duration.ofMillis(80)));
            host.mainThread.pause();

            // when & then
            assertThatThrownBy(() -> shortWait.runOnMainThreadSyncWithTimeout(() -> "never"))
                .isInstanceOf(ThreadDispatchTimeoutException.class)
                .hasMessageContaining("80ms");
        }

        @Test
        void runOnMainThreadSyncWithTimeout_음수_제한_시간은_거부() {
            assertThatThrownBy(() -> dispatcher.runOnMainThreadSyncWithTimeout(() -> 1, Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("교착 감지")
    class Deadlock {

        @Test
        void 마샬링된_콜백_안에서_메인_스레드는_인라인_실행() throws Exception {
            // when
            String result = dispatcher.runOnMainThreadSync(() -> dispatcher.runOnMainThreadSync(() -> "nested"));

            // then
            assertThat(result).isEqualTo("nested");
        }

        @Test
        void 콜백_실행_스레드를_메인으로_보지_않으면_중첩_블로킹_디스패치는_즉시_실패() {
            // given: 호스트 루프와 다른 스레드가 프로세스 메인 스레드로 설치된 상태
            ProcessMainThread.install(new Thread(() -> { }, "detached-main"));

            // when & then
            assertThatThrownBy(() -> dispatcher.runOnMainThreadSync(() ->
                dispatcher.runOnMainThreadSync(() -> "would hang")))
                .isInstanceOf(DeadlockDetectedException.class)
                .hasMessageContaining("host-main")
                .satisfies(e -> assertThat(((DeadlockDetectedException) e).getDepth()).isEqualTo(1));
        }

        @Test
        void 중첩_제한_시간_디스패치도_즉시_실패() {
            // given
            ProcessMainThread.install(new Thread(() -> { }, "detached-main"));

            // when & then
            assertThatThrownBy(() -> dispatcher.runOnMainThreadSyncWithTimeout(() ->
                dispatcher.runOnMainThreadSyncWithTimeout(() -> "would hang", WAIT), WAIT))
                .isInstanceOf(DeadlockDetectedException.class);
        }

        @Test
        void 스레드_친화성이_없는_백엔드는_교착_검사_대상이_아님() throws Exception {
            // given
            BackendRegistry fallbackOnly = new BackendRegistry(new DispatcherConfig(), key -> null, key -> null);
            fallbackOnly.register(BackendSpec.of(FallbackBackend.class), 1000);
            MainThreadDispatcher direct = new MainThreadDispatcher(fallbackOnly);
            ProcessMainThread.install(new Thread(() -> { }, "detached-main"));

            // when
            String result = direct.runOnMainThreadSync(() -> direct.runOnMainThreadSync(() -> "direct"));

            // then
            assertThat(result).isEqualTo("direct");
        }

        @Test
        void Qt_없는_3ds_Max_백엔드는_중첩_동기_디스패치를_직접_실행() throws Exception {
            // given: Qt가 없는 Max 런타임은 호출자 스레드에서 직접 실행
            MaxRuntime noQt = mock(MaxRuntime.class);
            when(noQt.isAlive()).thenReturn(true);
            when(noQt.hasQt()).thenReturn(false);
            HostBindings bindings = new HostBindings(false);
            bindings.install(MaxRuntime.class, noQt);

            BackendRegistry maxOnly = new BackendRegistry(new DispatcherConfig(), key -> null, key -> null);
            maxOnly.register(BackendSpec.of(new BackendProvider() {
                @Override
                public String name() {
                    return "Max";
                }

                @Override
                public DispatcherBackend create() {
                    return new MaxBackend(bindings);
                }
            }), 1000);
            MainThreadDispatcher direct = new MainThreadDispatcher(maxOnly);
            ProcessMainThread.install(new Thread(() -> { }, "detached-main"));

            // when
            String result = direct.runOnMainThreadSync(() -> direct.runOnMainThreadSync(() -> "nested"));

            // then
            assertThat(result).isEqualTo("nested");
            verify(noQt, never()).singleShot(anyInt(), any());
        }

        @Test
        void 콜백이_끝나면_재진입_깊이가_복구됨() throws Exception {
            // given
            ProcessMainThread.install(new Thread(() -> { }, "detached-main"));
            assertThatThrownBy(() -> dispatcher.runOnMainThreadSync(() ->
                dispatcher.runOnMainThreadSync(() -> "would hang")))
                .isInstanceOf(DeadlockDetectedException.class);

            // when: 같은 루프 스레드에서 이후 일반 콜백 실행
            String result = dispatcher.runOnMainThreadSync(() -> "fresh");

            // then
            assertThat(result).isEqualTo("fresh");
        }
    }

    @Nested
    @DisplayName("종료")
    class Shutdown {

        @Test
        void shutdown_이후_모든_디스패치는_즉시_실패() {
            // when
            dispatcher.shutdown();

            // then
            assertThat(dispatcher.isShuttingDown()).isTrue();
            assertThatThrownBy(() -> dispatcher.runOnMainThread(() -> { }))
                .isInstanceOf(ShutdownInProgressException.class);
            assertThatThrownBy(() -> dispatcher.runOnMainThreadSync(() -> 1))
                .isInstanceOf(ShutdownInProgressException.class);
            assertThatThrownBy(() -> dispatcher.runOnMainThreadSyncWithTimeout(() -> 1, WAIT))
                .isInstanceOf(ShutdownInProgressException.class)
                .isInstanceOf(ThreadSafetyException.class);
        }

        @Test
        void shutdown_이후에도_메인_스레드_확인은_동작() throws Exception {
            dispatcher.shutdown();

            assertThat(dispatcher.isMainThread()).isFalse();
            assertThat(host.mainThread.invoke(dispatcher::isMainThread)).isTrue();
        }

        @Test
        void shutdown_제한_시간_대기_중인_호출자를_해제() throws Exception {
            // given
            host.mainThread.pause();
            ExecutorService worker = Executors.newSingleThreadExecutor();
            try {
                Future<String> pending = worker.submit(() ->
                    dispatcher.runOnMainThreadSyncWithTimeout(() -> "never", Duration.ofSeconds(30)));
                Thread.sleep(100);
                long started = System.nanoTime();

                // when
                dispatcher.shutdown();

                // then
                assertThatThrownBy(() -> pending.get(5, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(ShutdownInProgressException.class);
                assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started)).isLessThan(5_000L);
            } finally {
                worker.shutdownNow();
                host.mainThread.resume();
            }
        }

        @Test
        void shutdown_반복_호출해도_안전() {
            dispatcher.shutdown();
            dispatcher.shutdown();

            assertThat(dispatcher.isShuttingDown()).isTrue();
        }
    }
}

package com.ryuqq.dispatcher.testkit.contract;

import com.ryuqq.dispatcher.core.spi.DispatcherBackend;
import com.ryuqq.dispatcher.core.support.ProcessMainThread;
import com.ryuqq.dispatcher.testkit.host.SimulatedMainThread;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Abstract base class for backend Contract Tests.
 *
 * <p>Every {@link DispatcherBackend} must pass these scenarios regardless of the host
 * primitive it wraps. Subclasses wire the backend to test doubles of the host SDK that
 * post their callbacks onto a {@link SimulatedMainThread}.</p>
 *
 * <p><strong>Contract:</strong></p>
 * <ul>
 *   <li>runSync from a worker thread executes on the main thread</li>
 *   <li>runSync from the main thread executes inline (no marshaling round-trip)</li>
 *   <li>runSync re-throws the task's exception with type and message intact</li>
 *   <li>runDeferred executes exactly once, later, on the main thread</li>
 *   <li>runDeferred task exceptions never escape into the host loop</li>
 *   <li>isMainThread distinguishes the main thread from workers</li>
 *   <li>isAvailable is false, without throwing, when the host is absent</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MayaBackendContractTest extends AbstractBackendContractTest {
 *     {@literal @}Override
 *     protected DispatcherBackend createBackend(SimulatedMainThread mainThread) {
 *         return new MayaBackend(new LoopMayaUtils(mainThread));
 *     }
 *     ...
 * }
 * </pre>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public abstract class AbstractBackendContractTest {

    protected static final Duration WAIT = Duration.ofSeconds(5);

    protected SimulatedMainThread mainThread;
    protected DispatcherBackend backend;

    /**
     * Creates the backend under test, bound to the simulated main thread.
     *
     * @param mainThread the simulated host main thread
     * @return the backend
     */
    protected abstract DispatcherBackend createBackend(SimulatedMainThread mainThread);

    /**
     * Creates the same backend with no host present.
     *
     * @return a backend whose host SDK cannot be detected
     */
    protected abstract DispatcherBackend createUnboundBackend();

    /**
     * Sets up a fresh simulated main thread and backend before each test.
     *
     * <p>The simulated thread is installed as the process main thread so backends that
     * rely on the default identity check see it as the main thread.</p>
     */
    @BeforeEach
    void setUpBackend() {
        mainThread = new SimulatedMainThread(getClass().getSimpleName() + "-main");
        ProcessMainThread.install(mainThread.thread());
        backend = createBackend(mainThread);
    }

    @AfterEach
    void tearDownBackend() {
        ProcessMainThread.uninstall();
        if (mainThread != null) {
            mainThread.close();
        }
    }

    @Test
    void contract_isAvailable_호스트_바인딩_시_true() {
        assertThat(backend.isAvailable()).isTrue();
    }

    @Test
    void contract_isAvailable_호스트_부재_시_예외_없이_false() {
        DispatcherBackend unbound = createUnboundBackend();

        assertThat(unbound.isAvailable()).isFalse();
    }

    @Test
    void contract_runSync_작업_스레드에서_메인_스레드로_마샬링() throws Exception {
        // when
        Thread executedOn = backend.runSync(Thread::currentThread);

        // then
        assertThat(executedOn).isSameAs(mainThread.thread());
    }

    @Test
    void contract_runSync_메인_스레드에서_인라인_실행() throws Exception {
        // when
        Integer result = mainThread.invoke(() -> backend.runSync(() -> 1 + 1));

        // then
        assertThat(result).isEqualTo(2);
    }

    @Test
    void contract_runSync_예외_타입과_메시지_보존() {
        assertThatThrownBy(() -> backend.runSync(() -> {
            throw new IOException("node not found: pCube1");
        }))
            .isInstanceOf(IOException.class)
            .hasMessage("node not found: pCube1");
    }

    @Test
    void contract_runSync_null_결과_전달() throws Exception {
        Object result = backend.runSync(() -> null);

        assertThat(result).isNull();
    }

    @Test
    void contract_runDeferred_메인_스레드에서_정확히_한_번_실행() throws Exception {
        // given
        AtomicInteger calls = new AtomicInteger();
        List<Thread> threads = new CopyOnWriteArrayList<>();
        CountDownLatch executed = new CountDownLatch(1);

        // when
        backend.runDeferred(() -> {
            calls.incrementAndGet();
            threads.add(Thread.currentThread());
            executed.countDown();
        });

        // then
        assertThat(executed.await(WAIT.toMillis(), TimeUnit.MILLISECONDS)).isTrue();
        assertThat(mainThread.awaitIdle(WAIT)).isTrue();
        assertThat(calls.get()).isEqualTo(1);
        assertThat(threads).containsExactly(mainThread.thread());
    }

    @Test
    void contract_runDeferred_호출자를_블로킹하지_않음() throws Exception {
        // given: 메인 스레드가 바쁜 상태
        mainThread.pause();
        CountDownLatch executed = new CountDownLatch(1);

        try {
            // when
            long start = System.nanoTime();
            backend.runDeferred(executed::countDown);
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            // then
            assertThat(elapsedMs).isLessThan(1_000);
            assertThat(executed.getCount()).isEqualTo(1);
        } finally {
            mainThread.resume();
        }
        assertThat(executed.await(WAIT.toMillis(), TimeUnit.MILLISECONDS)).isTrue();
    }

    @Test
    void contract_runDeferred_작업_예외가_호스트_루프로_전파되지_않음() throws Exception {
        // when
        backend.runDeferred(() -> {
            throw new IllegalStateException("deferred failure");
        });

        // then
        assertThat(mainThread.awaitIdle(WAIT)).isTrue();
        assertThat(mainThread.uncaughtErrors()).isEmpty();
        assertThat(backend.runSync(() -> "still serving")).isEqualTo("still serving");
    }

    @Test
    void contract_isMainThread_메인과_작업_스레드_구분() throws Exception {
        assertThat(backend.isMainThread()).isFalse();
        assertThat(mainThread.invoke(backend::isMainThread)).isTrue();
    }

    @Test
    void contract_getName_비어있지_않음() {
        assertThat(backend.getName()).isNotBlank();
    }
}

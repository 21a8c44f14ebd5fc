package com.ryuqq.dispatcher.adapter.dcc.blender;

import com.ryuqq.dispatcher.adapter.dcc.HostBindings;
import com.ryuqq.dispatcher.core.spi.DispatcherBackend;
import com.ryuqq.dispatcher.testkit.contract.AbstractBackendContractTest;
import com.ryuqq.dispatcher.testkit.host.SimulatedMainThread;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * BlenderBackend Contract Test.
 *
 * <p>{@code bpy.app.timers} 흉내: 등록된 함수는 메인 루프에서 호출되고, null이 아닌 값을
 * 반환하면 다시 예약됩니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
class BlenderBackendContractTest extends AbstractBackendContractTest {

    private LoopBlenderTimers timers;

    @Override
    protected DispatcherBackend createBackend(SimulatedMainThread mainThread) {
        timers = new LoopBlenderTimers(mainThread);
        HostBindings bindings = new HostBindings(false);
        bindings.install(BlenderTimers.class, timers);
        return new BlenderBackend(bindings);
    }

    @Override
    protected DispatcherBackend createUnboundBackend() {
        return new BlenderBackend(new HostBindings(false));
    }

    @Test
    void runSync_타이머는_첫_호출_후_해제됨() throws Exception {
        // when
        backend.runSync(() -> "once");
        backend.runDeferred(() -> { });
        mainThread.awaitIdle(WAIT);

        // then
        assertThat(timers.registrations.get()).isEqualTo(2);
        assertThat(timers.invocations.get()).isEqualTo(2);
    }

    private static final class LoopBlenderTimers implements BlenderTimers {

        private final SimulatedMainThread mainThread;
        private final AtomicInteger registrations = new AtomicInteger();
        private final AtomicInteger invocations = new AtomicInteger();

        LoopBlenderTimers(SimulatedMainThread mainThread) {
            this.mainThread = mainThread;
        }

        @Override
        public void register(TimerFunction function, double firstInterval) {
            registrations.incrementAndGet();
            schedule(function);
        }

        private void schedule(TimerFunction function) {
            mainThread.post(() -> {
                invocations.incrementAndGet();
                Double next = function.call();
                if (next != null) {
                    schedule(function);
                }
            });
        }
    }
}

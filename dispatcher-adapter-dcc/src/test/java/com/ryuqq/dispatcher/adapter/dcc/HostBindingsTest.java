package com.ryuqq.dispatcher.adapter.dcc;

import com.ryuqq.dispatcher.adapter.dcc.maya.MayaUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * HostBindings 유닛 테스트.
 *
 * <p>호스트 바인딩 설치/조회와 가용성 탐지가 예외를 던지지 않는지 검증합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
class HostBindingsTest {

    private HostBindings bindings;

    @BeforeEach
    void setUp() {
        bindings = new HostBindings(false);
    }

    @Test
    void install_설치된_바인딩을_조회() {
        // given
        MayaUtils utils = mock(MayaUtils.class);
        when(utils.isAlive()).thenReturn(true);

        // when
        bindings.install(MayaUtils.class, utils);

        // then
        assertThat(bindings.find(MayaUtils.class)).containsSame(utils);
        assertThat(bindings.require(MayaUtils.class)).isSameAs(utils);
        assertThat(bindings.isBound(MayaUtils.class)).isTrue();
    }

    @Test
    void isBound_바인딩_없으면_false() {
        assertThat(bindings.isBound(MayaUtils.class)).isFalse();
        assertThat(bindings.find(MayaUtils.class)).isEmpty();
    }

    @Test
    void isBound_핸드셰이크_false면_false() {
        // given
        MayaUtils utils = mock(MayaUtils.class);
        when(utils.isAlive()).thenReturn(false);
        bindings.install(MayaUtils.class, utils);

        // when & then
        assertThat(bindings.isBound(MayaUtils.class)).isFalse();
    }

    @Test
    void isBound_핸드셰이크_예외는_false로_변환() {
        // given
        MayaUtils utils = mock(MayaUtils.class);
        when(utils.isAlive()).thenThrow(new IllegalStateException("interpreter finalized"));
        bindings.install(MayaUtils.class, utils);

        // when & then
        assertThat(bindings.isBound(MayaUtils.class)).isFalse();
    }

    @Test
    void uninstall_제거_후_사용_불가() {
        // given
        bindings.install(MayaUtils.class, mock(MayaUtils.class));

        // when
        boolean removed = bindings.uninstall(MayaUtils.class);

        // then
        assertThat(removed).isTrue();
        assertThat(bindings.uninstall(MayaUtils.class)).isFalse();
        assertThat(bindings.find(MayaUtils.class)).isEmpty();
    }

    @Test
    void require_바인딩_없으면_IllegalStateException() {
        assertThatThrownBy(() -> bindings.require(MayaUtils.class))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("MayaUtils");
    }

    @Test
    void find_ServiceLoader_탐색에_구현이_없으면_empty() {
        HostBindings withLookup = new HostBindings(true);

        assertThat(withLookup.find(MayaUtils.class)).isEmpty();
        assertThat(withLookup.isBound(MayaUtils.class)).isFalse();
    }

    @Test
    void install_null_인자는_거부() {
        assertThatThrownBy(() -> bindings.install(null, mock(MayaUtils.class)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("port cannot be null");
        assertThatThrownBy(() -> bindings.install(MayaUtils.class, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("binding cannot be null");
    }
}

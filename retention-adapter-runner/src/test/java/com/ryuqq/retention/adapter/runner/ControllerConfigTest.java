package com.ryuqq.retention.adapter.runner;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ControllerConfig 테스트.
 *
 * @author Retention Team
 * @since 1.0.0
 */
class ControllerConfigTest {

    @Test
    void 기본값() {
        // when
        ControllerConfig config = new ControllerConfig();

        // then
        assertThat(config.maxConcurrentReconciles()).isZero();
        assertThat(config.effectiveConcurrency()).isEqualTo(1);
        assertThat(config.pollIntervalMs()).isEqualTo(100);
        assertThat(config.reconcileTimeoutMs()).isEqualTo(300000);
        assertThat(config.shutdownTimeoutMs()).isEqualTo(60000);
    }

    @Test
    void withX_지정한_값만_변경() {
        // when
        ControllerConfig config = new ControllerConfig().withMaxConcurrentReconciles(4).withPollIntervalMs(10);

        // then
        assertThat(config.effectiveConcurrency()).isEqualTo(4);
        assertThat(config.pollIntervalMs()).isEqualTo(10);
        assertThat(config.reconcileTimeoutMs()).isEqualTo(300000);
    }

    @Test
    void 유효하지_않은_값이면_예외() {
        // when & then
        assertThatThrownBy(() -> new ControllerConfig().withMaxConcurrentReconciles(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxConcurrentReconciles cannot be negative");
        assertThatThrownBy(() -> new ControllerConfig().withReconcileTimeoutMs(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("reconcileTimeoutMs must be positive");
    }

    @Test
    void fromEnvironment_컨트롤러별_동시성과_제한_시간_로드() {
        // given
        Map<String, String> environment = Map.of(
            ControllerConfig.EXECUTION_MAX_CONCURRENT_RECONCILES, "8",
            ControllerConfig.MANAGED_MAX_CONCURRENT_RECONCILES, "2",
            ControllerConfig.CTX_TIMEOUT, "30"
        );

        // when
        ControllerConfig ttl = ControllerConfig.fromEnvironment(
            environment, ControllerConfig.EXECUTION_MAX_CONCURRENT_RECONCILES);
        ControllerConfig limit = ControllerConfig.fromEnvironment(
            environment, ControllerConfig.MANAGED_MAX_CONCURRENT_RECONCILES);

        // then
        assertThat(ttl.maxConcurrentReconciles()).isEqualTo(8);
        assertThat(limit.maxConcurrentReconciles()).isEqualTo(2);
        assertThat(ttl.reconcileTimeoutMs()).isEqualTo(30000);
        assertThat(limit.reconcileTimeoutMs()).isEqualTo(30000);
    }

    @Test
    void fromEnvironment_변수가_없으면_기본값() {
        // when
        ControllerConfig config = ControllerConfig.fromEnvironment(
            Map.of(), ControllerConfig.EXECUTION_MAX_CONCURRENT_RECONCILES);

        // then
        assertThat(config).isEqualTo(new ControllerConfig());
    }

    @Test
    void fromEnvironment_정수가_아니면_변수_이름과_함께_예외() {
        // given
        Map<String, String> environment = Map.of(ControllerConfig.CTX_TIMEOUT, "5m");

        // when & then
        assertThatThrownBy(() -> ControllerConfig.fromEnvironment(
            environment, ControllerConfig.EXECUTION_MAX_CONCURRENT_RECONCILES))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("CTX_TIMEOUT");
    }
}

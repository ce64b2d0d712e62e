package com.ryuqq.retry.core.handler;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * HandlerRegistry 테스트.
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
class HandlerRegistryTest {

    private final RetryHandler orderSync = record -> { };
    private final RetryHandler invoicePush = record -> { };

    @Test
    void require_등록된_이름이면_핸들러를_반환함() {
        // given
        HandlerRegistry registry = HandlerRegistry.builder()
            .register("OrderSync", orderSync)
            .register("InvoicePush", invoicePush)
            .build();

        // when & then
        assertThat(registry.require("OrderSync")).isSameAs(orderSync);
        assertThat(registry.require("InvoicePush")).isSameAs(invoicePush);
        assertThat(registry.processNames()).containsExactlyInAnyOrder("OrderSync", "InvoicePush");
    }

    @Test
    void require_등록되지_않은_이름이면_예외() {
        // given
        HandlerRegistry registry = HandlerRegistry.builder()
            .register("OrderSync", orderSync)
            .build();

        // when & then
        assertThatThrownBy(() -> registry.require("ordersync"))
            .isInstanceOf(HandlerNotRegisteredException.class)
            .hasMessageContaining("ordersync")
            .extracting(e -> ((HandlerNotRegisteredException) e).getProcessName())
            .isEqualTo("ordersync");
    }

    @Test
    void find_null_이름이면_empty() {
        HandlerRegistry registry = HandlerRegistry.builder().build();

        assertThat(registry.find(null)).isEmpty();
    }

    @Test
    void register_중복_이름이면_예외() {
        HandlerRegistry.Builder builder = HandlerRegistry.builder().register("OrderSync", orderSync);

        assertThatThrownBy(() -> builder.register("OrderSync", invoicePush))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("already registered");
    }

    @Test
    void register_null_핸들러면_예외() {
        assertThatThrownBy(() -> HandlerRegistry.builder().register("OrderSync", null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("handler cannot be null");
    }
}

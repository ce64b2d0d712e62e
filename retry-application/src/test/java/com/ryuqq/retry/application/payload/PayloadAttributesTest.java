package com.ryuqq.retry.application.payload;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PayloadAttributes 테스트.
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
class PayloadAttributesTest {

    private static final String PAYLOAD =
        "{\"orderId\":\"ORD-1\",\"amount\":50000,\"express\":true,"
            + "\"customer\":{\"id\":\"C-7\",\"tier\":null},\"items\":[1,2]}";

    @Test
    void lookup_최상위_문자열_속성을_찾음() {
        // when
        AttributeLookup lookup = PayloadAttributes.parse(PAYLOAD).lookup("orderId");

        // then
        assertThat(lookup).isEqualTo(new AttributeLookup.Found("orderId", "ORD-1"));
        assertThat(lookup.isFound()).isTrue();
    }

    @Test
    void lookup_숫자와_불리언은_텍스트로_반환함() {
        PayloadAttributes attributes = PayloadAttributes.parse(PAYLOAD);

        assertThat(attributes.require("amount")).isEqualTo("50000");
        assertThat(attributes.require("express")).isEqualTo("true");
    }

    @Test
    void lookup_중첩_경로를_따라감() {
        assertThat(PayloadAttributes.parse(PAYLOAD).require("customer.id")).isEqualTo("C-7");
    }

    @Test
    void lookup_배열은_JSON_문자열로_반환함() {
        assertThat(PayloadAttributes.parse(PAYLOAD).require("items")).isEqualTo("[1,2]");
    }

    @Test
    void lookup_없는_속성이면_NotFound() {
        // when
        AttributeLookup lookup = PayloadAttributes.parse(PAYLOAD).lookup("missing");

        // then
        assertThat(lookup).isEqualTo(new AttributeLookup.NotFound("missing"));
        assertThat(lookup.orElse("fallback")).isEqualTo("fallback");
        assertThat(lookup.toOptional()).isEmpty();
    }

    @Test
    void lookup_JSON_null은_없는_것으로_취급함() {
        assertThat(PayloadAttributes.parse(PAYLOAD).has("customer.tier")).isFalse();
    }

    @Test
    void lookup_값이_객체가_아닌_경로_중간은_NotFound() {
        assertThat(PayloadAttributes.parse(PAYLOAD).lookup("orderId.value").isFound()).isFalse();
    }

    @Test
    void require_없는_속성이면_AttributeNotFoundException() {
        assertThatThrownBy(() -> PayloadAttributes.parse(PAYLOAD).require("customer.email"))
            .isInstanceOf(AttributeNotFoundException.class)
            .hasMessageContaining("customer.email")
            .extracting(e -> ((AttributeNotFoundException) e).getKey())
            .isEqualTo("customer.email");
    }

    @Test
    void parse_null이나_빈_문자열은_빈_페이로드() {
        assertThat(PayloadAttributes.parse(null).has("orderId")).isFalse();
        assertThat(PayloadAttributes.parse("  ").has("orderId")).isFalse();
    }

    @Test
    void parse_잘못된_JSON이면_예외() {
        assertThatThrownBy(() -> PayloadAttributes.parse("{not json"))
            .isInstanceOf(PayloadParseException.class)
            .hasMessageContaining("not valid JSON");
    }

    @Test
    void parse_객체가_아닌_JSON이면_예외() {
        assertThatThrownBy(() -> PayloadAttributes.parse("[1,2,3]"))
            .isInstanceOf(PayloadParseException.class)
            .hasMessageContaining("must be a JSON object");
    }

    @Test
    void lookup_빈_키면_예외() {
        assertThatThrownBy(() -> PayloadAttributes.parse(PAYLOAD).lookup(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

package com.ryuqq.retry.adapter.inmemory.config;

import com.ryuqq.retry.core.config.RetryConfigurationException;
import com.ryuqq.retry.core.config.RetryPolicyCache;
import com.ryuqq.retry.core.model.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * JsonRetryPolicySource 유닛 테스트.
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
class JsonRetryPolicySourceTest {

    @Test
    void fromClasspath_모든_행을_읽음() {
        // given
        JsonRetryPolicySource source = JsonRetryPolicySource.fromClasspath("retry-policies.json");

        // when
        List<RetryPolicy> policies = source.loadAll();

        // then
        assertThat(policies).containsExactly(
            new RetryPolicy("OrderSync", null, 3, 30, 5, true),
            new RetryPolicy("OrderSync", "push", 5, 10, 1, true),
            new RetryPolicy("Invoice", null, 2, 60, 0, false)
        );
    }

    @Test
    void fromClasspath_캐시와_함께_method_키를_우선함() {
        // given
        RetryPolicyCache cache = new RetryPolicyCache(JsonRetryPolicySource.fromClasspath("retry-policies.json"));

        // when & then
        assertThat(cache.resolve("OrderSync", "push")).get()
            .extracting(RetryPolicy::maxRetryCount).isEqualTo(5);
        assertThat(cache.resolve("OrderSync", "pull")).get()
            .extracting(RetryPolicy::maxRetryCount).isEqualTo(3);
        assertThat(cache.resolve("Invoice", null)).isEmpty();
    }

    @Test
    void fromString_누락된_필드는_기본값() {
        // given
        String json = "[{\"processName\":\"Shipping\",\"methodName\":\"\",\"unknown\":1}]";

        // when
        List<RetryPolicy> policies = JsonRetryPolicySource.fromString(json).loadAll();

        // then
        assertThat(policies).containsExactly(new RetryPolicy("Shipping", null, 0, 0, 0, true));
    }

    @Test
    void 없는_리소스는_설정_오류() {
        JsonRetryPolicySource source = JsonRetryPolicySource.fromClasspath("missing-policies.json");

        assertThatThrownBy(source::loadAll)
            .isInstanceOf(RetryConfigurationException.class)
            .hasMessageContaining("missing-policies.json");
    }

    @Test
    void 잘못된_JSON은_설정_오류() {
        JsonRetryPolicySource source = JsonRetryPolicySource.fromString("{not json");

        assertThatThrownBy(source::loadAll)
            .isInstanceOf(RetryConfigurationException.class)
            .hasMessageContaining("Failed to read retry policies");
    }

    @Test
    void 유효하지_않은_행은_행_번호와_함께_설정_오류() {
        JsonRetryPolicySource source = JsonRetryPolicySource.fromString(
            "[{\"processName\":\"A\"},{\"processName\":\"B\",\"maxRetryCount\":-1}]");

        assertThatThrownBy(source::loadAll)
            .isInstanceOf(RetryConfigurationException.class)
            .hasMessageContaining("row 1")
            .hasMessageContaining("maxRetryCount");
    }
}

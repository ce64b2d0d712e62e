package com.ryuqq.retry.adapter.inmemory.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.retry.core.config.RetryConfigurationException;
import com.ryuqq.retry.core.model.RetryPolicy;
import com.ryuqq.retry.core.spi.RetryPolicySource;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON 문서에서 재시도 정책 테이블을 읽는 RetryPolicySource.
 *
 * <p>문서는 정책 행 배열입니다. 알 수 없는 필드는 무시하고, 누락된 숫자 필드는 0,
 * 누락된 {@code isActive}는 true로 취급합니다.</p>
 *
 * <pre>
 * [
 *   { "processName": "ORDER", "methodName": "charge", "maxRetryCount": 3,
 *     "retryIntervalMinutes": 30, "startFirstRetryAfterMinutes": 5, "isActive": true },
 *   { "processName": "ORDER", "maxRetryCount": 5, "retryIntervalMinutes": 60 }
 * ]
 * </pre>
 *
 * <p>매 {@link #loadAll()} 호출마다 문서를 다시 읽으므로 캐시 reload 시 변경 사항이 반영됩니다.</p>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public final class JsonRetryPolicySource implements RetryPolicySource {

    private static final TypeReference<List<PolicyRow>> ROWS = new TypeReference<>() { };

    private final ObjectMapper mapper;
    private final DocumentReader reader;
    private final String description;

    private JsonRetryPolicySource(DocumentReader reader, String description) {
        this.mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.reader = reader;
        this.description = description;
    }

    /**
     * 클래스패스 리소스에서 읽는 소스 생성.
     *
     * @param resource 리소스 경로 (예: {@code "retry-policies.json"})
     * @return JsonRetryPolicySource 인스턴스
     * @throws IllegalArgumentException resource가 null이거나 빈 문자열인 경우
     */
    public static JsonRetryPolicySource fromClasspath(String resource) {
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("resource cannot be null or blank");
        }
        ClassLoader loader = JsonRetryPolicySource.class.getClassLoader();
        return new JsonRetryPolicySource((mapper) -> {
            try (InputStream in = loader.getResourceAsStream(resource)) {
                if (in == null) {
                    throw new RetryConfigurationException("Retry policy resource not found: " + resource);
                }
                return mapper.readValue(in, ROWS);
            }
        }, "classpath:" + resource);
    }

    /**
     * JSON 문자열에서 읽는 소스 생성.
     *
     * @param json 정책 배열 JSON
     * @return JsonRetryPolicySource 인스턴스
     * @throws IllegalArgumentException json이 null인 경우
     */
    public static JsonRetryPolicySource fromString(String json) {
        if (json == null) {
            throw new IllegalArgumentException("json cannot be null");
        }
        return new JsonRetryPolicySource((mapper) -> mapper.readValue(new StringReader(json), ROWS), "inline");
    }

    /**
     * {@inheritDoc}
     *
     * @throws RetryConfigurationException 문서를 읽을 수 없거나 행이 유효하지 않은 경우
     */
    @Override
    public List<RetryPolicy> loadAll() {
        List<PolicyRow> rows;
        try {
            rows = reader.read(mapper);
        } catch (IOException e) {
            throw new RetryConfigurationException("Failed to read retry policies from " + description, e);
        }
        if (rows == null) {
            return List.of();
        }

        List<RetryPolicy> policies = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            PolicyRow row = rows.get(i);
            if (row == null) {
                throw new RetryConfigurationException("Retry policy row " + i + " in " + description + " is null");
            }
            try {
                policies.add(row.toPolicy());
            } catch (IllegalArgumentException e) {
                throw new RetryConfigurationException(
                    "Invalid retry policy row " + i + " in " + description + ": " + e.getMessage(), e);
            }
        }
        return policies;
    }

    @Override
    public String toString() {
        return "JsonRetryPolicySource{" + description + "}";
    }

    @FunctionalInterface
    private interface DocumentReader {
        List<PolicyRow> read(ObjectMapper mapper) throws IOException;
    }

    record PolicyRow(
        @JsonProperty("processName") String processName,
        @JsonProperty("methodName") String methodName,
        @JsonProperty("maxRetryCount") Integer maxRetryCount,
        @JsonProperty("retryIntervalMinutes") Integer retryIntervalMinutes,
        @JsonProperty("startFirstRetryAfterMinutes") Integer startFirstRetryAfterMinutes,
        @JsonProperty("isActive") Boolean active
    ) {

        RetryPolicy toPolicy() {
            return new RetryPolicy(
                processName,
                methodName == null || methodName.isBlank() ? null : methodName,
                orZero(maxRetryCount),
                orZero(retryIntervalMinutes),
                orZero(startFirstRetryAfterMinutes),
                active == null || active
            );
        }

        private static int orZero(Integer value) {
            return value == null ? 0 : value;
        }
    }
}

package com.ryuqq.retry.application.payload;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON 페이로드에서 이름으로 속성을 꺼내는 읽기 전용 뷰.
 *
 * <p>requestPayload / responsePayload는 Ledger 입장에서 불투명 문자열이며,
 * 구조는 각 핸들러가 소유합니다. 핸들러는 이 클래스로 필요한 필드를 조회합니다.</p>
 *
 * <p><strong>경로 규칙:</strong></p>
 * <ul>
 *   <li>{@code "orderId"}: 최상위 필드</li>
 *   <li>{@code "customer.id"}: 중첩 객체 필드 (점으로 구분)</li>
 *   <li>JSON null 값은 없는 것으로 취급</li>
 *   <li>문자열은 그대로, 숫자/불리언은 텍스트로, 객체/배열은 JSON 문자열로 반환</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * PayloadAttributes request = PayloadAttributes.parse(record.requestPayload());
 * String orderId = request.lookup("orderId").orElseThrow();
 * </pre>
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public final class PayloadAttributes {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ObjectNode root;

    private PayloadAttributes(ObjectNode root) {
        this.root = root;
    }

    /**
     * JSON 페이로드 파싱.
     *
     * <p>null 또는 빈 문자열은 속성이 없는 빈 페이로드로 취급합니다.</p>
     *
     * @param payload JSON 문자열 (null 가능)
     * @return PayloadAttributes 인스턴스
     * @throws PayloadParseException JSON 객체가 아닌 경우
     */
    public static PayloadAttributes parse(String payload) {
        if (payload == null || payload.isBlank()) {
            return new PayloadAttributes(JsonNodeFactory.instance.objectNode());
        }

        JsonNode node;
        try {
            node = MAPPER.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new PayloadParseException("Payload is not valid JSON", e);
        }
        if (!(node instanceof ObjectNode objectNode)) {
            throw new PayloadParseException("Payload must be a JSON object but was: " + node.getNodeType());
        }
        return new PayloadAttributes(objectNode);
    }

    /**
     * 속성 조회.
     *
     * @param key 속성 이름 또는 점으로 구분한 경로
     * @return Found 또는 NotFound
     * @throws IllegalArgumentException key가 null이거나 빈 문자열인 경우
     */
    public AttributeLookup lookup(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }

        JsonNode current = root;
        for (String segment : key.split("\\.")) {
            if (current == null || !current.isObject()) {
                return new AttributeLookup.NotFound(key);
            }
            current = current.get(segment);
        }

        if (current == null || current.isNull() || current.isMissingNode()) {
            return new AttributeLookup.NotFound(key);
        }
        String value = current.isValueNode() ? current.asText() : current.toString();
        return new AttributeLookup.Found(key, value);
    }

    /**
     * 필수 속성 조회.
     *
     * @param key 속성 이름 또는 경로
     * @return 값
     * @throws AttributeNotFoundException 속성이 없는 경우
     */
    public String require(String key) {
        return lookup(key).orElseThrow();
    }

    /**
     * 속성 존재 여부.
     *
     * @param key 속성 이름 또는 경로
     * @return 존재하면 true
     */
    public boolean has(String key) {
        return lookup(key).isFound();
    }
}

/**
 * 재시도 핸들러 계약과 이름 기반 레지스트리.
 *
 * <h2>구성</h2>
 * <ul>
 *   <li>{@link com.ryuqq.retry.core.handler.RetryHandler} - 외부 업무 로직이 구현하는 재시도 진입점</li>
 *   <li>{@link com.ryuqq.retry.core.handler.HandlerRegistry} - processName → 핸들러 불변 매핑</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Retry Ledger Team
 */
package com.ryuqq.retry.core.handler;

package com.example.eventcore.application.domain.saga;

import java.util.Map;

/**
 * 傳給活動的執行上下文
 *
 * @param sagaId   Saga 識別碼，可用來組合冪等鍵
 * @param stepName 目前步驟
 * @param attempt  第幾次嘗試 (由 1 開始)
 * @param input    Saga 輸入
 * @param results  已完成步驟的輸出，以步驟名稱為鍵
 */
public record SagaExecutionContext(String sagaId, String stepName, int attempt, Map<String, Object> input,
		Map<String, Map<String, Object>> results) {

	public Object input(String key) {
		return input.get(key);
	}

	public String requireString(String key) {
		Object value = input.get(key);
		if (!(value instanceof String) || ((String) value).isBlank()) {
			throw new IllegalArgumentException("Saga 輸入缺少 " + key);
		}
		return (String) value;
	}

	public Map<String, Object> result(String stepName) {
		return results.getOrDefault(stepName, Map.of());
	}
}

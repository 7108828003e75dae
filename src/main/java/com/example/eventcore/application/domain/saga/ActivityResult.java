package com.example.eventcore.application.domain.saga;

import java.util.Map;

/**
 * 活動執行結果
 *
 * @param result            步驟輸出，後續步驟可透過 context 取得
 * @param compensationInput 補償時需要的輸入
 */
public record ActivityResult(Map<String, Object> result, Map<String, Object> compensationInput) {

	public ActivityResult {
		result = result == null ? Map.of() : result;
		compensationInput = compensationInput == null ? Map.of() : compensationInput;
	}

	public static ActivityResult of(Map<String, Object> result, Map<String, Object> compensationInput) {
		return new ActivityResult(result, compensationInput);
	}

	public static ActivityResult empty() {
		return new ActivityResult(Map.of(), Map.of());
	}
}

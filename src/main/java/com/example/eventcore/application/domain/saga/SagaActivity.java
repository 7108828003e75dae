package com.example.eventcore.application.domain.saga;

import java.util.Map;

/**
 * Saga 步驟的外部活動
 *
 * <p>
 * 兩個方法都可能被重複呼叫 (重試、恢復)，實作必須冪等。 拋出 {@code DomainValidationException} 代表業務拒絕，不會重試。
 * </p>
 */
public interface SagaActivity {

	ActivityResult execute(SagaExecutionContext context) throws Exception;

	/**
	 * 撤銷 {@link #execute} 的效果
	 *
	 * @param compensationInput 步驟成功時保存的補償輸入
	 */
	void compensate(Map<String, Object> compensationInput, SagaExecutionContext context) throws Exception;

	/**
	 * 沒有副作用需要撤銷的步驟回傳 false，補償時直接略過
	 */
	default boolean compensatable() {
		return true;
	}
}

package com.example.eventcore.application.domain.saga.vo;

/**
 * 已完成步驟的補償狀態
 */
public enum CompensationState {
	/** 尚未補償 */
	PENDING,
	/** 已補償，或該步驟不需要補償 */
	COMPENSATED,
	/** 補償失敗，需人工介入 */
	FAILED
}

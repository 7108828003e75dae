package com.example.eventcore.application.projection;

import java.time.Instant;

/**
 * 投影執行狀態
 *
 * @param checkpoint          最後成功套用的全域位置
 * @param running             背景工作是否執行中
 * @param consecutiveFailures 連續失敗次數
 * @param lastError           最近一次錯誤，成功後清除
 * @param failedPosition      最近一次失敗的事件位置
 */
public record ProjectionStatus(String projectionName, long checkpoint, boolean running, int consecutiveFailures,
		String lastError, Long failedPosition, Instant lastErrorAt, Instant lastProcessedAt) {

	public boolean isHealthy() {
		return lastError == null;
	}
}

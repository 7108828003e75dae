package com.example.eventcore.application.domain.snapshot;

import java.time.Instant;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@AllArgsConstructor
public class AggregateSnapshot {

	/**
	 * Stream 識別碼
	 */
	private String streamId;

	/**
	 * 快照所對應的最後一個事件版本，重播時從 streamVersion + 1 開始讀取
	 */
	private long streamVersion;

	/**
	 * 該版本之後的聚合狀態 (JSON 物件)
	 */
	private Map<String, Object> state;

	/**
	 * 快照建立時間
	 */
	private Instant takenAt;
}

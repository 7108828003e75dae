package com.example.eventcore.application.domain.saga;

import java.time.Instant;
import java.util.Map;

import com.example.eventcore.application.domain.saga.vo.SagaLogType;

import lombok.Builder;
import lombok.Value;

/**
 * Saga 執行日誌 (append-only)
 *
 * <p>
 * 依 sequence 順序重播即可還原 Saga 的狀態、步驟索引與已完成步驟。
 * </p>
 */
@Value
@Builder
public class SagaLogEntry {

	String sagaId;

	long sequence;

	SagaLogType type;

	/**
	 * 與步驟無關的紀錄為 null
	 */
	Integer stepIndex;

	String stepName;

	int attempt;

	Map<String, Object> data;

	String error;

	Instant recordedAt;
}

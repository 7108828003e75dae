package com.example.eventcore.application.domain.event;

import java.time.Instant;
import java.util.Map;

import lombok.Builder;
import lombok.Value;

/**
 * 已寫入事件日誌的不可變事實 (Recorded Event)
 *
 * <p>
 * {@code (streamId, streamVersion)} 唯一；{@code globalPosition} 在所有 Stream 間唯一且嚴格遞增。
 * payload 為 JSON 物件的 Map 表示，讀取端應視為唯讀。
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class RecordedEvent {

	String streamId;

	String streamType;

	String eventType;

	int schemaVersion;

	/**
	 * Stream 內序號，由 0 開始且無間隙
	 */
	long streamVersion;

	/**
	 * 全域序號，由 1 開始
	 */
	long globalPosition;

	Map<String, Object> payload;

	Instant occurredAt;

	String correlationId;

	String causationId;
}

package com.example.eventcore.application.domain.event;

import java.time.Instant;
import java.util.Map;

import lombok.Builder;
import lombok.Value;

/**
 * 待追加的事件，版本與全域序號由事件日誌在寫入時指派
 */
@Value
@Builder
public class NewEvent {

	String streamType;

	String eventType;

	int schemaVersion;

	Map<String, Object> payload;

	Instant occurredAt;

	String correlationId;

	String causationId;
}

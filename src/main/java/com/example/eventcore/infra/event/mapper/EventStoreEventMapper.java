package com.example.eventcore.infra.event.mapper;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.eventstore.dbclient.EventData;
import com.eventstore.dbclient.ResolvedEvent;
import com.example.eventcore.application.domain.event.NewEvent;
import com.example.eventcore.application.domain.event.RecordedEvent;
import com.example.eventcore.infra.event.codec.EventJsonCodec;

import lombok.RequiredArgsConstructor;

/**
 * EventStoreDB 事件映射器
 *
 * <p>
 * EventStoreDB 的事件本體只存 payload；streamType、schemaVersion、occurredAt 與追蹤 ID 放在 user metadata。
 * 全域位置使用 prepare position (同一次追加的事件共用 commit position，prepare position 才是每個事件唯一)，
 * Stream 版本使用 revision。
 * </p>
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "eventcore.event-log", name = "backend", havingValue = "eventstoredb")
public class EventStoreEventMapper {

	static final String STREAM_TYPE = "streamType";
	static final String SCHEMA_VERSION = "schemaVersion";
	static final String OCCURRED_AT = "occurredAt";
	static final String CORRELATION_ID = "correlationId";
	static final String CAUSATION_ID = "causationId";

	private final EventJsonCodec codec;

	/**
	 * 轉為可寫入 EventStoreDB 的 {@link EventData}，事件 ID 隨機產生
	 */
	public EventData toEventData(NewEvent event) {
		Map<String, Object> metadata = new LinkedHashMap<>();
		metadata.put(STREAM_TYPE, event.getStreamType());
		metadata.put(SCHEMA_VERSION, event.getSchemaVersion());
		metadata.put(OCCURRED_AT, event.getOccurredAt().toString());
		metadata.put(CORRELATION_ID, event.getCorrelationId());
		metadata.put(CAUSATION_ID, event.getCausationId());
		return EventData.builderAsJson(UUID.randomUUID(), event.getEventType(), codec.serializeToBytes(event.getPayload()))
				.metadataAsBytes(codec.serializeToBytes(metadata)).build();
	}

	/**
	 * 還原為日誌事件；缺少 metadata 的外部事件以 schemaVersion 1 與寫入時間處理
	 *
	 * @throws IllegalStateException payload 或 metadata 不是合法 JSON
	 */
	public RecordedEvent toRecordedEvent(ResolvedEvent resolvedEvent) {
		com.eventstore.dbclient.RecordedEvent source = resolvedEvent.getEvent();
		Map<String, Object> metadata = codec.deserializeToMap(source.getUserMetadata());
		Object schemaVersion = metadata.get(SCHEMA_VERSION);
		Object occurredAt = metadata.get(OCCURRED_AT);
		return RecordedEvent.builder().streamId(source.getStreamId())
				.streamType((String) metadata.get(STREAM_TYPE)).eventType(source.getEventType())
				.schemaVersion(schemaVersion == null ? 1 : ((Number) schemaVersion).intValue())
				.streamVersion(source.getRevision()).globalPosition(source.getPosition().getPrepareUnsigned())
				.payload(Collections.unmodifiableMap(codec.deserializeToMap(source.getEventData())))
				.occurredAt(occurredAt == null ? source.getCreated() : Instant.parse((String) occurredAt))
				.correlationId((String) metadata.get(CORRELATION_ID))
				.causationId((String) metadata.get(CAUSATION_ID)).build();
	}

	/**
	 * {@code $} 開頭的系統 Stream 與系統事件不屬於業務日誌
	 */
	public boolean isSystemEvent(ResolvedEvent resolvedEvent) {
		com.eventstore.dbclient.RecordedEvent source = resolvedEvent.getEvent();
		return source == null || source.getStreamId().startsWith("$") || source.getEventType().startsWith("$");
	}
}

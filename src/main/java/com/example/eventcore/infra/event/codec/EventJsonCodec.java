package com.example.eventcore.infra.event.codec;

import java.util.LinkedHashMap;
import java.util.Map;

import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * 事件與狀態的 JSON 編解碼器
 *
 * <p>
 * 負責將領域 payload、聚合狀態、Saga 資料與 JSON / Map 之間互相轉換，完全獨立於事件日誌、投影或 RingBuffer 的實作。
 * 序列化/反序列化失敗均視為系統錯誤。
 * </p>
 */
public class EventJsonCodec {

	private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
	};

	private final ObjectMapper objectMapper;

	/**
	 * @param objectMapper Jackson ObjectMapper
	 */
	public EventJsonCodec(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * 將物件序列化為 JSON 字串，null 會序列化為 {@code null}
	 */
	public String serialize(Object value) {
		try {
			return objectMapper.writeValueAsString(value);
		} catch (Exception e) {
			throw new IllegalStateException(typeName(value) + " JSON 序列化失敗", e);
		}
	}

	public byte[] serializeToBytes(Object value) {
		try {
			return objectMapper.writeValueAsBytes(value);
		} catch (Exception e) {
			throw new IllegalStateException(typeName(value) + " JSON 序列化失敗", e);
		}
	}

	/**
	 * 將 JSON 物件字串還原為 Map；空白或 null 視為空物件
	 */
	public Map<String, Object> deserializeToMap(String json) {
		if (json == null || json.isBlank()) {
			return new LinkedHashMap<>();
		}
		try {
			return objectMapper.readValue(json, MAP_TYPE);
		} catch (Exception e) {
			throw new IllegalStateException("JSON 物件反序列化失敗", e);
		}
	}

	public Map<String, Object> deserializeToMap(byte[] json) {
		if (json == null || json.length == 0) {
			return new LinkedHashMap<>();
		}
		try {
			return objectMapper.readValue(json, MAP_TYPE);
		} catch (Exception e) {
			throw new IllegalStateException("JSON 物件反序列化失敗", e);
		}
	}

	/**
	 * 將領域物件轉為 JSON 物件的 Map 表示
	 */
	public Map<String, Object> toMap(Object value) {
		if (value == null) {
			return new LinkedHashMap<>();
		}
		try {
			return objectMapper.convertValue(value, MAP_TYPE);
		} catch (Exception e) {
			throw new IllegalStateException(typeName(value) + " 轉換為 Map 失敗", e);
		}
	}

	/**
	 * 將 JSON 物件的 Map 表示還原為指定型別
	 */
	public <T> T fromMap(Map<String, Object> map, Class<T> type) {
		try {
			return objectMapper.convertValue(map, type);
		} catch (Exception e) {
			throw new IllegalStateException(type.getSimpleName() + " 由 Map 還原失敗", e);
		}
	}

	private static String typeName(Object value) {
		return value == null ? "null" : value.getClass().getSimpleName();
	}
}

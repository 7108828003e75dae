package com.example.eventcore.application.domain.upcast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.example.eventcore.application.domain.event.RecordedEvent;
import com.example.eventcore.application.shared.exception.SchemaUpcastException;

import lombok.extern.slf4j.Slf4j;

/**
 * 事件結構升級鏈 (Upcasting Chain)
 *
 * <p>
 * 啟動時依 {@code (eventType, fromVersion)} 建立索引，讀取時反覆套用符合的升級器，直到沒有下一個轉換為止。
 * 儲存中的原始事件永遠不會被修改，每個升級器拿到的都是 payload 的深層副本。
 * </p>
 */
@Slf4j
public class UpcasterChain {

	private final Map<String, Upcaster> registry = new HashMap<>();

	public UpcasterChain(List<? extends Upcaster> upcasters) {
		for (Upcaster upcaster : upcasters) {
			if (upcaster.toVersion() <= upcaster.fromVersion()) {
				throw new IllegalStateException("Upcaster " + upcaster.getClass().getSimpleName() + " 的目標版本必須大於來源版本");
			}
			Upcaster previous = registry.putIfAbsent(key(upcaster.eventType(), upcaster.fromVersion()), upcaster);
			if (previous != null) {
				throw new IllegalStateException("重複註冊的 Upcaster: " + upcaster.eventType() + "@v"
						+ upcaster.fromVersion() + " (" + previous.getClass().getSimpleName() + ", "
						+ upcaster.getClass().getSimpleName() + ")");
			}
		}
		log.info(">>> [Upcast] 已註冊 {} 個事件升級器", registry.size());
	}

	public static UpcasterChain empty() {
		return new UpcasterChain(List.of());
	}

	/**
	 * 將事件升級到鏈上可到達的最新版本；已是最新版本的事件原樣回傳。
	 */
	public RecordedEvent upcast(RecordedEvent event) {
		RecordedEvent current = event;
		Upcaster upcaster;
		while ((upcaster = registry.get(key(current.getEventType(), current.getSchemaVersion()))) != null) {
			Map<String, Object> upgraded;
			try {
				upgraded = upcaster.upcast(deepCopy(current.getPayload()));
			} catch (RuntimeException e) {
				throw new SchemaUpcastException(current.getEventType(), current.getSchemaVersion(),
						"升級失敗 (stream=" + current.getStreamId() + ", version=" + current.getStreamVersion() + ")", e);
			}
			if (upgraded == null) {
				throw new SchemaUpcastException(current.getEventType(), current.getSchemaVersion(), "升級器回傳空的 payload");
			}
			current = current.toBuilder().schemaVersion(upcaster.toVersion())
					.payload(Collections.unmodifiableMap(upgraded)).build();
		}
		return current;
	}

	/**
	 * 升級事件並確認結果與消費端註冊的版本一致，缺少中間環節時拋出 {@link SchemaUpcastException}。
	 */
	public RecordedEvent upcast(RecordedEvent event, int expectedVersion) {
		RecordedEvent upgraded = upcast(event);
		if (upgraded.getSchemaVersion() != expectedVersion) {
			throw new SchemaUpcastException(event.getEventType(), event.getSchemaVersion(),
					"無法升級至 v" + expectedVersion + "，升級鏈停在 v" + upgraded.getSchemaVersion());
		}
		return upgraded;
	}

	private static String key(String eventType, int version) {
		return eventType + "@" + version;
	}

	@SuppressWarnings("unchecked")
	private static Object copyValue(Object value) {
		if (value instanceof Map) {
			return deepCopy((Map<String, Object>) value);
		}
		if (value instanceof List) {
			List<Object> copy = new ArrayList<>();
			for (Object element : (List<Object>) value) {
				copy.add(copyValue(element));
			}
			return copy;
		}
		return value;
	}

	private static Map<String, Object> deepCopy(Map<String, Object> payload) {
		Map<String, Object> copy = new LinkedHashMap<>();
		if (payload != null) {
			payload.forEach((k, v) -> copy.put(k, copyValue(v)));
		}
		return copy;
	}
}

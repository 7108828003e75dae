package com.example.eventcore.application.domain.upcast;

import java.util.Map;

/**
 * 單一事件結構升級器
 *
 * <p>
 * 將 {@link #eventType()} 的 {@link #fromVersion()} 版 payload 轉換為 {@link #toVersion()} 版。
 * 實作必須為純函式：不得存取外部資源，也不得依賴呼叫順序以外的狀態。
 * </p>
 */
public interface Upcaster {

	String eventType();

	int fromVersion();

	default int toVersion() {
		return fromVersion() + 1;
	}

	/**
	 * @param payload 舊版 payload 的副本，可直接修改
	 * @return 新版 payload
	 */
	Map<String, Object> upcast(Map<String, Object> payload);
}

package com.example.eventcore.application.shared.exception;

import lombok.Getter;

/**
 * 事件結構升級失敗 (致命錯誤)
 *
 * <p>
 * 代表缺少或損壞的 Upcaster，必須中止該 Stream 的重播，而不是默默丟棄資料。
 * </p>
 */
@Getter
public class SchemaUpcastException extends EventCoreException {

	private static final long serialVersionUID = 1L;

	private final String eventType;
	private final int schemaVersion;

	public SchemaUpcastException(String eventType, int schemaVersion, String message) {
		super(eventType + "@v" + schemaVersion + ": " + message);
		this.eventType = eventType;
		this.schemaVersion = schemaVersion;
	}

	public SchemaUpcastException(String eventType, int schemaVersion, String message, Throwable cause) {
		super(eventType + "@v" + schemaVersion + ": " + message, cause);
		this.eventType = eventType;
		this.schemaVersion = schemaVersion;
	}
}

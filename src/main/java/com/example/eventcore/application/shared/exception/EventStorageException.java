package com.example.eventcore.application.shared.exception;

/**
 * 底層儲存故障，回報給呼叫端，事件日誌本身不會自動重試
 */
public class EventStorageException extends EventCoreException {

	private static final long serialVersionUID = 1L;

	public EventStorageException(String message, Throwable cause) {
		super(message, cause);
	}
}

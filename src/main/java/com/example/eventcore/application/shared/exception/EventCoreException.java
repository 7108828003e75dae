package com.example.eventcore.application.shared.exception;

/**
 * 事件核心的例外基底類別
 *
 * <p>
 * 所有事件溯源、投影與 Saga 相關的錯誤皆繼承自此類別，方便介面層統一轉譯。
 * </p>
 */
public abstract class EventCoreException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	protected EventCoreException(String message) {
		super(message);
	}

	protected EventCoreException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * 呼叫端是否可以透過「重新載入 + 重試」解決此錯誤
	 */
	public boolean isRetryable() {
		return false;
	}
}

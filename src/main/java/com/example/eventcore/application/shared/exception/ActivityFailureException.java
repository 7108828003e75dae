package com.example.eventcore.application.shared.exception;

import lombok.Getter;

/**
 * Saga 步驟的外部活動 (Activity) 執行失敗
 */
@Getter
public class ActivityFailureException extends EventCoreException {

	private static final long serialVersionUID = 1L;

	private final String stepName;
	private final boolean retryable;

	public ActivityFailureException(String stepName, String message, boolean retryable) {
		super("步驟 " + stepName + " 失敗: " + message);
		this.stepName = stepName;
		this.retryable = retryable;
	}

	public ActivityFailureException(String stepName, String message, boolean retryable, Throwable cause) {
		super("步驟 " + stepName + " 失敗: " + message, cause);
		this.stepName = stepName;
		this.retryable = retryable;
	}

	@Override
	public boolean isRetryable() {
		return retryable;
	}
}

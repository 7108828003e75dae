package com.example.eventcore.application.shared.exception;

import lombok.Getter;

/**
 * 補償動作失敗
 *
 * <p>
 * 僅記錄並標記為需人工介入，不會中斷其他步驟的補償流程。
 * </p>
 */
@Getter
public class CompensationFailureException extends EventCoreException {

	private static final long serialVersionUID = 1L;

	private final String stepName;

	public CompensationFailureException(String stepName, Throwable cause) {
		super("步驟 " + stepName + " 補償失敗: " + cause.getMessage(), cause);
		this.stepName = stepName;
	}
}

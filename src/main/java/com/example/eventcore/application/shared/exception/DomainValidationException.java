package com.example.eventcore.application.shared.exception;

/**
 * 領域規則驗證失敗
 *
 * <p>
 * 指令在聚合根目前狀態下不可執行時拋出，不可重試，原樣回傳給呼叫端。
 * </p>
 */
public class DomainValidationException extends EventCoreException {

	private static final long serialVersionUID = 1L;

	public DomainValidationException(String message) {
		super(message);
	}
}

package com.example.eventcore.application.shared.exception;

public class SagaNotFoundException extends EventCoreException {

	private static final long serialVersionUID = 1L;

	public SagaNotFoundException(String sagaId) {
		super("找不到 Saga: " + sagaId);
	}
}

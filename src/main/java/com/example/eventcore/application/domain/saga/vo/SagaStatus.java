package com.example.eventcore.application.domain.saga.vo;

public enum SagaStatus {
	RUNNING,
	COMPENSATING,
	COMPLETED,
	FAILED;

	public boolean isTerminal() {
		return this == COMPLETED || this == FAILED;
	}
}

package com.example.eventcore.application.domain.saga.vo;

public enum SagaLogType {
	SAGA_STARTED,
	STEP_ATTEMPTED,
	STEP_ATTEMPT_FAILED,
	STEP_SUCCEEDED,
	STEP_FAILED,
	COMPENSATION_STARTED,
	COMPENSATION_ATTEMPTED,
	COMPENSATION_SUCCEEDED,
	COMPENSATION_FAILED,
	COMPENSATION_SKIPPED,
	SAGA_COMPLETED,
	SAGA_FAILED
}

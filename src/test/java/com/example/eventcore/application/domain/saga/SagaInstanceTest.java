package com.example.eventcore.application.domain.saga;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.eventcore.application.domain.saga.vo.CompensationState;
import com.example.eventcore.application.domain.saga.vo.SagaLogType;
import com.example.eventcore.application.domain.saga.vo.SagaStatus;

class SagaInstanceTest {

	private static final Instant AT = Instant.parse("2026-01-01T00:00:00Z");

	@Test
	@DisplayName("由日誌重播：完成步驟、補償狀態與失敗原因")
	void replayCompensatedSaga() {
		List<SagaLogEntry> log = List.of(
				entry(1, SagaLogType.SAGA_STARTED, null, null,
						Map.of("definitionName", "order-checkout", "input", Map.of("orderId", "o-1")), null),
				entry(2, SagaLogType.STEP_ATTEMPTED, 0, "debit", null, null),
				entry(3, SagaLogType.STEP_SUCCEEDED, 0, "debit",
						Map.of("result", Map.of("tx", "t-1"), "compensationInput", Map.of("amountCents", 100)), null),
				entry(4, SagaLogType.STEP_SUCCEEDED, 1, "credit", Map.of("result", Map.of()), null),
				entry(5, SagaLogType.STEP_FAILED, 2, "confirm", null, "boom"),
				entry(6, SagaLogType.COMPENSATION_STARTED, null, null, null, "步驟 confirm 失敗: boom"),
				entry(7, SagaLogType.COMPENSATION_SUCCEEDED, 1, "credit", null, null),
				entry(8, SagaLogType.COMPENSATION_FAILED, 0, "debit", null, "refund failed"));

		SagaInstance instance = SagaInstance.replay(log).orElseThrow();

		assertThat(instance.getDefinitionName()).isEqualTo("order-checkout");
		assertThat(instance.getInput()).containsEntry("orderId", "o-1");
		assertThat(instance.getStatus()).isEqualTo(SagaStatus.COMPENSATING);
		assertThat(instance.getCurrentStepIndex()).isEqualTo(2);
		assertThat(instance.getFailureReason()).isEqualTo("步驟 confirm 失敗: boom");
		assertThat(instance.completedStep(0)).get().satisfies(step -> {
			assertThat(step.getCompensationState()).isEqualTo(CompensationState.FAILED);
			assertThat(step.getCompensationInput()).containsEntry("amountCents", 100);
		});
		assertThat(instance.completedStep(1)).get().extracting(CompletedStep::getCompensationState)
				.isEqualTo(CompensationState.COMPENSATED);
	}

	@Test
	@DisplayName("空日誌回傳 empty；缺少開始紀錄視為損毀")
	void emptyOrBrokenLog() {
		assertThat(SagaInstance.replay(List.of())).isEmpty();
		assertThatThrownBy(() -> SagaInstance.replay(List.of(entry(1, SagaLogType.SAGA_COMPLETED, null, null, null, null))))
				.isInstanceOf(IllegalStateException.class);
	}

	private static SagaLogEntry entry(long sequence, SagaLogType type, Integer stepIndex, String stepName,
			Map<String, Object> data, String error) {
		return SagaLogEntry.builder().sagaId("saga-1").sequence(sequence).type(type).stepIndex(stepIndex)
				.stepName(stepName).data(data).error(error).recordedAt(AT.plusSeconds(sequence)).build();
	}
}

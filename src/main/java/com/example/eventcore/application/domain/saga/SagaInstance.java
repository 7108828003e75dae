package com.example.eventcore.application.domain.saga;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.example.eventcore.application.domain.saga.vo.CompensationState;
import com.example.eventcore.application.domain.saga.vo.SagaLogType;
import com.example.eventcore.application.domain.saga.vo.SagaStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Saga 執行個體
 *
 * <p>
 * 每完成一個步驟都會先持久化再前進；{@code version} 供樂觀鎖使用，避免兩個程序同時推進同一個 Saga。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SagaInstance {

	private String sagaId;

	private String definitionName;

	private SagaStatus status;

	/**
	 * 下一個要執行的正向步驟
	 */
	private int currentStepIndex;

	private Map<String, Object> input;

	@Builder.Default
	private List<CompletedStep> completedSteps = new ArrayList<>();

	private String failureReason;

	private long version;

	private Instant createdAt;

	private Instant updatedAt;

	public Optional<CompletedStep> completedStep(int stepIndex) {
		return completedSteps.stream().filter(s -> s.getStepIndex() == stepIndex).findFirst();
	}

	/**
	 * 依序重播 Saga 日誌，還原狀態、步驟索引與已完成步驟 (不含 version)
	 *
	 * @param log 依 sequence 排序的日誌
	 * @return 重建的執行個體；日誌為空時回傳 empty
	 */
	@SuppressWarnings("unchecked")
	public static Optional<SagaInstance> replay(List<SagaLogEntry> log) {
		SagaInstance instance = null;
		for (SagaLogEntry entry : log) {
			if (entry.getType() == SagaLogType.SAGA_STARTED) {
				Map<String, Object> data = entry.getData() == null ? Map.of() : entry.getData();
				Object input = data.get("input");
				instance = SagaInstance.builder().sagaId(entry.getSagaId())
						.definitionName((String) data.get("definitionName")).status(SagaStatus.RUNNING)
						.currentStepIndex(0)
						.input(input instanceof Map ? new LinkedHashMap<>((Map<String, Object>) input)
								: new LinkedHashMap<>())
						.createdAt(entry.getRecordedAt()).updatedAt(entry.getRecordedAt()).build();
				continue;
			}
			if (instance == null) {
				throw new IllegalStateException("Saga 日誌缺少 SAGA_STARTED: " + entry.getSagaId());
			}
			instance.apply(entry);
		}
		return Optional.ofNullable(instance);
	}

	@SuppressWarnings("unchecked")
	private void apply(SagaLogEntry entry) {
		updatedAt = entry.getRecordedAt();
		switch (entry.getType()) {
		case STEP_SUCCEEDED -> {
			Map<String, Object> data = entry.getData() == null ? Map.of() : entry.getData();
			completedSteps.add(CompletedStep.builder().stepIndex(entry.getStepIndex()).stepName(entry.getStepName())
					.result((Map<String, Object>) data.get("result"))
					.compensationInput((Map<String, Object>) data.get("compensationInput"))
					.compensationState(CompensationState.PENDING).build());
			currentStepIndex = entry.getStepIndex() + 1;
		}
		case COMPENSATION_STARTED -> {
			status = SagaStatus.COMPENSATING;
			failureReason = entry.getError();
		}
		case COMPENSATION_SUCCEEDED, COMPENSATION_SKIPPED -> completedStep(entry.getStepIndex())
				.ifPresent(s -> s.setCompensationState(CompensationState.COMPENSATED));
		case COMPENSATION_FAILED -> completedStep(entry.getStepIndex())
				.ifPresent(s -> s.setCompensationState(CompensationState.FAILED));
		case SAGA_COMPLETED -> status = SagaStatus.COMPLETED;
		case SAGA_FAILED -> {
			status = SagaStatus.FAILED;
			if (entry.getError() != null) {
				failureReason = entry.getError();
			}
		}
		default -> {
			// 嘗試類紀錄不影響狀態
		}
		}
	}
}

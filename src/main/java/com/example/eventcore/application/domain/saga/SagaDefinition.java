package com.example.eventcore.application.domain.saga;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Saga 定義：固定順序的步驟清單
 */
public record SagaDefinition(String name, List<SagaStep> steps) {

	public SagaDefinition {
		if (steps == null || steps.isEmpty()) {
			throw new IllegalArgumentException("Saga " + name + " 至少需要一個步驟");
		}
		Set<String> names = new HashSet<>();
		for (SagaStep step : steps) {
			if (!names.add(step.name())) {
				throw new IllegalArgumentException("Saga " + name + " 步驟名稱重複: " + step.name());
			}
		}
		steps = List.copyOf(steps);
	}

	public static SagaDefinition of(String name, SagaStep... steps) {
		return new SagaDefinition(name, List.of(steps));
	}

	public SagaStep step(int index) {
		return steps.get(index);
	}

	public int size() {
		return steps.size();
	}
}

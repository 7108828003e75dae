package com.example.eventcore.application.domain.saga;

/**
 * Saga 的單一步驟
 */
public record SagaStep(String name, SagaActivity activity) {
}

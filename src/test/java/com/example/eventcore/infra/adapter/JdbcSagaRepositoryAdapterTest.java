package com.example.eventcore.infra.adapter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.eventcore.application.domain.saga.CompletedStep;
import com.example.eventcore.application.domain.saga.SagaInstance;
import com.example.eventcore.application.domain.saga.SagaLogEntry;
import com.example.eventcore.application.domain.saga.vo.CompensationState;
import com.example.eventcore.application.domain.saga.vo.SagaLogType;
import com.example.eventcore.application.domain.saga.vo.SagaStatus;
import com.example.eventcore.application.shared.exception.ConcurrencyConflictException;
import com.example.eventcore.support.TestDatabase;

/**
 * <h1>Saga 持久化測試</h1>
 *
 * <pre>
 * <b>Feature:</b> Saga 狀態、已完成步驟與日誌在同一交易內寫入，並以 version 防止重複推進
 * </pre>
 */
class JdbcSagaRepositoryAdapterTest {

	private static final Instant NOW = Instant.now().truncatedTo(ChronoUnit.MILLIS);

	private TestDatabase database;
	private JdbcSagaRepositoryAdapter repository;

	@BeforeEach
	void setUp() {
		database = TestDatabase.create();
		repository = new JdbcSagaRepositoryAdapter(database.jdbcTemplate(), database.transactionManager(),
				database.codec());
	}

	@AfterEach
	void tearDown() {
		database.shutdown();
	}

	@Test
	@DisplayName("建立後更新：狀態、已完成步驟與日誌都能讀回，version 加一")
	void createAndUpdate() {
		// Given
		SagaInstance instance = newInstance("saga-1", NOW);
		repository.create(instance, entry("saga-1", 1, SagaLogType.SAGA_STARTED, null, Map.of("definitionName", "demo")));

		// When
		instance.getCompletedSteps().add(CompletedStep.builder().stepIndex(0).stepName("a").result(Map.of("x", 1))
				.compensationInput(Map.of("undo", "a")).compensationState(CompensationState.PENDING).build());
		instance.setCurrentStepIndex(1);
		repository.update(instance, List.of(entry("saga-1", 2, SagaLogType.STEP_SUCCEEDED, 0, null)));

		// Then
		assertThat(instance.getVersion()).isEqualTo(1);
		SagaInstance loaded = repository.findById("saga-1").orElseThrow();
		assertThat(loaded.getStatus()).isEqualTo(SagaStatus.RUNNING);
		assertThat(loaded.getCurrentStepIndex()).isEqualTo(1);
		assertThat(loaded.getVersion()).isEqualTo(1);
		assertThat(loaded.getInput()).containsEntry("orderId", "o-1");
		assertThat(loaded.getCompletedSteps()).singleElement().satisfies(step -> {
			assertThat(step.getStepName()).isEqualTo("a");
			assertThat(step.getCompensationInput()).containsEntry("undo", "a");
			assertThat(step.getCompensationState()).isEqualTo(CompensationState.PENDING);
		});

		List<SagaLogEntry> log = repository.findLog("saga-1");
		assertThat(log).extracting(SagaLogEntry::getType).containsExactly(SagaLogType.SAGA_STARTED,
				SagaLogType.STEP_SUCCEEDED);
		assertThat(log.get(0).getStepIndex()).isNull();
		assertThat(log.get(0).getData()).containsEntry("definitionName", "demo");
		assertThat(log.get(1).getStepIndex()).isZero();
		assertThat(repository.lastLogSequence("saga-1")).isEqualTo(2);
	}

	@Test
	@DisplayName("以過期的 version 更新會衝突，日誌也不會寫入")
	void staleVersionIsRejected() {
		SagaInstance instance = newInstance("saga-2", NOW);
		repository.create(instance, entry("saga-2", 1, SagaLogType.SAGA_STARTED, null, null));
		SagaInstance other = repository.findById("saga-2").orElseThrow();
		repository.update(other, List.of(entry("saga-2", 2, SagaLogType.STEP_ATTEMPTED, 0, null)));

		instance.setStatus(SagaStatus.COMPENSATING);
		assertThatThrownBy(() -> repository.update(instance,
				List.of(entry("saga-2", 3, SagaLogType.COMPENSATION_STARTED, null, null))))
				.isInstanceOf(ConcurrencyConflictException.class);

		assertThat(repository.findById("saga-2").orElseThrow().getStatus()).isEqualTo(SagaStatus.RUNNING);
		assertThat(repository.lastLogSequence("saga-2")).isEqualTo(2);
	}

	@Test
	@DisplayName("取消旗標、逾期查詢與結束 Saga 的清理")
	void cancelStaleAndCleanup() {
		Instant old = NOW.minus(Duration.ofHours(2));
		SagaInstance stale = newInstance("stale", old);
		SagaInstance fresh = newInstance("fresh", NOW);
		SagaInstance done = newInstance("done", old);
		done.setStatus(SagaStatus.COMPLETED);
		repository.create(stale, entry("stale", 1, SagaLogType.SAGA_STARTED, null, null));
		repository.create(fresh, entry("fresh", 1, SagaLogType.SAGA_STARTED, null, null));
		repository.create(done, entry("done", 1, SagaLogType.SAGA_STARTED, null, null));

		repository.requestCancel("fresh");

		assertThat(repository.isCancelRequested("fresh")).isTrue();
		assertThat(repository.isCancelRequested("stale")).isFalse();
		assertThat(repository.isCancelRequested("unknown")).isFalse();
		assertThat(repository.findStale(NOW.minus(Duration.ofHours(1)), 10)).containsExactly("stale");

		assertThat(repository.deleteFinishedBefore(NOW.minus(Duration.ofHours(1)))).isEqualTo(1);
		assertThat(repository.findById("done")).isEmpty();
		assertThat(repository.findLog("done")).isEmpty();
		assertThat(repository.findById("stale")).isPresent();
	}

	private static SagaInstance newInstance(String sagaId, Instant at) {
		return SagaInstance.builder().sagaId(sagaId).definitionName("demo").status(SagaStatus.RUNNING)
				.currentStepIndex(0).input(Map.of("orderId", "o-1")).completedSteps(new ArrayList<>()).version(0)
				.createdAt(at).updatedAt(at).build();
	}

	private static SagaLogEntry entry(String sagaId, long sequence, SagaLogType type, Integer stepIndex,
			Map<String, Object> data) {
		return SagaLogEntry.builder().sagaId(sagaId).sequence(sequence).type(type).stepIndex(stepIndex)
				.stepName(stepIndex == null ? null : "a").attempt(1).data(data).recordedAt(NOW).build();
	}
}

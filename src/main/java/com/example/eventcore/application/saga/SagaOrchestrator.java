package com.example.eventcore.application.saga;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.example.eventcore.application.domain.saga.ActivityResult;
import com.example.eventcore.application.domain.saga.CompletedStep;
import com.example.eventcore.application.domain.saga.RetryPolicy;
import com.example.eventcore.application.domain.saga.SagaDefinition;
import com.example.eventcore.application.domain.saga.SagaExecutionContext;
import com.example.eventcore.application.domain.saga.SagaInstance;
import com.example.eventcore.application.domain.saga.SagaLogEntry;
import com.example.eventcore.application.domain.saga.SagaStep;
import com.example.eventcore.application.domain.saga.vo.CompensationState;
import com.example.eventcore.application.domain.saga.vo.SagaLogType;
import com.example.eventcore.application.domain.saga.vo.SagaStatus;
import com.example.eventcore.application.port.SagaRepositoryPort;
import com.example.eventcore.application.shared.exception.ActivityFailureException;
import com.example.eventcore.application.shared.exception.CompensationFailureException;
import com.example.eventcore.application.shared.exception.ConcurrencyConflictException;
import com.example.eventcore.application.shared.exception.DomainValidationException;
import com.example.eventcore.application.shared.exception.SagaNotFoundException;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

/**
 * Saga 協調者 (Orchestration-based Saga)
 *
 * <p>
 * 依定義的順序執行步驟，每個步驟成功後先持久化 (狀態 + 日誌) 才前進。 任何步驟用盡重試仍失敗時，依相反順序補償已完成的步驟；
 * 補償失敗只會記錄並標記，不會中斷其餘補償。
 * </p>
 *
 * <h2>執行保證：</h2>
 * <ul>
 * <li><b>單一驅動者</b>：同一程序內一個 Saga 同時只會被一條執行緒推進 (active registry)，跨程序則由資料列 version 樂觀鎖把關。</li>
 * <li><b>步驟逾時</b>：每次嘗試都在步驟執行緒池上執行，超過時限即中斷並視為可重試的失敗。</li>
 * <li><b>可恢復</b>：程序重啟後，{@link #resume(String)} 會從持久化的步驟索引或尚未補償的步驟繼續。</li>
 * </ul>
 */
@Slf4j
public class SagaOrchestrator {

	private static final String CANCELLED = "Saga 已取消";
	private static final int STALE_SCAN_LIMIT = 100;

	private final Map<String, SagaDefinition> definitions = new ConcurrentHashMap<>();
	private final Map<String, ExecutionHandle> active = new ConcurrentHashMap<>();

	private final SagaRepositoryPort repository;
	private final ExecutorService stepExecutor;
	private final ExecutorService coordinatorExecutor;
	private final Duration stepTimeout;
	private final RetryPolicy retryPolicy;
	private final RetryPolicy compensationPolicy;
	private final Clock clock;

	public SagaOrchestrator(List<SagaDefinition> definitions, SagaRepositoryPort repository,
			ExecutorService stepExecutor, ExecutorService coordinatorExecutor, Duration stepTimeout,
			RetryPolicy retryPolicy, RetryPolicy compensationPolicy, Clock clock) {
		definitions.forEach(this::register);
		this.repository = repository;
		this.stepExecutor = stepExecutor;
		this.coordinatorExecutor = coordinatorExecutor;
		this.stepTimeout = stepTimeout;
		this.retryPolicy = retryPolicy;
		this.compensationPolicy = compensationPolicy;
		this.clock = clock;
	}

	public void register(SagaDefinition definition) {
		SagaDefinition previous = definitions.putIfAbsent(definition.name(), definition);
		if (previous != null && previous != definition) {
			throw new IllegalStateException("Saga 定義名稱重複: " + definition.name());
		}
	}

	/**
	 * 建立 Saga 並同步執行到結束 (COMPLETED / FAILED)
	 */
	public SagaInstance start(SagaDefinition definition, Map<String, Object> input) {
		register(definition);
		SagaInstance instance = create(definition, input);
		return drive(definition, instance);
	}

	public SagaInstance start(String definitionName, Map<String, Object> input) {
		return start(definition(definitionName), input);
	}

	/**
	 * 建立 Saga 後交由協調執行緒池推進，立即回傳 sagaId
	 */
	public String startAsync(String definitionName, Map<String, Object> input) {
		SagaDefinition definition = definition(definitionName);
		SagaInstance instance = create(definition, input);
		coordinatorExecutor.execute(() -> {
			try {
				resume(instance.getSagaId());
			} catch (RuntimeException e) {
				log.error(">>> [Saga] {} 背景執行失敗", instance.getSagaId(), e);
			}
		});
		return instance.getSagaId();
	}

	/**
	 * 從持久化狀態繼續推進；已結束或正在本程序執行中的 Saga 直接回傳目前狀態
	 */
	public SagaInstance resume(String sagaId) {
		SagaInstance instance = find(sagaId);
		if (instance.getStatus().isTerminal()) {
			return instance;
		}
		if (active.containsKey(sagaId)) {
			log.info(">>> [Saga] {} 已在執行中，略過恢復", sagaId);
			return instance;
		}
		log.info(">>> [Saga] 恢復 {} (status={}, step={})", sagaId, instance.getStatus(),
				instance.getCurrentStepIndex());
		return drive(definition(instance.getDefinitionName()), instance);
	}

	/**
	 * 取消 Saga：視同目前步驟失敗，中斷執行中的步驟並補償已完成的步驟
	 */
	public SagaInstance cancel(String sagaId) {
		SagaInstance instance = find(sagaId);
		if (instance.getStatus().isTerminal()) {
			log.info(">>> [Saga] {} 已結束 ({})，取消請求忽略", sagaId, instance.getStatus());
			return instance;
		}
		repository.requestCancel(sagaId);
		ExecutionHandle handle = active.get(sagaId);
		if (handle != null) {
			log.warn(">>> [Saga] {} 收到取消請求，中斷執行中的步驟", sagaId);
			handle.cancel();
			return find(sagaId);
		}
		log.warn(">>> [Saga] {} 收到取消請求，由本執行緒進行補償", sagaId);
		return drive(definition(instance.getDefinitionName()), instance);
	}

	public SagaInstance find(String sagaId) {
		return repository.findById(sagaId).orElseThrow(() -> new SagaNotFoundException(sagaId));
	}

	public List<SagaLogEntry> history(String sagaId) {
		find(sagaId);
		return repository.findLog(sagaId);
	}

	/**
	 * 恢復超過 olderThan 未更新的執行中 Saga (程序中斷後的孤兒)
	 *
	 * @return 成功恢復的筆數
	 */
	public int resumeStale(Duration olderThan) {
		List<String> staleIds = repository.findStale(clock.instant().minus(olderThan), STALE_SCAN_LIMIT);
		int resumed = 0;
		for (String sagaId : staleIds) {
			if (active.containsKey(sagaId)) {
				continue;
			}
			try {
				SagaInstance instance = resume(sagaId);
				log.info(">>> [Recovery] Saga {} 恢復完成: {}", sagaId, instance.getStatus());
				resumed++;
			} catch (RuntimeException e) {
				log.error(">>> [Recovery] Saga {} 恢復失敗", sagaId, e);
			}
		}
		return resumed;
	}

	public boolean isActive(String sagaId) {
		return active.containsKey(sagaId);
	}

	@PreDestroy
	public void shutdown() {
		log.info(">>> [System] 停止 Saga 協調者，執行中 {} 筆將留待恢復", active.size());
		coordinatorExecutor.shutdownNow();
		stepExecutor.shutdownNow();
	}

	private SagaDefinition definition(String name) {
		SagaDefinition definition = definitions.get(name);
		if (definition == null) {
			throw new IllegalArgumentException("未知的 Saga 定義: " + name);
		}
		return definition;
	}

	private SagaInstance create(SagaDefinition definition, Map<String, Object> input) {
		Map<String, Object> sagaInput = input == null ? new LinkedHashMap<>() : new LinkedHashMap<>(input);
		SagaInstance instance = SagaInstance.builder().sagaId(UUID.randomUUID().toString())
				.definitionName(definition.name()).status(SagaStatus.RUNNING).currentStepIndex(0).input(sagaInput)
				.completedSteps(new ArrayList<>()).version(0).createdAt(clock.instant()).updatedAt(clock.instant())
				.build();
		Map<String, Object> data = new LinkedHashMap<>();
		data.put("definitionName", definition.name());
		data.put("input", sagaInput);
		repository.create(instance, SagaLogEntry.builder().sagaId(instance.getSagaId()).sequence(1)
				.type(SagaLogType.SAGA_STARTED).data(data).recordedAt(clock.instant()).build());
		log.info(">>> [Saga] 建立 {} ({})，共 {} 個步驟", instance.getSagaId(), definition.name(), definition.size());
		return instance;
	}

	private SagaInstance drive(SagaDefinition definition, SagaInstance instance) {
		String sagaId = instance.getSagaId();
		ExecutionHandle handle = new ExecutionHandle();
		if (active.putIfAbsent(sagaId, handle) != null) {
			throw new IllegalStateException("Saga 已在執行中: " + sagaId);
		}
		try {
			Execution execution = new Execution(definition, instance, handle, repository.lastLogSequence(sagaId));
			if (instance.getStatus() == SagaStatus.RUNNING) {
				runForward(execution);
			}
			if (instance.getStatus() == SagaStatus.COMPENSATING) {
				runCompensation(execution);
			}
		} catch (ConcurrencyConflictException e) {
			log.warn(">>> [Saga] {} 已被其他程序推進，停止本次執行", sagaId);
		} catch (ExecutionAbortedException e) {
			log.warn(">>> [Saga] {} 執行中斷，留待恢復 (status={}, step={})", sagaId, instance.getStatus(),
					instance.getCurrentStepIndex());
		} finally {
			active.remove(sagaId, handle);
		}
		return instance;
	}

	private void runForward(Execution execution) {
		SagaInstance instance = execution.instance;
		SagaDefinition definition = execution.definition;

		while (instance.getCurrentStepIndex() < definition.size()) {
			int index = instance.getCurrentStepIndex();
			SagaStep step = definition.step(index);

			if (cancelRequested(execution)) {
				beginCompensation(execution, CANCELLED, execution.entry(SagaLogType.STEP_FAILED, index, step.name(),
						0, null, CANCELLED));
				return;
			}

			StepOutcome outcome = executeStep(execution, index, step);
			if (outcome.result != null) {
				instance.getCompletedSteps()
						.add(CompletedStep.builder().stepIndex(index).stepName(step.name())
								.result(outcome.result.result()).compensationInput(outcome.result.compensationInput())
								.compensationState(CompensationState.PENDING).build());
				instance.setCurrentStepIndex(index + 1);
				touch(instance);

				Map<String, Object> data = new LinkedHashMap<>();
				data.put("result", outcome.result.result());
				data.put("compensationInput", outcome.result.compensationInput());
				repository.update(instance, List.of(execution.entry(SagaLogType.STEP_SUCCEEDED, index, step.name(),
						outcome.attempts, data, null)));
				log.info(">>> [Saga] {} 步驟 {} ({}) 成功", instance.getSagaId(), index, step.name());
			} else {
				String reason = "步驟 " + step.name() + " 失敗: " + outcome.error;
				log.error(">>> [Saga] {} {}，開始補償", instance.getSagaId(), reason);
				beginCompensation(execution, reason, execution.entry(SagaLogType.STEP_FAILED, index, step.name(),
						outcome.attempts, null, outcome.error));
				return;
			}
		}

		instance.setStatus(SagaStatus.COMPLETED);
		touch(instance);
		repository.update(instance, List.of(execution.entry(SagaLogType.SAGA_COMPLETED, null, null, 0, null, null)));
		log.info(">>> [Saga] {} 全部步驟完成", instance.getSagaId());
	}

	private StepOutcome executeStep(Execution execution, int index, SagaStep step) {
		String sagaId = execution.instance.getSagaId();
		for (int attempt = 1;; attempt++) {
			if (cancelRequested(execution)) {
				return StepOutcome.failed(attempt - 1, CANCELLED);
			}
			SagaExecutionContext context = context(execution, step, attempt);
			repository.appendLog(execution.entry(SagaLogType.STEP_ATTEMPTED, index, step.name(), attempt, null, null));

			String error;
			boolean retryable;
			try {
				ActivityResult result = callWithTimeout(execution.handle, () -> step.activity().execute(context));
				return StepOutcome.succeeded(attempt, result == null ? ActivityResult.empty() : result);
			} catch (TimeoutException e) {
				error = "逾時 (" + stepTimeout.toMillis() + " ms)";
				retryable = true;
			} catch (CancellationException e) {
				error = CANCELLED;
				retryable = false;
			} catch (ExecutionException e) {
				error = describe(e.getCause());
				retryable = isRetryable(e.getCause());
			}

			repository.appendLog(
					execution.entry(SagaLogType.STEP_ATTEMPT_FAILED, index, step.name(), attempt, null, error));
			log.warn(">>> [Saga] {} 步驟 {} 第 {} 次嘗試失敗: {}", sagaId, step.name(), attempt, error);

			if (!retryable || !retryPolicy.hasAttemptsAfter(attempt)) {
				return StepOutcome.failed(attempt, error);
			}
			if (execution.handle.awaitCancel(retryPolicy.delayAfter(attempt))) {
				return StepOutcome.failed(attempt, CANCELLED);
			}
		}
	}

	private void beginCompensation(Execution execution, String reason, SagaLogEntry failedEntry) {
		SagaInstance instance = execution.instance;
		instance.setStatus(SagaStatus.COMPENSATING);
		instance.setFailureReason(reason);
		touch(instance);
		repository.update(instance, List.of(failedEntry,
				execution.entry(SagaLogType.COMPENSATION_STARTED, null, null, 0, null, reason)));
	}

	private void runCompensation(Execution execution) {
		SagaInstance instance = execution.instance;
		List<CompletedStep> completed = instance.getCompletedSteps();

		for (int i = completed.size() - 1; i >= 0; i--) {
			CompletedStep done = completed.get(i);
			if (done.getCompensationState() != CompensationState.PENDING) {
				continue;
			}
			SagaStep step = execution.definition.step(done.getStepIndex());

			if (!step.activity().compensatable()) {
				done.setCompensationState(CompensationState.COMPENSATED);
				touch(instance);
				repository.update(instance, List.of(execution.entry(SagaLogType.COMPENSATION_SKIPPED,
						done.getStepIndex(), done.getStepName(), 0, null, null)));
				continue;
			}

			String error = compensate(execution, done, step);
			if (error == null) {
				done.setCompensationState(CompensationState.COMPENSATED);
				touch(instance);
				repository.update(instance, List.of(execution.entry(SagaLogType.COMPENSATION_SUCCEEDED,
						done.getStepIndex(), done.getStepName(), 0, null, null)));
				log.info(">>> [Saga] {} 已補償步驟 {}", instance.getSagaId(), done.getStepName());
			} else {
				done.setCompensationState(CompensationState.FAILED);
				touch(instance);
				repository.update(instance, List.of(execution.entry(SagaLogType.COMPENSATION_FAILED,
						done.getStepIndex(), done.getStepName(), 0, null, error)));
				log.error(">>> [Saga] {} 補償失敗，需人工介入", instance.getSagaId(),
						new CompensationFailureException(done.getStepName(), new IllegalStateException(error)));
			}
		}

		instance.setStatus(SagaStatus.FAILED);
		touch(instance);
		repository.update(instance, List.of(
				execution.entry(SagaLogType.SAGA_FAILED, null, null, 0, null, instance.getFailureReason())));
		log.warn(">>> [Saga] {} 結束於 FAILED: {}", instance.getSagaId(), instance.getFailureReason());
	}

	/**
	 * @return null 代表補償成功，否則為最後一次的錯誤訊息
	 */
	private String compensate(Execution execution, CompletedStep done, SagaStep step) {
		for (int attempt = 1;; attempt++) {
			SagaExecutionContext context = context(execution, step, attempt);
			repository.appendLog(execution.entry(SagaLogType.COMPENSATION_ATTEMPTED, done.getStepIndex(),
					done.getStepName(), attempt, null, null));
			String error;
			try {
				callWithTimeout(null, () -> {
					step.activity().compensate(done.getCompensationInput(), context);
					return null;
				});
				return null;
			} catch (TimeoutException e) {
				error = "補償逾時 (" + stepTimeout.toMillis() + " ms)";
			} catch (CancellationException e) {
				error = "補償被中斷";
			} catch (ExecutionException e) {
				error = describe(e.getCause());
			}
			log.warn(">>> [Saga] {} 補償 {} 第 {} 次失敗: {}", execution.instance.getSagaId(), done.getStepName(),
					attempt, error);
			if (!compensationPolicy.hasAttemptsAfter(attempt)) {
				return error;
			}
			sleep(compensationPolicy.delayAfter(attempt));
		}
	}

	private <T> T callWithTimeout(ExecutionHandle handle, Callable<T> task)
			throws TimeoutException, ExecutionException {
		Future<T> future = stepExecutor.submit(task);
		if (handle != null) {
			handle.track(future);
		}
		try {
			return future.get(stepTimeout.toMillis(), TimeUnit.MILLISECONDS);
		} catch (TimeoutException e) {
			future.cancel(true);
			throw e;
		} catch (InterruptedException e) {
			future.cancel(true);
			Thread.currentThread().interrupt();
			throw new ExecutionAbortedException();
		} finally {
			if (handle != null) {
				handle.untrack();
			}
		}
	}

	private boolean cancelRequested(Execution execution) {
		return execution.handle.isCancelled() || repository.isCancelRequested(execution.instance.getSagaId());
	}

	private SagaExecutionContext context(Execution execution, SagaStep step, int attempt) {
		Map<String, Map<String, Object>> results = new LinkedHashMap<>();
		for (CompletedStep done : execution.instance.getCompletedSteps()) {
			results.put(done.getStepName(), done.getResult() == null ? Map.of() : done.getResult());
		}
		return new SagaExecutionContext(execution.instance.getSagaId(), step.name(), attempt,
				execution.instance.getInput(), results);
	}

	private void touch(SagaInstance instance) {
		instance.setUpdatedAt(clock.instant());
	}

	private static boolean isRetryable(Throwable cause) {
		if (cause instanceof DomainValidationException) {
			return false;
		}
		if (cause instanceof ActivityFailureException) {
			return ((ActivityFailureException) cause).isRetryable();
		}
		return true;
	}

	private static String describe(Throwable cause) {
		if (cause == null) {
			return "未知錯誤";
		}
		return Optional.ofNullable(cause.getMessage()).orElse(cause.getClass().getSimpleName());
	}

	private static void sleep(Duration delay) {
		if (delay.isZero()) {
			return;
		}
		try {
			Thread.sleep(delay.toMillis());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new ExecutionAbortedException();
		}
	}

	/**
	 * 單次驅動的狀態：定義、執行個體與日誌序號
	 */
	private final class Execution {

		private final SagaDefinition definition;
		private final SagaInstance instance;
		private final ExecutionHandle handle;
		private long sequence;

		private Execution(SagaDefinition definition, SagaInstance instance, ExecutionHandle handle, long sequence) {
			this.definition = definition;
			this.instance = instance;
			this.handle = handle;
			this.sequence = sequence;
		}

		private SagaLogEntry entry(SagaLogType type, Integer stepIndex, String stepName, int attempt,
				Map<String, Object> data, String error) {
			return SagaLogEntry.builder().sagaId(instance.getSagaId()).sequence(++sequence).type(type)
					.stepIndex(stepIndex).stepName(stepName).attempt(attempt).data(data).error(error)
					.recordedAt(clock.instant()).build();
		}
	}

	/**
	 * 執行中 Saga 的取消開關與目前步驟
	 */
	private static final class ExecutionHandle {

		private final CountDownLatch cancelLatch = new CountDownLatch(1);
		private volatile Future<?> current;

		void cancel() {
			cancelLatch.countDown();
			Future<?> running = current;
			if (running != null) {
				running.cancel(true);
			}
		}

		boolean isCancelled() {
			return cancelLatch.getCount() == 0;
		}

		void track(Future<?> future) {
			current = future;
			if (isCancelled()) {
				future.cancel(true);
			}
		}

		void untrack() {
			current = null;
		}

		/**
		 * 等待 delay，期間被取消則立即回傳 true
		 */
		boolean awaitCancel(Duration delay) {
			try {
				return cancelLatch.await(delay.toMillis(), TimeUnit.MILLISECONDS);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new ExecutionAbortedException();
			}
		}
	}

	private static final class StepOutcome {

		private final int attempts;
		private final ActivityResult result;
		private final String error;

		private StepOutcome(int attempts, ActivityResult result, String error) {
			this.attempts = attempts;
			this.result = result;
			this.error = error;
		}

		static StepOutcome succeeded(int attempts, ActivityResult result) {
			return new StepOutcome(attempts, result, null);
		}

		static StepOutcome failed(int attempts, String error) {
			return new StepOutcome(attempts, null, error);
		}
	}

	/**
	 * 驅動執行緒被中斷 (例如停機)，狀態保持不變留待恢復
	 */
	private static final class ExecutionAbortedException extends RuntimeException {

		private static final long serialVersionUID = 1L;
	}
}

package com.example.eventcore.config.config;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import com.example.eventcore.application.domain.saga.RetryPolicy;
import com.example.eventcore.application.domain.saga.SagaDefinition;
import com.example.eventcore.application.port.CommandBusPort;
import com.example.eventcore.application.port.SagaRepositoryPort;
import com.example.eventcore.application.saga.SagaOrchestrator;
import com.example.eventcore.application.saga.checkout.OrderCheckoutSaga;
import com.example.eventcore.application.service.AggregateEngineRegistry;
import com.example.eventcore.config.properties.EventCoreProperties;

/**
 * Saga 協調器組裝
 *
 * <p>
 * 步驟執行緒與協調執行緒分開：協調執行緒等待步驟結果並負責逾時，步驟執行緒只跑活動本身。
 * </p>
 */
@Configuration
public class SagaConfiguration {

	@Bean(destroyMethod = "shutdownNow")
	public ExecutorService sagaStepExecutor(EventCoreProperties properties) {
		return Executors.newFixedThreadPool(properties.saga().executorThreads(), daemonThreads("saga-step-"));
	}

	@Bean(destroyMethod = "shutdownNow")
	public ExecutorService sagaCoordinatorExecutor(EventCoreProperties properties) {
		return Executors.newFixedThreadPool(properties.saga().executorThreads(), daemonThreads("saga-coordinator-"));
	}

	@Bean
	public SagaDefinition orderCheckoutSagaDefinition(CommandBusPort commandBus, AggregateEngineRegistry engines) {
		return OrderCheckoutSaga.definition(commandBus, engines);
	}

	@Bean
	public SagaOrchestrator sagaOrchestrator(List<SagaDefinition> definitions, SagaRepositoryPort repository,
			ExecutorService sagaStepExecutor, ExecutorService sagaCoordinatorExecutor, EventCoreProperties properties,
			Clock clock) {
		EventCoreProperties.Saga saga = properties.saga();
		return new SagaOrchestrator(definitions, repository, sagaStepExecutor, sagaCoordinatorExecutor,
				saga.stepTimeout(), toPolicy(saga.retry()), toPolicy(saga.compensationRetry()), clock);
	}

	private static RetryPolicy toPolicy(EventCoreProperties.Retry retry) {
		return new RetryPolicy(retry.maxAttempts(), retry.initialDelay(), retry.multiplier(), retry.maxDelay());
	}

	private static CustomizableThreadFactory daemonThreads(String prefix) {
		CustomizableThreadFactory threadFactory = new CustomizableThreadFactory(prefix);
		threadFactory.setDaemon(true);
		return threadFactory;
	}
}

package com.example.eventcore.config.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.eventcore.application.domain.upcast.UpcasterChain;
import com.example.eventcore.application.port.AccountBalanceRepositoryPort;
import com.example.eventcore.application.port.CheckpointRepositoryPort;
import com.example.eventcore.application.port.EventLogPort;
import com.example.eventcore.application.port.OrderSummaryRepositoryPort;
import com.example.eventcore.application.projection.AccountBalanceProjector;
import com.example.eventcore.application.projection.OrderSummaryProjector;
import com.example.eventcore.application.projection.ProjectionManager;
import com.example.eventcore.config.properties.EventCoreProperties;
import com.example.eventcore.infra.event.codec.EventJsonCodec;

/**
 * 投影管理器與讀取模型處理器
 */
@Configuration
public class ProjectionConfiguration {

	@Bean
	public ProjectionManager projectionManager(EventLogPort eventLog, UpcasterChain upcasterChain,
			CheckpointRepositoryPort checkpoints, EventCoreProperties properties, Clock clock) {
		EventCoreProperties.Projection projection = properties.projection();
		return new ProjectionManager(eventLog, upcasterChain, checkpoints, projection.batchSize(),
				projection.pollInterval(), projection.errorBackoff(), clock);
	}

	@Bean
	public OrderSummaryProjector orderSummaryProjector(OrderSummaryRepositoryPort repository, EventJsonCodec codec) {
		return new OrderSummaryProjector(repository, codec);
	}

	@Bean
	public AccountBalanceProjector accountBalanceProjector(AccountBalanceRepositoryPort repository,
			EventJsonCodec codec) {
		return new AccountBalanceProjector(repository, codec);
	}
}

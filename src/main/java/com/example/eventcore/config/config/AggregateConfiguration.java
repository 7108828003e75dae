package com.example.eventcore.config.config;

import java.time.Clock;
import java.util.List;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.eventcore.application.domain.account.aggregate.AccountAggregate;
import com.example.eventcore.application.domain.account.aggregate.AccountState;
import com.example.eventcore.application.domain.order.aggregate.OrderAggregate;
import com.example.eventcore.application.domain.order.aggregate.OrderState;
import com.example.eventcore.application.domain.order.upcast.ItemAddedV1ToV2Upcaster;
import com.example.eventcore.application.domain.order.upcast.ItemAddedV2ToV3Upcaster;
import com.example.eventcore.application.domain.snapshot.SnapshotPolicy;
import com.example.eventcore.application.domain.upcast.UpcasterChain;
import com.example.eventcore.application.port.EventLogPort;
import com.example.eventcore.application.port.SnapshotRepositoryPort;
import com.example.eventcore.application.service.AggregateEngine;
import com.example.eventcore.application.service.AggregateEngineRegistry;
import com.example.eventcore.application.service.CommandService;
import com.example.eventcore.config.properties.EventCoreProperties;
import com.example.eventcore.infra.event.codec.EventJsonCodec;

/**
 * 聚合引擎組裝
 *
 * <p>
 * 新增聚合型別時：在此建立對應的 {@link AggregateEngine} Bean，並把它的升級器加入 {@link UpcasterChain}。
 * </p>
 */
@Configuration
public class AggregateConfiguration {

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

	@Bean
	public UpcasterChain upcasterChain() {
		return new UpcasterChain(List.of(new ItemAddedV1ToV2Upcaster(), new ItemAddedV2ToV3Upcaster()));
	}

	@Bean
	public SnapshotPolicy snapshotPolicy(EventCoreProperties properties) {
		return new SnapshotPolicy(properties.snapshot().interval(), properties.snapshot().retain());
	}

	@Bean
	public AggregateEngine<OrderState> orderAggregateEngine(EventLogPort eventLog,
			SnapshotRepositoryPort snapshotRepository, UpcasterChain upcasterChain, EventJsonCodec codec,
			SnapshotPolicy snapshotPolicy, Clock clock) {
		return new AggregateEngine<>(OrderAggregate.definition(), eventLog, snapshotRepository, upcasterChain, codec,
				snapshotPolicy, clock);
	}

	@Bean
	public AggregateEngine<AccountState> accountAggregateEngine(EventLogPort eventLog,
			SnapshotRepositoryPort snapshotRepository, UpcasterChain upcasterChain, EventJsonCodec codec,
			SnapshotPolicy snapshotPolicy, Clock clock) {
		return new AggregateEngine<>(AccountAggregate.definition(), eventLog, snapshotRepository, upcasterChain,
				codec, snapshotPolicy, clock);
	}

	@Bean
	public AggregateEngineRegistry aggregateEngineRegistry(List<AggregateEngine<?>> engines) {
		return new AggregateEngineRegistry(engines);
	}

	@Bean
	public CommandService commandService(AggregateEngineRegistry registry, EventCoreProperties properties) {
		return new CommandService(registry, properties.command().maxConflictRetries());
	}
}

package com.example.eventcore.config.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.eventcore.application.service.CommandService;
import com.example.eventcore.config.properties.EventCoreProperties;
import com.example.eventcore.iface.handler.CommandDispatchHandler;
import com.example.eventcore.infra.lmax.event.CommandEnvelope;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.util.DaemonThreadFactory;

/**
 * LMAX Disruptor 指令匯流排設定
 *
 * <p>
 * 所有經由 {@code CommandBusPort} 送出的指令都在同一個消費者執行緒上依序處理 (Single Writer)，
 * 同一 Stream 的指令因此不會在本機互相產生版本衝突。
 * </p>
 */
@Configuration
public class DisruptorConfiguration {

	/**
	 * @param properties 取得 RingBuffer 容量，必須為 2 的次方
	 */
	@Bean(destroyMethod = "shutdown")
	public Disruptor<CommandEnvelope> commandDisruptor(CommandService commandService,
			EventCoreProperties properties) {
		Disruptor<CommandEnvelope> disruptor = new Disruptor<>(CommandEnvelope::new,
				properties.command().ringBufferSize(), DaemonThreadFactory.INSTANCE);
		disruptor.handleEventsWith(new CommandDispatchHandler(commandService));
		disruptor.start();
		return disruptor;
	}

	@Bean
	public RingBuffer<CommandEnvelope> commandRingBuffer(Disruptor<CommandEnvelope> disruptor) {
		return disruptor.getRingBuffer();
	}
}

package com.example.eventcore.config.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.eventcore.infra.event.codec.EventJsonCodec;

import tools.jackson.databind.ObjectMapper;

/**
 * EventCodec 的配置類
 * <p>
 * 事件 payload、快照狀態與 Saga 資料共用同一個 ObjectMapper
 * </p>
 */
@Configuration
public class EventCodecConfiguration {

	@Bean
	public EventJsonCodec eventJsonCodec(ObjectMapper objectMapper) {
		return new EventJsonCodec(objectMapper);
	}
}

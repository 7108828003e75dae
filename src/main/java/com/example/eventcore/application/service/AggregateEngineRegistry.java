package com.example.eventcore.application.service;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 依 Stream 型別查找聚合引擎，啟動時建立
 */
public class AggregateEngineRegistry {

	private final Map<String, AggregateEngine<?>> engines = new LinkedHashMap<>();

	public AggregateEngineRegistry(List<AggregateEngine<?>> engines) {
		for (AggregateEngine<?> engine : engines) {
			if (this.engines.putIfAbsent(engine.streamType(), engine) != null) {
				throw new IllegalStateException("重複註冊的聚合型別: " + engine.streamType());
			}
		}
	}

	/**
	 * @throws IllegalArgumentException 未知的 Stream 型別
	 */
	public AggregateEngine<?> get(String streamType) {
		AggregateEngine<?> engine = engines.get(streamType);
		if (engine == null) {
			throw new IllegalArgumentException("未知的聚合型別: " + streamType);
		}
		return engine;
	}

	@SuppressWarnings("unchecked")
	public <S> AggregateEngine<S> get(String streamType, Class<S> stateType) {
		AggregateEngine<?> engine = get(streamType);
		if (!engine.definition().stateType().equals(stateType)) {
			throw new IllegalArgumentException(streamType + " 的狀態型別不是 " + stateType.getSimpleName());
		}
		return (AggregateEngine<S>) engine;
	}

	public Collection<AggregateEngine<?>> all() {
		return Collections.unmodifiableCollection(engines.values());
	}
}

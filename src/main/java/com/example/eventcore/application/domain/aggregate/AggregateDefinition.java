package com.example.eventcore.application.domain.aggregate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 聚合定義 (Aggregate Definition)
 *
 * <p>
 * 在啟動時一次性建立「事件型別 → 套用函式」與「指令型別 → 處理函式」兩張註冊表，執行期不做任何型別判斷分支。
 * 同一個 payload 類別只能對應一個事件型別，指令處理器回傳的 payload 依此對應到事件型別與結構版本。
 * </p>
 *
 * @param <S> 聚合狀態型別
 */
public final class AggregateDefinition<S> {

	private final String streamType;
	private final Class<S> stateType;
	private final Supplier<S> initialState;
	private final Map<String, EventRegistration<S>> eventsByType;
	private final Map<Class<?>, EventRegistration<S>> eventsByPayload;
	private final Map<Class<?>, CommandHandler<S, Object>> commands;

	private AggregateDefinition(Builder<S> builder) {
		this.streamType = builder.streamType;
		this.stateType = builder.stateType;
		this.initialState = builder.initialState;
		this.eventsByType = Collections.unmodifiableMap(new HashMap<>(builder.eventsByType));
		this.eventsByPayload = Collections.unmodifiableMap(new HashMap<>(builder.eventsByPayload));
		this.commands = Collections.unmodifiableMap(new HashMap<>(builder.commands));
	}

	public static <S> Builder<S> builder(String streamType, Class<S> stateType, Supplier<S> initialState) {
		return new Builder<>(streamType, stateType, initialState);
	}

	public String streamType() {
		return streamType;
	}

	public Class<S> stateType() {
		return stateType;
	}

	public S initialState() {
		return initialState.get();
	}

	public Optional<EventRegistration<S>> eventRegistration(String eventType) {
		return Optional.ofNullable(eventsByType.get(eventType));
	}

	public boolean supportsCommand(Class<?> commandType) {
		return commands.containsKey(commandType);
	}

	/**
	 * 執行指令並將產生的 payload 轉為待寫入事件，不修改傳入的狀態。
	 *
	 * @throws IllegalArgumentException 指令型別未註冊
	 */
	public List<PendingEvent> execute(S state, Object command) {
		Objects.requireNonNull(command, "command");
		CommandHandler<S, Object> handler = commands.get(command.getClass());
		if (handler == null) {
			throw new IllegalArgumentException(streamType + " 不支援的指令: " + command.getClass().getSimpleName());
		}
		List<Object> payloads = handler.handle(state, command);
		if (payloads == null || payloads.isEmpty()) {
			return List.of();
		}
		List<PendingEvent> events = new ArrayList<>(payloads.size());
		for (Object payload : payloads) {
			EventRegistration<S> registration = eventsByPayload.get(payload.getClass());
			if (registration == null) {
				throw new IllegalStateException(streamType + " 未註冊的事件 payload: " + payload.getClass().getSimpleName());
			}
			events.add(new PendingEvent(registration.eventType(), registration.schemaVersion(), payload));
		}
		return events;
	}

	/**
	 * 將待寫入事件依序套用到狀態上 (記憶體內，不經過序列化)
	 */
	public S fold(S state, List<PendingEvent> events) {
		S current = state;
		for (PendingEvent event : events) {
			EventRegistration<S> registration = eventsByType.get(event.eventType());
			current = registration.apply(current, event.payload());
		}
		return current;
	}

	/**
	 * 單一事件型別的註冊資訊
	 */
	public static final class EventRegistration<S> {

		private final String eventType;
		private final int schemaVersion;
		private final Class<?> payloadType;
		private final EventApplier<S, Object> applier;

		@SuppressWarnings("unchecked")
		private <P> EventRegistration(String eventType, int schemaVersion, Class<P> payloadType,
				EventApplier<S, ? super P> applier) {
			this.eventType = eventType;
			this.schemaVersion = schemaVersion;
			this.payloadType = payloadType;
			this.applier = (EventApplier<S, Object>) applier;
		}

		public String eventType() {
			return eventType;
		}

		public int schemaVersion() {
			return schemaVersion;
		}

		public Class<?> payloadType() {
			return payloadType;
		}

		public S apply(S state, Object payload) {
			return applier.apply(state, payloadType.cast(payload));
		}
	}

	public static final class Builder<S> {

		private final String streamType;
		private final Class<S> stateType;
		private final Supplier<S> initialState;
		private final Map<String, EventRegistration<S>> eventsByType = new HashMap<>();
		private final Map<Class<?>, EventRegistration<S>> eventsByPayload = new HashMap<>();
		private final Map<Class<?>, CommandHandler<S, Object>> commands = new HashMap<>();

		private Builder(String streamType, Class<S> stateType, Supplier<S> initialState) {
			this.streamType = Objects.requireNonNull(streamType, "streamType");
			this.stateType = Objects.requireNonNull(stateType, "stateType");
			this.initialState = Objects.requireNonNull(initialState, "initialState");
		}

		/**
		 * 註冊事件型別，schemaVersion 為目前 (最新) 的結構版本
		 */
		public <P> Builder<S> onEvent(String eventType, int schemaVersion, Class<P> payloadType,
				EventApplier<S, ? super P> applier) {
			EventRegistration<S> registration = new EventRegistration<>(eventType, schemaVersion, payloadType, applier);
			if (eventsByType.putIfAbsent(eventType, registration) != null) {
				throw new IllegalStateException(streamType + " 重複註冊事件型別: " + eventType);
			}
			if (eventsByPayload.putIfAbsent(payloadType, registration) != null) {
				throw new IllegalStateException(streamType + " payload 類別已被其他事件使用: " + payloadType.getSimpleName());
			}
			return this;
		}

		@SuppressWarnings("unchecked")
		public <C> Builder<S> onCommand(Class<C> commandType, CommandHandler<S, ? super C> handler) {
			if (commands.putIfAbsent(commandType, (CommandHandler<S, Object>) handler) != null) {
				throw new IllegalStateException(streamType + " 重複註冊指令: " + commandType.getSimpleName());
			}
			return this;
		}

		public AggregateDefinition<S> build() {
			return new AggregateDefinition<>(this);
		}
	}
}

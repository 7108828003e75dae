package com.example.eventcore.application.service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.example.eventcore.application.domain.aggregate.AggregateDefinition;
import com.example.eventcore.application.domain.aggregate.AggregateDefinition.EventRegistration;
import com.example.eventcore.application.domain.aggregate.LoadedAggregate;
import com.example.eventcore.application.domain.aggregate.PendingEvent;
import com.example.eventcore.application.domain.event.EventMetadata;
import com.example.eventcore.application.domain.event.NewEvent;
import com.example.eventcore.application.domain.event.RecordedEvent;
import com.example.eventcore.application.domain.snapshot.AggregateSnapshot;
import com.example.eventcore.application.domain.snapshot.SnapshotPolicy;
import com.example.eventcore.application.domain.upcast.UpcasterChain;
import com.example.eventcore.application.port.EventLogPort;
import com.example.eventcore.application.port.SnapshotRepositoryPort;
import com.example.eventcore.application.shared.exception.ConcurrencyConflictException;
import com.example.eventcore.application.shared.exception.SchemaUpcastException;
import com.example.eventcore.infra.event.codec.EventJsonCodec;

import lombok.extern.slf4j.Slf4j;

/**
 * 聚合引擎 (Aggregate Engine)
 *
 * <p>
 * 負責單一聚合型別的 load / execute / save 流程：
 * <ol>
 * <li>load：先讀最新快照，再從快照版本 + 1 重播事件，每筆事件都先經過升級鏈</li>
 * <li>execute：純運算，依目前狀態產生待寫入事件</li>
 * <li>save：以樂觀併發寫入事件日誌，成功後依快照策略建立快照</li>
 * </ol>
 * 快照只是加速手段，讀不到或寫不進去都只記錄警告，不影響正確性。
 * </p>
 *
 * @param <S> 聚合狀態型別
 */
@Slf4j
public class AggregateEngine<S> {

	private final AggregateDefinition<S> definition;
	private final EventLogPort eventLog;
	private final SnapshotRepositoryPort snapshotRepository;
	private final UpcasterChain upcasterChain;
	private final EventJsonCodec codec;
	private final SnapshotPolicy snapshotPolicy;
	private final Clock clock;

	public AggregateEngine(AggregateDefinition<S> definition, EventLogPort eventLog,
			SnapshotRepositoryPort snapshotRepository, UpcasterChain upcasterChain, EventJsonCodec codec,
			SnapshotPolicy snapshotPolicy, Clock clock) {
		this.definition = definition;
		this.eventLog = eventLog;
		this.snapshotRepository = snapshotRepository;
		this.upcasterChain = upcasterChain;
		this.codec = codec;
		this.snapshotPolicy = snapshotPolicy;
		this.clock = clock;
	}

	public AggregateDefinition<S> definition() {
		return definition;
	}

	public String streamType() {
		return definition.streamType();
	}

	/**
	 * 載入聚合目前狀態
	 *
	 * @param streamId Stream 識別碼
	 * @return 狀態與版本；Stream 不存在時為初始狀態與版本 -1
	 */
	public LoadedAggregate<S> load(String streamId) {
		S state = definition.initialState();
		long version = -1;

		Optional<LoadedAggregate<S>> snapshot = restoreSnapshot(streamId);
		if (snapshot.isPresent()) {
			state = snapshot.get().state();
			version = snapshot.get().version();
			log.debug(">>> [Recovery] {} 發現快照 v{}，從 v{} 開始補齊事件", streamId, version, version + 1);
		}

		List<RecordedEvent> events = eventLog.readStream(streamId, version + 1);
		for (RecordedEvent event : events) {
			state = apply(state, event);
			version = event.getStreamVersion();
		}
		log.debug(">>> [Recovery] {} 重播 {} 筆事件，目前版本 v{}", streamId, events.size(), version);
		return new LoadedAggregate<>(streamId, state, version);
	}

	/**
	 * 由版本 0 完整重播，不使用快照
	 */
	public LoadedAggregate<S> replay(String streamId) {
		S state = definition.initialState();
		long version = -1;
		for (RecordedEvent event : eventLog.readStream(streamId, 0)) {
			state = apply(state, event);
			version = event.getStreamVersion();
		}
		return new LoadedAggregate<>(streamId, state, version);
	}

	/**
	 * 純運算：依狀態執行指令，不寫入任何資料
	 */
	public List<PendingEvent> execute(S state, Object command) {
		return definition.execute(state, command);
	}

	/**
	 * 以樂觀併發寫入事件，不做任何自動重試。
	 *
	 * @return 寫入後的 Stream 版本
	 */
	public long save(String streamId, long expectedVersion, List<PendingEvent> events, EventMetadata metadata) {
		long newVersion = eventLog.append(streamId, expectedVersion, toNewEvents(events, metadata));
		if (snapshotPolicy.shouldSnapshot(expectedVersion, newVersion)) {
			try {
				takeSnapshot(load(streamId));
			} catch (RuntimeException e) {
				log.warn(">>> [Snapshot] {} 建立快照失敗，略過: {}", streamId, e.getMessage());
			}
		}
		return newVersion;
	}

	/**
	 * 寫入已載入聚合所產生的事件，快照直接使用記憶體中推進後的狀態
	 */
	public LoadedAggregate<S> save(LoadedAggregate<S> aggregate, List<PendingEvent> events, EventMetadata metadata) {
		long newVersion = eventLog.append(aggregate.streamId(), aggregate.version(), toNewEvents(events, metadata));
		LoadedAggregate<S> saved = new LoadedAggregate<>(aggregate.streamId(),
				definition.fold(aggregate.state(), events), newVersion);
		if (snapshotPolicy.shouldSnapshot(aggregate.version(), newVersion)) {
			takeSnapshot(saved);
		}
		return saved;
	}

	/**
	 * load + execute + save 的便利方法
	 *
	 * @param expectedVersion 呼叫端指定的預期版本，null 代表使用載入時的版本
	 */
	public CommandResult handle(String streamId, Object command, EventMetadata metadata, Long expectedVersion) {
		LoadedAggregate<S> aggregate = load(streamId);
		if (expectedVersion != null && expectedVersion != aggregate.version()) {
			throw new ConcurrencyConflictException(streamId, expectedVersion, aggregate.version());
		}
		List<PendingEvent> events = execute(aggregate.state(), command);
		if (events.isEmpty()) {
			log.info(">>> [Command] {} 指令 {} 未產生事件 (冪等重送)", streamId, command.getClass().getSimpleName());
			return new CommandResult(streamId, aggregate.version(), 0);
		}
		LoadedAggregate<S> saved = save(aggregate, events, metadata);
		return new CommandResult(streamId, saved.version(), events.size());
	}

	private S apply(S state, RecordedEvent raw) {
		EventRegistration<S> registration = definition.eventRegistration(raw.getEventType())
				.orElseThrow(() -> new SchemaUpcastException(raw.getEventType(), raw.getSchemaVersion(),
						definition.streamType() + " 沒有對應的事件處理器"));
		RecordedEvent event = upcasterChain.upcast(raw, registration.schemaVersion());
		Object payload = codec.fromMap(event.getPayload(), registration.payloadType());
		return registration.apply(state, payload);
	}

	private List<NewEvent> toNewEvents(List<PendingEvent> events, EventMetadata metadata) {
		EventMetadata meta = metadata == null ? EventMetadata.none() : metadata;
		Instant now = clock.instant();
		List<NewEvent> newEvents = new ArrayList<>(events.size());
		for (PendingEvent event : events) {
			newEvents.add(NewEvent.builder().streamType(definition.streamType()).eventType(event.eventType())
					.schemaVersion(event.schemaVersion()).payload(codec.toMap(event.payload())).occurredAt(now)
					.correlationId(meta.correlationId()).causationId(meta.causationId()).build());
		}
		return newEvents;
	}

	private Optional<LoadedAggregate<S>> restoreSnapshot(String streamId) {
		try {
			Optional<AggregateSnapshot> snapshot = snapshotRepository.findLatest(streamId);
			if (snapshot.isEmpty()) {
				return Optional.empty();
			}
			if (snapshot.get().getState() == null) {
				log.warn(">>> [Snapshot] {} 快照內容為空，改為完整重播", streamId);
				return Optional.empty();
			}
			S state = codec.fromMap(snapshot.get().getState(), definition.stateType());
			return Optional.of(new LoadedAggregate<>(streamId, state, snapshot.get().getStreamVersion()));
		} catch (RuntimeException e) {
			log.warn(">>> [Snapshot] {} 快照無法讀取，改為完整重播: {}", streamId, e.getMessage());
			return Optional.empty();
		}
	}

	private void takeSnapshot(LoadedAggregate<S> aggregate) {
		try {
			snapshotRepository.save(AggregateSnapshot.builder().streamId(aggregate.streamId())
					.streamVersion(aggregate.version()).state(codec.toMap(aggregate.state())).takenAt(clock.instant())
					.build());
			int deleted = snapshotRepository.deleteOlderSnapshots(aggregate.streamId(), snapshotPolicy.retain());
			log.info(">>> [Snapshot] {} 已建立快照 v{}，清除舊快照 {} 筆", aggregate.streamId(), aggregate.version(), deleted);
		} catch (RuntimeException e) {
			log.warn(">>> [Snapshot] {} 建立快照失敗，略過: {}", aggregate.streamId(), e.getMessage());
		}
	}
}

package com.example.eventcore.infra.adapter;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import com.eventstore.dbclient.AppendToStreamOptions;
import com.eventstore.dbclient.EventData;
import com.eventstore.dbclient.EventStoreDBClient;
import com.eventstore.dbclient.ExpectedRevision;
import com.eventstore.dbclient.Position;
import com.eventstore.dbclient.ReadAllOptions;
import com.eventstore.dbclient.ReadStreamOptions;
import com.eventstore.dbclient.ResolvedEvent;
import com.eventstore.dbclient.StreamNotFoundException;
import com.eventstore.dbclient.WrongExpectedVersionException;
import com.example.eventcore.application.domain.event.ExpectedVersion;
import com.example.eventcore.application.domain.event.NewEvent;
import com.example.eventcore.application.domain.event.RecordedEvent;
import com.example.eventcore.application.port.EventLogPort;
import com.example.eventcore.application.shared.exception.ConcurrencyConflictException;
import com.example.eventcore.application.shared.exception.EventStorageException;
import com.example.eventcore.infra.event.mapper.EventStoreEventMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 以 EventStoreDB 作為事件日誌
 *
 * <p>
 * 版本檢查交給 EventStoreDB 的 expected revision。同一次追加的事件共用 commit position，
 * 因此全域位置採用每個事件各自的 prepare position；單一寫入者下 prepare position 沿 {@code $all} 順序嚴格遞增但不連續。
 * 讀取 {@code $all} 時以完整的 {@link Position} (先比 commit 再比 prepare) 作為游標。
 * </p>
 */
@Slf4j
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "eventcore.event-log", name = "backend", havingValue = "eventstoredb")
public class EventStoreDbEventLogAdapter implements EventLogPort {

	private static final long TIMEOUT_SECONDS = 5;

	private final EventStoreDBClient client;
	private final EventStoreEventMapper mapper;

	@Override
	public long append(String streamId, long expectedVersion, List<NewEvent> events) {
		if (events == null || events.isEmpty()) {
			throw new IllegalArgumentException("追加的事件不可為空 (stream=" + streamId + ")");
		}
		ExpectedRevision revision = expectedVersion == ExpectedVersion.NO_STREAM ? ExpectedRevision.noStream()
				: ExpectedRevision.expectedRevision(expectedVersion);
		List<EventData> batch = new ArrayList<>(events.size());
		events.forEach(event -> batch.add(mapper.toEventData(event)));
		try {
			client.appendToStream(streamId, AppendToStreamOptions.get().expectedRevision(revision), batch.iterator())
					.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
			long newVersion = expectedVersion + events.size();
			log.debug(">>> [EventStore] {} 追加 {} 筆事件，版本 v{}", streamId, events.size(), newVersion);
			return newVersion;
		} catch (ExecutionException e) {
			if (e.getCause() instanceof WrongExpectedVersionException) {
				throw new ConcurrencyConflictException(streamId, expectedVersion, currentVersion(streamId));
			}
			throw new EventStorageException("EventStoreDB 寫入失敗 (stream=" + streamId + ")", e.getCause());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new EventStorageException("EventStoreDB 寫入被中斷 (stream=" + streamId + ")", e);
		} catch (TimeoutException e) {
			throw new EventStorageException("EventStoreDB 寫入逾時 (stream=" + streamId + ")", e);
		}
	}

	@Override
	public List<RecordedEvent> readStream(String streamId, long fromVersion) {
		ReadStreamOptions options = ReadStreamOptions.get().forwards().fromRevision(Math.max(0, fromVersion));
		List<RecordedEvent> result = new ArrayList<>();
		for (ResolvedEvent re : readStreamEvents(streamId, options)) {
			result.add(mapper.toRecordedEvent(re));
		}
		return result;
	}

	@Override
	public List<RecordedEvent> readAll(long afterPosition, int maxCount) {
		List<RecordedEvent> result = new ArrayList<>();
		Position cursor = afterPosition > 0 ? new Position(afterPosition, afterPosition) : null;
		// 系統事件與已讀事件會被略過，整頁都被略過時繼續往後讀
		while (result.size() < maxCount) {
			ReadAllOptions options = ReadAllOptions.get().forwards().maxCount(maxCount + 1L);
			if (cursor != null) {
				options.fromPosition(cursor);
			} else {
				options.fromStart();
			}
			List<ResolvedEvent> page = await(client.readAll(options), "讀取 $all 失敗 (after=" + afterPosition + ")")
					.getEvents();
			boolean advanced = false;
			for (ResolvedEvent re : page) {
				if (re.getEvent() == null) {
					continue;
				}
				Position position = re.getEvent().getPosition();
				if (cursor != null && compare(position, cursor) <= 0) {
					continue;
				}
				cursor = position;
				advanced = true;
				// 與 afterPosition 同批次、排在它之前的事件
				if (position.getPrepareUnsigned() <= afterPosition) {
					continue;
				}
				if (!mapper.isSystemEvent(re) && result.size() < maxCount) {
					result.add(mapper.toRecordedEvent(re));
				}
			}
			if (!advanced) {
				break;
			}
		}
		return result;
	}

	@Override
	public long currentVersion(String streamId) {
		ReadStreamOptions options = ReadStreamOptions.get().backwards().fromEnd().maxCount(1);
		List<ResolvedEvent> last = readStreamEvents(streamId, options);
		return last.isEmpty() ? -1 : last.get(0).getEvent().getRevision();
	}

	private List<ResolvedEvent> readStreamEvents(String streamId, ReadStreamOptions options) {
		try {
			return client.readStream(streamId, options).get(TIMEOUT_SECONDS, TimeUnit.SECONDS).getEvents();
		} catch (ExecutionException e) {
			if (e.getCause() instanceof StreamNotFoundException) {
				return List.of();
			}
			throw new EventStorageException("讀取 Stream 失敗 (stream=" + streamId + ")", e.getCause());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new EventStorageException("讀取 Stream 被中斷 (stream=" + streamId + ")", e);
		} catch (TimeoutException e) {
			throw new EventStorageException("讀取 Stream 逾時 (stream=" + streamId + ")", e);
		}
	}

	private static int compare(Position left, Position right) {
		int byCommit = Long.compareUnsigned(left.getCommitUnsigned(), right.getCommitUnsigned());
		return byCommit != 0 ? byCommit : Long.compareUnsigned(left.getPrepareUnsigned(), right.getPrepareUnsigned());
	}

	private static <T> T await(CompletableFuture<T> future, String message) {
		try {
			return future.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
		} catch (ExecutionException e) {
			throw new EventStorageException(message, e.getCause());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new EventStorageException(message, e);
		} catch (TimeoutException e) {
			throw new EventStorageException(message, e);
		}
	}
}

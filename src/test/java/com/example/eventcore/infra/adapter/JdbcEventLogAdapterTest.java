package com.example.eventcore.infra.adapter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.eventcore.application.domain.event.ExpectedVersion;
import com.example.eventcore.application.domain.event.NewEvent;
import com.example.eventcore.application.domain.event.RecordedEvent;
import com.example.eventcore.application.shared.exception.ConcurrencyConflictException;
import com.example.eventcore.support.TestDatabase;

/**
 * <h1>JDBC 事件日誌測試</h1>
 *
 * <pre>
 * <b>Feature:</b> 以樂觀併發控制追加事件，並依 Stream 版本與全域位置讀回
 * </pre>
 */
class JdbcEventLogAdapterTest {

	private TestDatabase database;
	private JdbcEventLogAdapter eventLog;

	@BeforeEach
	void setUp() {
		database = TestDatabase.create();
		eventLog = new JdbcEventLogAdapter(database.jdbcTemplate(), database.transactionManager(), database.codec());
	}

	@AfterEach
	void tearDown() {
		database.shutdown();
	}

	@Test
	@DisplayName("order-1：依序追加兩筆事件後讀回，以過期版本追加則衝突")
	void orderOneScenario() {
		// Given
		long v0 = eventLog.append("order-1", ExpectedVersion.NO_STREAM,
				List.of(event("OrderCreated", Map.of("customerId", "c-1"))));
		long v1 = eventLog.append("order-1", v0,
				List.of(event("ItemAdded", Map.of("sku", "A", "quantity", 1, "unitPriceCents", 500))));

		// When
		List<RecordedEvent> stream = eventLog.readStream("order-1");

		// Then
		assertThat(v0).isZero();
		assertThat(v1).isEqualTo(1);
		assertThat(stream).extracting(RecordedEvent::getEventType).containsExactly("OrderCreated", "ItemAdded");
		assertThat(stream).extracting(RecordedEvent::getStreamVersion).containsExactly(0L, 1L);
		assertThat(stream.get(1).getPayload()).containsEntry("sku", "A");

		assertThatThrownBy(() -> eventLog.append("order-1", 0, List.of(event("OrderConfirmed", Map.of()))))
				.isInstanceOf(ConcurrencyConflictException.class)
				.satisfies(e -> {
					ConcurrencyConflictException conflict = (ConcurrencyConflictException) e;
					assertThat(conflict.getExpectedVersion()).isZero();
					assertThat(conflict.getActualVersion()).isEqualTo(1);
				});
		assertThat(eventLog.currentVersion("order-1")).isEqualTo(1);
	}

	@Test
	@DisplayName("批次追加為全有或全無，版本依批次大小遞增且連續")
	void appendsBatchWithConsecutiveVersions() {
		long version = eventLog.append("s-1", ExpectedVersion.NO_STREAM,
				List.of(event("A", Map.of()), event("B", Map.of()), event("C", Map.of())));

		assertThat(version).isEqualTo(2);
		assertThat(eventLog.readStream("s-1")).extracting(RecordedEvent::getStreamVersion).containsExactly(0L, 1L, 2L);
		assertThat(eventLog.readStream("s-1", 1)).extracting(RecordedEvent::getEventType).containsExactly("B", "C");
	}

	@Test
	@DisplayName("Stream 已存在時以 NO_STREAM 追加會衝突，且不寫入任何事件")
	void noStreamExpectationRejectsExistingStream() {
		eventLog.append("s-1", ExpectedVersion.NO_STREAM, List.of(event("A", Map.of())));

		assertThatThrownBy(() -> eventLog.append("s-1", ExpectedVersion.NO_STREAM,
				List.of(event("B", Map.of()), event("C", Map.of())))).isInstanceOf(ConcurrencyConflictException.class);

		assertThat(eventLog.readStream("s-1")).hasSize(1);
		assertThat(eventLog.readAll(0, 10)).hasSize(1);
	}

	@Test
	@DisplayName("不存在的 Stream 讀取為空、版本為 -1；空批次直接拒絕")
	void emptyStreamAndEmptyBatch() {
		assertThat(eventLog.readStream("missing")).isEmpty();
		assertThat(eventLog.currentVersion("missing")).isEqualTo(-1);
		assertThatThrownBy(() -> eventLog.append("missing", ExpectedVersion.NO_STREAM, List.of()))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("全域位置由 1 開始嚴格遞增，readAll 不包含 afterPosition 本身")
	void readAllPagesByGlobalPosition() {
		eventLog.append("a", ExpectedVersion.NO_STREAM, List.of(event("A0", Map.of()), event("A1", Map.of())));
		eventLog.append("b", ExpectedVersion.NO_STREAM, List.of(event("B0", Map.of())));
		eventLog.append("a", 1, List.of(event("A2", Map.of())));

		List<RecordedEvent> all = eventLog.readAll(0, 100);
		assertThat(all).extracting(RecordedEvent::getGlobalPosition).containsExactly(1L, 2L, 3L, 4L);
		assertThat(all).extracting(RecordedEvent::getEventType).containsExactly("A0", "A1", "B0", "A2");

		assertThat(eventLog.readAll(2, 1)).extracting(RecordedEvent::getEventType).containsExactly("B0");
		assertThat(eventLog.readAll(4, 10)).isEmpty();
	}

	@Test
	@DisplayName("同一 Stream 的並行追加只有一方成功")
	void concurrentAppendsToSameStream() throws Exception {
		eventLog.append("hot", ExpectedVersion.NO_STREAM, List.of(event("Init", Map.of())));
		ExecutorService pool = Executors.newFixedThreadPool(4);
		try {
			List<Callable<Boolean>> tasks = new ArrayList<>();
			for (int i = 0; i < 4; i++) {
				tasks.add(() -> {
					try {
						eventLog.append("hot", 0, List.of(event("Next", Map.of())));
						return true;
					} catch (ConcurrencyConflictException e) {
						return false;
					}
				});
			}
			int succeeded = 0;
			for (Future<Boolean> result : pool.invokeAll(tasks)) {
				if (result.get()) {
					succeeded++;
				}
			}
			assertThat(succeeded).isEqualTo(1);
			assertThat(eventLog.readStream("hot")).extracting(RecordedEvent::getStreamVersion).containsExactly(0L, 1L);
		} finally {
			pool.shutdownNow();
		}
	}

	@Test
	@DisplayName("tailAll 讀完既有事件後會等待新事件")
	void tailAllFollowsNewEvents() throws Exception {
		eventLog.append("t", ExpectedVersion.NO_STREAM, List.of(event("First", Map.of())));
		Iterator<RecordedEvent> tail = eventLog.tailAll(0, 10, Duration.ofMillis(20));

		assertThat(tail.next().getEventType()).isEqualTo("First");

		ExecutorService appender = Executors.newSingleThreadExecutor();
		try {
			appender.submit(() -> {
				Thread.sleep(100);
				return eventLog.append("t", 0, List.of(event("Second", Map.of())));
			});
			RecordedEvent second = tail.next();
			assertThat(second.getEventType()).isEqualTo("Second");
			assertThat(second.getGlobalPosition()).isEqualTo(2);
		} finally {
			appender.shutdownNow();
		}
	}

	private static NewEvent event(String type, Map<String, Object> payload) {
		return NewEvent.builder().streamType("Test").eventType(type).schemaVersion(1).payload(payload)
				.occurredAt(Instant.now()).correlationId("corr-1").build();
	}
}

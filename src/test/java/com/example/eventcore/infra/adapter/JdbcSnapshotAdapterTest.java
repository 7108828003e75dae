package com.example.eventcore.infra.adapter;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.eventcore.application.domain.snapshot.AggregateSnapshot;
import com.example.eventcore.support.TestDatabase;

/**
 * <h1>快照適配器測試</h1>
 *
 * <pre>
 * <b>Scenario:</b> 驗證快照的存取、最新檢索以及舊快照清理功能。
 * <b>Given</b> 一個 Stream 存入多個不同版本的快照
 * <b>When</b>  查詢最新快照並清理
 * <b>Then</b>  findLatest 回傳版本最大的一份，清理後只留下指定數量
 * </pre>
 */
class JdbcSnapshotAdapterTest {

	private TestDatabase database;
	private JdbcSnapshotAdapter snapshots;

	@BeforeEach
	void setUp() {
		database = TestDatabase.create();
		snapshots = new JdbcSnapshotAdapter(database.jdbcTemplate(), database.codec());
	}

	@AfterEach
	void tearDown() {
		database.shutdown();
	}

	@Test
	@DisplayName("驗證快照生命週期：存儲、檢索最新、以及舊快照清理")
	void snapshotLifecycleAndCleanup() {
		// Given
		save("acc-1", 99, 1000);
		save("acc-1", 199, 1500);
		save("acc-1", 299, 1200);
		save("acc-2", 9, 1);

		// When
		Optional<AggregateSnapshot> latest = snapshots.findLatest("acc-1");

		// Then
		assertThat(latest).isPresent();
		assertThat(latest.get().getStreamVersion()).isEqualTo(299);
		assertThat(latest.get().getState()).containsEntry("balanceCents", 1200);

		// When
		int deleted = snapshots.deleteOlderSnapshots("acc-1", 1);

		// Then
		assertThat(deleted).isEqualTo(2);
		Integer remaining = database.jdbcTemplate().queryForObject(
				"SELECT COUNT(*) FROM aggregate_snapshots WHERE stream_id = ?", Integer.class, "acc-1");
		assertThat(remaining).isEqualTo(1);
		assertThat(snapshots.findLatest("acc-2")).isPresent();
	}

	@Test
	@DisplayName("同一版本重複儲存時覆寫")
	void sameVersionOverwrites() {
		save("acc-1", 4, 10);
		save("acc-1", 4, 20);

		assertThat(snapshots.findLatest("acc-1")).get().extracting(s -> s.getState().get("balanceCents"))
				.isEqualTo(20);
		assertThat(snapshots.deleteOlderSnapshots("acc-1", 2)).isZero();
	}

	@Test
	@DisplayName("沒有快照時回傳 empty")
	void missingSnapshot() {
		assertThat(snapshots.findLatest("none")).isEmpty();
	}

	private void save(String streamId, long version, long balance) {
		snapshots.save(AggregateSnapshot.builder().streamId(streamId).streamVersion(version)
				.state(Map.of("balanceCents", balance)).takenAt(Instant.now()).build());
	}
}

package com.example.eventcore.infra.adapter;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import com.example.eventcore.application.domain.snapshot.AggregateSnapshot;
import com.example.eventcore.application.port.SnapshotRepositoryPort;
import com.example.eventcore.infra.event.codec.EventJsonCodec;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 聚合快照的 JDBC 實作
 *
 * <p>
 * 快照以 {@code (stream_id, stream_version)} 為鍵，同一版本重複儲存時覆寫。
 * </p>
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcSnapshotAdapter implements SnapshotRepositoryPort {

	private final JdbcTemplate jdbcTemplate;
	private final EventJsonCodec codec;

	@Override
	public void save(AggregateSnapshot snapshot) {
		String state = codec.serialize(snapshot.getState());
		Timestamp takenAt = Timestamp.from(snapshot.getTakenAt());
		int updated = jdbcTemplate.update(
				"UPDATE aggregate_snapshots SET state = ?, taken_at = ? WHERE stream_id = ? AND stream_version = ?",
				state, takenAt, snapshot.getStreamId(), snapshot.getStreamVersion());
		if (updated == 0) {
			jdbcTemplate.update(
					"INSERT INTO aggregate_snapshots (stream_id, stream_version, state, taken_at) VALUES (?, ?, ?, ?)",
					snapshot.getStreamId(), snapshot.getStreamVersion(), state, takenAt);
		}
		log.debug("[Snapshot] 快照已存入: Stream={}, Version={}", snapshot.getStreamId(), snapshot.getStreamVersion());
	}

	@Override
	public Optional<AggregateSnapshot> findLatest(String streamId) {
		String sql = """
				SELECT stream_id, stream_version, state, taken_at FROM aggregate_snapshots
				WHERE stream_id = ?
				ORDER BY stream_version DESC
				LIMIT 1
				""";
		List<AggregateSnapshot> snapshots = jdbcTemplate.query(sql,
				(rs, rowNum) -> AggregateSnapshot.builder().streamId(rs.getString("stream_id"))
						.streamVersion(rs.getLong("stream_version"))
						.state(codec.deserializeToMap(rs.getString("state")))
						.takenAt(rs.getTimestamp("taken_at").toInstant()).build(),
				streamId);
		return snapshots.stream().findFirst();
	}

	@Override
	public int deleteOlderSnapshots(String streamId, int retainCount) {
		List<Long> versions = jdbcTemplate.queryForList(
				"SELECT stream_version FROM aggregate_snapshots WHERE stream_id = ? ORDER BY stream_version DESC",
				Long.class, streamId);
		if (versions.size() <= retainCount) {
			return 0;
		}
		long oldestRetained = versions.get(retainCount - 1);
		return jdbcTemplate.update("DELETE FROM aggregate_snapshots WHERE stream_id = ? AND stream_version < ?",
				streamId, oldestRetained);
	}
}

package com.example.eventcore.infra.adapter;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import com.example.eventcore.application.port.CheckpointRepositoryPort;

import lombok.RequiredArgsConstructor;

/**
 * 投影 Checkpoint 的 JDBC 實作
 */
@Repository
@RequiredArgsConstructor
public class JdbcCheckpointAdapter implements CheckpointRepositoryPort {

	private final JdbcTemplate jdbcTemplate;

	@Override
	public long load(String projectionName) {
		List<Long> positions = jdbcTemplate.queryForList(
				"SELECT global_position FROM projection_checkpoints WHERE projection_name = ?", Long.class,
				projectionName);
		return positions.isEmpty() ? 0 : positions.get(0);
	}

	@Override
	public void save(String projectionName, long globalPosition) {
		Timestamp now = Timestamp.from(Instant.now());
		// 只允許往前推進
		int updated = jdbcTemplate.update(
				"UPDATE projection_checkpoints SET global_position = ?, updated_at = ? WHERE projection_name = ? AND global_position < ?",
				globalPosition, now, projectionName, globalPosition);
		if (updated == 0 && !exists(projectionName)) {
			jdbcTemplate.update(
					"INSERT INTO projection_checkpoints (projection_name, global_position, updated_at) VALUES (?, ?, ?)",
					projectionName, globalPosition, now);
		}
	}

	@Override
	public void reset(String projectionName) {
		jdbcTemplate.update("DELETE FROM projection_checkpoints WHERE projection_name = ?", projectionName);
	}

	@Override
	public Map<String, Long> findAll() {
		Map<String, Long> checkpoints = new LinkedHashMap<>();
		jdbcTemplate.query("SELECT projection_name, global_position FROM projection_checkpoints ORDER BY projection_name",
				rs -> {
					checkpoints.put(rs.getString("projection_name"), rs.getLong("global_position"));
				});
		return checkpoints;
	}

	private boolean exists(String projectionName) {
		Integer count = jdbcTemplate.queryForObject(
				"SELECT COUNT(*) FROM projection_checkpoints WHERE projection_name = ?", Integer.class, projectionName);
		return count != null && count > 0;
	}
}

package com.example.eventcore.infra.adapter;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Collections;
import java.util.List;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import com.example.eventcore.application.domain.event.NewEvent;
import com.example.eventcore.application.domain.event.RecordedEvent;
import com.example.eventcore.application.port.EventLogPort;
import com.example.eventcore.application.shared.exception.ConcurrencyConflictException;
import com.example.eventcore.application.shared.exception.EventStorageException;
import com.example.eventcore.infra.event.codec.EventJsonCodec;

import lombok.extern.slf4j.Slf4j;

/**
 * 關聯式資料庫事件日誌 (預設實作)
 *
 * <p>
 * 每次 append 都在單一交易內完成：
 * <ol>
 * <li>先鎖定 {@code event_log_sequence} 並配發全域位置，使提交順序等於位置順序，讀者不會先看到較大的位置</li>
 * <li>檢查 Stream 目前版本，不符即拋出 {@link ConcurrencyConflictException}</li>
 * <li>批次寫入事件；{@code (stream_id, stream_version)} 唯一鍵衝突同樣轉譯為版本衝突</li>
 * </ol>
 * </p>
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "eventcore.event-log", name = "backend", havingValue = "jdbc", matchIfMissing = true)
public class JdbcEventLogAdapter implements EventLogPort {

	private static final String SELECT_COLUMNS = """
			SELECT global_position, stream_id, stream_type, stream_version, event_type, schema_version,
			       payload, occurred_at, correlation_id, causation_id
			FROM event_log
			""";

	private final JdbcTemplate jdbcTemplate;
	private final TransactionTemplate transactionTemplate;
	private final EventJsonCodec codec;
	private final RowMapper<RecordedEvent> rowMapper = this::mapRow;

	public JdbcEventLogAdapter(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager,
			EventJsonCodec codec) {
		this.jdbcTemplate = jdbcTemplate;
		this.transactionTemplate = new TransactionTemplate(transactionManager);
		this.codec = codec;
	}

	@Override
	public long append(String streamId, long expectedVersion, List<NewEvent> events) {
		if (events == null || events.isEmpty()) {
			throw new IllegalArgumentException("追加的事件不可為空 (stream=" + streamId + ")");
		}
		if (expectedVersion < -1) {
			throw new IllegalArgumentException("expectedVersion 不可小於 -1: " + expectedVersion);
		}
		try {
			Long newVersion = transactionTemplate.execute(status -> doAppend(streamId, expectedVersion, events));
			log.debug(">>> [EventLog] {} 追加 {} 筆事件，版本 v{}", streamId, events.size(), newVersion);
			return newVersion;
		} catch (DuplicateKeyException e) {
			throw new ConcurrencyConflictException(streamId, expectedVersion, currentVersion(streamId));
		} catch (DataAccessException e) {
			throw new EventStorageException("事件寫入失敗 (stream=" + streamId + ")", e);
		}
	}

	private long doAppend(String streamId, long expectedVersion, List<NewEvent> events) {
		int count = events.size();
		jdbcTemplate.update("UPDATE event_log_sequence SET last_position = last_position + ? WHERE id = 1", count);
		Long lastPosition = jdbcTemplate.queryForObject("SELECT last_position FROM event_log_sequence WHERE id = 1",
				Long.class);

		long current = currentVersion(streamId);
		if (current != expectedVersion) {
			throw new ConcurrencyConflictException(streamId, expectedVersion, current);
		}

		long firstPosition = lastPosition - count + 1;
		String sql = """
				INSERT INTO event_log (global_position, stream_id, stream_type, stream_version, event_type,
				                       schema_version, payload, occurred_at, correlation_id, causation_id)
				VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
				""";
		jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
			@Override
			public void setValues(PreparedStatement ps, int i) throws SQLException {
				NewEvent event = events.get(i);
				ps.setLong(1, firstPosition + i);
				ps.setString(2, streamId);
				ps.setString(3, event.getStreamType());
				ps.setLong(4, expectedVersion + 1 + i);
				ps.setString(5, event.getEventType());
				ps.setInt(6, event.getSchemaVersion());
				ps.setString(7, codec.serialize(event.getPayload()));
				ps.setTimestamp(8, Timestamp.from(event.getOccurredAt()));
				ps.setString(9, event.getCorrelationId());
				ps.setString(10, event.getCausationId());
			}

			@Override
			public int getBatchSize() {
				return count;
			}
		});
		return expectedVersion + count;
	}

	@Override
	public List<RecordedEvent> readStream(String streamId, long fromVersion) {
		try {
			return jdbcTemplate.query(SELECT_COLUMNS + " WHERE stream_id = ? AND stream_version >= ? ORDER BY stream_version",
					rowMapper, streamId, Math.max(0, fromVersion));
		} catch (DataAccessException e) {
			throw new EventStorageException("讀取 Stream 失敗 (stream=" + streamId + ")", e);
		}
	}

	@Override
	public List<RecordedEvent> readAll(long afterPosition, int maxCount) {
		try {
			return jdbcTemplate.query(SELECT_COLUMNS + " WHERE global_position > ? ORDER BY global_position LIMIT ?",
					rowMapper, afterPosition, maxCount);
		} catch (DataAccessException e) {
			throw new EventStorageException("讀取全域日誌失敗 (after=" + afterPosition + ")", e);
		}
	}

	@Override
	public long currentVersion(String streamId) {
		Long version = jdbcTemplate.queryForObject(
				"SELECT COALESCE(MAX(stream_version), -1) FROM event_log WHERE stream_id = ?", Long.class, streamId);
		return version == null ? -1 : version;
	}

	private RecordedEvent mapRow(ResultSet rs, int rowNum) throws SQLException {
		return RecordedEvent.builder().globalPosition(rs.getLong("global_position"))
				.streamId(rs.getString("stream_id")).streamType(rs.getString("stream_type"))
				.streamVersion(rs.getLong("stream_version")).eventType(rs.getString("event_type"))
				.schemaVersion(rs.getInt("schema_version"))
				.payload(Collections.unmodifiableMap(codec.deserializeToMap(rs.getString("payload"))))
				.occurredAt(rs.getTimestamp("occurred_at").toInstant()).correlationId(rs.getString("correlation_id"))
				.causationId(rs.getString("causation_id")).build();
	}
}

package com.example.eventcore.infra.adapter;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import com.example.eventcore.application.domain.saga.CompletedStep;
import com.example.eventcore.application.domain.saga.SagaInstance;
import com.example.eventcore.application.domain.saga.SagaLogEntry;
import com.example.eventcore.application.domain.saga.vo.CompensationState;
import com.example.eventcore.application.domain.saga.vo.SagaLogType;
import com.example.eventcore.application.domain.saga.vo.SagaStatus;
import com.example.eventcore.application.port.SagaRepositoryPort;
import com.example.eventcore.application.shared.exception.ConcurrencyConflictException;
import com.example.eventcore.infra.event.codec.EventJsonCodec;

import lombok.extern.slf4j.Slf4j;

/**
 * Saga 持久化的 JDBC 實作
 *
 * <p>
 * 狀態更新、已完成步驟與日誌在同一個交易內寫入；{@code version} 欄位作為樂觀鎖，防止多個程序同時推進同一個 Saga。
 * </p>
 */
@Slf4j
@Repository
public class JdbcSagaRepositoryAdapter implements SagaRepositoryPort {

	private final JdbcTemplate jdbcTemplate;
	private final TransactionTemplate transactionTemplate;
	private final EventJsonCodec codec;

	public JdbcSagaRepositoryAdapter(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager,
			EventJsonCodec codec) {
		this.jdbcTemplate = jdbcTemplate;
		this.transactionTemplate = new TransactionTemplate(transactionManager);
		this.codec = codec;
	}

	@Override
	public void create(SagaInstance instance, SagaLogEntry startedEntry) {
		transactionTemplate.executeWithoutResult(status -> {
			jdbcTemplate.update("""
					INSERT INTO saga_instances (saga_id, definition_name, status, current_step_index, input,
					                            failure_reason, cancel_requested, version, created_at, updated_at)
					VALUES (?, ?, ?, ?, ?, ?, FALSE, ?, ?, ?)
					""", instance.getSagaId(), instance.getDefinitionName(), instance.getStatus().name(),
					instance.getCurrentStepIndex(), codec.serialize(instance.getInput()), instance.getFailureReason(),
					instance.getVersion(), Timestamp.from(instance.getCreatedAt()),
					Timestamp.from(instance.getUpdatedAt()));
			insertLog(List.of(startedEntry));
		});
	}

	@Override
	public void update(SagaInstance instance, List<SagaLogEntry> entries) {
		transactionTemplate.executeWithoutResult(status -> {
			int updated = jdbcTemplate.update("""
					UPDATE saga_instances
					SET status = ?, current_step_index = ?, failure_reason = ?, version = version + 1, updated_at = ?
					WHERE saga_id = ? AND version = ?
					""", instance.getStatus().name(), instance.getCurrentStepIndex(), instance.getFailureReason(),
					Timestamp.from(instance.getUpdatedAt()), instance.getSagaId(), instance.getVersion());
			if (updated == 0) {
				throw new ConcurrencyConflictException(instance.getSagaId(), instance.getVersion(), -1);
			}
			replaceCompletedSteps(instance);
			insertLog(entries);
		});
		instance.setVersion(instance.getVersion() + 1);
	}

	@Override
	public void appendLog(SagaLogEntry entry) {
		insertLog(List.of(entry));
	}

	@Override
	public Optional<SagaInstance> findById(String sagaId) {
		List<SagaInstance> found = jdbcTemplate.query("""
				SELECT saga_id, definition_name, status, current_step_index, input, failure_reason, version,
				       created_at, updated_at
				FROM saga_instances WHERE saga_id = ?
				""", this::mapInstance, sagaId);
		if (found.isEmpty()) {
			return Optional.empty();
		}
		SagaInstance instance = found.get(0);
		instance.setCompletedSteps(new ArrayList<>(jdbcTemplate.query("""
				SELECT step_index, step_name, result, compensation_input, compensation_state
				FROM saga_completed_steps WHERE saga_id = ? ORDER BY step_index
				""", this::mapStep, sagaId)));
		return Optional.of(instance);
	}

	@Override
	public List<SagaLogEntry> findLog(String sagaId) {
		return jdbcTemplate.query("""
				SELECT saga_id, sequence_no, entry_type, step_index, step_name, attempt, data, error, recorded_at
				FROM saga_log WHERE saga_id = ? ORDER BY sequence_no
				""", this::mapLog, sagaId);
	}

	@Override
	public long lastLogSequence(String sagaId) {
		Long last = jdbcTemplate.queryForObject("SELECT COALESCE(MAX(sequence_no), 0) FROM saga_log WHERE saga_id = ?",
				Long.class, sagaId);
		return last == null ? 0 : last;
	}

	@Override
	public void requestCancel(String sagaId) {
		jdbcTemplate.update("UPDATE saga_instances SET cancel_requested = TRUE WHERE saga_id = ?", sagaId);
	}

	@Override
	public boolean isCancelRequested(String sagaId) {
		List<Boolean> flags = jdbcTemplate.queryForList(
				"SELECT cancel_requested FROM saga_instances WHERE saga_id = ?", Boolean.class, sagaId);
		return !flags.isEmpty() && Boolean.TRUE.equals(flags.get(0));
	}

	@Override
	public List<String> findStale(Instant updatedBefore, int limit) {
		return jdbcTemplate.queryForList("""
				SELECT saga_id FROM saga_instances
				WHERE status IN ('RUNNING', 'COMPENSATING') AND updated_at < ?
				ORDER BY updated_at
				LIMIT ?
				""", String.class, Timestamp.from(updatedBefore), limit);
	}

	@Override
	public int deleteFinishedBefore(Instant finishedBefore) {
		Integer deleted = transactionTemplate.execute(status -> {
			List<String> ids = jdbcTemplate.queryForList("""
					SELECT saga_id FROM saga_instances
					WHERE status IN ('COMPLETED', 'FAILED') AND updated_at < ?
					""", String.class, Timestamp.from(finishedBefore));
			for (String sagaId : ids) {
				jdbcTemplate.update("DELETE FROM saga_log WHERE saga_id = ?", sagaId);
				jdbcTemplate.update("DELETE FROM saga_completed_steps WHERE saga_id = ?", sagaId);
				jdbcTemplate.update("DELETE FROM saga_instances WHERE saga_id = ?", sagaId);
			}
			return ids.size();
		});
		return deleted == null ? 0 : deleted;
	}

	private void replaceCompletedSteps(SagaInstance instance) {
		jdbcTemplate.update("DELETE FROM saga_completed_steps WHERE saga_id = ?", instance.getSagaId());
		List<CompletedStep> steps = instance.getCompletedSteps();
		if (steps.isEmpty()) {
			return;
		}
		jdbcTemplate.batchUpdate("""
				INSERT INTO saga_completed_steps (saga_id, step_index, step_name, result, compensation_input,
				                                  compensation_state)
				VALUES (?, ?, ?, ?, ?, ?)
				""", new BatchPreparedStatementSetter() {
			@Override
			public void setValues(PreparedStatement ps, int i) throws SQLException {
				CompletedStep step = steps.get(i);
				ps.setString(1, instance.getSagaId());
				ps.setInt(2, step.getStepIndex());
				ps.setString(3, step.getStepName());
				ps.setString(4, codec.serialize(step.getResult()));
				ps.setString(5, codec.serialize(step.getCompensationInput()));
				ps.setString(6, step.getCompensationState().name());
			}

			@Override
			public int getBatchSize() {
				return steps.size();
			}
		});
	}

	private void insertLog(List<SagaLogEntry> entries) {
		jdbcTemplate.batchUpdate("""
				INSERT INTO saga_log (saga_id, sequence_no, entry_type, step_index, step_name, attempt, data, error,
				                      recorded_at)
				VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
				""", new BatchPreparedStatementSetter() {
			@Override
			public void setValues(PreparedStatement ps, int i) throws SQLException {
				SagaLogEntry entry = entries.get(i);
				ps.setString(1, entry.getSagaId());
				ps.setLong(2, entry.getSequence());
				ps.setString(3, entry.getType().name());
				ps.setObject(4, entry.getStepIndex());
				ps.setString(5, entry.getStepName());
				ps.setInt(6, entry.getAttempt());
				ps.setString(7, entry.getData() == null ? null : codec.serialize(entry.getData()));
				ps.setString(8, truncate(entry.getError()));
				ps.setTimestamp(9, Timestamp.from(entry.getRecordedAt()));
			}

			@Override
			public int getBatchSize() {
				return entries.size();
			}
		});
	}

	private SagaInstance mapInstance(ResultSet rs, int rowNum) throws SQLException {
		return SagaInstance.builder().sagaId(rs.getString("saga_id")).definitionName(rs.getString("definition_name"))
				.status(SagaStatus.valueOf(rs.getString("status"))).currentStepIndex(rs.getInt("current_step_index"))
				.input(codec.deserializeToMap(rs.getString("input"))).failureReason(rs.getString("failure_reason"))
				.version(rs.getLong("version")).createdAt(rs.getTimestamp("created_at").toInstant())
				.updatedAt(rs.getTimestamp("updated_at").toInstant()).build();
	}

	private CompletedStep mapStep(ResultSet rs, int rowNum) throws SQLException {
		return CompletedStep.builder().stepIndex(rs.getInt("step_index")).stepName(rs.getString("step_name"))
				.result(codec.deserializeToMap(rs.getString("result")))
				.compensationInput(codec.deserializeToMap(rs.getString("compensation_input")))
				.compensationState(CompensationState.valueOf(rs.getString("compensation_state"))).build();
	}

	private SagaLogEntry mapLog(ResultSet rs, int rowNum) throws SQLException {
		String data = rs.getString("data");
		int stepIndex = rs.getInt("step_index");
		Integer nullableStepIndex = rs.wasNull() ? null : stepIndex;
		return SagaLogEntry.builder().sagaId(rs.getString("saga_id")).sequence(rs.getLong("sequence_no"))
				.type(SagaLogType.valueOf(rs.getString("entry_type"))).stepIndex(nullableStepIndex)
				.stepName(rs.getString("step_name")).attempt(rs.getInt("attempt"))
				.data(data == null ? null : codec.deserializeToMap(data))
				.error(rs.getString("error")).recordedAt(rs.getTimestamp("recorded_at").toInstant()).build();
	}

	private static String truncate(String error) {
		if (error == null || error.length() <= 1000) {
			return error;
		}
		return error.substring(0, 1000);
	}
}

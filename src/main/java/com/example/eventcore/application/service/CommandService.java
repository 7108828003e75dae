package com.example.eventcore.application.service;

import com.example.eventcore.application.domain.event.EventMetadata;
import com.example.eventcore.application.shared.exception.ConcurrencyConflictException;

import lombok.extern.slf4j.Slf4j;

/**
 * 指令提交服務 (Command Side Application Service)
 *
 * <p>
 * 呼叫端不指定 expectedVersion 時，版本衝突會以「重新載入 + 重新執行」的方式重試，次數由設定決定；
 * 指定 expectedVersion 代表呼叫端要求嚴格的樂觀鎖，衝突直接回拋。 領域驗證錯誤永遠不重試。
 * </p>
 */
@Slf4j
public class CommandService {

	private final AggregateEngineRegistry engines;
	private final int maxConflictRetries;

	public CommandService(AggregateEngineRegistry engines, int maxConflictRetries) {
		this.engines = engines;
		this.maxConflictRetries = maxConflictRetries;
	}

	/**
	 * 提交指令
	 *
	 * @param streamType      聚合型別 (例如 Order)
	 * @param streamId        Stream 識別碼
	 * @param command         指令物件
	 * @param metadata        追蹤資訊
	 * @param expectedVersion 預期版本，null 代表由系統載入時決定
	 * @return 指令執行結果
	 */
	public CommandResult submit(String streamType, String streamId, Object command, EventMetadata metadata,
			Long expectedVersion) {
		AggregateEngine<?> engine = engines.get(streamType);
		if (expectedVersion != null) {
			return engine.handle(streamId, command, metadata, expectedVersion);
		}

		int attempt = 0;
		while (true) {
			try {
				CommandResult result = engine.handle(streamId, command, metadata, null);
				log.debug(">>> [Command] {}/{} {} -> v{}", streamType, streamId, command.getClass().getSimpleName(),
						result.version());
				return result;
			} catch (ConcurrencyConflictException e) {
				if (attempt >= maxConflictRetries) {
					log.warn(">>> [Command] {}/{} 版本衝突，已重試 {} 次仍失敗", streamType, streamId, attempt);
					throw e;
				}
				attempt++;
				log.info(">>> [Command] {}/{} 版本衝突 (expected={}, actual={})，重新載入後第 {} 次重試", streamType,
						streamId, e.getExpectedVersion(), e.getActualVersion(), attempt);
			}
		}
	}

	public CommandResult submit(String streamType, String streamId, Object command, EventMetadata metadata) {
		return submit(streamType, streamId, command, metadata, null);
	}
}

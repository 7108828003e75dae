package com.example.eventcore.application.port;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import com.example.eventcore.application.domain.saga.SagaInstance;
import com.example.eventcore.application.domain.saga.SagaLogEntry;
import com.example.eventcore.application.shared.exception.ConcurrencyConflictException;

/**
 * Saga 持久化埠：執行個體、已完成步驟與執行日誌
 */
public interface SagaRepositoryPort {

	/**
	 * 建立新的 Saga 並寫入第一筆日誌
	 */
	void create(SagaInstance instance, SagaLogEntry startedEntry);

	/**
	 * 以樂觀鎖更新 Saga 狀態，並在同一個交易內追加日誌。成功後 instance 的 version 會加一。
	 *
	 * @throws ConcurrencyConflictException instance.version 與資料庫不一致
	 */
	void update(SagaInstance instance, List<SagaLogEntry> entries);

	/**
	 * 追加不影響狀態的日誌 (例如單次嘗試的紀錄)
	 */
	void appendLog(SagaLogEntry entry);

	Optional<SagaInstance> findById(String sagaId);

	/**
	 * 依 sequence 排序的完整日誌
	 */
	List<SagaLogEntry> findLog(String sagaId);

	long lastLogSequence(String sagaId);

	/**
	 * 標記取消請求，供其他程序中正在執行的 Saga 在下一次檢查時發現
	 */
	void requestCancel(String sagaId);

	boolean isCancelRequested(String sagaId);

	/**
	 * 查詢 updatedBefore 之前最後更新、仍在 RUNNING / COMPENSATING 的 Saga
	 */
	List<String> findStale(Instant updatedBefore, int limit);

	/**
	 * 刪除 finishedBefore 之前結束的 Saga 及其日誌
	 */
	int deleteFinishedBefore(Instant finishedBefore);
}

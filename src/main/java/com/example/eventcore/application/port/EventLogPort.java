package com.example.eventcore.application.port;

import java.time.Duration;
import java.util.Iterator;
import java.util.List;

import com.example.eventcore.application.domain.event.ExpectedVersion;
import com.example.eventcore.application.domain.event.NewEvent;
import com.example.eventcore.application.domain.event.RecordedEvent;
import com.example.eventcore.application.shared.exception.ConcurrencyConflictException;

/**
 * 事件日誌埠 (Event Log Port)
 *
 * <p>
 * 系統唯一的真相來源，也是唯一允許變更 Stream 狀態的元件。 快照、Checkpoint 與 Saga 狀態皆為可由此重建的衍生資料。
 * </p>
 */
public interface EventLogPort {

	/**
	 * 以樂觀併發控制追加一批事件 (全有或全無)。
	 *
	 * @param streamId        Stream 識別碼
	 * @param expectedVersion 呼叫端預期的目前版本，{@link ExpectedVersion#NO_STREAM} 代表 Stream 不可存在
	 * @param events          待追加事件，不可為空
	 * @return 追加後的 Stream 版本
	 * @throws ConcurrencyConflictException 目前版本與 expectedVersion 不一致
	 */
	long append(String streamId, long expectedVersion, List<NewEvent> events);

	/**
	 * 讀取單一 Stream，從 fromVersion (含) 開始依序回傳。Stream 不存在時回傳空清單。
	 */
	List<RecordedEvent> readStream(String streamId, long fromVersion);

	default List<RecordedEvent> readStream(String streamId) {
		return readStream(streamId, 0);
	}

	/**
	 * 讀取全域日誌中位置大於 afterPosition 的一頁事件，依 globalPosition 排序。
	 */
	List<RecordedEvent> readAll(long afterPosition, int maxCount);

	/**
	 * 目前 Stream 版本，不存在時為 -1
	 */
	long currentVersion(String streamId);

	/**
	 * 以 afterPosition 為起點的無限延遲序列，讀完現有事件後會輪詢等待新事件。
	 *
	 * @param afterPosition 已處理的最後位置
	 * @param pageSize      每次向日誌讀取的筆數
	 * @param pollInterval  無新事件時的等待間隔
	 */
	default Iterator<RecordedEvent> tailAll(long afterPosition, int pageSize, Duration pollInterval) {
		return new TailingEventIterator(this, afterPosition, pageSize, pollInterval);
	}
}

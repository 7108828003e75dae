package com.example.eventcore.application.port;

import java.util.Optional;

import com.example.eventcore.application.domain.snapshot.AggregateSnapshot;

/**
 * 聚合快照儲存埠 (Snapshot Repository Port)
 *
 * <p>
 * 快照只用來縮短重播，永遠不是權威資料。
 * </p>
 */
public interface SnapshotRepositoryPort {

	/**
	 * 儲存一個新的快照
	 * 
	 * @param snapshot 聚合快照
	 */
	void save(AggregateSnapshot snapshot);

	/**
	 * 取得該 Stream 最新的快照
	 * 
	 * @param streamId Stream 識別碼
	 * @return 最新的快照，若無快照則回傳 Optional.empty()
	 */
	Optional<AggregateSnapshot> findLatest(String streamId);

	/**
	 * 清理過舊的快照
	 * 
	 * @param streamId    Stream 識別碼
	 * @param retainCount 保留最新的快照數量
	 * @return 刪除筆數
	 */
	int deleteOlderSnapshots(String streamId, int retainCount);
}

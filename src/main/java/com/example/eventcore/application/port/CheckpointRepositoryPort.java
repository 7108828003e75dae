package com.example.eventcore.application.port;

import java.util.Map;

/**
 * 投影進度 (Checkpoint) 儲存埠
 */
public interface CheckpointRepositoryPort {

	/**
	 * 讀取投影最後處理的全域位置，從未執行過時回傳 0
	 */
	long load(String projectionName);

	/**
	 * 持久化投影進度，僅允許往前推進
	 */
	void save(String projectionName, long globalPosition);

	/**
	 * 將投影進度歸零，僅供重建 (rebuild) 使用
	 */
	void reset(String projectionName);

	Map<String, Long> findAll();
}

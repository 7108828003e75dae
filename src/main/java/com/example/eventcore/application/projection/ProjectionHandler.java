package com.example.eventcore.application.projection;

import com.example.eventcore.application.domain.event.RecordedEvent;

/**
 * 投影處理器
 *
 * <p>
 * 事件至少送達一次，實作必須冪等：讀取模型記錄最後套用的全域位置，小於等於該位置的事件直接忽略。
 * </p>
 */
public interface ProjectionHandler {

	/**
	 * 投影名稱，同時作為 Checkpoint 的鍵
	 */
	String projectionName();

	/**
	 * 套用單一事件 (已經過升級鏈)，失敗時拋出例外以停止該投影的前進
	 */
	void handle(RecordedEvent event);

	/**
	 * 清空讀取模型，供重建使用
	 */
	void reset();
}

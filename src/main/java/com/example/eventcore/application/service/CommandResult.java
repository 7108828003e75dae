package com.example.eventcore.application.service;

/**
 * 指令執行結果
 *
 * @param streamId       Stream 識別碼
 * @param version        執行後的 Stream 版本
 * @param appendedEvents 本次追加的事件數，冪等重送時為 0
 */
public record CommandResult(String streamId, long version, int appendedEvents) {

	public boolean isNoop() {
		return appendedEvents == 0;
	}
}

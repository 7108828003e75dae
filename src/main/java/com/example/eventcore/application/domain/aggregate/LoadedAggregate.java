package com.example.eventcore.application.domain.aggregate;

/**
 * 已載入的聚合：狀態與其對應的 Stream 版本 (-1 代表尚無事件)
 */
public record LoadedAggregate<S>(String streamId, S state, long version) {
}

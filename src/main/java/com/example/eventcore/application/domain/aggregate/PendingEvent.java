package com.example.eventcore.application.domain.aggregate;

/**
 * 指令產生、尚未寫入日誌的事件
 *
 * @param eventType     事件型別
 * @param schemaVersion payload 的結構版本
 * @param payload       領域 payload 物件
 */
public record PendingEvent(String eventType, int schemaVersion, Object payload) {
}

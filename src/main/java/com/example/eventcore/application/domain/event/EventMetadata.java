package com.example.eventcore.application.domain.event;

/**
 * 指令與事件的追蹤資訊
 *
 * @param correlationId 整段業務流程共用的追蹤 ID
 * @param causationId   直接導致此事件的訊息 ID
 */
public record EventMetadata(String correlationId, String causationId) {

	public static EventMetadata none() {
		return new EventMetadata(null, null);
	}

	public static EventMetadata of(String correlationId, String causationId) {
		return new EventMetadata(correlationId, causationId);
	}
}

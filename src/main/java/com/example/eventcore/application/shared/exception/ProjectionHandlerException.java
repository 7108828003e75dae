package com.example.eventcore.application.shared.exception;

import lombok.Getter;

/**
 * 投影處理器套用事件失敗，該投影的 Checkpoint 不會前進
 */
@Getter
public class ProjectionHandlerException extends EventCoreException {

	private static final long serialVersionUID = 1L;

	private final String projectionName;
	private final long globalPosition;

	public ProjectionHandlerException(String projectionName, long globalPosition, Throwable cause) {
		super("投影 " + projectionName + " 於位置 " + globalPosition + " 處理失敗: " + cause.getMessage(), cause);
		this.projectionName = projectionName;
		this.globalPosition = globalPosition;
	}
}

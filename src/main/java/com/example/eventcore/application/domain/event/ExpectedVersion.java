package com.example.eventcore.application.domain.event;

/**
 * expectedVersion 的特殊值
 */
public final class ExpectedVersion {

	/**
	 * Stream 必須尚未存在
	 */
	public static final long NO_STREAM = -1L;

	private ExpectedVersion() {
	}
}

package com.example.eventcore.application.shared.exception;

import lombok.Getter;

/**
 * 樂觀併發衝突 (Optimistic Concurrency Conflict)
 *
 * <p>
 * 當呼叫端的 expectedVersion 與 Stream 目前版本不一致時拋出。 呼叫端應重新 load、重新 execute 後再重試 append。
 * </p>
 */
@Getter
public class ConcurrencyConflictException extends EventCoreException {

	private static final long serialVersionUID = 1L;

	private final String streamId;
	private final long expectedVersion;
	private final long actualVersion;

	public ConcurrencyConflictException(String streamId, long expectedVersion, long actualVersion) {
		super("Stream " + streamId + " 版本衝突: expected=" + expectedVersion + ", actual=" + actualVersion);
		this.streamId = streamId;
		this.expectedVersion = expectedVersion;
		this.actualVersion = actualVersion;
	}

	@Override
	public boolean isRetryable() {
		return true;
	}
}

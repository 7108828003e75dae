package com.example.eventcore.application.domain.saga;

import java.time.Duration;

/**
 * 指數退避重試策略
 *
 * @param maxAttempts  最多嘗試次數 (含第一次)
 * @param initialDelay 第一次重試前的等待
 * @param multiplier   每次重試的等待倍數
 * @param maxDelay     等待上限
 */
public record RetryPolicy(int maxAttempts, Duration initialDelay, double multiplier, Duration maxDelay) {

	public RetryPolicy {
		if (maxAttempts < 1) {
			throw new IllegalArgumentException("maxAttempts 至少為 1");
		}
		if (multiplier < 1.0) {
			throw new IllegalArgumentException("multiplier 不可小於 1");
		}
	}

	/**
	 * 只嘗試一次、失敗不重試
	 */
	public static RetryPolicy once() {
		return new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO);
	}

	public boolean hasAttemptsAfter(int attempt) {
		return attempt < maxAttempts;
	}

	/**
	 * 第 attempt 次失敗後、下一次嘗試前的等待時間
	 */
	public Duration delayAfter(int attempt) {
		double millis = initialDelay.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
		long capped = (long) Math.min(millis, maxDelay.toMillis());
		return Duration.ofMillis(Math.max(0, capped));
	}
}

package com.example.eventcore.application.domain.snapshot;

/**
 * 快照策略：每累積 interval 個事件建立一次快照，並保留最新 retain 份
 *
 * @param interval 快照間隔事件數，0 代表停用
 * @param retain   每個 Stream 保留的快照數
 */
public record SnapshotPolicy(int interval, int retain) {

	public SnapshotPolicy {
		if (interval < 0) {
			throw new IllegalArgumentException("snapshot interval 不可為負數");
		}
		if (retain < 1) {
			throw new IllegalArgumentException("snapshot retain 至少為 1");
		}
	}

	public static SnapshotPolicy disabled() {
		return new SnapshotPolicy(0, 1);
	}

	/**
	 * 版本由 previousVersion 推進到 newVersion 時，事件總數是否跨過 interval 的倍數
	 */
	public boolean shouldSnapshot(long previousVersion, long newVersion) {
		if (interval == 0 || newVersion <= previousVersion) {
			return false;
		}
		return (newVersion + 1) / interval > (previousVersion + 1) / interval;
	}
}

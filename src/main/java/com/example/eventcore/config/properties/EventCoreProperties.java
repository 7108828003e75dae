package com.example.eventcore.config.properties;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 事件核心設定 ({@code eventcore.*})
 *
 * <p>
 * 所有數值皆在 application.yml 中明確給定，程式碼不內建預設值。
 * </p>
 */
@ConfigurationProperties(prefix = "eventcore")
public record EventCoreProperties(EventLog eventLog, Snapshot snapshot, Projection projection, Command command,
		Saga saga) {

	/**
	 * @param backend 事件日誌實作：{@code jdbc} 或 {@code eventstoredb}
	 */
	public record EventLog(String backend) {
	}

	/**
	 * @param interval 每累積多少事件建立一次快照，0 代表停用
	 * @param retain   每個 Stream 保留的快照數
	 */
	public record Snapshot(int interval, int retain) {
	}

	/**
	 * @param autoStart    啟動時是否自動執行已註冊的投影
	 * @param pollInterval 無新事件時的輪詢間隔
	 * @param batchSize    每次讀取的事件數
	 * @param errorBackoff 投影失敗後的等待時間
	 */
	public record Projection(boolean autoStart, Duration pollInterval, int batchSize, Duration errorBackoff) {
	}

	/**
	 * @param maxConflictRetries 版本衝突時重新載入並重試的次數
	 * @param ringBufferSize     指令 RingBuffer 容量 (2 的次方)
	 */
	public record Command(int maxConflictRetries, int ringBufferSize) {
	}

	/**
	 * @param stepTimeout       單一步驟的執行時限
	 * @param executorThreads   步驟執行緒數
	 * @param retry             正向步驟的重試策略
	 * @param compensationRetry 補償步驟的重試策略
	 * @param recovery          中斷 Saga 的恢復排程
	 * @param cleanup           終結 Saga 的清理排程
	 */
	public record Saga(Duration stepTimeout, int executorThreads, Retry retry, Retry compensationRetry,
			Recovery recovery, Cleanup cleanup) {
	}

	public record Retry(int maxAttempts, Duration initialDelay, double multiplier, Duration maxDelay) {
	}

	/**
	 * @param enabled    是否啟用恢復排程
	 * @param staleAfter 超過此時間未更新的執行中 Saga 視為中斷
	 * @param interval   掃描間隔
	 */
	public record Recovery(boolean enabled, Duration staleAfter, Duration interval) {
	}

	/**
	 * @param cron      清理排程
	 * @param retention 已結束 Saga 的保留期間
	 */
	public record Cleanup(String cron, Duration retention) {
	}
}

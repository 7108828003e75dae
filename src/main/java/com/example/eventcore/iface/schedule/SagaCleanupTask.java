package com.example.eventcore.iface.schedule;

import java.time.Clock;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.example.eventcore.application.port.SagaRepositoryPort;
import com.example.eventcore.config.properties.EventCoreProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 已結束 Saga 的自動清理任務
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SagaCleanupTask {

	private final SagaRepositoryPort sagaRepository;
	private final EventCoreProperties properties;
	private final Clock clock;

	/**
	 * 刪除保留期間之前結束 (COMPLETED / FAILED) 的 Saga 與其日誌
	 */
	@Scheduled(cron = "${eventcore.saga.cleanup.cron}")
	public void cleanupFinishedSagas() {
		log.info(">>> [Cleanup] 開始清理已結束的 Saga...");
		try {
			int deleted = sagaRepository.deleteFinishedBefore(clock.instant().minus(properties.saga().cleanup().retention()));
			log.info(">>> [Cleanup] 清理完成，共移除 {} 筆 Saga", deleted);
		} catch (Exception e) {
			log.error(">>> [Cleanup] 清理過程發生異常: {}", e.getMessage(), e);
		}
	}
}

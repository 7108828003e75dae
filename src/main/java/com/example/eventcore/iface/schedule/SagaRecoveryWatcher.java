package com.example.eventcore.iface.schedule;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.example.eventcore.application.saga.SagaOrchestrator;
import com.example.eventcore.config.properties.EventCoreProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Saga 恢復監視器：找回因程序中斷而停在 RUNNING / COMPENSATING 的 Saga 並繼續推進
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "eventcore.saga.recovery", name = "enabled", havingValue = "true")
public class SagaRecoveryWatcher {

	private final SagaOrchestrator orchestrator;
	private final EventCoreProperties properties;

	@Scheduled(fixedDelayString = "${eventcore.saga.recovery.interval}", initialDelayString = "${eventcore.saga.recovery.interval}")
	public void resumeStaleSagas() {
		try {
			int resumed = orchestrator.resumeStale(properties.saga().recovery().staleAfter());
			if (resumed > 0) {
				log.info(">>> [Watcher] 本輪恢復 {} 筆中斷的 Saga", resumed);
			}
		} catch (Exception e) {
			log.error(">>> [Watcher] 掃描中斷 Saga 失敗: {}", e.getMessage(), e);
		}
	}
}

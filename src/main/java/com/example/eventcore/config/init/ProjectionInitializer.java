package com.example.eventcore.config.init;

import java.util.List;

import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import com.example.eventcore.application.projection.ProjectionHandler;
import com.example.eventcore.application.projection.ProjectionManager;
import com.example.eventcore.config.properties.EventCoreProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 應用程式就緒後啟動所有投影的背景工作
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProjectionInitializer {

	private final ProjectionManager projectionManager;
	private final List<ProjectionHandler> handlers;
	private final EventCoreProperties properties;

	@EventListener(ApplicationReadyEvent.class)
	public void startProjections() {
		if (!properties.projection().autoStart()) {
			log.info(">>> [系統初始化] eventcore.projection.auto-start=false，投影需手動觸發");
			return;
		}
		handlers.forEach(projectionManager::run);
		log.info(">>> [系統初始化] 已啟動 {} 個投影", handlers.size());
	}
}

package com.example.eventcore.application.projection;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import com.example.eventcore.application.domain.event.RecordedEvent;
import com.example.eventcore.application.domain.upcast.UpcasterChain;
import com.example.eventcore.application.port.CheckpointRepositoryPort;
import com.example.eventcore.application.port.EventLogPort;
import com.example.eventcore.application.shared.exception.ProjectionHandlerException;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

/**
 * 投影管理器 (Projection Manager)
 *
 * <p>
 * 每個投影擁有一條獨立的排程執行緒，依全域位置順序讀取事件、經過升級鏈後交給處理器，
 * 每套用一筆事件就持久化一次 Checkpoint，重啟後可從中斷處續傳 (at-least-once)。
 * </p>
 *
 * <h2>失敗處理：</h2>
 * <ul>
 * <li>處理器或升級失敗時，該投影停在失敗事件之前 (Checkpoint 不動)，記錄於狀態並在退避後重試。</li>
 * <li>各投影互不影響，也不影響寫入端。</li>
 * <li>重建 (rebuild) 會排入該投影自己的執行緒，與一般輪詢互斥。</li>
 * </ul>
 */
@Slf4j
public class ProjectionManager {

	private final EventLogPort eventLog;
	private final UpcasterChain upcasterChain;
	private final CheckpointRepositoryPort checkpoints;
	private final int batchSize;
	private final Duration pollInterval;
	private final Duration errorBackoff;
	private final Clock clock;

	private final Map<String, Worker> workers = new ConcurrentHashMap<>();
	private final Map<String, Tracker> trackers = new ConcurrentHashMap<>();

	public ProjectionManager(EventLogPort eventLog, UpcasterChain upcasterChain, CheckpointRepositoryPort checkpoints,
			int batchSize, Duration pollInterval, Duration errorBackoff, Clock clock) {
		if (batchSize < 1) {
			throw new IllegalArgumentException("projection batch size 至少為 1");
		}
		this.eventLog = eventLog;
		this.upcasterChain = upcasterChain;
		this.checkpoints = checkpoints;
		this.batchSize = batchSize;
		this.pollInterval = pollInterval;
		this.errorBackoff = errorBackoff;
		this.clock = clock;
	}

	/**
	 * 啟動投影的背景工作
	 *
	 * @throws IllegalStateException 同名投影已在執行
	 */
	public void run(String projectionName, ProjectionHandler handler) {
		Worker worker = new Worker(projectionName, handler);
		if (workers.putIfAbsent(projectionName, worker) != null) {
			throw new IllegalStateException("投影已在執行中: " + projectionName);
		}
		log.info(">>> [Projection] 啟動 {}，目前進度: {}", projectionName, checkpoints.load(projectionName));
		worker.schedule(Duration.ZERO);
	}

	public void run(ProjectionHandler handler) {
		run(handler.projectionName(), handler);
	}

	/**
	 * 同步追上日誌尾端一次
	 *
	 * @return 本次套用的事件數
	 * @throws ProjectionHandlerException 處理器或升級失敗，Checkpoint 停在失敗事件之前
	 */
	public int catchUp(String projectionName, ProjectionHandler handler) {
		Tracker tracker = tracker(projectionName);
		synchronized (tracker) {
			long position = checkpoints.load(projectionName);
			int processed = 0;
			while (true) {
				List<RecordedEvent> page = eventLog.readAll(position, batchSize);
				for (RecordedEvent raw : page) {
					try {
						handler.handle(upcasterChain.upcast(raw));
					} catch (RuntimeException e) {
						tracker.failed(raw.getGlobalPosition(), e, clock.instant());
						throw new ProjectionHandlerException(projectionName, raw.getGlobalPosition(), e);
					}
					checkpoints.save(projectionName, raw.getGlobalPosition());
					position = raw.getGlobalPosition();
					processed++;
				}
				if (page.size() < batchSize) {
					break;
				}
			}
			tracker.succeeded(processed, clock.instant());
			if (processed > 0) {
				log.debug(">>> [Projection] {} 套用 {} 筆事件，進度 {}", projectionName, processed, position);
			}
			return processed;
		}
	}

	/**
	 * 清空讀取模型並從頭重建；背景工作執行中時排入同一條執行緒並等待完成
	 *
	 * @return 重建時套用的事件數
	 */
	public int rebuild(String projectionName, ProjectionHandler handler) {
		Worker worker = workers.get(projectionName);
		if (worker == null) {
			return doRebuild(projectionName, handler);
		}
		Future<Integer> future = worker.executor.submit(() -> doRebuild(projectionName, handler));
		try {
			return future.get();
		} catch (ExecutionException e) {
			if (e.getCause() instanceof RuntimeException) {
				throw (RuntimeException) e.getCause();
			}
			throw new IllegalStateException("投影重建失敗: " + projectionName, e.getCause());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("投影重建被中斷: " + projectionName, e);
		}
	}

	/**
	 * 使用已註冊的處理器重建
	 */
	public int rebuild(String projectionName) {
		Worker worker = workers.get(projectionName);
		if (worker == null) {
			throw new IllegalArgumentException("未註冊的投影: " + projectionName);
		}
		return rebuild(projectionName, worker.handler);
	}

	public ProjectionStatus status(String projectionName) {
		Tracker tracker = trackers.get(projectionName);
		Worker worker = workers.get(projectionName);
		long checkpoint = checkpoints.load(projectionName);
		boolean running = worker != null && !worker.stopped;
		if (tracker == null) {
			return new ProjectionStatus(projectionName, checkpoint, running, 0, null, null, null, null);
		}
		synchronized (tracker.stats) {
			return new ProjectionStatus(projectionName, checkpoint, running, tracker.stats.consecutiveFailures,
					tracker.stats.lastError, tracker.stats.failedPosition, tracker.stats.lastErrorAt,
					tracker.stats.lastProcessedAt);
		}
	}

	public List<ProjectionStatus> statuses() {
		TreeSet<String> names = new TreeSet<>(workers.keySet());
		names.addAll(trackers.keySet());
		names.addAll(checkpoints.findAll().keySet());
		List<ProjectionStatus> result = new ArrayList<>();
		for (String name : names) {
			result.add(status(name));
		}
		return result;
	}

	/**
	 * 停止投影的背景工作，等待目前批次結束
	 */
	public void stop(String projectionName) {
		Optional.ofNullable(workers.remove(projectionName)).ifPresent(Worker::stop);
	}

	@PreDestroy
	public void shutdown() {
		log.info(">>> [System] 停止所有投影 ({})", workers.size());
		new ArrayList<>(workers.keySet()).forEach(this::stop);
	}

	private int doRebuild(String projectionName, ProjectionHandler handler) {
		Tracker tracker = tracker(projectionName);
		synchronized (tracker) {
			log.warn(">>> [Projection] 重建 {}：清空讀取模型並將進度歸零", projectionName);
			handler.reset();
			checkpoints.reset(projectionName);
			tracker.reset();
			return catchUp(projectionName, handler);
		}
	}

	private Tracker tracker(String projectionName) {
		return trackers.computeIfAbsent(projectionName, name -> new Tracker());
	}

	/**
	 * 單一投影的背景輪詢
	 */
	private final class Worker {

		private final String name;
		private final ProjectionHandler handler;
		private final ScheduledExecutorService executor;
		private volatile boolean stopped;

		private Worker(String name, ProjectionHandler handler) {
			this.name = name;
			this.handler = handler;
			CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("projection-" + name + "-");
			threadFactory.setDaemon(true);
			this.executor = Executors.newSingleThreadScheduledExecutor(threadFactory);
		}

		private void schedule(Duration delay) {
			if (stopped) {
				return;
			}
			try {
				executor.schedule(this::poll, delay.toMillis(), TimeUnit.MILLISECONDS);
			} catch (RejectedExecutionException e) {
				log.debug(">>> [Projection] {} 已停止，不再排程", name);
			}
		}

		private void poll() {
			Duration next;
			try {
				int processed = catchUp(name, handler);
				next = processed > 0 ? Duration.ZERO : pollInterval;
			} catch (RuntimeException e) {
				log.error(">>> [Projection] {} 處理失敗，{} ms 後重試: {}", name, errorBackoff.toMillis(), e.getMessage(), e);
				next = errorBackoff;
			}
			schedule(next);
		}

		private void stop() {
			stopped = true;
			executor.shutdown();
			try {
				if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
					executor.shutdownNow();
				}
			} catch (InterruptedException e) {
				executor.shutdownNow();
				Thread.currentThread().interrupt();
			}
			log.info(">>> [Projection] {} 已停止", name);
		}
	}

	/**
	 * 投影的互斥鎖與統計資訊
	 */
	private static final class Tracker {

		private final Stats stats = new Stats();

		void failed(long position, Exception error, Instant at) {
			synchronized (stats) {
				stats.consecutiveFailures++;
				stats.lastError = error.getClass().getSimpleName() + ": " + error.getMessage();
				stats.failedPosition = position;
				stats.lastErrorAt = at;
			}
		}

		void succeeded(int processed, Instant at) {
			synchronized (stats) {
				stats.consecutiveFailures = 0;
				stats.lastError = null;
				stats.failedPosition = null;
				if (processed > 0) {
					stats.lastProcessedAt = at;
				}
			}
		}

		void reset() {
			synchronized (stats) {
				stats.consecutiveFailures = 0;
				stats.lastError = null;
				stats.failedPosition = null;
			}
		}
	}

	private static final class Stats {
		private int consecutiveFailures;
		private String lastError;
		private Long failedPosition;
		private Instant lastErrorAt;
		private Instant lastProcessedAt;
	}
}

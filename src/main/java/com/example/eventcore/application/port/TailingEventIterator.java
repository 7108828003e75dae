package com.example.eventcore.application.port;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;

import com.example.eventcore.application.domain.event.RecordedEvent;

/**
 * 追蹤全域日誌尾端的迭代器
 *
 * <p>
 * {@link #hasNext()} 會阻塞直到有新事件；執行緒被中斷時結束迭代並保留中斷旗標。
 * </p>
 */
class TailingEventIterator implements Iterator<RecordedEvent> {

	private final EventLogPort eventLog;
	private final int pageSize;
	private final long pollMillis;
	private final Deque<RecordedEvent> page = new ArrayDeque<>();
	private long lastPosition;

	TailingEventIterator(EventLogPort eventLog, long afterPosition, int pageSize, Duration pollInterval) {
		this.eventLog = eventLog;
		this.lastPosition = afterPosition;
		this.pageSize = pageSize;
		this.pollMillis = Math.max(1, pollInterval.toMillis());
	}

	@Override
	public boolean hasNext() {
		while (page.isEmpty()) {
			page.addAll(eventLog.readAll(lastPosition, pageSize));
			if (!page.isEmpty()) {
				break;
			}
			try {
				Thread.sleep(pollMillis);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				return false;
			}
		}
		return true;
	}

	@Override
	public RecordedEvent next() {
		if (!hasNext()) {
			throw new NoSuchElementException("事件追蹤已中斷");
		}
		RecordedEvent event = page.poll();
		lastPosition = event.getGlobalPosition();
		return event;
	}
}

package com.example.eventcore.iface.handler;

import com.example.eventcore.application.service.CommandResult;
import com.example.eventcore.application.service.CommandService;
import com.example.eventcore.infra.lmax.event.CommandEnvelope;
import com.lmax.disruptor.EventHandler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * RingBuffer 的唯一消費者：依序執行指令並完成呼叫端的 Future
 *
 * <p>
 * 失敗不會中斷 Disruptor，例外一律轉交給 Future，由呼叫端決定如何處理。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class CommandDispatchHandler implements EventHandler<CommandEnvelope> {

	private final CommandService commandService;

	@Override
	public void onEvent(CommandEnvelope envelope, long sequence, boolean endOfBatch) {
		try {
			CommandResult result = commandService.submit(envelope.getStreamType(), envelope.getStreamId(),
					envelope.getCommand(), envelope.getMetadata());
			envelope.getResult().complete(result);
		} catch (Exception e) {
			log.debug("[Seq: {}] {}/{} 指令失敗: {}", sequence, envelope.getStreamType(), envelope.getStreamId(),
					e.getMessage());
			envelope.getResult().completeExceptionally(e);
		} finally {
			envelope.clear();
		}
	}
}

package com.example.eventcore.infra.adapter;

import java.util.concurrent.CompletableFuture;

import org.springframework.stereotype.Component;

import com.example.eventcore.application.domain.event.EventMetadata;
import com.example.eventcore.application.port.CommandBusPort;
import com.example.eventcore.application.service.CommandResult;
import com.example.eventcore.infra.lmax.event.CommandEnvelope;
import com.lmax.disruptor.RingBuffer;

import lombok.AllArgsConstructor;

@Component
@AllArgsConstructor
public class DisruptorCommandBusAdapter implements CommandBusPort {

	private final RingBuffer<CommandEnvelope> ringBuffer;

	@Override
	public CompletableFuture<CommandResult> send(String streamType, String streamId, Object command,
			EventMetadata metadata) {
		CompletableFuture<CommandResult> future = new CompletableFuture<>();
		// RingBuffer 已滿時 next() 會等待空位
		long sequence = ringBuffer.next();
		try {
			CommandEnvelope envelope = ringBuffer.get(sequence);
			envelope.setStreamType(streamType);
			envelope.setStreamId(streamId);
			envelope.setCommand(command);
			envelope.setMetadata(metadata == null ? EventMetadata.none() : metadata);
			envelope.setResult(future);
		} finally {
			ringBuffer.publish(sequence);
		}
		return future;
	}
}

package com.example.eventcore.infra.lmax.event;

import java.util.concurrent.CompletableFuture;

import com.example.eventcore.application.domain.event.EventMetadata;
import com.example.eventcore.application.service.CommandResult;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * RingBuffer 中的指令載體
 *
 * <p>
 * 物件由 Disruptor 預先配置並重複使用，處理完畢後必須呼叫 {@link #clear()}。
 * </p>
 */
@Data
@NoArgsConstructor
public class CommandEnvelope {

	private String streamType;

	private String streamId;

	private Object command;

	private EventMetadata metadata;

	private CompletableFuture<CommandResult> result;

	public void clear() {
		streamType = null;
		streamId = null;
		command = null;
		metadata = null;
		result = null;
	}
}

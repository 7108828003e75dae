package com.example.eventcore.application.port;

import java.util.concurrent.CompletableFuture;

import com.example.eventcore.application.domain.event.EventMetadata;
import com.example.eventcore.application.service.CommandResult;

/**
 * 非同步指令發布 Port
 */
public interface CommandBusPort {

	CompletableFuture<CommandResult> send(String streamType, String streamId, Object command, EventMetadata metadata);
}

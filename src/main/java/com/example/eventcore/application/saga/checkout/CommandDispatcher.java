package com.example.eventcore.application.saga.checkout;

import java.util.concurrent.ExecutionException;

import com.example.eventcore.application.domain.event.EventMetadata;
import com.example.eventcore.application.domain.saga.SagaExecutionContext;
import com.example.eventcore.application.port.CommandBusPort;
import com.example.eventcore.application.service.CommandResult;
import com.example.eventcore.application.shared.exception.ActivityFailureException;

/**
 * 透過指令匯流排送出指令並等待結果
 *
 * <p>
 * 等待可被中斷 (步驟逾時或取消時)；處理端拋出的領域例外原樣回拋，讓協調者判斷是否重試。
 * </p>
 */
final class CommandDispatcher {

	private final CommandBusPort commandBus;

	CommandDispatcher(CommandBusPort commandBus) {
		this.commandBus = commandBus;
	}

	CommandResult dispatch(SagaExecutionContext context, String streamType, String streamId, Object command)
			throws InterruptedException {
		EventMetadata metadata = EventMetadata.of(context.sagaId(), context.sagaId() + ":" + context.stepName());
		try {
			return commandBus.send(streamType, streamId, command, metadata).get();
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException) {
				throw (RuntimeException) cause;
			}
			throw new ActivityFailureException(context.stepName(), String.valueOf(cause), true, cause);
		}
	}

	static long asLong(Object value) {
		if (!(value instanceof Number)) {
			throw new IllegalArgumentException("不是數值: " + value);
		}
		return ((Number) value).longValue();
	}
}

package com.example.eventcore.application.domain.aggregate;

import java.util.List;

/**
 * 指令處理器：依目前狀態決定要產生的事件 payload。
 *
 * <p>
 * 必須為純函式，指令不適用時拋出 {@code DomainValidationException}；回傳空清單代表冪等的重複指令。
 * </p>
 */
@FunctionalInterface
public interface CommandHandler<S, C> {

	List<Object> handle(S state, C command);
}

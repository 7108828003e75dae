package com.example.eventcore.application.domain.aggregate;

/**
 * 將單一事件套用到聚合狀態，必須為純函式
 */
@FunctionalInterface
public interface EventApplier<S, P> {

	S apply(S state, P payload);
}

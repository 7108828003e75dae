package com.example.eventcore.application.saga.checkout;

import java.util.Map;

import com.example.eventcore.application.domain.order.command.CancelOrder;
import com.example.eventcore.application.domain.order.command.ConfirmOrder;
import com.example.eventcore.application.domain.order.event.OrderEventTypes;
import com.example.eventcore.application.domain.saga.ActivityResult;
import com.example.eventcore.application.domain.saga.SagaActivity;
import com.example.eventcore.application.domain.saga.SagaExecutionContext;
import com.example.eventcore.application.service.CommandResult;

/**
 * 步驟 3：以扣款步驟記錄的金額確認訂單；補償為取消訂單
 *
 * <p>
 * 扣款後訂單若被加減商品，總額與扣款金額不符，訂單拒絕確認並觸發補償。
 * </p>
 */
class ConfirmOrderActivity implements SagaActivity {

	private final CommandDispatcher dispatcher;

	ConfirmOrderActivity(CommandDispatcher dispatcher) {
		this.dispatcher = dispatcher;
	}

	@Override
	public ActivityResult execute(SagaExecutionContext context) throws Exception {
		String orderId = context.requireString(OrderCheckoutSaga.ORDER_ID);
		Object charged = context.result(OrderCheckoutSaga.DEBIT_CUSTOMER).get("amountCents");
		if (charged == null) {
			throw new IllegalStateException("Saga " + context.sagaId() + " 缺少扣款金額，無法確認訂單");
		}
		CommandResult result = dispatcher.dispatch(context, OrderEventTypes.STREAM_TYPE, orderId,
				new ConfirmOrder(CommandDispatcher.asLong(charged)));
		return ActivityResult.of(Map.of("orderVersion", result.version()), Map.of("orderId", orderId));
	}

	@Override
	public void compensate(Map<String, Object> compensationInput, SagaExecutionContext context) throws Exception {
		dispatcher.dispatch(context, OrderEventTypes.STREAM_TYPE, (String) compensationInput.get("orderId"),
				new CancelOrder("結帳失敗 (saga " + context.sagaId() + ")"));
	}
}

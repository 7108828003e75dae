package com.example.eventcore.application.saga.checkout;

import java.util.Map;

import com.example.eventcore.application.domain.account.command.Deposit;
import com.example.eventcore.application.domain.account.command.Withdraw;
import com.example.eventcore.application.domain.account.event.AccountEventTypes;
import com.example.eventcore.application.domain.order.aggregate.OrderState;
import com.example.eventcore.application.domain.order.aggregate.vo.OrderStatus;
import com.example.eventcore.application.domain.order.event.OrderEventTypes;
import com.example.eventcore.application.domain.saga.ActivityResult;
import com.example.eventcore.application.domain.saga.SagaActivity;
import com.example.eventcore.application.domain.saga.SagaExecutionContext;
import com.example.eventcore.application.service.AggregateEngineRegistry;
import com.example.eventcore.application.shared.exception.DomainValidationException;

import lombok.extern.slf4j.Slf4j;

/**
 * 步驟 1：依訂單總額從顧客帳戶扣款；補償為等額退款
 */
@Slf4j
class DebitCustomerActivity implements SagaActivity {

	private final CommandDispatcher dispatcher;
	private final AggregateEngineRegistry engines;

	DebitCustomerActivity(CommandDispatcher dispatcher, AggregateEngineRegistry engines) {
		this.dispatcher = dispatcher;
		this.engines = engines;
	}

	@Override
	public ActivityResult execute(SagaExecutionContext context) throws Exception {
		String orderId = context.requireString(OrderCheckoutSaga.ORDER_ID);
		String customerAccountId = context.requireString(OrderCheckoutSaga.CUSTOMER_ACCOUNT_ID);

		OrderState order = engines.get(OrderEventTypes.STREAM_TYPE, OrderState.class).load(orderId).state();
		if (order.status() != OrderStatus.OPEN) {
			throw new DomainValidationException("訂單 " + orderId + " 狀態為 " + order.status() + "，無法結帳");
		}
		long amountCents = order.totalCents();
		String transactionId = context.sagaId() + ":debit";

		dispatcher.dispatch(context, AccountEventTypes.STREAM_TYPE, customerAccountId,
				new Withdraw(transactionId, amountCents));
		log.info(">>> [Checkout] {} 已向 {} 扣款 {}", context.sagaId(), customerAccountId, amountCents);

		return ActivityResult.of(Map.of("transactionId", transactionId, "amountCents", amountCents),
				Map.of("accountId", customerAccountId, "amountCents", amountCents, "transactionId",
						context.sagaId() + ":debit-refund"));
	}

	@Override
	public void compensate(Map<String, Object> compensationInput, SagaExecutionContext context) throws Exception {
		dispatcher.dispatch(context, AccountEventTypes.STREAM_TYPE, (String) compensationInput.get("accountId"),
				new Deposit((String) compensationInput.get("transactionId"),
						CommandDispatcher.asLong(compensationInput.get("amountCents"))));
		log.warn(">>> [Checkout] {} 已退款至 {}", context.sagaId(), compensationInput.get("accountId"));
	}
}

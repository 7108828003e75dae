package com.example.eventcore.application.saga.checkout;

import com.example.eventcore.application.domain.saga.SagaDefinition;
import com.example.eventcore.application.domain.saga.SagaStep;
import com.example.eventcore.application.port.CommandBusPort;
import com.example.eventcore.application.service.AggregateEngineRegistry;

/**
 * 訂單結帳 Saga：扣顧客款 → 入商家帳 → 確認訂單
 *
 * <p>
 * 輸入欄位：{@code orderId}、{@code customerAccountId}、{@code merchantAccountId}。
 * 每個步驟的交易 ID 都由 sagaId 衍生，重試與恢復不會重複扣款。
 * </p>
 */
public final class OrderCheckoutSaga {

	public static final String NAME = "order-checkout";

	public static final String ORDER_ID = "orderId";
	public static final String CUSTOMER_ACCOUNT_ID = "customerAccountId";
	public static final String MERCHANT_ACCOUNT_ID = "merchantAccountId";

	public static final String DEBIT_CUSTOMER = "debit-customer";
	public static final String CREDIT_MERCHANT = "credit-merchant";
	public static final String CONFIRM_ORDER = "confirm-order";

	private OrderCheckoutSaga() {
	}

	public static SagaDefinition definition(CommandBusPort commandBus, AggregateEngineRegistry engines) {
		CommandDispatcher dispatcher = new CommandDispatcher(commandBus);
		return SagaDefinition.of(NAME, new SagaStep(DEBIT_CUSTOMER, new DebitCustomerActivity(dispatcher, engines)),
				new SagaStep(CREDIT_MERCHANT, new CreditMerchantActivity(dispatcher)),
				new SagaStep(CONFIRM_ORDER, new ConfirmOrderActivity(dispatcher)));
	}
}

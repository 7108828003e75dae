package com.example.eventcore.application.saga.checkout;

import java.util.Map;

import com.example.eventcore.application.domain.account.command.Deposit;
import com.example.eventcore.application.domain.account.command.Withdraw;
import com.example.eventcore.application.domain.account.event.AccountEventTypes;
import com.example.eventcore.application.domain.saga.ActivityResult;
import com.example.eventcore.application.domain.saga.SagaActivity;
import com.example.eventcore.application.domain.saga.SagaExecutionContext;

/**
 * 步驟 2：將扣得的金額存入商家帳戶；補償為從商家帳戶提回
 */
class CreditMerchantActivity implements SagaActivity {

	private final CommandDispatcher dispatcher;

	CreditMerchantActivity(CommandDispatcher dispatcher) {
		this.dispatcher = dispatcher;
	}

	@Override
	public ActivityResult execute(SagaExecutionContext context) throws Exception {
		String merchantAccountId = context.requireString(OrderCheckoutSaga.MERCHANT_ACCOUNT_ID);
		long amountCents = CommandDispatcher
				.asLong(context.result(OrderCheckoutSaga.DEBIT_CUSTOMER).get("amountCents"));
		String transactionId = context.sagaId() + ":credit";

		dispatcher.dispatch(context, AccountEventTypes.STREAM_TYPE, merchantAccountId,
				new Deposit(transactionId, amountCents));

		return ActivityResult.of(Map.of("transactionId", transactionId, "amountCents", amountCents),
				Map.of("accountId", merchantAccountId, "amountCents", amountCents, "transactionId",
						context.sagaId() + ":credit-reversal"));
	}

	@Override
	public void compensate(Map<String, Object> compensationInput, SagaExecutionContext context) throws Exception {
		dispatcher.dispatch(context, AccountEventTypes.STREAM_TYPE, (String) compensationInput.get("accountId"),
				new Withdraw((String) compensationInput.get("transactionId"),
						CommandDispatcher.asLong(compensationInput.get("amountCents"))));
	}
}

package com.example.eventcore.application.domain.account.aggregate;

import java.util.List;

import com.example.eventcore.application.domain.account.command.Deposit;
import com.example.eventcore.application.domain.account.command.Withdraw;
import com.example.eventcore.application.domain.account.event.AccountEventTypes;
import com.example.eventcore.application.domain.account.event.MoneyDeposited;
import com.example.eventcore.application.domain.account.event.MoneyWithdrawn;
import com.example.eventcore.application.domain.aggregate.AggregateDefinition;
import com.example.eventcore.application.shared.exception.DomainValidationException;

/**
 * 帳戶聚合 (Account Aggregate)
 *
 * <p>
 * 同一個 transactionId 只會生效一次，重送的存提款指令不產生事件。 餘額不足的提款屬於業務拒絕，不會重試。
 * </p>
 */
public final class AccountAggregate {

	private AccountAggregate() {
	}

	public static AggregateDefinition<AccountState> definition() {
		return AggregateDefinition.builder(AccountEventTypes.STREAM_TYPE, AccountState.class, AccountState::initial)
				.onEvent(AccountEventTypes.MONEY_DEPOSITED, 1, MoneyDeposited.class, AccountState::withDeposited)
				.onEvent(AccountEventTypes.MONEY_WITHDRAWN, 1, MoneyWithdrawn.class, AccountState::withWithdrawn)
				.onCommand(Deposit.class, AccountAggregate::deposit)
				.onCommand(Withdraw.class, AccountAggregate::withdraw)
				.build();
	}

	static List<Object> deposit(AccountState state, Deposit command) {
		validate(command.transactionId(), command.amountCents());
		if (state.hasProcessed(command.transactionId())) {
			return List.of();
		}
		return List.of(new MoneyDeposited(command.transactionId(), command.amountCents()));
	}

	static List<Object> withdraw(AccountState state, Withdraw command) {
		validate(command.transactionId(), command.amountCents());
		if (state.hasProcessed(command.transactionId())) {
			return List.of();
		}
		if (state.balanceCents() < command.amountCents()) {
			throw new DomainValidationException(
					"餘額不足: balance=" + state.balanceCents() + ", amount=" + command.amountCents());
		}
		return List.of(new MoneyWithdrawn(command.transactionId(), command.amountCents()));
	}

	private static void validate(String transactionId, long amountCents) {
		if (transactionId == null || transactionId.isBlank()) {
			throw new DomainValidationException("transactionId 不可為空");
		}
		if (amountCents <= 0) {
			throw new DomainValidationException("金額必須大於 0");
		}
	}
}

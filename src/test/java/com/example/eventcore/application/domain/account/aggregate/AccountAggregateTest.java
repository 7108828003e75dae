package com.example.eventcore.application.domain.account.aggregate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.eventcore.application.domain.account.command.Deposit;
import com.example.eventcore.application.domain.account.command.Withdraw;
import com.example.eventcore.application.domain.aggregate.AggregateDefinition;
import com.example.eventcore.application.shared.exception.DomainValidationException;

class AccountAggregateTest {

	private final AggregateDefinition<AccountState> account = AccountAggregate.definition();

	@Test
	@DisplayName("存提款後餘額正確，同一交易 ID 重送不產生事件")
	void depositWithdrawAndIdempotency() {
		AccountState state = apply(AccountState.initial(), new Deposit("tx-1", 1000));
		state = apply(state, new Withdraw("tx-2", 300));

		assertThat(state.balanceCents()).isEqualTo(700);
		assertThat(account.execute(state, new Deposit("tx-1", 1000))).isEmpty();
		assertThat(account.execute(state, new Withdraw("tx-2", 300))).isEmpty();
		assertThat(state.hasProcessed("tx-1")).isTrue();
	}

	@Test
	@DisplayName("餘額不足、金額非正數、缺少交易 ID 皆為領域錯誤")
	void rejectsInvalidTransactions() {
		AccountState state = apply(AccountState.initial(), new Deposit("tx-1", 100));

		assertThatThrownBy(() -> account.execute(state, new Withdraw("tx-2", 101)))
				.isInstanceOf(DomainValidationException.class).hasMessageContaining("餘額不足");
		assertThatThrownBy(() -> account.execute(state, new Deposit("tx-3", 0)))
				.isInstanceOf(DomainValidationException.class);
		assertThatThrownBy(() -> account.execute(state, new Deposit(" ", 10)))
				.isInstanceOf(DomainValidationException.class);
	}

	private AccountState apply(AccountState state, Object command) {
		return account.fold(state, account.execute(state, command));
	}
}

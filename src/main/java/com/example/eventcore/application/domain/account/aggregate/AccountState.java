package com.example.eventcore.application.domain.account.aggregate;

import java.util.HashSet;
import java.util.Set;

import com.example.eventcore.application.domain.account.event.MoneyDeposited;
import com.example.eventcore.application.domain.account.event.MoneyWithdrawn;

/**
 * 帳戶聚合狀態 (不可變)
 *
 * @param balanceCents          餘額 (分)
 * @param processedTransactions 已處理的交易 ID，用於冪等判斷
 */
public record AccountState(long balanceCents, Set<String> processedTransactions) {

	public AccountState {
		processedTransactions = processedTransactions == null ? Set.of() : Set.copyOf(processedTransactions);
	}

	public static AccountState initial() {
		return new AccountState(0, Set.of());
	}

	public boolean hasProcessed(String transactionId) {
		return processedTransactions.contains(transactionId);
	}

	public AccountState withDeposited(MoneyDeposited event) {
		return new AccountState(balanceCents + event.amountCents(), plus(event.transactionId()));
	}

	public AccountState withWithdrawn(MoneyWithdrawn event) {
		return new AccountState(balanceCents - event.amountCents(), plus(event.transactionId()));
	}

	private Set<String> plus(String transactionId) {
		Set<String> updated = new HashSet<>(processedTransactions);
		updated.add(transactionId);
		return updated;
	}
}

package com.example.eventcore.application.domain.account.event;

/**
 * Account 事件型別名稱，寫入日誌後不可更改
 */
public final class AccountEventTypes {

	public static final String STREAM_TYPE = "Account";

	public static final String MONEY_DEPOSITED = "MoneyDeposited";
	public static final String MONEY_WITHDRAWN = "MoneyWithdrawn";

	private AccountEventTypes() {
	}
}

package com.example.eventcore.application.domain.account.event;

public record MoneyDeposited(String transactionId, long amountCents) {
}

package com.example.eventcore.application.domain.account.event;

public record MoneyWithdrawn(String transactionId, long amountCents) {
}

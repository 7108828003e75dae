package com.example.eventcore.application.domain.account.command;

public record Deposit(String transactionId, long amountCents) {
}

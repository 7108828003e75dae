package com.example.eventcore.application.domain.account.command;

public record Withdraw(String transactionId, long amountCents) {
}

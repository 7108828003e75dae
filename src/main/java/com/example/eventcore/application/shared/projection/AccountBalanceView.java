package com.example.eventcore.application.shared.projection;

import java.time.Instant;

/**
 * 帳戶餘額讀取模型
 */
public record AccountBalanceView(String accountId, long balanceCents, long lastPosition, Instant updatedAt) {
}

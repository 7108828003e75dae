package com.example.eventcore.application.shared.projection;

import java.time.Instant;

/**
 * 訂單摘要讀取模型
 *
 * @param lastPosition 最後套用的全域位置，投影以此判斷重複事件
 */
public record OrderSummaryView(String orderId, String customerId, String status, int itemCount, long totalCents,
		long lastPosition, Instant updatedAt) {
}

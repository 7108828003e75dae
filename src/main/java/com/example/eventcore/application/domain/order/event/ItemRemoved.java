package com.example.eventcore.application.domain.order.event;

/**
 * 移除商品，帶出被移除明細的數量與單價供讀取模型扣回
 */
public record ItemRemoved(String sku, int quantity, long unitPriceCents) {
}

package com.example.eventcore.application.domain.order.event;

/**
 * 加入商品 (結構版本 3)
 *
 * <ul>
 * <li>v1: {@code {sku, price}}，price 為元，數量固定為 1</li>
 * <li>v2: {@code {sku, quantity, unitPrice}}，unitPrice 為元</li>
 * <li>v3: {@code {sku, quantity, unitPriceCents}}</li>
 * </ul>
 */
public record ItemAdded(String sku, int quantity, long unitPriceCents) {

	public static final int SCHEMA_VERSION = 3;
}

package com.example.eventcore.application.domain.order.aggregate;

/**
 * 訂單明細，金額以「分」為單位
 */
public record OrderLine(String sku, int quantity, long unitPriceCents) {

	public long subtotalCents() {
		return quantity * unitPriceCents;
	}
}

package com.example.eventcore.application.domain.order.command;

/**
 * 確認訂單
 *
 * @param expectedTotalCents 呼叫端認定的訂單總額 (例如已扣款金額)，與目前總額不符即拒絕；null 代表不檢查
 */
public record ConfirmOrder(Long expectedTotalCents) {

	public ConfirmOrder() {
		this(null);
	}
}
